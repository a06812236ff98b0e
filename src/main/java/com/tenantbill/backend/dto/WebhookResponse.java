package com.tenantbill.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Webhook acknowledgement. Duplicates carry the stored event type,
 * fresh deliveries carry whether a subscription was resolved and updated.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookResponse {

    public static final String PROCESSED = "processed";
    public static final String DUPLICATE = "duplicate";

    private String status;

    @JsonProperty("idempotency_key")
    private String idempotencyKey;

    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("updated_subscription")
    private Boolean updatedSubscription;

    public static WebhookResponse processed(String idempotencyKey, boolean updatedSubscription) {
        return new WebhookResponse(PROCESSED, idempotencyKey, null, updatedSubscription);
    }

    public static WebhookResponse duplicate(String idempotencyKey, String eventType) {
        return new WebhookResponse(DUPLICATE, idempotencyKey, eventType, null);
    }

    @JsonIgnore
    public boolean isDuplicate() {
        return DUPLICATE.equals(status);
    }
}
