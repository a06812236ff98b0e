package com.tenantbill.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Self-service signup: creates the organization, its owner and the first access token.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    @NotNull(message = "Organization name is required")
    @Size(min = 2, max = 200)
    @JsonProperty("organization_name")
    private String organizationName;

    @NotNull(message = "Organization slug is required")
    @Size(min = 3, max = 80)
    @Pattern(regexp = "^[a-z0-9]+(?:-[a-z0-9]+)*$",
            message = "Slug must be lowercase letters and digits separated by single hyphens")
    @JsonProperty("organization_slug")
    private String organizationSlug;

    @NotNull(message = "Email is required")
    @Size(min = 5, max = 255)
    private String email;

    @NotNull(message = "Full name is required")
    @Size(min = 2, max = 200)
    @JsonProperty("full_name")
    private String fullName;
}
