package com.tenantbill.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserCreateRequest {

    @NotNull(message = "Email is required")
    @Size(min = 5, max = 255)
    private String email;

    @NotNull(message = "Full name is required")
    @Size(min = 2, max = 200)
    @JsonProperty("full_name")
    private String fullName;
}
