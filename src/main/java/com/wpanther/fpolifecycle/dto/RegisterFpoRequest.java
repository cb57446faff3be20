package com.wpanther.fpolifecycle.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterFpoRequest {
    @NotBlank(message = "Name is required")
    private String name;

    @NotBlank(message = "Registration number is required")
    private String registrationNumber;

    private String description;

    private Map<String, Object> metadata;

    // Optional parent FPO for federated structures
    private String parentFpoId;

    @Valid
    @NotNull(message = "CEO details are required")
    private CeoDetails ceo;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CeoDetails {
        @NotBlank(message = "CEO first name is required")
        private String firstName;

        @NotBlank(message = "CEO last name is required")
        private String lastName;

        @NotBlank(message = "CEO phone number is required")
        @Pattern(regexp = "^\\+?[0-9]{10,15}$", message = "CEO phone number must be 10 to 15 digits")
        private String phoneNumber;

        @Email(message = "CEO email must be a valid address")
        private String email;
    }
}
