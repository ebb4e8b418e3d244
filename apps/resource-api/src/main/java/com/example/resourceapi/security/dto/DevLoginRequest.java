package com.example.resourceapi.security.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public record DevLoginRequest(
        @NotBlank(message = "Subject is required")
        @Size(max = 128, message = "Subject must not exceed 128 characters")
        String subject,

        List<String> roles
) {
    public DevLoginRequest {
        if (roles == null) roles = List.of();
    }
}
