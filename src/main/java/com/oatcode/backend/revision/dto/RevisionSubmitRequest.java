package com.oatcode.backend.revision.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * customerId 跟 email 至少帶一個；prospect 只有 email
 */
public record RevisionSubmitRequest(
        Long customerId,
        @Email(message = "Email format is invalid") String email,
        @NotBlank(message = "Description is required")
        @Size(max = 5000, message = "Description is too long") String description
) {}
