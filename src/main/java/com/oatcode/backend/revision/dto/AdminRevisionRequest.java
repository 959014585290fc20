package com.oatcode.backend.revision.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AdminRevisionRequest(
        @NotBlank(message = "Description is required")
        @Size(max = 5000, message = "Description is too long") String description
) {}
