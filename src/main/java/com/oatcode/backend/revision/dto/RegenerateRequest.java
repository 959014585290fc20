package com.oatcode.backend.revision.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RegenerateRequest(
        @NotNull(message = "Customer id is required") Long customerId,
        Long requestId,     // 沒帶就用該客戶最新的待審核
        @NotBlank(message = "Feedback is required")
        @Size(max = 5000, message = "Feedback is too long") String feedback
) {}
