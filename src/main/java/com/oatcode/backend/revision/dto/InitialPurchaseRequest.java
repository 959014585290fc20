package com.oatcode.backend.revision.dto;

import jakarta.validation.constraints.Size;

public record InitialPurchaseRequest(
        @Size(max = 5000, message = "Onboarding notes are too long") String onboardingNotes
) {}
