package com.callshield.interfaces.api.dto;

import com.callshield.domain.evidence.model.SubmissionStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record StatusUpdateRequest(
        @NotNull(message = "new_status is required")
        SubmissionStatus newStatus,

        @Size(max = 2000, message = "notes must be at most 2000 characters")
        String notes,

        @Size(max = 100, message = "actor must be at most 100 characters")
        String actor
) {}
