package com.creditengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * DTO for an administrative credit adjustment.
 */
@Data
public class AdminAdjustmentRequest {

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private Long amount;

    @NotBlank(message = "Reason is required")
    private String reason;

    @NotBlank(message = "Admin ID is required")
    @Size(max = 128, message = "Admin ID must be at most 128 characters")
    private String adminId;
}
