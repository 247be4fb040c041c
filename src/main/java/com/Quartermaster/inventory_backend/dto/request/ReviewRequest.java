package com.Quartermaster.inventory_backend.dto.request;

import com.Quartermaster.inventory_backend.enums.ReviewDecision;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRequest {

    @NotNull(message = "Decision is required")
    private ReviewDecision decision;

    private String denialReason;
}
