package com.Quartermaster.inventory_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a checkout or checkin.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustodyRequest {

    @NotBlank(message = "Person name is required")
    private String personName;

    private String notes = "";
}
