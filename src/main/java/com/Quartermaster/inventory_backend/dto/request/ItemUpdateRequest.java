package com.Quartermaster.inventory_backend.dto.request;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Partial update: only non-null fields are applied.
 */
@Data
public class ItemUpdateRequest {

    @Size(min = 1, max = 255, message = "Item name must be between 1 and 255 characters")
    private String name;

    private String description;

    private String category;

    @Size(max = 255, message = "Barcode must not exceed 255 characters")
    private String barcode;

    private String serialNumber;

    private String storageLocation;

    private String imageUrl;

    private String notes;
}
