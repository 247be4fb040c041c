package com.Quartermaster.inventory_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ItemCreateRequest {

    @NotBlank(message = "Item name is required")
    @Size(max = 255, message = "Item name must not exceed 255 characters")
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
