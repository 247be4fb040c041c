package com.Quartermaster.inventory_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemResponse {
    private Long id;
    private String name;
    private String description;
    private String category;
    private String barcode;
    private String serialNumber;
    private String storageLocation;
    private boolean checkedOut;
    private String checkedOutBy;
    private LocalDateTime checkedOutDate;
    private String imageUrl;
    private String notes;
    private LocalDateTime createdDate;
    private LocalDateTime lastModifiedDate;
}
