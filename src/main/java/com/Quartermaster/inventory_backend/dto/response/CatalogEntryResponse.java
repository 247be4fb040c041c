package com.Quartermaster.inventory_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A category or storage location.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogEntryResponse {
    private Long id;
    private String name;
    private String createdBy;
    private LocalDateTime createdDate;
}
