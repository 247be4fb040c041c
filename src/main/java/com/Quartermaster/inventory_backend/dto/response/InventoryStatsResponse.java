package com.Quartermaster.inventory_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryStatsResponse {
    private long totalItems;
    private long checkedOut;
    private long available;
    private Map<String, Long> categories;
}
