package com.Quartermaster.inventory_backend.dto.response;

import com.Quartermaster.inventory_backend.enums.HistoryAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryEntryResponse {
    private Long id;
    private Long itemId;
    private HistoryAction action;
    private String personName;
    private LocalDateTime timestamp;
    private String notes;
}
