package com.Quartermaster.inventory_backend.dto.response;

import com.Quartermaster.inventory_backend.enums.RequestStatus;
import com.Quartermaster.inventory_backend.enums.RequestType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ItemRequestResponse {
    private Long id;
    private Long requesterId;
    private String requesterName;
    private RequestType requestType;
    private String itemName;
    private String description;
    private Long itemId;
    // Null once the target item has been removed
    private String currentItemName;
    private RequestStatus status;
    private String denialReason;
    private LocalDateTime createdDate;
    private LocalDateTime reviewedDate;
    private Long reviewedById;
    private String reviewedByName;
}
