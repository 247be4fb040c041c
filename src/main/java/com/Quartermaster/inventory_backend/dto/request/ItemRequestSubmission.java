package com.Quartermaster.inventory_backend.dto.request;

import com.Quartermaster.inventory_backend.enums.RequestType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ItemRequestSubmission {

    @NotNull(message = "Request type is required")
    private RequestType requestType;

    // May be blank for remove_item; the target's current name is used then
    private String itemName;

    @NotBlank(message = "A justification is required")
    private String description;

    private Long itemId;
}
