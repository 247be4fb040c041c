package com.Quartermaster.inventory_backend.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class ItemNotCheckedOutException extends ApiException {
    public ItemNotCheckedOutException(Long itemId) {
        super(String.format("Item %d is not checked out", itemId),
                HttpStatus.CONFLICT,
                "NOT_CHECKED_OUT",
                Map.of("itemId", itemId));
    }
}
