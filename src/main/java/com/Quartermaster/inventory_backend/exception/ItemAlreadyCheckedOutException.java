package com.Quartermaster.inventory_backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Checkout lost to an existing holder. {@code currentHolder} is null when that holder
 * returned the item between the rejected checkout and the re-read.
 */
@Getter
public class ItemAlreadyCheckedOutException extends ApiException {
    private final String currentHolder;

    public ItemAlreadyCheckedOutException(Long itemId, String currentHolder) {
        this(String.format("Item %d is already checked out by %s", itemId, currentHolder),
                currentHolder,
                Map.of("itemId", itemId, "checkedOutBy", currentHolder));
    }

    private ItemAlreadyCheckedOutException(String message, String currentHolder, Map<String, Object> details) {
        super(message, HttpStatus.CONFLICT, "ALREADY_CHECKED_OUT", details);
        this.currentHolder = currentHolder;
    }

    public static ItemAlreadyCheckedOutException releasedConcurrently(Long itemId) {
        return new ItemAlreadyCheckedOutException(
                String.format("Item %d was checked out by someone else and has since been checked in", itemId),
                null,
                Map.of("itemId", itemId, "changedConcurrently", true));
    }
}
