package com.Quartermaster.inventory_backend.enums;

/**
 * What an approved or denied review did to the inventory.
 */
public enum SideEffectType {
    ITEM_CREATED,
    ITEM_REMOVED,
    TARGET_ALREADY_REMOVED,
    NONE,
    FAILED
}
