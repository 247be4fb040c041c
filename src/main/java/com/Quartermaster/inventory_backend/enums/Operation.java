package com.Quartermaster.inventory_backend.enums;

/**
 * Operation kinds checked by {@link com.Quartermaster.inventory_backend.security.AccessPolicy}.
 */
public enum Operation {
    READ_ITEMS,
    CREATE_ITEM,
    UPDATE_ITEM,
    DELETE_ITEM,
    CHECKOUT_CHECKIN,
    VIEW_STATS,
    SUBMIT_REQUEST,
    REVIEW_REQUEST,
    READ_OWN_REQUESTS,
    MANAGE_USERS,
    MANAGE_OWN_ACCOUNT,
    READ_CATALOG,
    MANAGE_CATALOG
}
