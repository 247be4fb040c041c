package com.Quartermaster.inventory_backend.exception;

import org.springframework.http.HttpStatus;

public class CannotDeactivateSelfException extends ApiException {
    public CannotDeactivateSelfException() {
        super("You cannot deactivate your own account", HttpStatus.BAD_REQUEST, "CANNOT_DEACTIVATE_SELF");
    }
}
