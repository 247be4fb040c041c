package com.Quartermaster.inventory_backend.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class MissingDenialReasonException extends ApiException {
    public MissingDenialReasonException(Long requestId) {
        super("A denial reason is required when denying a request",
                HttpStatus.BAD_REQUEST,
                "MISSING_REASON",
                Map.of("requestId", requestId, "field", "denialReason"));
    }
}
