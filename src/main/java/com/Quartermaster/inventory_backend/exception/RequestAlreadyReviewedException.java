package com.Quartermaster.inventory_backend.exception;

import com.Quartermaster.inventory_backend.enums.RequestStatus;
import org.springframework.http.HttpStatus;

import java.util.Map;

public class RequestAlreadyReviewedException extends ApiException {
    public RequestAlreadyReviewedException(Long requestId, RequestStatus currentStatus) {
        super(String.format("Request %d has already been reviewed", requestId),
                HttpStatus.CONFLICT,
                "ALREADY_REVIEWED",
                Map.of("requestId", requestId, "status", currentStatus.getValue()));
    }
}
