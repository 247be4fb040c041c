package com.Quartermaster.inventory_backend.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class DuplicateBarcodeException extends ApiException {
    public DuplicateBarcodeException(String barcode) {
        super("Barcode already in use: " + barcode,
                HttpStatus.CONFLICT,
                "DUPLICATE_BARCODE",
                Map.of("barcode", barcode));
    }
}
