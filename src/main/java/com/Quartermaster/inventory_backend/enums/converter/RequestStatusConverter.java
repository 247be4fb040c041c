package com.Quartermaster.inventory_backend.enums.converter;

import com.Quartermaster.inventory_backend.enums.RequestStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class RequestStatusConverter implements AttributeConverter<RequestStatus, String> {

    @Override
    public String convertToDatabaseColumn(RequestStatus attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public RequestStatus convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.trim().isEmpty()) {
            return null;
        }
        return RequestStatus.fromString(dbData);
    }
}
