package com.Quartermaster.inventory_backend.enums.converter;

import com.Quartermaster.inventory_backend.enums.RequestType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class RequestTypeConverter implements AttributeConverter<RequestType, String> {

    @Override
    public String convertToDatabaseColumn(RequestType attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public RequestType convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.trim().isEmpty()) {
            return null;
        }
        return RequestType.fromString(dbData);
    }
}
