package com.Quartermaster.inventory_backend.enums.converter;

import com.Quartermaster.inventory_backend.enums.HistoryAction;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class HistoryActionConverter implements AttributeConverter<HistoryAction, String> {

    @Override
    public String convertToDatabaseColumn(HistoryAction attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public HistoryAction convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.trim().isEmpty()) {
            return null;
        }
        return HistoryAction.fromString(dbData);
    }
}
