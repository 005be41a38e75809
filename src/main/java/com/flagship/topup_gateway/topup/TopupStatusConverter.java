package com.flagship.topup_gateway.topup;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class TopupStatusConverter implements AttributeConverter<TopupStatus, String> {

    @Override
    public String convertToDatabaseColumn(TopupStatus status) {
        return status == null ? null : status.getValue();
    }

    @Override
    public TopupStatus convertToEntityAttribute(String value) {
        return value == null ? null : TopupStatus.fromValue(value);
    }
}
