package com.kpiforecast.entity;

import com.kpiforecast.ml.anomaly.AnomalyType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class AnomalyTypeConverter implements AttributeConverter<AnomalyType, String> {

    @Override
    public String convertToDatabaseColumn(AnomalyType attribute) {
        return attribute == null ? null : attribute.label();
    }

    @Override
    public AnomalyType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : AnomalyType.fromLabel(dbData);
    }
}
