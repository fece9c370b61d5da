package com.example.smartbin.model;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class AnomalyDetailsConverter extends JsonAttributeConverter<Map<String, Object>> {

    public AnomalyDetailsConverter() {
        super(new TypeReference<>() {
        });
    }
}
