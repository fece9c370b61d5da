package com.example.smartbin.model;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class MaterialCountsConverter extends JsonAttributeConverter<Map<String, Integer>> {

    public MaterialCountsConverter() {
        super(new TypeReference<>() {
        });
    }
}
