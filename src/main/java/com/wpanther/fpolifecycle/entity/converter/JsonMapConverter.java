package com.wpanther.fpolifecycle.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;

import jakarta.persistence.Converter;

import java.util.LinkedHashMap;

@Converter
public class JsonMapConverter extends AbstractJsonMapConverter<Object> {

    public JsonMapConverter() {
        super(new TypeReference<LinkedHashMap<String, Object>>() { });
    }
}
