package com.wpanther.fpolifecycle.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;

import jakarta.persistence.Converter;

import java.util.LinkedHashMap;

@Converter
public class StringMapConverter extends AbstractJsonMapConverter<String> {

    public StringMapConverter() {
        super(new TypeReference<LinkedHashMap<String, String>>() { });
    }
}
