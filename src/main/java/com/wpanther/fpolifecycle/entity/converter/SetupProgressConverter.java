package com.wpanther.fpolifecycle.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;

import jakarta.persistence.Converter;

import java.util.LinkedHashMap;

@Converter
public class SetupProgressConverter extends AbstractJsonMapConverter<Boolean> {

    public SetupProgressConverter() {
        super(new TypeReference<LinkedHashMap<String, Boolean>>() { });
    }
}
