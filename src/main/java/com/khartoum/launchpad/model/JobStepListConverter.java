package com.khartoum.launchpad.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores a job's steps as one JSON array. Readers always get a fresh mutable
 * list, so callers can modify it and write the whole array back.
 */
@Converter
public class JobStepListConverter implements AttributeConverter<List<JobStep>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private static final TypeReference<ArrayList<JobStep>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<JobStep> steps) {
        try {
            return MAPPER.writeValueAsString(steps == null ? List.of() : steps);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize job steps", e);
        }
    }

    @Override
    public List<JobStep> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return MAPPER.readValue(json, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read job steps", e);
        }
    }
}
