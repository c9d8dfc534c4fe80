package dev.jobscout.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class ScoreBreakdownConverter extends JsonAttributeConverter<Map<String, Integer>> {

    public ScoreBreakdownConverter() {
        super(new TypeReference<>() {
        }, LinkedHashMap::new);
    }
}
