package dev.jobscout.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.LinkedHashSet;
import java.util.Set;

@Converter
public class LongSetConverter extends JsonAttributeConverter<Set<Long>> {

    public LongSetConverter() {
        super(new TypeReference<>() {
        }, LinkedHashSet::new);
    }
}
