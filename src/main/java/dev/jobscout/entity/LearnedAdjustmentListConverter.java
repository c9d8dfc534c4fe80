package dev.jobscout.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class LearnedAdjustmentListConverter extends JsonAttributeConverter<List<LearnedAdjustment>> {

    public LearnedAdjustmentListConverter() {
        super(new TypeReference<>() {
        }, ArrayList::new);
    }
}
