package dev.jobscout.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Serializes a source payload for the raw JSON column. A payload that cannot be written
 * is logged and stored as null; it never blocks persisting the posting itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RawPayloadWriter {

    private final ObjectMapper objectMapper;

    public String toJson(Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize {} payload: {}", payload.getClass().getSimpleName(), e.getOriginalMessage());
            return null;
        }
    }
}
