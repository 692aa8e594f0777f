package com.p14n.pubsub.sink;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.pubsub.data.BatchedMessage;

/**
 * JSON form of a batch: an array of
 * {@code {"timestamp":..., "channel":..., "message":...}} objects.
 */
public class BatchJson {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final TypeReference<List<BatchedMessage>> BATCH = new TypeReference<>() {
    };

    private BatchJson() {
    }

    public static String encode(List<BatchedMessage> batch) {
        try {
            return mapper.writeValueAsString(batch);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Batch cannot be serialised", e);
        }
    }

    public static List<BatchedMessage> decode(String json) {
        try {
            return mapper.readValue(json, BATCH);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a batch: " + json, e);
        }
    }
}
