package com.qubi.netmap.core.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public final class JsonSupport {
    private JsonSupport(){}
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new Jdk8Module())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

    public static String toJson(Object o){
        try { return MAPPER.writeValueAsString(o); }
        catch (JsonProcessingException e){ throw new IllegalStateException("Failed to serialize JSON", e); }
    }

    public static <T> T fromJson(String json, Class<T> cls){
        try { return MAPPER.readValue(json, cls); }
        catch (JsonProcessingException e){ throw new IllegalStateException("Failed to parse JSON", e); }
    }

    /** Parses text into a tree; null when the text is blank or not valid JSON. */
    public static JsonNode readTree(String text){
        if (text == null || text.isBlank()) return null;
        try { return MAPPER.readTree(text); }
        catch (JsonProcessingException e){ return null; }
    }
}
