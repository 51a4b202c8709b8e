package com.blockstore.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Unstructured block payload. Any combination of the parts may be set:
 * plain text, a nested object map, a tabular data map, or a reference to
 * another block whose content this one mirrors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Content(
    @JsonProperty("plain_text") String plainText,
    @JsonProperty("object") Map<String, Object> object,
    @JsonProperty("data") Map<String, Object> data,
    @JsonProperty("synced_from") UUID syncedFrom
) {
    public Content {
        object = object == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(object));
        data = data == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static Content text(String plainText) {
        return new Content(plainText, null, null, null);
    }

    public static Content data(Map<String, Object> data) {
        return new Content(null, null, data, null);
    }

    public static Content syncedFrom(UUID blockId) {
        return new Content(null, null, null, blockId);
    }
}
