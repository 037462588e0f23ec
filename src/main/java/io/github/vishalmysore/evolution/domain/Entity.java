package io.github.vishalmysore.evolution.domain;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reference data for a company, regulator or person mentioned by events.
 */
@Value
@Builder
public class Entity {
    String id;
    String name;
    String type;

    public Map<String, Object> toJsonLd() {
        Map<String, Object> jsonLd = new LinkedHashMap<>();
        jsonLd.put("@type", "fe:Entity");
        jsonLd.put("@id", "urn:feekg:entity:" + id);
        jsonLd.put("name", name);
        if (type != null) {
            jsonLd.put("fe:entityType", type);
        }
        return jsonLd;
    }
}
