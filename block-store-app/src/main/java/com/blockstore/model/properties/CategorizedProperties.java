package com.blockstore.model.properties;

import java.util.Map;

/** Derived-content and system containers are always filed under a category. */
public class CategorizedProperties extends BlockProperties {

    public CategorizedProperties(Map<String, Object> values) {
        super(values);
        requiredString("category");
    }

    public static CategorizedProperties of(String category) {
        return new CategorizedProperties(Map.of("category", category));
    }

    public String category() {
        return stringValue("category");
    }
}
