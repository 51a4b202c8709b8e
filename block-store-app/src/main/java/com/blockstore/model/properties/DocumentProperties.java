package com.blockstore.model.properties;

import java.util.HashMap;
import java.util.Map;

public class DocumentProperties extends BlockProperties {

    public DocumentProperties(Map<String, Object> values) {
        super(values);
        stringValue("title");
        stringValue("category");
    }

    public static DocumentProperties of(String title, String category) {
        Map<String, Object> values = new HashMap<>();
        if (title != null) values.put("title", title);
        if (category != null) values.put("category", category);
        return new DocumentProperties(values);
    }

    public String title() {
        return stringValue("title");
    }

    public String category() {
        return stringValue("category");
    }
}
