package com.blockstore.model.properties;

import java.util.Map;

public class ObjectProperties extends GroupedProperties {

    public ObjectProperties(Map<String, Object> values) {
        super(values);
        stringValue("category");
    }

    public String category() {
        return stringValue("category");
    }
}
