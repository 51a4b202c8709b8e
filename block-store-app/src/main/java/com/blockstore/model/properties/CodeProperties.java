package com.blockstore.model.properties;

import java.util.Map;

public class CodeProperties extends GroupedProperties {

    public CodeProperties(Map<String, Object> values) {
        super(values);
        stringValue("language");
    }

    public String language() {
        return stringValue("language");
    }
}
