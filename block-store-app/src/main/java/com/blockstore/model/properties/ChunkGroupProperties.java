package com.blockstore.model.properties;

import java.util.Map;

public class ChunkGroupProperties extends BlockProperties {

    public ChunkGroupProperties(Map<String, Object> values) {
        super(values);
        stringValue("title");
    }

    public String title() {
        return stringValue("title");
    }
}
