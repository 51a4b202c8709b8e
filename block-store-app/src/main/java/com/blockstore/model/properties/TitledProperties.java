package com.blockstore.model.properties;

import java.util.Map;

/** Workspaces and collections: a title is mandatory. */
public class TitledProperties extends BlockProperties {

    public TitledProperties(Map<String, Object> values) {
        super(values);
        requiredString("title");
    }

    public static TitledProperties of(String title) {
        return new TitledProperties(Map.of("title", title));
    }

    public String title() {
        return stringValue("title");
    }
}
