package com.blockstore.model.properties;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Quotes, tables and html fragments may belong to page or chunk groups,
 * referenced by id under {@code groups}.
 */
public class GroupedProperties extends BlockProperties {

    public GroupedProperties(Map<String, Object> values) {
        super(values);
        groups();
    }

    public List<UUID> groups() {
        return uuidList("groups");
    }
}
