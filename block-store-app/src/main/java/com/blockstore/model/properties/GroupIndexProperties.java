package com.blockstore.model.properties;

import java.util.Map;
import java.util.Set;

public class GroupIndexProperties extends BlockProperties {

    private static final Set<String> INDEX_TYPES = Set.of("page", "chunk");

    public GroupIndexProperties(Map<String, Object> values) {
        super(values);
        String indexType = requiredString("group_index_type");
        if (!INDEX_TYPES.contains(indexType)) {
            throw new IllegalArgumentException("group_index_type must be one of " + INDEX_TYPES + ", got " + indexType);
        }
    }

    public String groupIndexType() {
        return stringValue("group_index_type");
    }
}
