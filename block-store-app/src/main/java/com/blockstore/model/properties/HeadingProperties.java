package com.blockstore.model.properties;

import java.util.Map;

public class HeadingProperties extends BlockProperties {

    public static final int DEFAULT_LEVEL = 2;

    public HeadingProperties(Map<String, Object> values) {
        super(values);
        int level = level();
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("Heading level must be between 1 and 6, got " + level);
        }
    }

    public static HeadingProperties of(int level) {
        return new HeadingProperties(Map.of("level", level));
    }

    public int level() {
        Integer level = intValue("level");
        return level != null ? level : DEFAULT_LEVEL;
    }
}
