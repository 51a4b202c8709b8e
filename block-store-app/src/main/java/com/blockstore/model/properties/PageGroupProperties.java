package com.blockstore.model.properties;

import java.util.Map;

public class PageGroupProperties extends BlockProperties {

    public PageGroupProperties(Map<String, Object> values) {
        super(values);
        Integer pageNumber = intValue("page_number");
        if (pageNumber == null || pageNumber < 1) {
            throw new IllegalArgumentException("page_number must be >= 1, got " + pageNumber);
        }
    }

    public static PageGroupProperties of(int pageNumber) {
        return new PageGroupProperties(Map.of("page_number", pageNumber));
    }

    public int pageNumber() {
        return intValue("page_number");
    }
}
