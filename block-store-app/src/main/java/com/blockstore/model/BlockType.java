package com.blockstore.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of block types. The wire value is what gets stored in the
 * {@code type} column and what filters compare against.
 */
public enum BlockType {
    WORKSPACE("workspace"),
    COLLECTION("collection"),
    DOCUMENT("document"),
    DATASET("dataset"),
    DERIVED_CONTENT_CONTAINER("derived_content_container"),
    HEADING("heading"),
    PARAGRAPH("paragraph"),
    BULLETED_LIST_ITEM("bulleted_list_item"),
    NUMBERED_LIST_ITEM("numbered_list_item"),
    RECORD("record"),
    QUOTE("quote"),
    CODE("code"),
    TABLE("table"),
    HTML("html"),
    OBJECT("object"),
    GROUP_INDEX("group_index"),
    PAGE_GROUP("page_group"),
    CHUNK_GROUP("chunk_group"),
    SYSTEM_CONTAINER("system_container"),
    UNSUPPORTED("unsupported");

    private static final Map<String, BlockType> BY_VALUE = Arrays.stream(values())
        .collect(Collectors.toMap(BlockType::value, Function.identity()));

    private final String value;

    BlockType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static BlockType fromValue(String value) {
        BlockType type = BY_VALUE.get(value);
        if (type == null) {
            throw new IllegalArgumentException("Unknown block type: " + value);
        }
        return type;
    }
}
