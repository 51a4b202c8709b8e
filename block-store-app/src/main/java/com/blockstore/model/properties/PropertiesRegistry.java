package com.blockstore.model.properties;

import com.blockstore.model.BlockType;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Dispatch table from block type to the properties class that validates and
 * exposes its payload. Types without an entry use plain {@link BlockProperties}.
 */
public final class PropertiesRegistry {

    private static final Map<BlockType, Function<Map<String, Object>, ? extends BlockProperties>> FACTORIES =
        new EnumMap<>(BlockType.class);

    static {
        FACTORIES.put(BlockType.WORKSPACE, TitledProperties::new);
        FACTORIES.put(BlockType.COLLECTION, TitledProperties::new);
        FACTORIES.put(BlockType.DOCUMENT, DocumentProperties::new);
        FACTORIES.put(BlockType.DATASET, DatasetProperties::new);
        FACTORIES.put(BlockType.DERIVED_CONTENT_CONTAINER, CategorizedProperties::new);
        FACTORIES.put(BlockType.SYSTEM_CONTAINER, CategorizedProperties::new);
        FACTORIES.put(BlockType.HEADING, HeadingProperties::new);
        FACTORIES.put(BlockType.QUOTE, GroupedProperties::new);
        FACTORIES.put(BlockType.TABLE, GroupedProperties::new);
        FACTORIES.put(BlockType.HTML, GroupedProperties::new);
        FACTORIES.put(BlockType.CODE, CodeProperties::new);
        FACTORIES.put(BlockType.OBJECT, ObjectProperties::new);
        FACTORIES.put(BlockType.GROUP_INDEX, GroupIndexProperties::new);
        FACTORIES.put(BlockType.PAGE_GROUP, PageGroupProperties::new);
        FACTORIES.put(BlockType.CHUNK_GROUP, ChunkGroupProperties::new);
    }

    private PropertiesRegistry() {
    }

    public static BlockProperties create(BlockType type, Map<String, Object> values) {
        Function<Map<String, Object>, ? extends BlockProperties> factory = FACTORIES.get(type);
        return factory != null ? factory.apply(values) : new BlockProperties(values);
    }

    /**
     * Re-reads properties built for another type (or as a plain bag) through the
     * factory registered for {@code type}.
     */
    public static BlockProperties adapt(BlockType type, BlockProperties properties) {
        return create(type, properties == null ? Map.of() : properties.asMap());
    }
}
