package com.blockstore.model;

import com.blockstore.model.properties.BlockProperties;
import com.blockstore.model.properties.PropertiesRegistry;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable snapshot of a typed tree node.
 *
 * <p>Changes are expressed by building a new value ({@link #toBuilder()} or the
 * {@code with*} methods); a stored row is only ever replaced, never patched in
 * place. {@link #parent()} and {@link #children()} go through the
 * {@link BlockResolver} the block was loaded with, so a hydrated subtree can
 * point at itself without blocks holding references to each other.
 */
public final class Block {

    private final UUID id;
    private final BlockType type;
    private final UUID parentId;
    private final UUID rootId;
    private final List<UUID> childrenIds;
    private final UUID workspaceId;
    private final boolean inTrash;
    private final int version;
    private final Instant createdTime;
    private final Instant lastEditedTime;
    private final UUID createdBy;
    private final UUID lastEditedBy;
    private final BlockProperties properties;
    private final Map<String, Object> metadata;
    private final Content content;
    private final Integer propertiesVersion;
    private final BlockResolver resolver;

    private Block(Builder b) {
        this.id = b.id != null ? b.id : UUID.randomUUID();
        this.type = Objects.requireNonNull(b.type, "type");
        this.parentId = b.parentId;
        if (b.rootId == null && b.parentId != null) {
            throw new IllegalArgumentException("Block " + id + " has a parent but no root_id");
        }
        this.rootId = b.rootId != null ? b.rootId : this.id;
        this.childrenIds = List.copyOf(b.childrenIds);
        this.workspaceId = b.workspaceId;
        this.inTrash = b.inTrash;
        this.version = b.version;
        // Stored timestamps keep microseconds; trimming here keeps a read-back equal to what was written.
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        this.createdTime = b.createdTime != null ? b.createdTime.truncatedTo(ChronoUnit.MICROS) : now;
        this.lastEditedTime = b.lastEditedTime != null ? b.lastEditedTime.truncatedTo(ChronoUnit.MICROS) : this.createdTime;
        this.createdBy = b.createdBy;
        this.lastEditedBy = b.lastEditedBy;
        this.properties = PropertiesRegistry.adapt(type, b.properties);
        this.metadata = b.metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.content = b.content;
        this.propertiesVersion = b.propertiesVersion;
        this.resolver = b.resolver != null ? b.resolver : BlockResolver.NONE;

        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0, got " + version);
        }
        Set<UUID> seen = new HashSet<>();
        for (UUID childId : childrenIds) {
            if (childId.equals(this.id)) {
                throw new IllegalArgumentException("Block " + id + " lists itself as a child");
            }
            if (!seen.add(childId)) {
                throw new IllegalArgumentException("Block " + id + " lists child " + childId + " more than once");
            }
        }
    }

    public static Builder builder(BlockType type) {
        return new Builder().type(type);
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .type(type)
            .parentId(parentId)
            .rootId(rootId)
            .childrenIds(childrenIds)
            .workspaceId(workspaceId)
            .inTrash(inTrash)
            .version(version)
            .createdTime(createdTime)
            .lastEditedTime(lastEditedTime)
            .createdBy(createdBy)
            .lastEditedBy(lastEditedBy)
            .properties(properties)
            .metadata(metadata)
            .content(content)
            .propertiesVersion(propertiesVersion)
            .resolver(resolver);
    }

    // Navigation

    public Optional<Block> parent() {
        return parentId == null ? Optional.empty() : resolver.resolve(parentId);
    }

    public List<Block> children() {
        return childrenIds.isEmpty() ? List.of() : resolver.resolveAll(childrenIds);
    }

    public boolean isRoot() {
        return parentId == null;
    }

    // Copies

    public Block withResolver(BlockResolver resolver) {
        return toBuilder().resolver(resolver).build();
    }

    public Block withContent(Content content) {
        return toBuilder().content(content).build();
    }

    // Accessors

    public UUID id() { return id; }
    public BlockType type() { return type; }
    public UUID parentId() { return parentId; }
    public UUID rootId() { return rootId; }
    public List<UUID> childrenIds() { return childrenIds; }
    public UUID workspaceId() { return workspaceId; }
    public boolean inTrash() { return inTrash; }
    public int version() { return version; }
    public Instant createdTime() { return createdTime; }
    public Instant lastEditedTime() { return lastEditedTime; }
    public UUID createdBy() { return createdBy; }
    public UUID lastEditedBy() { return lastEditedBy; }
    public BlockProperties properties() { return properties; }
    public Map<String, Object> metadata() { return metadata; }
    public Content content() { return content; }
    public Integer propertiesVersion() { return propertiesVersion; }

    /** Typed view of {@link #properties()}; fails if the block's type uses another class. */
    public <P extends BlockProperties> P properties(Class<P> propertiesClass) {
        return propertiesClass.cast(properties);
    }

    public String plainText() {
        return content != null ? content.plainText() : null;
    }

    // Equality covers persisted state only; the resolver is not part of it.

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block other)) return false;
        return inTrash == other.inTrash
            && version == other.version
            && id.equals(other.id)
            && type == other.type
            && Objects.equals(parentId, other.parentId)
            && rootId.equals(other.rootId)
            && childrenIds.equals(other.childrenIds)
            && Objects.equals(workspaceId, other.workspaceId)
            && createdTime.equals(other.createdTime)
            && lastEditedTime.equals(other.lastEditedTime)
            && Objects.equals(createdBy, other.createdBy)
            && Objects.equals(lastEditedBy, other.lastEditedBy)
            && properties.equals(other.properties)
            && metadata.equals(other.metadata)
            && Objects.equals(content, other.content)
            && Objects.equals(propertiesVersion, other.propertiesVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, version);
    }

    @Override
    public String toString() {
        return "Block[" + type.value() + " " + id + " v" + version
            + (parentId != null ? " parent=" + parentId : "")
            + (inTrash ? " trashed" : "") + "]";
    }

    public static final class Builder {
        private UUID id;
        private BlockType type;
        private UUID parentId;
        private UUID rootId;
        private List<UUID> childrenIds = List.of();
        private UUID workspaceId;
        private boolean inTrash;
        private int version;
        private Instant createdTime;
        private Instant lastEditedTime;
        private UUID createdBy;
        private UUID lastEditedBy;
        private BlockProperties properties;
        private Map<String, Object> metadata;
        private Content content;
        private Integer propertiesVersion;
        private BlockResolver resolver;

        private Builder() {
        }

        public Builder id(UUID id) { this.id = id; return this; }
        public Builder type(BlockType type) { this.type = type; return this; }
        public Builder parentId(UUID parentId) { this.parentId = parentId; return this; }
        public Builder rootId(UUID rootId) { this.rootId = rootId; return this; }
        public Builder childrenIds(List<UUID> childrenIds) {
            this.childrenIds = childrenIds == null ? List.of() : childrenIds;
            return this;
        }
        public Builder childrenIds(UUID... childrenIds) { return childrenIds(List.of(childrenIds)); }
        public Builder workspaceId(UUID workspaceId) { this.workspaceId = workspaceId; return this; }
        public Builder inTrash(boolean inTrash) { this.inTrash = inTrash; return this; }
        public Builder version(int version) { this.version = version; return this; }
        public Builder createdTime(Instant createdTime) { this.createdTime = createdTime; return this; }
        public Builder lastEditedTime(Instant lastEditedTime) { this.lastEditedTime = lastEditedTime; return this; }
        public Builder createdBy(UUID createdBy) { this.createdBy = createdBy; return this; }
        public Builder lastEditedBy(UUID lastEditedBy) { this.lastEditedBy = lastEditedBy; return this; }
        public Builder properties(BlockProperties properties) { this.properties = properties; return this; }
        public Builder properties(Map<String, Object> properties) {
            this.properties = new BlockProperties(properties);
            return this;
        }
        public Builder metadata(Map<String, Object> metadata) { this.metadata = metadata; return this; }
        public Builder content(Content content) { this.content = content; return this; }
        public Builder text(String plainText) { this.content = Content.text(plainText); return this; }
        public Builder propertiesVersion(Integer propertiesVersion) { this.propertiesVersion = propertiesVersion; return this; }
        public Builder resolver(BlockResolver resolver) { this.resolver = resolver; return this; }

        public Block build() {
            return new Block(this);
        }
    }
}
