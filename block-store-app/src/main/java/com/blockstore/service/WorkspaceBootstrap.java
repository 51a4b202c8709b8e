package com.blockstore.service;

import com.blockstore.config.BlockStoreProperties;
import com.blockstore.model.Block;
import com.blockstore.model.BlockType;
import com.blockstore.model.properties.TitledProperties;
import com.blockstore.repository.BlockQuery;
import com.blockstore.repository.filter.WhereClause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
public class WorkspaceBootstrap {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceBootstrap.class);

    private final DocumentStore documentStore;
    private final BlockStoreProperties properties;

    public WorkspaceBootstrap(DocumentStore documentStore, BlockStoreProperties properties) {
        this.documentStore = documentStore;
        this.properties = properties;
    }

    public Block ensureWorkspace() {
        return ensureWorkspace(null, null);
    }

    /**
     * Return the workspace with {@code workspaceId} if it exists, otherwise the
     * first workspace found, otherwise a new root workspace block.
     *
     * @param workspaceId preferred workspace, also the id given to a new one; may be null
     * @param title       title for a new workspace; defaults to {@code blockstore.default-workspace-title}
     */
    public Block ensureWorkspace(UUID workspaceId, String title) {
        List<Block> existing = documentStore.query(BlockQuery.where(WhereClause.ofTypes(BlockType.WORKSPACE)));
        if (workspaceId != null) {
            for (Block workspace : existing) {
                if (workspace.id().equals(workspaceId)) {
                    return workspace;
                }
            }
        }
        if (!existing.isEmpty()) {
            return existing.get(0);
        }

        String workspaceTitle = title != null ? title : properties.getDefaultWorkspaceTitle();
        Block workspace = Block.builder(BlockType.WORKSPACE)
            .id(workspaceId != null ? workspaceId : UUID.randomUUID())
            .properties(TitledProperties.of(workspaceTitle))
            .build();
        documentStore.saveBlocks(List.of(workspace));
        log.info("Created workspace {} '{}'", workspace.id(), workspaceTitle);
        return workspace;
    }
}
