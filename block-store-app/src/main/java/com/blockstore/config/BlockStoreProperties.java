package com.blockstore.config;

import com.blockstore.model.BlockType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "blockstore")
public class BlockStoreProperties {

    public enum Dialect { AUTO, POSTGRES, H2 }

    private Dialect dialect = Dialect.AUTO;

    // Block types getRootTree will open
    private List<BlockType> rootTypes = new ArrayList<>(List.of(BlockType.DOCUMENT, BlockType.DATASET));

    private String defaultWorkspaceTitle = "Default Workspace";

    public Dialect getDialect() {
        return dialect;
    }

    public void setDialect(Dialect dialect) {
        this.dialect = dialect;
    }

    public List<BlockType> getRootTypes() {
        return rootTypes;
    }

    public void setRootTypes(List<BlockType> rootTypes) {
        this.rootTypes = rootTypes;
    }

    public String getDefaultWorkspaceTitle() {
        return defaultWorkspaceTitle;
    }

    public void setDefaultWorkspaceTitle(String defaultWorkspaceTitle) {
        this.defaultWorkspaceTitle = defaultWorkspaceTitle;
    }
}
