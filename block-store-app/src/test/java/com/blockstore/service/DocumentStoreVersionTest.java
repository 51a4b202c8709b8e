package com.blockstore.service;

import com.blockstore.config.BlockStoreProperties;
import com.blockstore.exception.DocumentStoreException;
import com.blockstore.model.Block;
import com.blockstore.model.BlockType;
import com.blockstore.repository.BlockRepository;
import com.blockstore.repository.RelationshipRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/** Which versions the store hands to the repository when callers leave them out. */
@ExtendWith(MockitoExtension.class)
class DocumentStoreVersionTest {

    private static final UUID ROOT = UUID.randomUUID();

    @Mock
    private BlockRepository blockRepository;

    @Mock
    private RelationshipRepository relationshipRepository;

    private DocumentStore store;

    @BeforeEach
    void setUp() {
        store = new DocumentStore(blockRepository, relationshipRepository, new BlockStoreProperties());
    }

    private Block stored(UUID id, UUID parentId, int version) {
        Block block = Block.builder(BlockType.HEADING).id(id).parentId(parentId).rootId(ROOT).version(version).build();
        when(blockRepository.get(eq(id), any())).thenReturn(Optional.of(block));
        return block;
    }

    @Test
    void setChildrenUsesStoredVersion() {
        UUID parent = UUID.randomUUID();
        UUID child = UUID.randomUUID();
        stored(parent, ROOT, 4);

        store.setChildren(parent, List.of(child), null);

        verify(blockRepository).setChildren(parent, List.of(child), 4);
    }

    @Test
    void explicitVersionSkipsTheLookup() {
        UUID parent = UUID.randomUUID();

        store.reorderChildren(parent, List.of(), 9);

        verify(blockRepository).reorderChildren(parent, List.of(), 9);
        verify(blockRepository, never()).get(any(), any());
    }

    @Test
    void moveBlockFillsEachVersion() {
        UUID oldParent = UUID.randomUUID();
        UUID newParent = UUID.randomUUID();
        UUID block = UUID.randomUUID();
        stored(oldParent, ROOT, 7);
        stored(newParent, ROOT, 5);
        stored(block, oldParent, 2);

        store.moveBlock(block, newParent, 0);

        verify(blockRepository).moveBlock(block, newParent, 0, 2, 5, 7);
    }

    @Test
    void moveBlockKeepsGivenVersions() {
        UUID oldParent = UUID.randomUUID();
        UUID newParent = UUID.randomUUID();
        UUID block = UUID.randomUUID();
        stored(block, oldParent, 2);

        store.moveBlock(block, newParent, 1, 3, 6, 8);

        verify(blockRepository).moveBlock(block, newParent, 1, 3, 6, 8);
    }

    @Test
    void missingParentFailsBeforeWriting() {
        UUID parent = UUID.randomUUID();
        when(blockRepository.get(eq(parent), any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.setChildren(parent, List.of(), null))
            .isInstanceOf(DocumentStoreException.class);
        verify(blockRepository, never()).setChildren(any(), anyList(), anyInt());
    }
}
