package com.blockstore.repository;

import com.blockstore.exception.BlockNotFoundException;
import com.blockstore.exception.InvalidChildrenException;
import com.blockstore.exception.VersionConflictException;
import com.blockstore.model.Block;
import com.blockstore.model.BlockType;
import com.blockstore.model.Content;
import com.blockstore.model.Depth;
import com.blockstore.model.properties.DocumentProperties;
import com.blockstore.model.properties.HeadingProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs against the handbook fixture:
 *
 * <pre>
 * W  workspace
 * +-- D1 document (root D1)
 * |   +-- H1 heading -- P1, P2
 * |   +-- H2 heading -- P_TRASHED (in trash)
 * |   +-- DS dataset -- R1, R2, R3
 * +-- D2 document (root D2)
 *     +-- H3 heading -- P3
 * </pre>
 */
@SpringBootTest
@ActiveProfiles("test")
@Sql(scripts = {"/cleanup.sql", "/handbook-blocks.sql"}, executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
class BlockRepositoryTest {

    @Autowired
    private BlockRepository repository;

    @Autowired
    private JdbcTemplate jdbc;

    // Test data IDs from handbook-blocks.sql
    static final UUID W = id("f01");
    static final UUID D1 = id("d01");
    static final UUID H1 = id("a11");
    static final UUID H2 = id("a12");
    static final UUID P1 = id("b11");
    static final UUID P2 = id("b12");
    static final UUID P_TRASHED = id("b13");
    static final UUID DS = id("c21");
    static final UUID R1 = id("e21");
    static final UUID R2 = id("e22");
    static final UUID R3 = id("e23");
    static final UUID D2 = id("d02");
    static final UUID H3 = id("a21");
    static final UUID P3 = id("b21");

    static UUID id(String suffix) {
        return UUID.fromString("00000000-0000-0000-0000-000000000" + suffix);
    }

    private Block load(UUID id) {
        return repository.get(id, Depth.none(), true).orElseThrow();
    }

    private UUID parentIdOf(UUID id) {
        String parent = jdbc.queryForObject("SELECT parent_id FROM blocks WHERE id = ?", String.class, id.toString());
        return parent != null ? UUID.fromString(parent) : null;
    }

    @Nested
    @DisplayName("get")
    class Get {

        @Test
        void readsTypedBlock() {
            Block doc = repository.get(D1, Depth.none()).orElseThrow();

            assertThat(doc.type()).isEqualTo(BlockType.DOCUMENT);
            assertThat(doc.properties(DocumentProperties.class).title()).isEqualTo("Security Handbook");
            assertThat(doc.parentId()).isEqualTo(W);
            assertThat(doc.rootId()).isEqualTo(D1);
            assertThat(doc.childrenIds()).containsExactly(H1, H2, DS);
            assertThat(doc.workspaceId()).isEqualTo(W);
            assertThat(doc.createdTime()).isEqualTo(Instant.parse("2024-01-15T10:00:00Z"));
        }

        @Test
        void missingBlockIsEmpty() {
            assertThat(repository.get(id("999"), Depth.none())).isEmpty();
        }

        @Test
        void trashedBlockIsHiddenUnlessRequested() {
            assertThat(repository.get(P_TRASHED, Depth.none())).isEmpty();
            assertThat(repository.get(P_TRASHED, Depth.none(), true)).get()
                .extracting(Block::inTrash).isEqualTo(true);
        }

        @Test
        void depthZeroFetchesChildrenLazily() {
            Block doc = repository.get(D1, Depth.none()).orElseThrow();

            List<Block> first = doc.children();
            List<Block> second = doc.children();

            assertThat(first).extracting(Block::id).containsExactly(H1, H2, DS);
            assertThat(first.get(0)).isEqualTo(second.get(0)).isNotSameAs(second.get(0));
        }

        @Test
        void boundedDepthSharesInstances() {
            Block doc = repository.get(D1, Depth.of(2)).orElseThrow();

            Block heading = doc.children().get(0);
            assertThat(doc.children().get(0)).isSameAs(heading);
            assertThat(heading.parent()).get().isSameAs(doc);
            assertThat(heading.children()).extracting(Block::id).containsExactly(P1, P2);
            assertThat(heading.children().get(0)).isSameAs(heading.children().get(0));
        }

        @Test
        void boundedDepthStillNavigatesBeyondItsLevels() {
            Block doc = repository.get(D1, Depth.of(1)).orElseThrow();

            Block heading = doc.children().get(0);

            assertThat(heading.children()).extracting(Block::id).containsExactly(P1, P2);
        }

        @Test
        void hydrationSkipsTrashedDescendants() {
            Block doc = repository.get(D1, Depth.of(3)).orElseThrow();

            Block archive = doc.children().get(1);

            assertThat(archive.id()).isEqualTo(H2);
            assertThat(archive.childrenIds()).containsExactly(P_TRASHED);
            assertThat(archive.children()).isEmpty();
        }

        @Test
        void unboundedDepthLoadsTheWholeRoot() {
            Block doc = repository.get(D1, Depth.unbounded()).orElseThrow();

            Block dataset = doc.children().get(2);
            List<Block> records = dataset.children();

            assertThat(records).extracting(Block::id).containsExactly(R1, R2, R3);
            assertThat(records.get(1).parent()).get().isSameAs(dataset);
            assertThat(records.get(1).parent().get().parent()).get().isSameAs(doc);
            assertThat(records.get(1).content().data()).containsEntry("category", "Detective");
        }

        @Test
        void includeTrashedHydratesTrashedDescendants() {
            Block doc = repository.get(D1, Depth.unbounded(), true).orElseThrow();

            assertThat(doc.children().get(1).children()).extracting(Block::id).containsExactly(P_TRASHED);
        }
    }

    @Nested
    @DisplayName("upsert")
    class Upsert {

        @Test
        void roundTripsAWholeTree() {
            UUID docId = UUID.randomUUID();
            UUID headingId = UUID.randomUUID();
            UUID paragraphId = UUID.randomUUID();
            UUID recordId = UUID.randomUUID();
            Block doc = Block.builder(BlockType.DOCUMENT).id(docId).workspaceId(W)
                .childrenIds(headingId, recordId)
                .properties(DocumentProperties.of("Runbook", "ops"))
                .metadata(Map.of("source", "markdown", "weight", 0.5))
                .propertiesVersion(1)
                .build();
            Block heading = Block.builder(BlockType.HEADING).id(headingId).parentId(docId).rootId(docId).workspaceId(W)
                .childrenIds(paragraphId)
                .properties(HeadingProperties.of(1))
                .text("Restarts")
                .build();
            Block paragraph = Block.builder(BlockType.PARAGRAPH).id(paragraphId).parentId(headingId).rootId(docId)
                .workspaceId(W)
                .text("Drain the node first.")
                .build();
            Block record = Block.builder(BlockType.RECORD).id(recordId).parentId(docId).rootId(docId).workspaceId(W)
                .content(new Content("row", Map.of("status", "Active"), Map.of("category", "Preventive", "count", 3), null))
                .build();

            repository.upsert(List.of(doc, heading, paragraph, record));
            Block loaded = repository.get(docId, Depth.unbounded()).orElseThrow();

            assertThat(loaded).isEqualTo(doc);
            assertThat(loaded.children()).containsExactly(heading, record);
            assertThat(loaded.children().get(0).children()).containsExactly(paragraph);
        }

        @Test
        void replacesByIdWithoutVersionCheck() {
            Block p1 = load(P1);
            Block edited = p1.withContent(Content.text("Rewritten")).toBuilder().version(7).build();

            repository.upsert(List.of(edited));

            Block reloaded = load(P1);
            assertThat(reloaded.plainText()).isEqualTo("Rewritten");
            assertThat(reloaded.version()).isEqualTo(7);
        }

        @Test
        void leavesOtherBlocksAlone() {
            Block orphan = Block.builder(BlockType.PARAGRAPH).parentId(H1).rootId(D1).text("Not listed").build();

            repository.upsert(List.of(orphan));

            assertThat(load(H1).childrenIds()).containsExactly(P1, P2);
            assertThat(load(H1).version()).isZero();
        }
    }

    @Nested
    @DisplayName("setChildren")
    class SetChildren {

        @Test
        void replacesChildrenAndBumpsOnlyTheParent() {
            repository.setChildren(H1, List.of(P2, P1), 0);

            Block heading = load(H1);
            assertThat(heading.childrenIds()).containsExactly(P2, P1);
            assertThat(heading.version()).isEqualTo(1);
            assertThat(load(P1).version()).isZero();
            assertThat(load(P2).version()).isZero();
        }

        @Test
        void reparentsAndOrphans() {
            repository.setChildren(H2, List.of(P1), 0);
            repository.setChildren(H1, List.of(P2), 0);

            assertThat(parentIdOf(P1)).isEqualTo(H2);
            assertThat(parentIdOf(P_TRASHED)).isNull();
            assertThat(parentIdOf(P2)).isEqualTo(H1);
            assertThat(load(H2).childrenIds()).containsExactly(P1);
        }

        @Test
        void droppedChildPointingElsewhereKeepsItsParent() {
            repository.setChildren(H2, List.of(P1), 0);
            repository.setChildren(H1, List.of(), 0);

            assertThat(parentIdOf(P1)).isEqualTo(H2);
            assertThat(parentIdOf(P2)).isNull();
        }

        @Test
        void duplicatesAreRejectedBeforeAnythingElse() {
            assertThatThrownBy(() -> repository.setChildren(id("999"), List.of(P1, P1), 42))
                .isInstanceOf(InvalidChildrenException.class);
        }

        @Test
        void acceptedVersionCannotBeReused() {
            repository.setChildren(H1, List.of(P2, P1), 0);

            assertThatThrownBy(() -> repository.setChildren(H1, List.of(P1, P2), 0))
                .isInstanceOf(VersionConflictException.class);
            assertThat(load(H1).childrenIds()).containsExactly(P2, P1);
            assertThat(load(H1).version()).isEqualTo(1);
        }

        @Test
        void staleVersionConflicts() {
            assertThatThrownBy(() -> repository.setChildren(H1, List.of(P1), 3))
                .isInstanceOf(VersionConflictException.class)
                .satisfies(e -> {
                    VersionConflictException conflict = (VersionConflictException) e;
                    assertThat(conflict.getBlockId()).isEqualTo(H1);
                    assertThat(conflict.getExpectedVersion()).isEqualTo(3);
                    assertThat(conflict.getActualVersion()).isZero();
                });
            assertThat(load(H1).childrenIds()).containsExactly(P1, P2);
        }

        @Test
        void missingParentOrChildIsNotFound() {
            UUID ghost = id("999");

            assertThatThrownBy(() -> repository.setChildren(ghost, List.of(P1), 0))
                .isInstanceOf(BlockNotFoundException.class);
            assertThatThrownBy(() -> repository.setChildren(H1, List.of(P1, ghost), 0))
                .isInstanceOf(BlockNotFoundException.class)
                .satisfies(e -> assertThat(((BlockNotFoundException) e).getBlockIds()).containsExactly(ghost));
        }

        @Test
        void parentCannotBeItsOwnChild() {
            assertThatThrownBy(() -> repository.setChildren(H1, List.of(H1), 0))
                .isInstanceOf(InvalidChildrenException.class);
        }

        @Test
        void ancestorCannotBecomeAChild() {
            assertThatThrownBy(() -> repository.setChildren(P1, List.of(H1), 0))
                .isInstanceOf(InvalidChildrenException.class)
                .hasMessageContaining("cycle");
            assertThatThrownBy(() -> repository.setChildren(H1, List.of(P1, P2, D1), 0))
                .isInstanceOf(InvalidChildrenException.class);
            assertThat(load(H1).version()).isZero();
            assertThat(parentIdOf(D1)).isEqualTo(W);
        }

        @Test
        void childFromAnotherDocumentIsRejected() {
            assertThatThrownBy(() -> repository.setChildren(D1, List.of(H1, H2, DS, H3), 0))
                .isInstanceOf(InvalidChildrenException.class)
                .hasMessageContaining("root");
        }

        @Test
        void documentCannotBeAdoptedInsideAnotherDocument() {
            assertThatThrownBy(() -> repository.setChildren(P1, List.of(D2), 0))
                .isInstanceOf(InvalidChildrenException.class)
                .hasMessageContaining("root");
            assertThatThrownBy(() -> repository.setChildren(H1, List.of(P1, P2, D2), 0))
                .isInstanceOf(InvalidChildrenException.class);

            assertThat(parentIdOf(D2)).isEqualTo(W);
            assertThat(load(P1).childrenIds()).isEmpty();
            assertThat(load(H1).version()).isZero();
        }

        @Test
        void rootBlocksCanBeAttached() {
            Block doc = Block.builder(BlockType.DOCUMENT).properties(DocumentProperties.of("Glossary", null)).build();
            repository.upsert(List.of(doc));

            repository.setChildren(W, List.of(D1, D2, doc.id()), 0);

            assertThat(load(W).childrenIds()).containsExactly(D1, D2, doc.id());
            assertThat(parentIdOf(doc.id())).isEqualTo(W);
            assertThat(load(doc.id()).rootId()).isEqualTo(doc.id());
        }

        @Test
        void ancestorWalkStopsOnCorruptedCycle() {
            jdbc.update("UPDATE blocks SET parent_id = ? WHERE id = ?", P1.toString(), H1.toString());

            assertThat(repository.ancestorIds(P1)).containsExactly(P1, H1);
        }
    }

    @Nested
    @DisplayName("reorderChildren")
    class ReorderChildren {

        @Test
        void acceptsPermutation() {
            repository.reorderChildren(D1, List.of(DS, H1, H2), 0);

            assertThat(load(D1).childrenIds()).containsExactly(DS, H1, H2);
            assertThat(load(D1).version()).isEqualTo(1);
        }

        @Test
        void rejectsMissingOrExtraIds() {
            assertThatThrownBy(() -> repository.reorderChildren(D1, List.of(DS, H1), 0))
                .isInstanceOf(InvalidChildrenException.class);
            assertThatThrownBy(() -> repository.reorderChildren(D1, List.of(DS, H1, H2, P1), 0))
                .isInstanceOf(InvalidChildrenException.class);
            assertThatThrownBy(() -> repository.reorderChildren(D1, List.of(DS, H1, H1), 0))
                .isInstanceOf(InvalidChildrenException.class);
        }
    }

    @Nested
    @DisplayName("moveBlock")
    class MoveBlock {

        @Test
        void movesAcrossParentsAndBumpsAllThree() {
            repository.moveBlock(P1, H2, 0, 0, 0, 0);

            assertThat(load(H1).childrenIds()).containsExactly(P2);
            assertThat(load(H2).childrenIds()).containsExactly(P1, P_TRASHED);
            assertThat(load(P1).parentId()).isEqualTo(H2);
            assertThat(load(P1).version()).isEqualTo(1);
            assertThat(load(H1).version()).isEqualTo(1);
            assertThat(load(H2).version()).isEqualTo(1);
        }

        @Test
        void repositionsWithinTheSameParent() {
            repository.moveBlock(P1, H1, 5, 0, 0, null);

            assertThat(load(H1).childrenIds()).containsExactly(P2, P1);
            assertThat(load(H1).version()).isEqualTo(1);
            assertThat(load(P1).version()).isEqualTo(1);
        }

        @Test
        void clampsNegativeIndex() {
            repository.moveBlock(R3, DS, -4, 0, 0, null);

            assertThat(load(DS).childrenIds()).containsExactly(R3, R1, R2);
        }

        @Test
        void crossRootMoveIsRejected() {
            assertThatThrownBy(() -> repository.moveBlock(P3, H1, 0, 0, 0, null))
                .isInstanceOf(InvalidChildrenException.class);
            assertThat(load(P3).parentId()).isEqualTo(H3);
            assertThat(load(P3).version()).isZero();
            assertThat(load(H3).childrenIds()).containsExactly(P3);
            assertThat(load(H3).version()).isZero();
            assertThat(load(H1).childrenIds()).containsExactly(P1, P2);
            assertThat(load(H1).version()).isZero();
        }

        @Test
        void documentCannotMoveUnderAnotherDocumentsBlock() {
            assertThatThrownBy(() -> repository.moveBlock(D2, P1, 0, 0, 0, null))
                .isInstanceOf(InvalidChildrenException.class);
            assertThat(parentIdOf(D2)).isEqualTo(W);
            assertThat(load(P1).childrenIds()).isEmpty();
        }

        @Test
        void documentsRepositionUnderTheirWorkspace() {
            repository.moveBlock(D1, W, 1, 0, 0, null);

            assertThat(load(W).childrenIds()).containsExactly(D2, D1);
            assertThat(load(W).version()).isEqualTo(1);
            assertThat(load(D1).version()).isEqualTo(1);
        }

        @Test
        void moveUnderOwnDescendantIsRejected() {
            assertThatThrownBy(() -> repository.moveBlock(H1, P1, 0, 0, 0, null))
                .isInstanceOf(InvalidChildrenException.class)
                .hasMessageContaining("cycle");
            assertThatThrownBy(() -> repository.moveBlock(H1, H1, 0, 0, 0, null))
                .isInstanceOf(InvalidChildrenException.class);

            assertThat(parentIdOf(H1)).isEqualTo(D1);
            assertThat(load(H1).version()).isZero();
            assertThat(load(H1).childrenIds()).containsExactly(P1, P2);
            assertThat(load(P1).childrenIds()).isEmpty();
            assertThat(load(P1).version()).isZero();
            assertThat(load(D1).childrenIds()).containsExactly(H1, H2, DS);
            assertThat(load(D1).version()).isZero();
        }

        @Test
        void missingOldParentIsNotFound() {
            UUID ghost = id("999");
            jdbc.update("UPDATE blocks SET parent_id = ? WHERE id = ?", ghost.toString(), P1.toString());

            assertThatThrownBy(() -> repository.moveBlock(P1, H2, 0, 0, 0, 42))
                .isInstanceOf(BlockNotFoundException.class)
                .satisfies(e -> assertThat(((BlockNotFoundException) e).getBlockIds()).containsExactly(ghost));
            assertThat(parentIdOf(P1)).isEqualTo(ghost);
            assertThat(load(H2).childrenIds()).containsExactly(P_TRASHED);
            assertThat(load(H2).version()).isZero();
        }

        @Test
        void staleBlockVersionConflicts() {
            assertThatThrownBy(() -> repository.moveBlock(P1, H2, 0, 4, 0, null))
                .isInstanceOf(VersionConflictException.class);
        }

        @Test
        void staleOldParentRollsBackEverything() {
            assertThatThrownBy(() -> repository.moveBlock(P1, H2, 0, 0, 0, 9))
                .isInstanceOf(VersionConflictException.class);

            assertThat(load(H1).childrenIds()).containsExactly(P1, P2);
            assertThat(load(H2).childrenIds()).containsExactly(P_TRASHED);
            assertThat(load(P1).version()).isZero();
        }

        @Test
        void versionsIncreaseWithEachMove() {
            repository.moveBlock(P1, H2, 0, 0, 0, 0);
            repository.moveBlock(P1, H1, 0, 1, 1, 1);

            assertThat(load(P1).version()).isEqualTo(2);
            assertThat(load(H1).version()).isEqualTo(2);
            assertThat(load(H2).version()).isEqualTo(2);
            assertThat(load(H1).childrenIds()).containsExactly(P1, P2);
        }
    }

    @Nested
    @DisplayName("setInTrash")
    class SetInTrash {

        @Test
        void cascadesToDescendants() {
            repository.setInTrash(List.of(H1), true, true);

            assertThat(repository.get(H1, Depth.none())).isEmpty();
            assertThat(repository.get(P1, Depth.none())).isEmpty();
            assertThat(repository.get(P2, Depth.none())).isEmpty();
            assertThat(load(P1).version()).isEqualTo(1);
            assertThat(repository.get(D1, Depth.none())).isPresent();
        }

        @Test
        void withoutCascadeOnlyTouchesRequestedIds() {
            repository.setInTrash(List.of(H1), true, false);

            assertThat(load(H1).inTrash()).isTrue();
            assertThat(load(P1).inTrash()).isFalse();
        }

        @Test
        void repeatingIsHarmless() {
            repository.setInTrash(List.of(DS), true, true);
            repository.setInTrash(List.of(DS), true, true);

            assertThat(List.of(DS, R1, R2, R3)).allSatisfy(id -> assertThat(load(id).inTrash()).isTrue());
            assertThat(load(R1).version()).isEqualTo(2);
        }

        @Test
        void restoreClearsTheWholeClosure() {
            repository.setInTrash(List.of(H2), true, true);

            repository.setInTrash(List.of(H2), false, true);

            assertThat(load(H2).inTrash()).isFalse();
            assertThat(load(P_TRASHED).inTrash()).isFalse();
        }

        @Test
        void missingIdsAreAllReported() {
            UUID first = id("998");
            UUID second = id("999");

            assertThatThrownBy(() -> repository.setInTrash(List.of(P1, first, second), true, true))
                .isInstanceOf(BlockNotFoundException.class)
                .satisfies(e -> assertThat(((BlockNotFoundException) e).getBlockIds()).containsExactly(first, second));
            assertThat(load(P1).inTrash()).isFalse();
        }
    }
}
