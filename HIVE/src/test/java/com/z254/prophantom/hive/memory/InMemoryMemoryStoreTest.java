package com.z254.prophantom.hive.memory;

import com.z254.prophantom.hive.HiveTestFixture;
import com.z254.prophantom.hive.MutableClock;
import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.domain.model.AssociationLabel;
import com.z254.prophantom.hive.domain.model.ConsolidationState;
import com.z254.prophantom.hive.domain.model.MemoryAssociation;
import com.z254.prophantom.hive.domain.model.MemoryItem;
import com.z254.prophantom.hive.domain.model.MemoryKind;
import com.z254.prophantom.hive.domain.model.ScoredMemory;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryMemoryStore}.
 */
class InMemoryMemoryStoreTest {

    private HiveProperties properties;
    private MutableClock clock;
    private InMemoryMemoryStore store;

    @BeforeEach
    void setUp() {
        properties = HiveTestFixture.defaultProperties();
        clock = new MutableClock(HiveTestFixture.START);
        store = new InMemoryMemoryStore(properties, clock);
    }

    private static MemoryItem item(String userId, String agentType, MemoryKind kind, String content, double importance) {
        return MemoryItem.builder()
                .userId(userId)
                .agentType(agentType)
                .kind(kind)
                .content(content)
                .importance(importance)
                .build();
    }

    private String write(String content) {
        return store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, content, 0.5));
    }

    @Nested
    @DisplayName("write")
    class Write {

        @Test
        @DisplayName("should assign store-managed fields")
        void shouldAssignStoreManagedFields() {
            String id = store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "likes hiking", 0.5)
                    .toBuilder().state(ConsolidationState.ARCHIVED).version(42).build());

            MemoryItem stored = store.get(id).orElseThrow();
            assertThat(stored.getState()).isEqualTo(ConsolidationState.RAW);
            assertThat(stored.getVersion()).isEqualTo(1);
            assertThat(stored.getSequence()).isEqualTo(1);
            assertThat(stored.getCreatedAt()).isEqualTo(HiveTestFixture.START);
            assertThat(stored.getAccessCount()).isZero();
        }

        @Test
        @DisplayName("should keep creation times strictly increasing when the clock stands still")
        void shouldKeepCreationTimesStrictlyIncreasing() {
            List<Instant> created = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                created.add(store.get(write("note " + i)).orElseThrow().getCreatedAt());
            }

            for (int i = 1; i < created.size(); i++) {
                assertThat(created.get(i)).isAfter(created.get(i - 1));
            }
        }

        @Test
        @DisplayName("should clamp importance into [0,1]")
        void shouldClampImportance() {
            String high = store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "high", 3.0));
            String low = store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "low", -1.0));

            assertThat(store.get(high).orElseThrow().getImportance()).isEqualTo(1.0);
            assertThat(store.get(low).orElseThrow().getImportance()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("should reject items without content or owner")
        void shouldRejectInvalidItems() {
            assertThatThrownBy(() -> store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "  ", 0.5)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> store.write(item(null, "emo_ai", MemoryKind.EPISODIC, "text", 0.5)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> store.write(item("u1", "emo_ai", null, "text", 0.5)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(store.stats().getTotalItems()).isZero();
        }

        @Test
        @DisplayName("should reject a duplicate id")
        void shouldRejectDuplicateId() {
            store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "first", 0.5).toBuilder().id("m-1").build());

            assertThatThrownBy(() -> store.write(
                    item("u1", "emo_ai", MemoryKind.EPISODIC, "second", 0.5).toBuilder().id("m-1").build()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("m-1");
        }
    }

    @Nested
    @DisplayName("rank")
    class Rank {

        @Test
        @DisplayName("should return nothing for a non-positive k or an unknown scope")
        void shouldReturnNothingForEmptyRequests() {
            write("coffee in the morning");

            assertThat(store.rank("u1", "emo_ai", "coffee", 0)).isEmpty();
            assertThat(store.rank("u2", "emo_ai", "coffee", 5)).isEmpty();
            assertThat(store.rank("u1", "pdf_mind", "coffee", 5)).isEmpty();
        }

        @Test
        @DisplayName("should put lexical matches first")
        void shouldPutLexicalMatchesFirst() {
            String match = write("user drinks black coffee every morning");
            write("user went to the cinema");
            write("user has a dog named Rex");

            List<MemoryItem> result = store.query("u1", "emo_ai", "coffee", 3);

            assertThat(result).hasSize(3);
            assertThat(result.get(0).getId()).isEqualTo(match);
        }

        @Test
        @DisplayName("should weight items by kind")
        void shouldWeightItemsByKind() {
            String emotional = store.write(item("u1", "emo_ai", MemoryKind.EMOTIONAL, "felt anxious at work", 0.5));
            store.write(item("u1", "emo_ai", MemoryKind.PROCEDURAL, "felt anxious at work", 0.5));

            List<ScoredMemory> ranked = store.rank("u1", "emo_ai", "anxious", 2);

            assertThat(ranked.get(0).getItem().getId()).isEqualTo(emotional);
            assertThat(ranked.get(0).getRelevance()).isGreaterThan(ranked.get(1).getRelevance());
        }

        @Test
        @DisplayName("should return the same order for the same state")
        void shouldBeDeterministic() {
            for (int i = 0; i < 10; i++) {
                write("identical memory");
            }

            List<String> first = store.query("u1", "emo_ai", "identical", 10).stream()
                    .map(MemoryItem::getId).collect(Collectors.toList());
            List<String> second = store.query("u1", "emo_ai", "identical", 10).stream()
                    .map(MemoryItem::getId).collect(Collectors.toList());

            assertThat(second).containsExactlyElementsOf(first);
        }

        @Test
        @DisplayName("should update access statistics of returned items only")
        void shouldTouchReturnedItems() {
            String match = write("loves jazz music");
            String other = write("works as a nurse");
            clock.advance(Duration.ofMinutes(5));

            store.query("u1", "emo_ai", "jazz", 1);

            MemoryItem touched = store.get(match).orElseThrow();
            assertThat(touched.getAccessCount()).isEqualTo(1);
            assertThat(touched.getVersion()).isEqualTo(2);
            assertThat(touched.getLastAccessAt()).isEqualTo(HiveTestFixture.START.plus(Duration.ofMinutes(5)));
            assertThat(store.get(other).orElseThrow().getAccessCount()).isZero();
        }
    }

    @Nested
    @DisplayName("associate")
    class Associate {

        @Test
        @DisplayName("should expose the edge from both endpoints")
        void shouldExposeEdgeFromBothEndpoints() {
            String a = write("first");
            String b = write("second");

            MemoryAssociation edge = store.associate(a, b, 0.8, AssociationLabel.REMINDS_OF);

            assertThat(store.associationsOf(a)).containsExactly(edge);
            assertThat(store.associationsOf(b)).containsExactly(edge);
            assertThat(edge.isStale()).isFalse();
        }

        @Test
        @DisplayName("should reject self loops, unknown items and out of range weights")
        void shouldRejectInvalidEdges() {
            String a = write("first");
            String b = write("second");

            assertThatThrownBy(() -> store.associate(a, a, 0.5, AssociationLabel.ELABORATES))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> store.associate(a, "missing", 0.5, AssociationLabel.ELABORATES))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> store.associate(a, b, 1.5, AssociationLabel.ELABORATES))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> store.associate(a, b, Double.NaN, AssociationLabel.ELABORATES))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(store.stats().getAssociations()).isZero();
        }
    }

    @Nested
    @DisplayName("consolidate")
    class Consolidate {

        @Test
        @DisplayName("should summarize a closed window and keep every original")
        void shouldSummarizeClosedWindow() {
            List<String> originals = List.of(
                    store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "talked about running shoes", 0.3)),
                    store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "planning a running trip", 0.7)),
                    store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "asked about running pace", 0.4)));
            clock.advance(Duration.ofHours(7));

            ConsolidationReport report = store.consolidate();

            assertThat(report.isSkipped()).isFalse();
            assertThat(report.getSummariesCreated()).isEqualTo(1);
            assertThat(report.getItemsConsolidated()).isEqualTo(3);
            assertThat(report.getTotalItemsBefore()).isEqualTo(3);
            assertThat(report.getTotalItemsAfter()).isEqualTo(4);
            assertThat(store.stats().getTotalItems()).isEqualTo(4);

            MemoryItem source = store.get(originals.get(0)).orElseThrow();
            assertThat(source.getState()).isEqualTo(ConsolidationState.CONSOLIDATED);
            MemoryItem summary = store.get(source.getConsolidatedInto()).orElseThrow();
            assertThat(summary.getKind()).isEqualTo(MemoryKind.SEMANTIC);
            assertThat(summary.getTags()).contains(ConsolidationPlanner.SUMMARY_TAG, "running");
            assertThat(summary.getImportance()).isEqualTo(0.7);
            assertThat(summary.getAttributes()).containsEntry(ConsolidationPlanner.ATTR_SOURCE_COUNT, "3");

            assertThat(store.associationsOf(summary.getId()))
                    .hasSize(3)
                    .allSatisfy(edge -> {
                        assertThat(edge.getLabel()).isEqualTo(AssociationLabel.SUMMARIZES);
                        assertThat(edge.getFromId()).isEqualTo(summary.getId());
                    })
                    .extracting(MemoryAssociation::getToId)
                    .containsExactlyInAnyOrderElementsOf(originals);
            assertThat(store.lastConsolidation()).contains(report);
        }

        @Test
        @DisplayName("should leave the open window alone")
        void shouldLeaveOpenWindowAlone() {
            write("first note");
            write("second note");

            ConsolidationReport report = store.consolidate();

            assertThat(report.getSummariesCreated()).isZero();
            assertThat(store.stats().getByState()).containsEntry(ConsolidationState.RAW, 2L);
        }

        @Test
        @DisplayName("should keep consolidated items queryable")
        void shouldKeepConsolidatedItemsQueryable() {
            String original = write("remembers the trip to Lisbon");
            write("another quiet evening");
            clock.advance(Duration.ofHours(7));
            store.consolidate();

            assertThat(store.query("u1", "emo_ai", "Lisbon", 5))
                    .extracting(MemoryItem::getId)
                    .contains(original);
        }

        @Test
        @DisplayName("should archive decayed items and mark their edges stale")
        void shouldArchiveDecayedItems() {
            String faint = store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "faint memory", 0.05));
            String strong = store.write(item("u1", "pdf_mind", MemoryKind.SEMANTIC, "strong memory", 0.8));
            store.associate(strong, faint, 0.5, AssociationLabel.REMINDS_OF);
            clock.advance(Duration.ofDays(8));

            ConsolidationReport report = store.consolidate();

            assertThat(report.getItemsDecayed()).isEqualTo(2);
            assertThat(report.getItemsArchived()).isEqualTo(1);
            assertThat(store.get(faint).orElseThrow().getState()).isEqualTo(ConsolidationState.ARCHIVED);
            assertThat(store.get(strong).orElseThrow().getImportance()).isCloseTo(0.792, within());
            assertThat(store.query("u1", "emo_ai", "faint", 5)).isEmpty();
            assertThat(store.associationsOf(strong)).singleElement()
                    .satisfies(edge -> assertThat(edge.isStale()).isTrue());
            assertThat(store.stats().getArchivedItems()).isEqualTo(1);
            assertThat(store.stats().getTotalItems()).isEqualTo(2);
        }

        @Test
        @DisplayName("should archive the least important items above the per-user cap")
        void shouldEnforcePerUserCap() {
            properties.getMemory().setMaxItemsPerUser(2);
            store = new InMemoryMemoryStore(properties, clock);
            String low = store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "low", 0.1));
            store.write(item("u1", "pdf_mind", MemoryKind.EPISODIC, "mid", 0.5));
            store.write(item("u1", "cv_smash", MemoryKind.EPISODIC, "high", 0.9));

            ConsolidationReport report = store.consolidate();

            assertThat(report.getItemsArchived()).isEqualTo(1);
            assertThat(store.get(low).orElseThrow().isActive()).isFalse();
            assertThat(store.stats().getActiveItems()).isEqualTo(2);
        }

        @Test
        @DisplayName("should never lose items while queries run concurrently")
        void shouldStayConsistentUnderConcurrentQueries() throws Exception {
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                ids.add(write("shared topic number " + i));
            }
            clock.advance(Duration.ofHours(7));

            ExecutorService executor = Executors.newFixedThreadPool(4);
            AtomicBoolean running = new AtomicBoolean(true);
            CountDownLatch started = new CountDownLatch(4);
            for (int t = 0; t < 4; t++) {
                executor.submit(() -> {
                    started.countDown();
                    while (running.get()) {
                        store.query("u1", "emo_ai", "shared topic", 20);
                    }
                });
            }
            started.await(5, TimeUnit.SECONDS);
            for (int pass = 0; pass < 5; pass++) {
                store.consolidate();
            }
            running.set(false);
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

            // Anything rescheduled by a conflict is picked up once readers are gone
            store.consolidate();

            assertThat(ids).allSatisfy(id -> {
                MemoryItem original = store.get(id).orElseThrow();
                assertThat(original.getState()).isEqualTo(ConsolidationState.CONSOLIDATED);
                assertThat(store.get(original.getConsolidatedInto())).isPresent();
            });
            long summaries = store.stats().getTotalItems() - ids.size();
            assertThat(summaries).isGreaterThanOrEqualTo(1);
            assertThat(store.stats().getByState()).doesNotContainKey(ConsolidationState.RAW);
        }
    }

    @Nested
    @DisplayName("consolidate across passes")
    class ConsolidateAcrossPasses {

        /**
         * A store that reads the given text once, between planning and applying its first pass.
         */
        private InMemoryMemoryStore readingBetweenPlanAndApply(String text) {
            AtomicBoolean pending = new AtomicBoolean(true);
            return new InMemoryMemoryStore(properties, clock) {
                @Override
                List<ChangeSet> plan(List<MemoryItem> snapshot, Instant now) {
                    List<ChangeSet> planned = super.plan(snapshot, now);
                    if (pending.getAndSet(false)) {
                        query("u1", "emo_ai", text, 1);
                    }
                    return planned;
                }
            };
        }

        @Test
        @DisplayName("should decay an idle item once per access window however often passes run")
        void shouldDecayOncePerAccessWindow() {
            String id = write("an old conversation");
            clock.advance(Duration.ofDays(8));

            ConsolidationReport first = store.consolidate();
            for (int pass = 0; pass < 300; pass++) {
                assertThat(store.consolidate().getItemsDecayed()).isZero();
            }

            MemoryItem item = store.get(id).orElseThrow();
            assertThat(first.getItemsDecayed()).isEqualTo(1);
            assertThat(item.getImportance()).isCloseTo(0.495, within());
            assertThat(item.getState()).isEqualTo(ConsolidationState.RAW);
            assertThat(item.getLastDecayedAt()).isEqualTo(clock.instant());

            clock.advance(Duration.ofDays(7).plusHours(1));
            store.consolidate();

            assertThat(store.get(id).orElseThrow().getImportance()).isCloseTo(0.495 * 0.99, within());
        }

        @Test
        @DisplayName("should leave items written during a pass to the next pass")
        void shouldExcludeItemsWrittenDuringPass() {
            properties.getMemory().setMaxItemsPerUser(2);
            AtomicReference<String> late = new AtomicReference<>();
            store = new InMemoryMemoryStore(properties, clock) {
                @Override
                List<MemoryItem> snapshotUpTo(long cutoff) {
                    if (late.get() == null) {
                        late.set(write(item("u1", "emo_ai", MemoryKind.EPISODIC, "written mid pass", 0.01)));
                    }
                    return super.snapshotUpTo(cutoff);
                }
            };
            store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "kept", 0.6));
            store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "also kept", 0.7));

            ConsolidationReport first = store.consolidate();

            assertThat(first.getExamined()).isEqualTo(2);
            assertThat(first.getItemsArchived()).isZero();
            MemoryItem lateItem = store.get(late.get()).orElseThrow();
            assertThat(lateItem.getState()).isEqualTo(ConsolidationState.RAW);
            assertThat(lateItem.getVersion()).isEqualTo(1);

            ConsolidationReport second = store.consolidate();

            assertThat(second.getExamined()).isEqualTo(3);
            assertThat(second.getItemsArchived()).isEqualTo(1);
            assertThat(store.get(late.get()).orElseThrow().isActive()).isFalse();
        }

        @Test
        @DisplayName("should reschedule a conflicting change set and apply it on the next pass")
        void shouldRescheduleConflictingChangeSet() {
            store = readingBetweenPlanAndApply("Lisbon");
            String read = store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "the trip to Lisbon", 0.5));
            String idle = store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "a quiet evening at home", 0.5));
            clock.advance(Duration.ofDays(8));

            ConsolidationReport first = store.consolidate();

            assertThat(first.getConflicts()).isEqualTo(1);
            assertThat(first.getSummariesCreated()).isZero();
            assertThat(first.getItemsDecayed()).isZero();
            assertThat(store.get(read).orElseThrow().getState()).isEqualTo(ConsolidationState.RAW);
            assertThat(store.get(idle).orElseThrow().getImportance()).isEqualTo(0.5);

            ConsolidationReport second = store.consolidate();

            assertThat(second.getConflicts()).isZero();
            assertThat(second.getSummariesCreated()).isEqualTo(1);
            assertThat(second.getItemsConsolidated()).isEqualTo(2);
            MemoryItem readItem = store.get(read).orElseThrow();
            assertThat(readItem.getState()).isEqualTo(ConsolidationState.CONSOLIDATED);
            assertThat(readItem.getImportance()).isEqualTo(0.5);
            assertThat(readItem.getAccessCount()).isEqualTo(1);
            assertThat(store.get(idle).orElseThrow().getImportance()).isCloseTo(0.495, within());
        }

        @Test
        @DisplayName("should summarize a group even when one of its items is read mid pass")
        void shouldSummarizeDespiteReadsDuringPass() {
            store = readingBetweenPlanAndApply("Lisbon");
            String read = store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "the trip to Lisbon", 0.5));
            store.write(item("u1", "emo_ai", MemoryKind.EPISODIC, "a quiet evening at home", 0.5));
            clock.advance(Duration.ofHours(7));

            ConsolidationReport report = store.consolidate();

            assertThat(report.getConflicts()).isZero();
            assertThat(report.getSummariesCreated()).isEqualTo(1);
            MemoryItem readItem = store.get(read).orElseThrow();
            assertThat(readItem.getState()).isEqualTo(ConsolidationState.CONSOLIDATED);
            assertThat(readItem.getAccessCount()).isEqualTo(1);
            assertThat(readItem.getLastAccessAt()).isEqualTo(clock.instant());
            assertThat(readItem.getVersion()).isEqualTo(3);
        }
    }

    private static Offset<Double> within() {
        return Offset.offset(1e-9);
    }
}
