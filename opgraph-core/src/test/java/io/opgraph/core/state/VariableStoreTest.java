package io.opgraph.core.state;

import static org.assertj.core.api.Assertions.assertThat;

import io.opgraph.core.template.PathTemplateResolver;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("VariableStore")
class VariableStoreTest {

    private VariableStore store;

    @BeforeEach
    void setUp() {
        store =
                new VariableStore(
                        5,
                        new PathTemplateResolver(),
                        Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("paths")
    class Paths {

        @Test
        void shouldCreateIntermediateContainers() {
            assertThat(store.set("user.profile.name", "Ada")).isTrue();

            assertThat(store.get("user.profile.name")).contains("Ada");
            assertThat(store.get("user")).contains(Map.of("profile", Map.of("name", "Ada")));
        }

        @Test
        void shouldReadListElementsByIndex() {
            store.set("mails", List.of(Map.of("subject", "hi"), Map.of("subject", "bye")));

            assertThat(store.get("mails[1].subject")).contains("bye");
            assertThat(store.get("mails.0.subject")).contains("hi");
        }

        @Test
        void shouldReturnEmptyForMissingOrNullValues() {
            store.set("a", null);

            assertThat(store.get("a")).isEmpty();
            assertThat(store.has("a")).isTrue();
            assertThat(store.get("nothing.here")).isEmpty();
        }

        @Test
        void shouldReturnWholeStateForEmptyPath() {
            store.set("x", 1);

            assertThat(store.get("")).contains(Map.of("x", 1));
        }

        @Test
        void shouldRejectEmptyPathOnSet() {
            assertThat(store.set("", 1)).isFalse();
            assertThat(store.getMutationHistory()).isEmpty();
        }

        @Test
        void shouldSpliceListElementsOnDelete() {
            store.set("tags", List.of("a", "b", "c"));

            assertThat(store.delete("tags.1")).isTrue();

            assertThat(store.get("tags")).contains(List.of("a", "c"));
            assertThat(store.delete("tags.9")).isFalse();
        }

        @Test
        void shouldTreatOversizedIndexAsMissing() {
            store.set("items", List.of(1, 2));

            assertThat(store.get("items.99999999999")).isEmpty();
            assertThat(store.has("items[99999999999]")).isFalse();
            assertThat(store.delete("items.99999999999")).isFalse();
            assertThat(store.resolveTemplate("{{items[99999999999]}}"))
                    .isEqualTo("{{items[99999999999]}}");
        }

        @Test
        void shouldAppendAtListEndButRejectGaps() {
            store.set("items", List.of(1, 2));

            assertThat(store.set("items.2", 3)).isTrue();
            assertThat(store.set("items.2000000000", 4)).isFalse();
            assertThat(store.set("items.99999999999", 5)).isFalse();

            assertThat(store.get("items")).contains(List.of(1, 2, 3));
        }

        @Test
        void shouldMergeShallowly() {
            store.set("config", Map.of("retries", 1, "nested", Map.of("a", 1)));

            store.merge("config", Map.of("timeout", 30, "nested", Map.of("b", 2)));

            assertThat(store.get("config"))
                    .contains(Map.of("retries", 1, "timeout", 30, "nested", Map.of("b", 2)));
        }

        @Test
        void shouldRejectMergeOfNonObject() {
            assertThat(store.merge("config", List.of(1))).isFalse();
        }
    }

    @Nested
    @DisplayName("isolation")
    class Isolation {

        @Test
        void shouldNotLeakCallerMutationsIntoStore() {
            List<Object> items = new ArrayList<>(List.of("a"));
            store.set("items", items);

            items.add("b");

            assertThat(store.get("items")).contains(List.of("a"));
        }

        @Test
        void shouldReturnCopiesOnRead() {
            store.set("items", List.of("a"));

            @SuppressWarnings("unchecked")
            List<Object> read = (List<Object>) store.get("items").orElseThrow();
            read.add("b");

            assertThat(store.get("items")).contains(List.of("a"));
        }
    }

    @Nested
    @DisplayName("history and snapshots")
    class History {

        @Test
        void shouldRecordMutationsOldestFirst() {
            store.set("a", 1);
            store.set("a", 2);
            store.delete("a");

            List<Mutation> history = store.getMutationHistory(10);

            assertThat(history)
                    .extracting(Mutation::operation)
                    .containsExactly(MutationOperation.SET, MutationOperation.SET, MutationOperation.DELETE);
            assertThat(history.get(1).oldValue()).isEqualTo(1);
            assertThat(history.get(1).newValue()).isEqualTo(2);
        }

        @Test
        void shouldEvictOldestBeyondCapacity() {
            for (int i = 0; i < 8; i++) {
                store.set("counter", i);
            }

            List<Mutation> history = store.getMutationHistory(0);

            assertThat(history).hasSize(5);
            assertThat(history.get(0).newValue()).isEqualTo(3);
        }

        @Test
        void shouldLimitToMostRecentEntries() {
            store.set("a", 1);
            store.set("b", 2);
            store.set("c", 3);

            assertThat(store.getMutationHistory(2)).extracting(Mutation::path).containsExactly("b", "c");
        }

        @Test
        void shouldRestoreSnapshotAndRecordIt() {
            store.set("a", 1);
            VariableSnapshot snapshot = store.createSnapshot();
            store.set("a", 2);
            store.set("b", 3);

            assertThat(store.restoreSnapshot(snapshot)).isTrue();

            assertThat(store.asMap()).isEqualTo(Map.of("a", 1));
            assertThat(store.getMutationHistory(1))
                    .extracting(Mutation::operation)
                    .containsExactly(MutationOperation.RESTORE);
        }

        @Test
        void shouldRejectNullSnapshot() {
            assertThat(store.restoreSnapshot(null)).isFalse();
        }

        @Test
        void shouldRecordClear() {
            store.set("a", 1);

            store.clear();

            assertThat(store.asMap()).isEmpty();
            assertThat(store.getMutationHistory(1))
                    .extracting(Mutation::operation)
                    .containsExactly(MutationOperation.CLEAR);
        }
    }

    @Test
    void shouldResolveTemplatesAgainstState() {
        store.set("user", Map.of("name", "Ada"));

        assertThat(store.resolveTemplate("Hello {{user.name}}, {{missing}}"))
                .isEqualTo("Hello Ada, {{missing}}");
    }
}
