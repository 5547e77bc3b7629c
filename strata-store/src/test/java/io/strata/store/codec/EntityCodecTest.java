package io.strata.store.codec;

import io.strata.core.error.ValidationException;
import io.strata.store.Note;
import io.strata.store.Tagged;
import io.strata.store.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for EntityCodec.
 *
 * @author Test Engineer
 */
@DisplayName("EntityCodec")
class EntityCodecTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final EntityCodec<Task> codec = new EntityCodec<>(Task.class);

    // ========================================================================
    // COPY / STAMP TESTS
    // ========================================================================

    @Nested
    @DisplayName("Copy and stamp")
    class CopyAndStamp {

        @Test
        @DisplayName("should copy into an equal but distinct instance")
        void shouldCopy() {
            Task task = new Task("t-1", T0, T0, "Buy milk", 2, false);

            Task copy = codec.copy(task);

            assertThat(copy).isEqualTo(task).isNotSameAs(task);
        }

        @Test
        @DisplayName("should deep copy mutable beans")
        void shouldCopyBeans() {
            EntityCodec<Note> notes = new EntityCodec<>(Note.class);
            Note note = new Note("hello");

            Note copy = notes.copy(note);
            copy.setText("changed");

            assertThat(note.getText()).isEqualTo("hello");
        }

        @Test
        @DisplayName("should stamp id and timestamps")
        void shouldStamp() {
            Instant later = T0.plusSeconds(60);

            Task stamped = codec.stamp(Task.draft("Buy milk", 1), "t-9", T0, later);

            assertThat(stamped.id()).isEqualTo("t-9");
            assertThat(stamped.createdAt()).isEqualTo(T0);
            assertThat(stamped.updatedAt()).isEqualTo(later);
            assertThat(stamped.title()).isEqualTo("Buy milk");
            assertThat(stamped.priority()).isEqualTo(1);
        }
    }

    // ========================================================================
    // MERGE TESTS
    // ========================================================================

    @Nested
    @DisplayName("Merge")
    class Merge {

        private final Task current = new Task("t-1", T0, T0, "Buy milk", 2, false);

        @Test
        @DisplayName("should overwrite only patched properties")
        void shouldMerge() {
            Task merged = codec.merge(current, Map.of("priority", 5));

            assertThat(merged.priority()).isEqualTo(5);
            assertThat(merged.title()).isEqualTo("Buy milk");
            assertThat(merged.id()).isEqualTo("t-1");
        }

        @Test
        @DisplayName("should reject unknown properties")
        void shouldRejectUnknown() {
            assertThatThrownBy(() -> codec.merge(current, Map.of("owner", "bob")))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> {
                    ValidationException error = (ValidationException) e;
                    assertThat(error.getField()).isEqualTo("owner");
                    assertThat(error.getRule()).isEqualTo("known-property");
                    assertThat(error.getValue()).isEqualTo("bob");
                });
        }

        @Test
        @DisplayName("should report the field whose value cannot be bound")
        void shouldRejectWrongType() {
            assertThatThrownBy(() -> codec.merge(current, Map.of("priority", "high")))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> {
                    ValidationException error = (ValidationException) e;
                    assertThat(error.getField()).isEqualTo("priority");
                    assertThat(error.getRule()).isEqualTo("type");
                });
        }

        @Test
        @DisplayName("should accept ISO strings for timestamps")
        void shouldBindIsoTimestamp() {
            Task merged = codec.merge(current, Map.of("updatedAt", "2024-03-02T00:00:00Z"));

            assertThat(merged.updatedAt()).isEqualTo(Instant.parse("2024-03-02T00:00:00Z"));
        }
    }

    // ========================================================================
    // UNTYPED PAYLOAD TESTS
    // ========================================================================

    @Nested
    @DisplayName("Untyped payload")
    class UntypedPayload {

        private final EntityCodec<Tagged> tagged = new EntityCodec<>(Tagged.class);

        private Map<String, Object> attributes() {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("count", 5L);
            attributes.put("due", T0);
            attributes.put("ratio", new BigDecimal("0.25"));
            return attributes;
        }

        @Test
        @DisplayName("should copy Object and Map<String, Object> values with their types")
        void shouldCopyWithRuntimeTypes() {
            Tagged original = new Tagged("g-1", T0, T0, 42L, attributes());

            Tagged copy = tagged.copy(original);

            assertThat(copy.payload()).isInstanceOf(Long.class).isEqualTo(42L);
            assertThat(copy.attributes().get("count")).isInstanceOf(Long.class);
            assertThat(copy.attributes().get("due")).isInstanceOf(Instant.class).isEqualTo(T0);
            assertThat(copy.attributes().get("ratio")).isEqualTo(new BigDecimal("0.25"));
            assertThat(copy).isEqualTo(original);
        }

        @Test
        @DisplayName("should merge untyped values with their types")
        void shouldMergeWithRuntimeTypes() {
            Tagged original = new Tagged("g-1", T0, T0, "text", attributes());
            Map<String, Object> replaced = new LinkedHashMap<>();
            replaced.put("when", T0.plusSeconds(1));

            Tagged merged = tagged.merge(original, Map.of("payload", T0, "attributes", replaced));

            assertThat(merged.payload()).isEqualTo(T0);
            assertThat(merged.attributes()).containsExactly(entry("when", T0.plusSeconds(1)));
        }

        @Test
        @DisplayName("should keep plain strings and numbers untouched")
        void shouldKeepNaturalTypes() {
            Tagged original = new Tagged("g-1", T0, T0, "text", Map.of());

            assertThat(tagged.copy(original).payload()).isEqualTo("text");
            assertThat(tagged.copy(new Tagged("g-2", T0, T0, 7, Map.of())).payload()).isEqualTo(7);
        }
    }

    // ========================================================================
    // PROPERTY ACCESS TESTS
    // ========================================================================

    @Nested
    @DisplayName("Property access")
    class PropertyAccess {

        @Test
        @DisplayName("should expose record components as properties")
        void shouldListProperties() {
            assertThat(codec.properties())
                .contains("id", "createdAt", "updatedAt", "title", "priority", "done");
            assertThat(codec.hasProperty("title")).isTrue();
            assertThat(codec.hasProperty("colour")).isFalse();
        }

        @Test
        @DisplayName("should read property values")
        void shouldRead() {
            Task task = new Task("t-1", T0, T0, "Buy milk", 2, true);

            assertThat(codec.read(task, "title")).isEqualTo("Buy milk");
            assertThat(codec.read(task, "priority")).isEqualTo(2);
            assertThat(codec.read(task, "done")).isEqualTo(true);
            assertThatThrownBy(() -> codec.read(task, "colour"))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject types without identity properties")
        void shouldRejectTypeWithoutIdentity() {
            assertThatThrownBy(() -> new EntityCodec<>(Plain.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("id");
        }
    }

    // ========================================================================
    // ORDERING TESTS
    // ========================================================================

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("should put missing values first")
        void shouldOrderNullsFirst() {
            List<Task> tasks = new ArrayList<>(List.of(
                new Task("a", T0, T0, "zeta", 0, false),
                new Task("b", T0, T0, null, 0, false),
                new Task("c", T0, T0, "alpha", 0, false)));

            tasks.sort(codec.comparing("title"));

            assertThat(tasks).extracting(Task::id).containsExactly("b", "c", "a");
        }

        @Test
        @DisplayName("should order booleans false before true")
        void shouldOrderBooleans() {
            assertThat(EntityCodec.compareValues(false, true)).isNegative();
            assertThat(EntityCodec.compareValues(true, true)).isZero();
        }

        @Test
        @DisplayName("should compare numbers of different classes numerically")
        void shouldCompareMixedNumbers() {
            assertThat(EntityCodec.compareValues(2, 10L)).isNegative();
            assertThat(EntityCodec.compareValues(new BigDecimal("2.5"), 2)).isPositive();
            assertThat(EntityCodec.compareValues(3.0, 3)).isZero();
        }

        @Test
        @DisplayName("should order instants chronologically")
        void shouldCompareInstants() {
            assertThat(EntityCodec.compareValues(T0, T0.plusMillis(1))).isNegative();
        }

        @Test
        @DisplayName("should reject comparator on unknown property")
        void shouldRejectUnknownComparator() {
            assertThatThrownBy(() -> codec.comparing("colour"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    /**
     * Type with no id or timestamps.
     */
    public record Plain(String name) {
    }
}
