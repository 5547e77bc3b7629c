package io.strata.core.event;

import io.strata.core.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Event.
 *
 * @author Test Engineer
 */
@DisplayName("Event")
class EventTest {

    @Test
    @DisplayName("should default the source")
    void shouldDefaultSource() {
        Event event = Event.of("task:created", 42);

        assertThat(event.source()).isEqualTo(Event.DEFAULT_SOURCE);
        assertThat(event.timestamp()).isNotNull();
        assertThat(event.dataAs(Integer.class)).isEqualTo(42);
    }

    @Test
    @DisplayName("should return null data for payload-less events")
    void shouldAllowNullData() {
        Event event = Event.of("tick", "clock", null);

        assertThat(event.dataAs(String.class)).isNull();
        assertThat(event.validate()).isSameAs(event);
    }

    @Test
    @DisplayName("should fail casting to the wrong payload type")
    void shouldRejectWrongPayloadType() {
        Event event = Event.of("task:created", "payload");

        assertThatThrownBy(() -> event.dataAs(Integer.class))
            .isInstanceOf(ClassCastException.class);
    }

    @Test
    @DisplayName("should reject events that cannot be routed")
    void shouldValidate() {
        Instant now = Instant.now();

        assertThatThrownBy(() -> new Event(null, now, "src", null).validate())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("type");
        assertThatThrownBy(() -> new Event("*", now, "src", null).validate())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("not-wildcard");
        assertThatThrownBy(() -> new Event("a", null, "src", null).validate())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("timestamp");
        assertThatThrownBy(() -> new Event("a", now, " ", null).validate())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("source");
    }
}
