package io.strata.store;

import java.time.Instant;

/**
 * Test entity.
 */
public record Task(
        String id,
        Instant createdAt,
        Instant updatedAt,
        String title,
        int priority,
        boolean done
) implements Identifiable, Timestamped {

    public static Task draft(String title) {
        return draft(title, 0);
    }

    public static Task draft(String title, int priority) {
        return new Task(null, null, null, title, priority, false);
    }

    public Task withTitle(String newTitle) {
        return new Task(id, createdAt, updatedAt, newTitle, priority, done);
    }

    public Task withPriority(int newPriority) {
        return new Task(id, createdAt, updatedAt, title, newPriority, done);
    }
}
