package io.strata.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.strata.core.error.CapacityException;
import io.strata.core.error.NotFoundException;
import io.strata.core.error.ValidationException;
import io.strata.core.lifecycle.ManagedResource;
import io.strata.store.codec.EntityCodec;
import io.strata.store.stats.StoreStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Thread-safe, in-memory, TTL-aware store of identified and timestamped entities.
 *
 * <p>The store assigns ids and timestamps, runs the injected sanitizer and
 * validator before every write and hands out defensive copies only, so no
 * caller ever holds a reference into the store's state.</p>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Create/read/update/delete with atomic, all-or-nothing writes</li>
 *   <li>Predicate queries and stable sorting on any entity property</li>
 *   <li>1-based pagination with totals</li>
 *   <li>Default and per-entity time-to-live, checked lazily on every read</li>
 *   <li>Optional hard size cap</li>
 *   <li>Lock-free statistics with LongAdder</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * EntityStore<Task> tasks = EntityStore.builder(Task.class)
 *     .name("task")
 *     .validator(task -> !task.title().isBlank())
 *     .sanitizer(task -> task.withTitle(task.title().strip()))
 *     .maxSize(10_000)
 *     .build();
 *
 * Task created = tasks.create(Task.draft("Buy milk"));
 * Task renamed = tasks.update(created.id(), Map.of("title", "Buy oat milk"));
 * Page<Task> first = tasks.findAll(PageRequest.of(1, 20).sortedBy("createdAt", SortOrder.DESC));
 * }</pre>
 *
 * <p>Each call is atomic on its own. Sequences of calls are not; callers
 * needing compound atomicity must synchronize externally.</p>
 *
 * @param <T> the entity type
 *
 * @author Strata Team
 * @since 1.0.0
 */
public class EntityStore<T extends Identifiable & Timestamped> implements ManagedResource, StoreStats {

    private static final Logger log = LoggerFactory.getLogger(EntityStore.class);

    private static final int MAX_ID_ATTEMPTS = 16;

    // Insertion-ordered: updates keep an entity's position, re-creation moves it to the end
    private final Map<String, StoredRecord<T>> records = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final String name;
    private final Duration defaultTtl;
    private final int maxSize;
    private final boolean recordStats;
    private final EntityCodec<T> codec;
    private final EntityValidator<T> validator;
    private final EntitySanitizer<T> sanitizer;
    private final IdGenerator idGenerator;
    private final Clock clock;

    // Statistics
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder expirations = new LongAdder();
    private final LongAdder creates = new LongAdder();
    private final LongAdder updates = new LongAdder();
    private final LongAdder deletes = new LongAdder();

    /**
     * Internal record with optional absolute expiration time.
     */
    private record StoredRecord<T>(T entity, Instant expiresAt) {
        boolean isExpiredAt(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private EntityStore(Builder<T> builder) {
        this.name = builder.name;
        this.defaultTtl = builder.defaultTtl;
        this.maxSize = builder.maxSize;
        this.recordStats = builder.recordStats;
        this.codec = builder.objectMapper != null
                ? new EntityCodec<>(builder.type, builder.objectMapper)
                : new EntityCodec<>(builder.type);
        this.validator = builder.validator;
        this.sanitizer = builder.sanitizer;
        this.idGenerator = builder.idGenerator;
        this.clock = builder.clock;
    }

    /**
     * Creates a new builder for EntityStore.
     *
     * @param type the entity class
     * @param <T> entity type
     * @return a new builder instance
     */
    public static <T extends Identifiable & Timestamped> Builder<T> builder(Class<T> type) {
        return new Builder<>(type);
    }

    /**
     * Creates a store from a configuration record, accepting every entity.
     *
     * @param type the entity class
     * @param config store configuration
     * @param <T> entity type
     * @return new store
     */
    public static <T extends Identifiable & Timestamped> EntityStore<T> create(Class<T> type, StoreConfig config) {
        return builder(type).config(config).build();
    }

    /**
     * Stores a new entity using the default ttl.
     *
     * @param draft entity whose timestamps are ignored; its id is kept if set
     * @return the stored entity
     * @throws ValidationException if the candidate is rejected or its id is taken
     * @throws CapacityException if the store is full
     * @see #create(Identifiable, Duration)
     */
    public T create(T draft) {
        return create(draft, defaultTtl);
    }

    /**
     * Stores a new entity.
     *
     * <p>The id comes from the draft when it sets one, otherwise from the
     * {@link IdGenerator}. Both timestamps are set to now. The sanitized,
     * stamped candidate must pass the validator before it becomes visible.</p>
     *
     * @param draft entity whose timestamps are ignored; its id is kept if set
     * @param ttl lifespan of the entity, or null to keep it until deleted
     * @return the stored entity
     * @throws ValidationException if the candidate is rejected or its id is taken
     * @throws CapacityException if the store is full
     */
    public T create(T draft, Duration ttl) {
        Objects.requireNonNull(draft, "draft must not be null");
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new ValidationException("ttl", "positive", ttl);
        }

        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            if (maxSize > 0 && records.size() >= maxSize) {
                purgeExpired(now);
                if (records.size() >= maxSize) {
                    throw new CapacityException(name, maxSize);
                }
            }

            String id = draft.id();
            if (id == null) {
                id = nextId();
            } else if (id.isBlank()) {
                throw new ValidationException(EntityCodec.ID, "not-blank", id);
            } else if (isLive(records.get(id), now)) {
                throw new ValidationException(EntityCodec.ID, "unique", id);
            }

            T candidate = prepare(draft, id, now, now);

            // An expired record under the same id is replaced, not updated
            records.remove(id);
            records.put(id, new StoredRecord<>(candidate, ttl != null ? now.plus(ttl) : null));
            if (recordStats) {
                creates.increment();
            }
            log.debug("[STRATA] {} '{}' created", name, id);
            return codec.copy(candidate);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Looks up a live entity.
     *
     * @param id entity id
     * @return a copy of the entity, or empty if absent or expired
     */
    public Optional<T> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        StoredRecord<T> record;
        lock.readLock().lock();
        try {
            record = records.get(id);
            if (record != null && !record.isExpiredAt(clock.instant())) {
                if (recordStats) {
                    hits.increment();
                }
                return Optional.of(codec.copy(record.entity()));
            }
        } finally {
            lock.readLock().unlock();
        }

        if (recordStats) {
            misses.increment();
        }
        if (record != null) {
            reap(id, record);
        }
        return Optional.empty();
    }

    /**
     * Returns every live entity in insertion order as a single page.
     * @return page 1 holding all entities
     */
    public Page<T> findAll() {
        return Page.single(copies(liveEntities()));
    }

    /**
     * Returns one page of live entities, optionally sorted.
     *
     * <p>Sorting is stable: entities with equal sort values keep insertion
     * order. A page past the end is empty but carries correct totals.</p>
     *
     * @param request page number, size and sort
     * @return the requested page
     * @throws ValidationException if {@code sortBy} names no entity property
     */
    public Page<T> findAll(PageRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Comparator<T> order = comparator(request.sortBy(), request.sortOrder());

        List<T> all = liveEntities();
        if (order != null) {
            all.sort(order);
        }
        Page<T> page = Page.slice(all, request);
        return new Page<>(copies(page.items()), page.totalItems(), page.totalPages(),
                page.currentPage(), page.hasNext(), page.hasPrev());
    }

    /**
     * Returns the live entities matching a predicate, in insertion order.
     *
     * @param predicate filter, evaluated against copies
     * @return copies of the matching entities
     */
    public List<T> findWhere(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        List<T> matches = new ArrayList<>();
        for (T entity : copies(liveEntities())) {
            if (predicate.test(entity)) {
                matches.add(entity);
            }
        }
        return matches;
    }

    /**
     * Overwrites properties of a live entity.
     *
     * <p>{@code id} and {@code createdAt} keep their stored values even if the
     * patch names them; {@code updatedAt} is set to now.</p>
     *
     * @param id entity id
     * @param patch property name to new value
     * @return the updated entity
     * @throws NotFoundException if no live entity has this id
     * @throws ValidationException if a property is unknown or the result is rejected
     */
    public T update(String id, Map<String, ?> patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        return update(id, current -> codec.merge(current, patch));
    }

    /**
     * Replaces a live entity with a modified version of itself.
     *
     * <p>The mutation receives a private copy. Identity and timestamps are
     * restored after it runs, exactly as for {@link #update(String, Map)}.
     * On any failure the stored entity is left untouched.</p>
     *
     * @param id entity id
     * @param mutation produces the new version from a copy of the current one
     * @return the updated entity
     * @throws NotFoundException if no live entity has this id
     * @throws ValidationException if the result is rejected
     */
    public T update(String id, UnaryOperator<T> mutation) {
        Objects.requireNonNull(mutation, "mutation must not be null");

        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            StoredRecord<T> record = id != null ? records.get(id) : null;
            if (!isLive(record, now)) {
                if (record != null) {
                    records.remove(id);
                    recordExpiration();
                }
                throw new NotFoundException(name, id);
            }

            T mutated = mutation.apply(codec.copy(record.entity()));
            if (mutated == null) {
                throw new ValidationException(name, "required", null);
            }
            T candidate = prepare(mutated, id, record.entity().createdAt(), now);

            records.put(id, new StoredRecord<>(candidate, record.expiresAt()));
            if (recordStats) {
                updates.increment();
            }
            log.debug("[STRATA] {} '{}' updated", name, id);
            return codec.copy(candidate);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes an entity.
     *
     * @param id entity id
     * @return true if a live entity was removed, false if there was none
     */
    public boolean delete(String id) {
        if (id == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            StoredRecord<T> removed = records.remove(id);
            if (removed == null) {
                return false;
            }
            if (removed.isExpiredAt(clock.instant())) {
                recordExpiration();
                return false;
            }
            if (recordStats) {
                deletes.increment();
            }
            log.debug("[STRATA] {} '{}' deleted", name, id);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns true if a live entity has this id.
     *
     * @param id entity id
     * @return true if present and not expired
     */
    public boolean exists(String id) {
        if (id == null) {
            return false;
        }
        lock.readLock().lock();
        try {
            return isLive(records.get(id), clock.instant());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the number of live entities.
     * @return live entity count
     */
    public long count() {
        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            return records.values().stream()
                    .filter(record -> !record.isExpiredAt(now))
                    .count();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns a snapshot of the ids of all live entities, in insertion order.
     * @return live ids
     */
    public Set<String> ids() {
        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            Set<String> ids = new LinkedHashSet<>();
            records.forEach((id, record) -> {
                if (!record.isExpiredAt(now)) {
                    ids.add(id);
                }
            });
            return ids;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the ids of all live entities matching a pattern, in insertion order.
     *
     * @param pattern regular expression searched for in each id
     * @return matching live ids
     */
    public Set<String> ids(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Set<String> matching = new LinkedHashSet<>();
        for (String id : ids()) {
            if (pattern.matcher(id).find()) {
                matching.add(id);
            }
        }
        return matching;
    }

    /**
     * Removes every entity.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            records.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes all expired entities now.
     * @return number of entities removed
     */
    public int evictExpired() {
        lock.writeLock().lock();
        try {
            return purgeExpired(clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns statistics for this store.
     * @return store statistics
     */
    public StoreStats stats() {
        return this;
    }

    // ManagedResource implementation

    @Override
    public String name() {
        return name;
    }

    @Override
    public long itemCount() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long releaseExpired() {
        return evictExpired();
    }

    // StoreStats implementation

    @Override
    public long hitCount() {
        return hits.sum();
    }

    @Override
    public long missCount() {
        return misses.sum();
    }

    @Override
    public long size() {
        return count();
    }

    @Override
    public long expirationCount() {
        return expirations.sum();
    }

    @Override
    public long createCount() {
        return creates.sum();
    }

    @Override
    public long updateCount() {
        return updates.sum();
    }

    @Override
    public long deleteCount() {
        return deletes.sum();
    }

    @Override
    public void reset() {
        hits.reset();
        misses.reset();
        expirations.reset();
        creates.reset();
        updates.reset();
        deletes.reset();
    }

    /**
     * Returns the ttl applied when none is given, or null.
     * @return default ttl
     */
    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    /**
     * Returns the configured max size, 0 when unbounded.
     * @return max size
     */
    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Returns the codec used to copy and inspect entities.
     * @return entity codec
     */
    public EntityCodec<T> getCodec() {
        return codec;
    }

    /**
     * Sanitizes, stamps and validates a candidate. Caller holds the write lock.
     */
    private T prepare(T candidate, String id, Instant createdAt, Instant updatedAt) {
        T sanitized = sanitizer.sanitize(candidate);
        if (sanitized == null) {
            throw new ValidationException(name, "required", null);
        }
        T stamped = codec.stamp(sanitized, id, createdAt, updatedAt);
        if (!validator.validate(stamped)) {
            throw new ValidationException(name, "valid", stamped);
        }
        return stamped;
    }

    /**
     * Caller holds the write lock.
     */
    private String nextId() {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String candidate = idGenerator.nextId();
            if (candidate != null && !candidate.isBlank() && !records.containsKey(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("IdGenerator produced no unused id in " + MAX_ID_ATTEMPTS + " attempts");
    }

    /**
     * Live stored entities in insertion order, without copying.
     */
    private List<T> liveEntities() {
        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            List<T> live = new ArrayList<>(records.size());
            for (StoredRecord<T> record : records.values()) {
                if (!record.isExpiredAt(now)) {
                    live.add(record.entity());
                }
            }
            return live;
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<T> copies(List<T> entities) {
        List<T> copies = new ArrayList<>(entities.size());
        for (T entity : entities) {
            copies.add(codec.copy(entity));
        }
        return copies;
    }

    private Comparator<T> comparator(String sortBy, SortOrder sortOrder) {
        if (sortBy == null) {
            return null;
        }
        if (!codec.hasProperty(sortBy)) {
            throw new ValidationException(sortBy, "sortable", sortBy);
        }
        Comparator<T> ascending = codec.comparing(sortBy);
        return sortOrder == SortOrder.DESC ? ascending.reversed() : ascending;
    }

    private boolean isLive(StoredRecord<T> record, Instant now) {
        return record != null && !record.isExpiredAt(now);
    }

    /**
     * Removes a record found expired during a read, unless it was replaced meanwhile.
     */
    private void reap(String id, StoredRecord<T> expired) {
        lock.writeLock().lock();
        try {
            if (records.get(id) == expired && expired.isExpiredAt(clock.instant())) {
                records.remove(id);
                recordExpiration();
                log.debug("[STRATA] {} '{}' expired", name, id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Caller holds the write lock.
     */
    private int purgeExpired(Instant now) {
        int count = 0;
        Iterator<StoredRecord<T>> iterator = records.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().isExpiredAt(now)) {
                iterator.remove();
                recordExpiration();
                count++;
            }
        }
        if (count > 0) {
            log.debug("[STRATA] {} evicted {} expired entities", name, count);
        }
        return count;
    }

    private void recordExpiration() {
        if (recordStats) {
            expirations.increment();
        }
    }

    /**
     * Builder for EntityStore.
     */
    public static class Builder<T extends Identifiable & Timestamped> {
        private final Class<T> type;
        private String name;
        private Duration defaultTtl = null;
        private int maxSize = StoreConfig.UNBOUNDED;
        private boolean recordStats = true;
        private EntityValidator<T> validator = EntityValidator.acceptAll();
        private EntitySanitizer<T> sanitizer = EntitySanitizer.identity();
        private IdGenerator idGenerator = IdGenerator.uuid();
        private Clock clock = Clock.systemUTC();
        private ObjectMapper objectMapper = null;

        private Builder(Class<T> type) {
            this.type = Objects.requireNonNull(type, "type must not be null");
            this.name = type.getSimpleName();
        }

        public Builder<T> name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        public Builder<T> defaultTtl(Duration defaultTtl) {
            if (defaultTtl != null && (defaultTtl.isNegative() || defaultTtl.isZero())) {
                throw new IllegalArgumentException("defaultTtl must be positive");
            }
            this.defaultTtl = defaultTtl;
            return this;
        }

        /**
         * Sets the hard cap on live entities; 0 means unbounded.
         * @param maxSize max size
         * @return this builder
         */
        public Builder<T> maxSize(int maxSize) {
            if (maxSize < 0) {
                throw new IllegalArgumentException("Max size must not be negative");
            }
            this.maxSize = maxSize;
            return this;
        }

        public Builder<T> recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public Builder<T> validator(EntityValidator<T> validator) {
            this.validator = Objects.requireNonNull(validator, "validator must not be null");
            return this;
        }

        public Builder<T> sanitizer(EntitySanitizer<T> sanitizer) {
            this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer must not be null");
            return this;
        }

        public Builder<T> idGenerator(IdGenerator idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
            return this;
        }

        public Builder<T> clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Sets the ObjectMapper used to copy and inspect entities.
         * It must support java.time types.
         * @param objectMapper custom mapper
         * @return this builder
         */
        public Builder<T> objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
            return this;
        }

        public Builder<T> config(StoreConfig config) {
            Objects.requireNonNull(config, "config must not be null");
            this.name = config.name();
            this.defaultTtl = config.defaultTtl();
            this.maxSize = config.maxSize();
            this.recordStats = config.recordStats();
            return this;
        }

        public EntityStore<T> build() {
            return new EntityStore<>(this);
        }
    }
}
