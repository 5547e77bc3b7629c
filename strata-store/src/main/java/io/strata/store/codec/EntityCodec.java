package io.strata.store.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.strata.core.error.ValidationException;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Jackson-backed structural operations on entities of one type.
 *
 * <p>The store treats entity fields as opaque, so everything that needs to
 * look inside an entity goes through this codec:</p>
 * <ul>
 *   <li>defensive copies (serialize to a tree and bind it back)</li>
 *   <li>stamping id and timestamps onto a draft</li>
 *   <li>merging a property patch onto an existing entity</li>
 *   <li>reading a property by name for sorting</li>
 * </ul>
 *
 * <p>Records and ordinary bean classes both work, as long as Jackson can
 * bind them. With the default ObjectMapper, values held in {@code Object}
 * slots (an {@code Object} property, the values of a
 * {@code Map<String, Object>}, the elements of a {@code List<Object>}) keep
 * their runtime type across copies, provided it is a JDK type.</p>
 *
 * @param <T> the entity type
 * @author Strata Team
 * @since 1.0.0
 */
public class EntityCodec<T> {

    public static final String ID = "id";
    public static final String CREATED_AT = "createdAt";
    public static final String UPDATED_AT = "updatedAt";

    private final ObjectMapper objectMapper;
    private final Class<T> type;
    private final Map<String, AnnotatedMember> accessors;
    private final Map<String, JavaType> propertyTypes;

    /**
     * Creates a codec with the default ObjectMapper.
     *
     * @param type the entity class
     */
    public EntityCodec(Class<T> type) {
        this(type, createDefaultObjectMapper());
    }

    /**
     * Creates a codec with a custom ObjectMapper.
     * <p>The mapper must be able to bind {@link Instant} values.</p>
     *
     * @param type the entity class
     * @param objectMapper the ObjectMapper to use
     * @throws IllegalArgumentException if the type lacks id or timestamp properties
     */
    public EntityCodec(Class<T> type, ObjectMapper objectMapper) {
        this.type = type;
        this.objectMapper = objectMapper;
        Map<String, AnnotatedMember> foundAccessors = new LinkedHashMap<>();
        Map<String, JavaType> foundTypes = new LinkedHashMap<>();
        introspect(type, objectMapper, foundAccessors, foundTypes);
        this.accessors = Collections.unmodifiableMap(foundAccessors);
        this.propertyTypes = Collections.unmodifiableMap(foundTypes);
        for (String required : List.of(ID, CREATED_AT, UPDATED_AT)) {
            if (!accessors.containsKey(required)) {
                throw new IllegalArgumentException(type.getName() + " has no '" + required + "' property");
            }
        }
    }

    /**
     * Creates the ObjectMapper used when none is supplied.
     *
     * <p>Type ids are written for values in {@code Object} slots and only
     * {@code java.*} classes are accepted when reading them back.</p>
     *
     * @return mapper with java.time support writing ISO-8601 timestamps
     */
    public static ObjectMapper createDefaultObjectMapper() {
        BasicPolymorphicTypeValidator jdkTypes = BasicPolymorphicTypeValidator.builder()
                .allowIfSubType("java.")
                .build();
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .activateDefaultTyping(jdkTypes, ObjectMapper.DefaultTyping.JAVA_LANG_OBJECT);
    }

    /**
     * Returns a structurally equal instance sharing no mutable state with {@code entity}.
     *
     * @param entity the entity to copy
     * @return deep copy
     */
    public T copy(T entity) {
        return bind(objectMapper.valueToTree(entity));
    }

    /**
     * Returns a copy of {@code entity} carrying the given id and timestamps.
     *
     * @param entity draft or existing entity
     * @param id id to set
     * @param createdAt creation time to set
     * @param updatedAt update time to set
     * @return stamped copy
     */
    public T stamp(T entity, String id, Instant createdAt, Instant updatedAt) {
        ObjectNode node = objectMapper.valueToTree(entity);
        node.put(ID, id);
        node.set(CREATED_AT, objectMapper.valueToTree(createdAt));
        node.set(UPDATED_AT, objectMapper.valueToTree(updatedAt));
        return bind(node);
    }

    /**
     * Returns a copy of {@code entity} with the patch properties overwritten.
     *
     * @param entity the current entity
     * @param patch property name to new value
     * @return merged copy
     * @throws ValidationException if a property is unknown or a value cannot be bound
     */
    public T merge(T entity, Map<String, ?> patch) {
        ObjectNode node = objectMapper.valueToTree(entity);
        for (Map.Entry<String, ?> change : patch.entrySet()) {
            if (!accessors.containsKey(change.getKey())) {
                throw new ValidationException(change.getKey(), "known-property", change.getValue());
            }
            node.set(change.getKey(), patchValue(change.getKey(), change.getValue()));
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonMappingException e) {
            throw new ValidationException(failedField(e), "type", e.getOriginalMessage());
        } catch (JsonProcessingException e) {
            throw new ValidationException(type.getSimpleName(), "binding", e.getOriginalMessage());
        }
    }

    /**
     * Returns true if the entity type exposes the named property.
     *
     * @param property property name
     * @return true if known
     */
    public boolean hasProperty(String property) {
        return accessors.containsKey(property);
    }

    /**
     * Returns the names of all properties of the entity type.
     * @return property names in declaration order
     */
    public Set<String> properties() {
        return accessors.keySet();
    }

    /**
     * Reads a property value from an entity.
     *
     * @param entity the entity
     * @param property property name
     * @return the value, possibly null
     * @throws IllegalArgumentException if the property is unknown
     */
    public Object read(T entity, String property) {
        AnnotatedMember accessor = accessors.get(property);
        if (accessor == null) {
            throw new IllegalArgumentException(type.getSimpleName() + " has no '" + property + "' property");
        }
        return accessor.getValue(entity);
    }

    /**
     * Returns an ascending comparator on a property.
     *
     * <p>Missing values sort first. Values of the same comparable class use
     * their natural order, numbers of different classes compare numerically,
     * anything else compares by its string form.</p>
     *
     * @param property property name
     * @return comparator
     * @throws IllegalArgumentException if the property is unknown
     */
    public Comparator<T> comparing(String property) {
        if (!hasProperty(property)) {
            throw new IllegalArgumentException(type.getSimpleName() + " has no '" + property + "' property");
        }
        return (left, right) -> compareValues(read(left, property), read(right, property));
    }

    /**
     * Returns the entity class.
     * @return entity type
     */
    public Class<T> getType() {
        return type;
    }

    /**
     * Returns the ObjectMapper used by this codec.
     *
     * @return the ObjectMapper
     */
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compareValues(Object left, Object right) {
        if (left == right) {
            return 0;
        }
        if (left == null) {
            return -1;
        }
        if (right == null) {
            return 1;
        }
        if (left.getClass() == right.getClass() && left instanceof Comparable) {
            return ((Comparable) left).compareTo(right);
        }
        if (left instanceof Number && right instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        return left.toString().compareTo(right.toString());
    }

    /**
     * Writes a patch value as its property would be written, so type ids
     * land where the reader expects them.
     */
    private JsonNode patchValue(String property, Object value) {
        JavaType declared = propertyTypes.get(property);
        if (value == null || declared == null || !declared.getRawClass().isInstance(value)) {
            return objectMapper.valueToTree(value);
        }
        try {
            return objectMapper.readTree(objectMapper.writerFor(declared).writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new ValidationException(property, "type", e.getOriginalMessage());
        }
    }

    private T bind(ObjectNode node) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot bind " + type.getName() + ": " + e.getOriginalMessage(), e);
        }
    }

    private String failedField(JsonMappingException e) {
        List<JsonMappingException.Reference> path = e.getPath();
        if (path.isEmpty() || path.get(path.size() - 1).getFieldName() == null) {
            return type.getSimpleName();
        }
        return path.get(path.size() - 1).getFieldName();
    }

    private static void introspect(Class<?> type, ObjectMapper objectMapper,
                                   Map<String, AnnotatedMember> accessors, Map<String, JavaType> types) {
        BeanDescription description = objectMapper.getSerializationConfig()
                .introspect(objectMapper.constructType(type));
        for (BeanPropertyDefinition property : description.findProperties()) {
            AnnotatedMember accessor = property.getAccessor();
            if (accessor != null) {
                accessor.fixAccess(true);
                accessors.put(property.getName(), accessor);
                types.put(property.getName(), property.getPrimaryType());
            }
        }
    }
}
