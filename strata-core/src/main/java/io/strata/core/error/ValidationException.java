package io.strata.core.error;

/**
 * Raised when a candidate value breaks a validation rule.
 *
 * <p>Covers entity validation failures, unknown sort properties, duplicate
 * caller-supplied ids and malformed events.</p>
 *
 * @author Strata Team
 * @since 1.0.0
 */
public class ValidationException extends StrataException {

    public static final String CODE = "VALIDATION_ERROR";

    private final String field;
    private final String rule;
    private final transient Object value;

    public ValidationException(String field, String rule, Object value) {
        super(CODE, "Validation failed for '" + field + "' (rule: " + rule + ", value: " + value + ")");
        this.field = field;
        this.rule = rule;
        this.value = value;
        addContext("field", field);
        addContext("rule", rule);
        addContext("value", value);
    }

    public String getField() {
        return field;
    }

    public String getRule() {
        return rule;
    }

    public Object getValue() {
        return value;
    }
}
