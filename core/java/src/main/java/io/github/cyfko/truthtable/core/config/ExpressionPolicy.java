package io.github.cyfko.truthtable.core.config;

/**
 * Resource limits applied to every submitted expression.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the trimmed expression (default: 5000)</li>
 *   <li><strong>maxVariables</strong>: Maximum number of distinct free variables (default: 12, i.e. 4096 rows)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * ExpressionPolicy policy = ExpressionPolicy.defaults();
 *
 * // Strict (for public endpoints with untrusted input)
 * ExpressionPolicy policy = ExpressionPolicy.strict();
 *
 * // Relaxed (for internal trusted callers)
 * ExpressionPolicy policy = ExpressionPolicy.relaxed();
 *
 * // Custom
 * ExpressionPolicy policy = ExpressionPolicy.builder()
 *     .maxVariables(10)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violation messages
 * @param maxExpressionLength maximum character length of the expression string
 * @param maxVariables        maximum number of distinct variables, bounding the table at {@code 2^maxVariables} rows
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ExpressionPolicy(
    String policyName,
    int maxExpressionLength,
    int maxVariables
) {

    /**
     * Upper bound on {@code maxVariables}; the row index of the enumerator is an {@code int}.
     */
    public static final int VARIABLE_CEILING = 30;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public ExpressionPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxVariables < 0 || maxVariables > VARIABLE_CEILING) {
            throw new IllegalArgumentException(
                "maxVariables must be between 0 and " + VARIABLE_CEILING + ", got: " + maxVariables);
        }
    }

    /**
     * Default configuration: 5000 characters and 12 variables (4096 rows).
     *
     * @return default configuration
     */
    public static ExpressionPolicy defaults() {
        return new ExpressionPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 12);
    }

    /**
     * Strict configuration for untrusted input: 1000 characters and 8 variables (256 rows).
     *
     * @return strict configuration
     */
    public static ExpressionPolicy strict() {
        return new ExpressionPolicy(PolicyName.STRICT_POLICY.name(), 1000, 8);
    }

    /**
     * Relaxed configuration for trusted callers: 10000 characters and 16 variables (65536 rows).
     *
     * @return relaxed configuration
     */
    public static ExpressionPolicy relaxed() {
        return new ExpressionPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 16);
    }

    /**
     * Creates a custom configuration. Builder parameters start from the default values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the number of rows a table with {@code maxVariables} variables would have
     */
    public long maxRows() {
        return 1L << maxVariables;
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxVariables = 12;

        private Builder() {}

        public ExpressionPolicy build() {
            return new ExpressionPolicy(_policyName, _maxExpressionLength, _maxVariables);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxVariables(int maxVariables) { this._maxVariables = maxVariables; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
