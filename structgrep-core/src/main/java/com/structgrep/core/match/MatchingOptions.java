package com.structgrep.core.match;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Equivalence policy used when comparing bound values and literals.
 *
 * <p>The default is strict syntactic equality (spans and comments ignored). Each flag loosens it
 * in one well-defined way; rules opt in explicitly.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * options:
 *   normalizeNumericLiterals: true
 *   commutativeOperators: true
 * }</pre>
 *
 * @param normalizeNumericLiterals compare numeric literals by value ({@code 0x10} equals {@code 16})
 * @param normalizeStringQuotes compare string and text-block literals by decoded content
 * @param commutativeOperators ignore operand order of commutative binary operators
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MatchingOptions(
    @JsonProperty("normalizeNumericLiterals") boolean normalizeNumericLiterals,
    @JsonProperty("normalizeStringQuotes") boolean normalizeStringQuotes,
    @JsonProperty("commutativeOperators") boolean commutativeOperators
) {
    private static final MatchingOptions STRICT = new MatchingOptions(false, false, false);

    /**
     * Strict syntactic equality.
     *
     * @return default options
     */
    public static MatchingOptions defaults() {
        return STRICT;
    }

    public MatchingOptions withNumericNormalization(boolean enabled) {
        return new MatchingOptions(enabled, normalizeStringQuotes, commutativeOperators);
    }

    public MatchingOptions withStringNormalization(boolean enabled) {
        return new MatchingOptions(normalizeNumericLiterals, enabled, commutativeOperators);
    }

    public MatchingOptions withCommutativeOperators(boolean enabled) {
        return new MatchingOptions(normalizeNumericLiterals, normalizeStringQuotes, enabled);
    }
}
