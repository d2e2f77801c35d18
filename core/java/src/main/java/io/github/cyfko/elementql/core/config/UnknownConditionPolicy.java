package io.github.cyfko.elementql.core.config;

/**
 * Policy for condition keys the rule builder does not recognize.
 */
public enum UnknownConditionPolicy {
    /** Ignore the key and log a warning. */
    IGNORE,
    /** Throw {@link io.github.cyfko.elementql.core.exception.RuleDefinitionException}. */
    STRICT_EXCEPTION
}
