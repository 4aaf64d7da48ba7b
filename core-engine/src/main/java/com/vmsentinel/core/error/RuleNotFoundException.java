package com.vmsentinel.core.error;

import java.util.NoSuchElementException;

/**
 * Thrown when an operation references a rule name that is not in the rule set.
 *
 * @since 1.0.0
 */
public class RuleNotFoundException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    private final String ruleName;

    public RuleNotFoundException(String ruleName) {
        super("Rule not found: '" + ruleName + "'");
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }
}
