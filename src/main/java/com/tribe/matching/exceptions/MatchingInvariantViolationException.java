package com.tribe.matching.exceptions;

import java.util.List;

/**
 * Raised when a formation run produces output that breaks a structural guarantee:
 * a tribe over capacity, a group outside its size bounds without the undersized flag,
 * or a user missing or duplicated. Never a recoverable condition.
 */
public class MatchingInvariantViolationException extends InternalServerErrorException {
    private final List<String> violations;

    public MatchingInvariantViolationException(List<String> violations) {
        super("Matching invariants violated: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
