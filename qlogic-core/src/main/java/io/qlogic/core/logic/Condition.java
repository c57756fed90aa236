package io.qlogic.core.logic;

/// Predicate of a conditional node over a single answer.
///
/// @param ifIdentifier identifier whose answer is tested, bare or qualified, empty if unset
/// @param operator comparison operator, defaults to {@link ConditionOperator#EQUALS}
/// @param value expected value or count threshold, empty if unset
public record Condition(String ifIdentifier, ConditionOperator operator, String value) {

    public Condition {
        ifIdentifier = ifIdentifier != null ? ifIdentifier : "";
        operator = operator != null ? operator : ConditionOperator.EQUALS;
        value = value != null ? value : "";
    }

    /// Creates an equality condition with no expected value yet.
    ///
    /// @param ifIdentifier identifier to test, may be null
    /// @return new condition, never null
    public static Condition on(String ifIdentifier) {
        return new Condition(ifIdentifier, ConditionOperator.EQUALS, "");
    }

    /// Creates an equality condition.
    ///
    /// @param ifIdentifier identifier to test, may be null
    /// @param value expected answer, may be null
    /// @return new condition, never null
    public static Condition equalTo(String ifIdentifier, String value) {
        return new Condition(ifIdentifier, ConditionOperator.EQUALS, value);
    }

    /// Returns whether the condition names an identifier.
    ///
    /// @return true if `ifIdentifier` is not blank
    public boolean hasIdentifier() {
        return !ifIdentifier.isBlank();
    }
}
