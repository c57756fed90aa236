package io.qlogic.core.logic;

/// Comparison operators of a conditional node.
///
/// Equality operators compare the answer text; count operators compare the number of
/// non-empty answer entries against an integer threshold.
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    COUNT_GREATER_THAN("count_greater_than"),
    COUNT_EQUALS("count_equals"),
    COUNT_LESS_THAN("count_less_than");

    private final String wireName;

    ConditionOperator(String wireName) {
        this.wireName = wireName;
    }

    /// Returns the name used in the serialized tree.
    ///
    /// @return lower snake case name, never null
    public String wireName() {
        return wireName;
    }

    /// Returns whether the operator counts answer entries.
    ///
    /// @return true for the `COUNT_*` operators
    public boolean isCount() {
        return this == COUNT_GREATER_THAN || this == COUNT_EQUALS || this == COUNT_LESS_THAN;
    }

    /// Parses a serialized operator name.
    ///
    /// @param wireName serialized name, null or blank for the default
    /// @return matching operator, {@link #EQUALS} when absent
    /// @throws IllegalArgumentException if the name is unknown
    public static ConditionOperator fromWire(String wireName) {
        if (wireName == null || wireName.isBlank()) {
            return EQUALS;
        }
        for (ConditionOperator operator : values()) {
            if (operator.wireName.equalsIgnoreCase(wireName)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown condition operator: " + wireName);
    }
}
