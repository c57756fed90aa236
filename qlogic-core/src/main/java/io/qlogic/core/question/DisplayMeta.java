package io.qlogic.core.question;

/// Type-specific display settings of a question.
///
/// @param personDisplayMode lookup style for person questions, null for other types
/// @param includeTime whether a date question also captures the time of day
public record DisplayMeta(PersonDisplayMode personDisplayMode, boolean includeTime) {

    private static final DisplayMeta NONE = new DisplayMeta(null, false);

    /// Returns display settings with no type-specific options.
    ///
    /// @return shared empty instance, never null
    public static DisplayMeta none() {
        return NONE;
    }
}
