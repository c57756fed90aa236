package io.qlogic.core.question;

import java.util.Objects;

/// A selectable option of a choice question.
///
/// @param value stored answer value, not null
/// @param label text shown to the user, not null
public record QuestionOption(String value, String label) {

    public QuestionOption {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(label, "label must not be null");
    }
}
