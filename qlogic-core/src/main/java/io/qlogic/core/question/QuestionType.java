package io.qlogic.core.question;

/// Answer widget and value shape of a question.
///
/// Choice types carry an ordered option list; `PERSON` and `PERSON_BACKUP` answers are
/// structured field maps; every other type stores a plain scalar.
public enum QuestionType {
    FREE_TEXT,
    MULTIPLE_CHOICE,
    CHECKBOX_GROUP,
    DROPDOWN,
    PERSON,
    PERSON_BACKUP,
    DATE;

    /// Returns whether this type selects from a fixed option list.
    ///
    /// @return true for multiple choice, checkbox group and dropdown
    public boolean hasOptions() {
        return this == MULTIPLE_CHOICE || this == CHECKBOX_GROUP || this == DROPDOWN;
    }

    /// Returns whether answers of this type are person records.
    ///
    /// @return true for person and person backup
    public boolean isPerson() {
        return this == PERSON || this == PERSON_BACKUP;
    }
}
