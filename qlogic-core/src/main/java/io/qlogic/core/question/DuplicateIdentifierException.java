package io.qlogic.core.question;

import java.io.Serial;

/// Thrown when a question identifier collides with another question of the same group.
///
/// Comparison is case-insensitive on the bare identifier. The conflicting question is never
/// renamed automatically; its autosave stays blocked until the author picks another name.
///
/// @see QuestionRegistry#create(Question)
/// @see QuestionRegistry#update(String, QuestionEdit)
public class DuplicateIdentifierException extends Exception {

    @Serial private static final long serialVersionUID = 2305521747181066341L;

    private final String identifier;

    /// Creates exception for a conflicting identifier.
    ///
    /// @param identifier the identifier that is already in use
    public DuplicateIdentifierException(String identifier) {
        super("Identifier already used in this group: " + identifier);
        this.identifier = identifier;
    }

    /// Returns the conflicting identifier.
    ///
    /// @return identifier as given by the author
    public String getIdentifier() {
        return identifier;
    }
}
