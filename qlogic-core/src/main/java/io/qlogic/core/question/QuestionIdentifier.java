package io.qlogic.core.question;

import java.util.Locale;
import java.util.regex.Pattern;

/// Identifier of a question in both of its forms.
///
/// Answers and conditionals refer to questions by identifier. Inside a group the identifier
/// is edited and displayed bare (`has_pet`), while persisted state namespaces it with the
/// owning group's identifier (`household.has_pet`) so the same bare name can be reused by
/// different groups.
///
/// ### Mapping
/// - {@link #of(String, String)} qualifies a raw value, accepting either form
/// - {@link #strip(String)} maps any form to the bare form
///
/// @param displayIdentifier bare identifier, empty for a draft question
/// @param qualifiedIdentifier group-prefixed identifier, empty for a draft question
public record QuestionIdentifier(String displayIdentifier, String qualifiedIdentifier) {

    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9_]+$");
    private static final QuestionIdentifier BLANK = new QuestionIdentifier("", "");

    public QuestionIdentifier {
        displayIdentifier = displayIdentifier != null ? displayIdentifier : "";
        qualifiedIdentifier = qualifiedIdentifier != null ? qualifiedIdentifier : "";
    }

    /// Builds an identifier from a raw value that may or may not already be namespaced.
    ///
    /// @param groupIdentifier identifier of the owning group, may be null or blank
    /// @param raw bare or qualified identifier, may be null
    /// @return identifier pair, never null
    public static QuestionIdentifier of(String groupIdentifier, String raw) {
        if (raw == null || raw.isBlank()) {
            return BLANK;
        }
        String display = strip(raw.trim());
        if (groupIdentifier == null || groupIdentifier.isBlank()) {
            return new QuestionIdentifier(display, display);
        }
        return new QuestionIdentifier(display, groupIdentifier + "." + display);
    }

    /// Returns the identifier of a draft question that has not been named yet.
    ///
    /// @return blank identifier, never null
    public static QuestionIdentifier blank() {
        return BLANK;
    }

    /// Removes the group namespace from an identifier.
    ///
    /// Everything up to and including the first dot is the namespace.
    ///
    /// @param raw bare or qualified identifier, not null
    /// @return bare identifier, never null
    public static String strip(String raw) {
        int dot = raw.indexOf('.');
        return dot >= 0 ? raw.substring(dot + 1) : raw;
    }

    /// Returns whether this identifier is empty.
    ///
    /// @return true for drafts
    public boolean isBlank() {
        return displayIdentifier.isBlank();
    }

    /// Returns whether the bare form only uses letters, digits and underscores.
    ///
    /// @return true if the identifier can be persisted
    public boolean isWellFormed() {
        return VALID.matcher(displayIdentifier).matches();
    }

    /// Returns the key used for case-insensitive uniqueness checks within a group.
    ///
    /// @return lower-cased bare identifier, never null
    public String uniquenessKey() {
        return displayIdentifier.toLowerCase(Locale.ROOT);
    }

    /// Returns whether a raw identifier names this question in either form.
    ///
    /// @param raw bare or qualified identifier, may be null
    /// @return true if the raw value equals the qualified form or strips to the bare form
    public boolean matches(String raw) {
        if (raw == null || raw.isBlank() || isBlank()) {
            return false;
        }
        return raw.equals(qualifiedIdentifier) || strip(raw).equals(displayIdentifier);
    }
}
