package io.qlogic.core.question;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/// Immutable question record belonging to one question group.
///
/// A question is created locally with a stable `localId` and only receives its persisted
/// `id` once the persistence collaborator acknowledges the create call. Both handles stay
/// valid for the lifetime of the question; logic tree nodes reference it through a
/// {@link QuestionRef}.
///
/// ### Persistability
/// A question is sent to persistence only when {@link #validationProblems()} is empty:
/// - identifier present and made of letters, digits and underscores
/// - question text present
/// - choice types carry at least two options
///
/// @implNote Immutable and thread-safe. Use {@link #toBuilder()} to derive modified copies.
///
/// @see QuestionRegistry for identifier uniqueness
/// @see QuestionRef for references held by the logic tree
public final class Question {

    private final String id;
    private final String localId;
    private final String text;
    private final QuestionType type;
    private final QuestionIdentifier identifier;
    private final boolean required;
    private final boolean repeatable;
    private final String repeatableGroupId;
    private final List<QuestionOption> options;
    private final DisplayMeta displayMeta;
    private final String helpText;

    private Question(Builder builder) {
        this.id = builder.id;
        this.localId = resolveLocalId(builder.localId, builder.id);
        this.text = builder.text != null ? builder.text : "";
        this.type = builder.type != null ? builder.type : QuestionType.FREE_TEXT;
        this.identifier =
                builder.identifier != null ? builder.identifier : QuestionIdentifier.blank();
        this.required = builder.required;
        this.repeatable = builder.repeatable;
        this.repeatableGroupId = repeatable ? builder.repeatableGroupId : null;
        this.options = builder.options != null ? List.copyOf(builder.options) : List.of();
        this.displayMeta = builder.displayMeta != null ? builder.displayMeta : DisplayMeta.none();
        this.helpText = builder.helpText;
    }

    // Questions loaded from persistence without a client handle use their id as the handle
    private static String resolveLocalId(String localId, String id) {
        if (localId != null && !localId.isBlank()) {
            return localId;
        }
        return id != null ? id : UUID.randomUUID().toString();
    }

    /// Creates a new question builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Returns an unnamed free-text question used as the body of new nodes.
    ///
    /// @return draft question with a fresh local id, never null
    public static Question draft() {
        return builder().required(true).build();
    }

    /// Returns the persisted id.
    ///
    /// @return id assigned by persistence, or null while the question is local only
    public String getId() {
        return id;
    }

    /// Returns the stable client-side handle.
    ///
    /// @return local id, never null
    public String getLocalId() {
        return localId;
    }

    public String getText() {
        return text;
    }

    public QuestionType getType() {
        return type;
    }

    /// Returns the identifier in its display and qualified forms.
    ///
    /// @return identifier, blank for drafts, never null
    public QuestionIdentifier getIdentifier() {
        return identifier;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isRepeatable() {
        return repeatable;
    }

    /// Returns the handle shared by questions that repeat together.
    ///
    /// @return repeatable set lineage id, or null if not repeatable or not assigned
    public String getRepeatableGroupId() {
        return repeatableGroupId;
    }

    /// Returns the ordered option list of a choice question.
    ///
    /// @return unmodifiable options, empty for non-choice types, never null
    public List<QuestionOption> getOptions() {
        return options;
    }

    public DisplayMeta getDisplayMeta() {
        return displayMeta;
    }

    public String getHelpText() {
        return helpText;
    }

    /// Returns whether persistence has assigned an id.
    ///
    /// @return true once created remotely
    public boolean isPersisted() {
        return id != null;
    }

    /// Returns why this question cannot be persisted yet.
    ///
    /// @return unmodifiable list of problems, empty if persistable, never null
    public List<String> validationProblems() {
        List<String> problems = new ArrayList<>();
        if (identifier.isBlank()) {
            problems.add("identifier is required");
        } else if (!identifier.isWellFormed()) {
            problems.add(
                    "identifier '"
                            + identifier.displayIdentifier()
                            + "' may only contain letters, digits and underscores");
        }
        if (text.isBlank()) {
            problems.add("question text is required");
        }
        if (type.hasOptions() && options.size() < 2) {
            problems.add(type + " questions need at least 2 options");
        }
        return List.copyOf(problems);
    }

    /// Returns whether this question may be sent to persistence.
    ///
    /// @return true if {@link #validationProblems()} is empty
    public boolean isPersistable() {
        return validationProblems().isEmpty();
    }

    /// Returns a copy carrying the given persisted id.
    ///
    /// @param persistedId id assigned by persistence, not null
    /// @return persisted copy, never null
    public Question withId(String persistedId) {
        return toBuilder().id(Objects.requireNonNull(persistedId, "persistedId")).build();
    }

    /// Returns a builder initialized with this question's fields.
    ///
    /// @return pre-filled builder, never null
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .localId(localId)
                .text(text)
                .type(type)
                .identifier(identifier)
                .required(required)
                .repeatable(repeatable)
                .repeatableGroupId(repeatableGroupId)
                .options(options)
                .displayMeta(displayMeta)
                .helpText(helpText);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Question that)) return false;
        return required == that.required
                && repeatable == that.repeatable
                && Objects.equals(id, that.id)
                && localId.equals(that.localId)
                && text.equals(that.text)
                && type == that.type
                && identifier.equals(that.identifier)
                && Objects.equals(repeatableGroupId, that.repeatableGroupId)
                && options.equals(that.options)
                && displayMeta.equals(that.displayMeta)
                && Objects.equals(helpText, that.helpText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                id,
                localId,
                text,
                type,
                identifier,
                required,
                repeatable,
                repeatableGroupId,
                options,
                displayMeta,
                helpText);
    }

    @Override
    public String toString() {
        return "Question{"
                + "id="
                + id
                + ", localId='"
                + localId
                + "', identifier='"
                + identifier.qualifiedIdentifier()
                + "', type="
                + type
                + ", repeatable="
                + repeatable
                + '}';
    }

    /// Builder for constructing immutable Question instances.
    ///
    /// No field is required; unset fields default to a free-text, blank-identifier draft.
    public static final class Builder {
        private String id;
        private String localId;
        private String text;
        private QuestionType type;
        private QuestionIdentifier identifier;
        private boolean required;
        private boolean repeatable;
        private String repeatableGroupId;
        private List<QuestionOption> options;
        private DisplayMeta displayMeta;
        private String helpText;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder localId(String localId) {
            this.localId = localId;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder type(QuestionType type) {
            this.type = type;
            return this;
        }

        /// Sets the identifier pair.
        ///
        /// @param identifier identifier in both forms, may be null for a draft
        /// @return this builder for chaining
        public Builder identifier(QuestionIdentifier identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder repeatable(boolean repeatable) {
            this.repeatable = repeatable;
            return this;
        }

        /// Sets the repeatable set lineage id.
        ///
        /// Ignored unless the question is repeatable.
        ///
        /// @param repeatableGroupId lineage handle, may be null
        /// @return this builder for chaining
        public Builder repeatableGroupId(String repeatableGroupId) {
            this.repeatableGroupId = repeatableGroupId;
            return this;
        }

        public Builder options(List<QuestionOption> options) {
            this.options = options;
            return this;
        }

        public Builder displayMeta(DisplayMeta displayMeta) {
            this.displayMeta = displayMeta;
            return this;
        }

        public Builder helpText(String helpText) {
            this.helpText = helpText;
            return this;
        }

        /// Builds the immutable question.
        ///
        /// @return new Question instance, never null
        public Question build() {
            return new Question(this);
        }
    }
}
