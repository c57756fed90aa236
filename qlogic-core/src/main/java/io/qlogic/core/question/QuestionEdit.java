package io.qlogic.core.question;

import java.util.List;
import java.util.Objects;

/// Partial content edit of a question.
///
/// Every field is optional; only non-null fields are applied. Edits are what the authoring
/// UI produces on each keystroke and what the persistence collaborator receives as the
/// partial update payload.
///
/// ### Usage
/// {@snippet :
/// QuestionEdit edit = QuestionEdit.builder().text("Do you own a pet?").required(true).build();
/// Question updated = edit.applyTo(question, "household");
/// }
///
/// @implNote Immutable and thread-safe.
public final class QuestionEdit {

    private static final QuestionEdit EMPTY = builder().build();

    private final String text;
    private final QuestionType type;
    private final String identifier;
    private final Boolean required;
    private final Boolean repeatable;
    private final String repeatableGroupId;
    private final List<QuestionOption> options;
    private final DisplayMeta displayMeta;
    private final String helpText;

    private QuestionEdit(Builder builder) {
        this.text = builder.text;
        this.type = builder.type;
        this.identifier = builder.identifier;
        this.required = builder.required;
        this.repeatable = builder.repeatable;
        this.repeatableGroupId = builder.repeatableGroupId;
        this.options = builder.options != null ? List.copyOf(builder.options) : null;
        this.displayMeta = builder.displayMeta;
        this.helpText = builder.helpText;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns an edit that changes nothing.
    ///
    /// @return shared empty edit, never null
    public static QuestionEdit empty() {
        return EMPTY;
    }

    /// Returns an edit carrying every content field of a question.
    ///
    /// Used to send the complete current content with each autosave, so a save never
    /// depends on which earlier partial edits reached persistence.
    ///
    /// @param question source question, not null
    /// @return full-content edit, never null
    public static QuestionEdit fullContentOf(Question question) {
        return builder()
                .text(question.getText())
                .type(question.getType())
                .identifier(question.getIdentifier().displayIdentifier())
                .required(question.isRequired())
                .repeatable(question.isRepeatable())
                .repeatableGroupId(question.getRepeatableGroupId())
                .options(question.getOptions())
                .displayMeta(question.getDisplayMeta())
                .helpText(question.getHelpText())
                .build();
    }

    public String getText() {
        return text;
    }

    public QuestionType getType() {
        return type;
    }

    /// Returns the raw identifier, bare or qualified.
    ///
    /// @return identifier, or null if the edit does not rename the question
    public String getIdentifier() {
        return identifier;
    }

    public Boolean getRequired() {
        return required;
    }

    public Boolean getRepeatable() {
        return repeatable;
    }

    public String getRepeatableGroupId() {
        return repeatableGroupId;
    }

    public List<QuestionOption> getOptions() {
        return options;
    }

    public DisplayMeta getDisplayMeta() {
        return displayMeta;
    }

    public String getHelpText() {
        return helpText;
    }

    /// Returns whether this edit renames the question.
    ///
    /// @return true if an identifier is present
    public boolean changesIdentifier() {
        return identifier != null;
    }

    /// Returns this edit without its identifier change.
    ///
    /// @return copy with a null identifier, never null
    public QuestionEdit withoutIdentifier() {
        return toBuilder().identifier(null).build();
    }

    /// Applies the non-null fields of this edit to a question.
    ///
    /// @param question question to edit, not null
    /// @param groupIdentifier identifier of the owning group, used to qualify a new identifier
    /// @return edited copy keeping the question's ids, never null
    public Question applyTo(Question question, String groupIdentifier) {
        Objects.requireNonNull(question, "question must not be null");
        Question.Builder b = question.toBuilder();
        if (text != null) b.text(text);
        if (type != null) b.type(type);
        if (identifier != null) b.identifier(QuestionIdentifier.of(groupIdentifier, identifier));
        if (required != null) b.required(required);
        if (repeatable != null) b.repeatable(repeatable);
        if (repeatableGroupId != null) b.repeatableGroupId(repeatableGroupId);
        if (options != null) b.options(options);
        if (displayMeta != null) b.displayMeta(displayMeta);
        if (helpText != null) b.helpText(helpText);
        return b.build();
    }

    public Builder toBuilder() {
        return new Builder()
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
        if (!(o instanceof QuestionEdit that)) return false;
        return Objects.equals(text, that.text)
                && type == that.type
                && Objects.equals(identifier, that.identifier)
                && Objects.equals(required, that.required)
                && Objects.equals(repeatable, that.repeatable)
                && Objects.equals(repeatableGroupId, that.repeatableGroupId)
                && Objects.equals(options, that.options)
                && Objects.equals(displayMeta, that.displayMeta)
                && Objects.equals(helpText, that.helpText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
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

    /// Builder for QuestionEdit. Unset fields leave the question unchanged.
    public static final class Builder {
        private String text;
        private QuestionType type;
        private String identifier;
        private Boolean required;
        private Boolean repeatable;
        private String repeatableGroupId;
        private List<QuestionOption> options;
        private DisplayMeta displayMeta;
        private String helpText;

        private Builder() {}

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder type(QuestionType type) {
            this.type = type;
            return this;
        }

        public Builder identifier(String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder required(Boolean required) {
            this.required = required;
            return this;
        }

        public Builder repeatable(Boolean repeatable) {
            this.repeatable = repeatable;
            return this;
        }

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

        public QuestionEdit build() {
            return new QuestionEdit(this);
        }
    }
}
