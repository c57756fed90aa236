package io.qlogic.core.answer;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Sealed interface for the value of one answer.
///
/// ### Permitted Implementations
/// - {@link Text} - a single answer as text
/// - {@link Items} - one entry per instance of a repeatable question
/// - {@link Fields} - structured answer such as a person's name and email
///
/// @implNote Implementations are immutable records.
public sealed interface AnswerValue
        permits AnswerValue.Text, AnswerValue.Items, AnswerValue.Fields {

    static Text text(String value) {
        return new Text(value);
    }

    static Items items(List<AnswerValue> entries) {
        return new Items(entries);
    }

    /// Creates a repeatable answer from text entries.
    ///
    /// @param entries one text per instance
    /// @return items value, never null
    static Items texts(String... entries) {
        List<AnswerValue> texts = Arrays.stream(entries).<AnswerValue>map(Text::new).toList();
        return new Items(texts);
    }

    static Fields fields(Map<String, String> values) {
        return new Fields(values);
    }

    /// Returns an empty text answer.
    ///
    /// @return empty value, never null
    static Text empty() {
        return Text.EMPTY;
    }

    /// Returns whether the value carries no content.
    ///
    /// @return true for blank text, lists of empty entries and maps of blank fields
    boolean isEmpty();

    /// Returns the number of non-empty entries, as counted by the `COUNT_*` operators.
    ///
    /// @return entry count; 0 or 1 for non-list values
    int nonEmptyCount();

    /// Returns the number of repeatable instances this value spans.
    ///
    /// @return list size for {@link Items}, 1 otherwise
    int length();

    /// Returns the value of one repeatable instance.
    ///
    /// @param index instance index, not negative
    /// @return the entry, or an empty text past the end, never null
    AnswerValue entryAt(int index);

    /// Returns the value as plain text when it has a single textual form.
    ///
    /// @return text for {@link Text}, empty otherwise
    Optional<String> scalar();

    /// Answer given as plain text.
    ///
    /// @param value answer text, null treated as empty
    record Text(String value) implements AnswerValue {

        private static final Text EMPTY = new Text("");

        public Text {
            value = value != null ? value : "";
        }

        @Override
        public boolean isEmpty() {
            return value.isBlank();
        }

        @Override
        public int nonEmptyCount() {
            return isEmpty() ? 0 : 1;
        }

        @Override
        public int length() {
            return 1;
        }

        @Override
        public AnswerValue entryAt(int index) {
            return index == 0 ? this : EMPTY;
        }

        @Override
        public Optional<String> scalar() {
            return Optional.of(value);
        }
    }

    /// Answer of a repeatable question, one entry per instance.
    ///
    /// @param entries ordered entries, not null
    record Items(List<AnswerValue> entries) implements AnswerValue {

        public Items {
            entries = List.copyOf(Objects.requireNonNull(entries, "entries must not be null"));
        }

        @Override
        public boolean isEmpty() {
            return entries.stream().allMatch(AnswerValue::isEmpty);
        }

        @Override
        public int nonEmptyCount() {
            return (int) entries.stream().filter(e -> !e.isEmpty()).count();
        }

        @Override
        public int length() {
            return entries.size();
        }

        @Override
        public AnswerValue entryAt(int index) {
            return index < entries.size() ? entries.get(index) : Text.EMPTY;
        }

        @Override
        public Optional<String> scalar() {
            return Optional.empty();
        }
    }

    /// Structured answer made of named text fields.
    ///
    /// @param values field values in insertion order, not null
    record Fields(Map<String, String> values) implements AnswerValue {

        public Fields {
            Objects.requireNonNull(values, "values must not be null");
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        @Override
        public boolean isEmpty() {
            return values.values().stream().allMatch(v -> v == null || v.isBlank());
        }

        @Override
        public int nonEmptyCount() {
            return isEmpty() ? 0 : 1;
        }

        @Override
        public int length() {
            return 1;
        }

        @Override
        public AnswerValue entryAt(int index) {
            return index == 0 ? this : Text.EMPTY;
        }

        @Override
        public Optional<String> scalar() {
            return Optional.empty();
        }
    }
}
