package io.qlogic.core.evaluation;

import io.qlogic.core.answer.AnswerValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// One repetition of a repeatable set with its slice of the answers.
///
/// @param index zero-based instance index
/// @param answers entry of each member question for this instance, keyed by bare identifier
public record RepeatableInstance(int index, Map<String, AnswerValue> answers) {

    public RepeatableInstance {
        answers = Collections.unmodifiableMap(new LinkedHashMap<>(answers));
    }
}
