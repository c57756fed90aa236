package io.qlogic.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.qlogic.core.question.Question;

/// Jackson mixin that binds `Question` deserialization to its builder.
///
/// Applied to `Question.class` via `QlogicJacksonModule.setupModule()`. The derived
/// `persisted` and `persistable` flags are written for readers of the JSON but never
/// read back.
///
/// @apiNote The companion mixin {@link QuestionBuilderMixin} must also be registered.
///
/// @see QuestionBuilderMixin
/// @see io.qlogic.serialization.QlogicJacksonModule
@JsonDeserialize(builder = Question.Builder.class)
@JsonIgnoreProperties(
        value = {"persisted", "persistable"},
        allowGetters = true)
public abstract class QuestionMixin {}
