package io.qlogic.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `Question.Builder`: setters carry no `with` prefix.
///
/// @see QuestionMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class QuestionBuilderMixin {}
