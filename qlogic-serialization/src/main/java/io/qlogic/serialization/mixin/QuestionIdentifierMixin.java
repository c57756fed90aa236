package io.qlogic.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/// Jackson mixin that limits `QuestionIdentifier` to its two record components.
///
/// Hides the `isBlank()` and `isWellFormed()` accessors, which Jackson would otherwise
/// write as `blank` and `wellFormed` properties.
@JsonIgnoreProperties({"blank", "wellFormed"})
public abstract class QuestionIdentifierMixin {}
