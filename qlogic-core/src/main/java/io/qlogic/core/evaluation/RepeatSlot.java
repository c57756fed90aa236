package io.qlogic.core.evaluation;

/// Position of a visible question inside an expanded repeatable set.
///
/// @param setIndex index of the set in {@link FlowEvaluation#repeatableSets()}
/// @param instanceIndex zero-based instance the question belongs to
/// @param instanceCount number of instances of the set
public record RepeatSlot(int setIndex, int instanceIndex, int instanceCount) {}
