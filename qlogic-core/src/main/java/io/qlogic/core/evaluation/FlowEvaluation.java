package io.qlogic.core.evaluation;

import io.qlogic.core.question.QuestionIdentifier;
import java.util.List;
import java.util.Set;

/// Result of evaluating a question group's flow against the current answers.
///
/// @param visibleQuestions questions on the requested page, not null
/// @param allVisibleQuestions every visible question across pages, not null
/// @param page 1-based page actually returned, after clamping
/// @param totalPages number of pages, at least 1
/// @param pageSize questions per page
/// @param conditionalDependencyIdentifiers identifiers tested by any conditional, not null
/// @param repeatableSets visible repeatable sets with their instances, not null
/// @param flowStopped true if a stop or end flag cut the evaluation short
public record FlowEvaluation(
        List<VisibleQuestion> visibleQuestions,
        List<VisibleQuestion> allVisibleQuestions,
        int page,
        int totalPages,
        int pageSize,
        Set<String> conditionalDependencyIdentifiers,
        List<ExpandedRepeatableSet> repeatableSets,
        boolean flowStopped) {

    public FlowEvaluation {
        visibleQuestions = List.copyOf(visibleQuestions);
        allVisibleQuestions = List.copyOf(allVisibleQuestions);
        conditionalDependencyIdentifiers = Set.copyOf(conditionalDependencyIdentifiers);
        repeatableSets = List.copyOf(repeatableSets);
    }

    public boolean isFirstPage() {
        return page == 1;
    }

    public boolean isLastPage() {
        return page >= totalPages;
    }

    /// Returns whether changing an answer can change which questions are visible.
    ///
    /// @param identifier bare or qualified identifier, may be null
    /// @return true if some conditional tests the identifier
    public boolean dependsOn(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return false;
        }
        String bare = QuestionIdentifier.strip(identifier);
        return conditionalDependencyIdentifiers.stream()
                .anyMatch(d -> d.equals(identifier) || QuestionIdentifier.strip(d).equals(bare));
    }

    /// Returns the bare identifiers of all visible questions, each once, in display order.
    ///
    /// @return unmodifiable list, never null
    public List<String> visibleIdentifiers() {
        return allVisibleQuestions.stream().map(VisibleQuestion::identifier).distinct().toList();
    }

    /// Returns the required questions on this page that have no answer.
    ///
    /// @return bare identifiers, each once, in display order
    public List<String> missingRequiredOnPage() {
        return visibleQuestions.stream()
                .filter(VisibleQuestion::isMissingRequiredAnswer)
                .map(VisibleQuestion::identifier)
                .distinct()
                .toList();
    }
}
