package io.qlogic.core.session;

import io.qlogic.core.answer.AnswerSheet;
import io.qlogic.core.answer.AnswerValue;
import io.qlogic.core.evaluation.ExpandedRepeatableSet;
import io.qlogic.core.evaluation.FlowEvaluation;
import io.qlogic.core.evaluation.FlowEvaluator;
import io.qlogic.core.evaluation.RepeatableInstance;
import io.qlogic.core.persistence.AnswerStore;
import io.qlogic.core.persistence.PersistenceFailureException;
import io.qlogic.core.question.Question;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/// End-user run through the question groups of a flow.
///
/// Holds the session's answers, the current group and page, and the latest
/// {@link FlowEvaluation}. Answer edits stay local until the field is blurred or the user
/// navigates; editing an answer some conditional depends on saves it at once and
/// re-evaluates, because it can change which questions are visible.
///
/// ### Lifecycle
/// ```
/// LOADING --start()--> ACTIVE --next() past the last page--> COMPLETED
/// ```
///
/// ### Answer Keys
/// Answers are stored under the qualified identifier of the question they belong to.
/// Identifiers that match no known question are stored as given.
///
/// @implNote Thread-safe. State is guarded by this session's monitor; store completions may
/// arrive on any thread.
/// @see FlowEvaluator for visibility rules
/// @see GroupFlow for group routing
public final class QuestionnaireSession {

    private static final Logger logger = Logger.getLogger(QuestionnaireSession.class.getName());

    private final String sessionId;
    private final Map<String, QuestionGroupDefinition> groups;
    private final GroupFlow flow;
    private final AnswerStore answerStore;
    private final FlowEvaluator evaluator;
    private final int pageSize;

    private SessionState state = SessionState.LOADING;
    private AnswerSheet answers = AnswerSheet.empty();
    private final Set<String> dirty = new HashSet<>();
    private final Set<String> editing = new HashSet<>();
    private String currentGroupId;
    private int page = 1;
    private FlowEvaluation current;

    private QuestionnaireSession(Builder builder) {
        this.sessionId = builder.sessionId;
        this.groups = Map.copyOf(builder.groups);
        this.flow =
                builder.flow != null
                        ? builder.flow
                        : GroupFlow.sequential(new ArrayList<>(builder.groups.keySet()));
        this.answerStore = builder.answerStore;
        this.evaluator = builder.evaluator;
        this.pageSize = builder.pageSize > 0 ? builder.pageSize : evaluator.getDefaultPageSize();
    }

    /// Creates a new session builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    public String getSessionId() {
        return sessionId;
    }

    public synchronized SessionState state() {
        return state;
    }

    public synchronized String currentGroupId() {
        return currentGroupId;
    }

    /// Returns the evaluation of the current page.
    ///
    /// @return latest evaluation, null before {@link #start()} completes
    public synchronized FlowEvaluation current() {
        return current;
    }

    /// Returns all answers, including unsaved local edits.
    ///
    /// @return immutable answers, never null
    public synchronized AnswerSheet answers() {
        return answers;
    }

    /// Returns whether any answer has local changes that are not saved yet.
    ///
    /// @return true if a save is pending
    public synchronized boolean hasUnsavedChanges() {
        return !dirty.isEmpty();
    }

    /// Loads persisted answers and evaluates the first page of the first group.
    ///
    /// @return future completing with the first evaluation
    /// @throws IllegalStateException if the session was already started
    public synchronized CompletableFuture<FlowEvaluation> start() {
        if (state != SessionState.LOADING || currentGroupId != null) {
            throw new IllegalStateException("Session " + sessionId + " already started");
        }
        return answerStore
                .loadAnswers(sessionId)
                .thenApply(
                        loaded -> {
                            synchronized (this) {
                                answers = loaded;
                                List<String> ordered = orderedGroupIds();
                                if (ordered.isEmpty()) {
                                    throw new IllegalStateException(
                                            "Session " + sessionId + " has no question groups");
                                }
                                currentGroupId = ordered.get(0);
                                page = 1;
                                state = SessionState.ACTIVE;
                                logger.info(
                                        "Started session "
                                                + sessionId
                                                + " with "
                                                + loaded.size()
                                                + " persisted answers");
                                return reevaluate();
                            }
                        });
    }

    /// Marks an answer as being edited, protecting it from {@link #reloadPersistedAnswers()}.
    ///
    /// @param identifier bare or qualified identifier, not null
    public synchronized void beginEditing(String identifier) {
        ensureStarted();
        editing.add(keyFor(identifier));
    }

    /// Changes an answer locally.
    ///
    /// If a conditional depends on the identifier, the answer is saved and the flow
    /// re-evaluated before the returned future completes.
    ///
    /// @param identifier bare or qualified identifier, not null
    /// @param value new answer, not null
    /// @return future completing with the evaluation after the edit
    public synchronized CompletableFuture<FlowEvaluation> editAnswer(
            String identifier, AnswerValue value) {
        ensureStarted();
        Objects.requireNonNull(value, "value must not be null");
        String key = keyFor(identifier);
        answers = answers.with(key, value);
        dirty.add(key);
        return afterChange(Set.of(key), current.dependsOn(key));
    }

    /// Changes the answer of one repeatable instance locally.
    ///
    /// Shorter answer lists are padded with empty entries.
    ///
    /// @param identifier bare or qualified identifier of a repeatable question, not null
    /// @param instanceIndex zero-based instance, not negative
    /// @param value new entry, not null
    /// @return future completing with the evaluation after the edit
    public synchronized CompletableFuture<FlowEvaluation> editInstanceAnswer(
            String identifier, int instanceIndex, AnswerValue value) {
        ensureStarted();
        if (instanceIndex < 0) {
            throw new IllegalArgumentException("instanceIndex must not be negative");
        }
        String key = keyFor(identifier);
        List<AnswerValue> entries = entriesOf(answers.get(key), instanceIndex + 1);
        entries.set(instanceIndex, value);
        return editAnswer(key, AnswerValue.items(entries));
    }

    /// Ends editing of an answer and saves it if it changed.
    ///
    /// @param identifier bare or qualified identifier, not null
    /// @return future completing when the answer is saved
    public synchronized CompletableFuture<Void> blur(String identifier) {
        ensureStarted();
        String key = keyFor(identifier);
        editing.remove(key);
        if (!dirty.contains(key)) {
            return CompletableFuture.completedFuture(null);
        }
        return save(Set.of(key));
    }

    /// Merges persisted answers into the session.
    ///
    /// Answers being edited or with unsaved local changes keep their local value.
    ///
    /// @return future completing with the re-evaluated page
    public synchronized CompletableFuture<FlowEvaluation> reloadPersistedAnswers() {
        ensureStarted();
        return answerStore
                .loadAnswers(sessionId)
                .thenApply(
                        loaded -> {
                            synchronized (this) {
                                Map<String, AnswerValue> merged =
                                        new LinkedHashMap<>(answers.answers());
                                loaded.answers()
                                        .forEach(
                                                (key, value) -> {
                                                    if (!editing.contains(key)
                                                            && !dirty.contains(key)) {
                                                        merged.put(key, value);
                                                    }
                                                });
                                answers = AnswerSheet.of(merged);
                                return reevaluate();
                            }
                        });
    }

    /// Moves forward one page, to the next group, or completes the session.
    ///
    /// Required questions on the current page must be answered first; otherwise nothing is
    /// saved and the result is {@link NavigationOutcome#BLOCKED}. On the last page of the last
    /// group without unsaved changes the session completes without a save.
    ///
    /// @return future completing with the navigation result
    public synchronized CompletableFuture<NavigationResult> next() {
        ensureState(SessionState.ACTIVE);
        List<String> missing = current.missingRequiredOnPage();
        if (!missing.isEmpty()) {
            logger.fine(() -> "Session " + sessionId + " blocked by " + missing);
            NavigationResult blocked =
                    new NavigationResult(
                            NavigationOutcome.BLOCKED, currentGroupId, missing, current);
            return CompletableFuture.completedFuture(blocked);
        }
        if (current.isLastPage() && isLastGroup() && dirty.isEmpty()) {
            state = SessionState.COMPLETED;
            logger.info("Session " + sessionId + " exited without changes");
            return CompletableFuture.completedFuture(result(NavigationOutcome.EXITED));
        }
        return save(Set.copyOf(dirty)).thenApply(v -> advance());
    }

    private synchronized NavigationResult advance() {
        if (!current.isLastPage()) {
            page = current.page() + 1;
            reevaluate();
            return result(NavigationOutcome.ADVANCED_PAGE);
        }
        List<String> ordered = orderedGroupIds();
        int index = ordered.indexOf(currentGroupId);
        if (index >= 0 && index < ordered.size() - 1) {
            currentGroupId = ordered.get(index + 1);
            page = 1;
            reevaluate();
            return result(NavigationOutcome.ADVANCED_GROUP);
        }
        state = SessionState.COMPLETED;
        logger.info("Session " + sessionId + " completed");
        return result(NavigationOutcome.COMPLETED);
    }

    /// Saves changes and moves back one page, or to the last page of the previous group.
    ///
    /// A completed session becomes active again.
    ///
    /// @return future completing with the navigation result
    public synchronized CompletableFuture<NavigationResult> previous() {
        ensureStarted();
        return save(Set.copyOf(dirty)).thenApply(v -> retreat());
    }

    private synchronized NavigationResult retreat() {
        state = SessionState.ACTIVE;
        if (current.page() > 1) {
            page = current.page() - 1;
            reevaluate();
            return result(NavigationOutcome.RETREATED_PAGE);
        }
        List<String> ordered = orderedGroupIds();
        int index = ordered.indexOf(currentGroupId);
        if (index > 0) {
            currentGroupId = ordered.get(index - 1);
            page = Integer.MAX_VALUE;
            reevaluate();
            return result(NavigationOutcome.RETREATED_GROUP);
        }
        return result(NavigationOutcome.AT_START);
    }

    /// Adds an empty instance to a visible repeatable set.
    ///
    /// Every member question's answer list grows by one entry, keeping the lists in
    /// lockstep. The change is local until blurred or navigated.
    ///
    /// @param setIndex index into the current evaluation's repeatable sets
    /// @return the evaluation after the change, never null
    /// @throws IndexOutOfBoundsException if no such set is visible
    public synchronized FlowEvaluation addRepeatableInstance(int setIndex) {
        ensureStarted();
        ExpandedRepeatableSet set = current.repeatableSets().get(setIndex);
        for (Question question : set.questions()) {
            String key = question.getIdentifier().qualifiedIdentifier();
            List<AnswerValue> entries = instanceEntries(set, question);
            entries.add(AnswerValue.empty());
            answers = answers.with(key, AnswerValue.items(entries));
            dirty.add(key);
        }
        return reevaluate();
    }

    /// Removes one instance from a visible repeatable set.
    ///
    /// The entry is removed from every member question's answer list. Removing the only
    /// instance clears it instead. If a conditional depends on a member question, the
    /// answers are saved and the flow re-evaluated before the future completes.
    ///
    /// @param setIndex index into the current evaluation's repeatable sets
    /// @param instanceIndex zero-based instance to remove
    /// @return future completing with the evaluation after the change
    /// @throws IndexOutOfBoundsException if no such set or instance is visible
    public synchronized CompletableFuture<FlowEvaluation> removeRepeatableInstance(
            int setIndex, int instanceIndex) {
        ensureStarted();
        ExpandedRepeatableSet set = current.repeatableSets().get(setIndex);
        Objects.checkIndex(instanceIndex, set.instanceCount());
        Set<String> keys = new HashSet<>();
        boolean dependency = false;
        for (Question question : set.questions()) {
            String key = question.getIdentifier().qualifiedIdentifier();
            List<AnswerValue> entries = instanceEntries(set, question);
            if (entries.size() > 1) {
                entries.remove(instanceIndex);
            } else {
                entries.set(0, AnswerValue.empty());
            }
            answers = answers.with(key, AnswerValue.items(entries));
            dirty.add(key);
            keys.add(key);
            dependency |= current.dependsOn(key);
        }
        return afterChange(keys, dependency);
    }

    private static List<AnswerValue> instanceEntries(ExpandedRepeatableSet set, Question question) {
        List<AnswerValue> entries = new ArrayList<>();
        String identifier = question.getIdentifier().displayIdentifier();
        for (RepeatableInstance instance : set.instances()) {
            entries.add(instance.answers().getOrDefault(identifier, AnswerValue.empty()));
        }
        return entries;
    }

    private static List<AnswerValue> entriesOf(Optional<AnswerValue> value, int minimumSize) {
        List<AnswerValue> entries = new ArrayList<>();
        if (value.isPresent() && value.get() instanceof AnswerValue.Items items) {
            entries.addAll(items.entries());
        } else if (value.isPresent() && !value.get().isEmpty()) {
            entries.add(value.get());
        }
        while (entries.size() < minimumSize) {
            entries.add(AnswerValue.empty());
        }
        return entries;
    }

    private CompletableFuture<FlowEvaluation> afterChange(Set<String> keys, boolean dependency) {
        if (!dependency) {
            return CompletableFuture.completedFuture(reevaluate());
        }
        return save(keys).thenApply(v -> reevaluateSynchronized());
    }

    private synchronized FlowEvaluation reevaluateSynchronized() {
        return reevaluate();
    }

    private CompletableFuture<Void> save(Set<String> keys) {
        if (keys.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        AnswerSheet changes = answers.only(keys);
        return answerStore
                .saveAnswers(sessionId, changes)
                .handle(
                        (v, error) -> {
                            if (error != null) {
                                throw new PersistenceFailureException(
                                        "Saving answers of session " + sessionId + " failed",
                                        error);
                            }
                            markSaved(changes);
                            return null;
                        });
    }

    private synchronized void markSaved(AnswerSheet saved) {
        saved.answers()
                .forEach(
                        (key, value) -> {
                            if (answers.get(key).map(value::equals).orElse(false)) {
                                dirty.remove(key);
                            }
                        });
    }

    private FlowEvaluation reevaluate() {
        QuestionGroupDefinition group = groups.get(currentGroupId);
        current = evaluator.evaluate(group.tree(), group.catalog(), answers, page, pageSize);
        page = current.page();
        return current;
    }

    private NavigationResult result(NavigationOutcome outcome) {
        return new NavigationResult(outcome, currentGroupId, List.of(), current);
    }

    private List<String> orderedGroupIds() {
        return flow.orderedGroupIds(answers, evaluator.getConditionEvaluator()).stream()
                .filter(groups::containsKey)
                .toList();
    }

    private boolean isLastGroup() {
        List<String> ordered = orderedGroupIds();
        return ordered.isEmpty() || ordered.get(ordered.size() - 1).equals(currentGroupId);
    }

    private String keyFor(String identifier) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        QuestionGroupDefinition group = groups.get(currentGroupId);
        Optional<Question> question = group.catalog().findByIdentifier(identifier);
        if (question.isEmpty()) {
            question =
                    groups.values().stream()
                            .flatMap(g -> g.catalog().findByIdentifier(identifier).stream())
                            .findFirst();
        }
        return question.map(q -> q.getIdentifier().qualifiedIdentifier()).orElse(identifier);
    }

    private void ensureStarted() {
        if (state == SessionState.LOADING) {
            throw new IllegalStateException("Session " + sessionId + " is not started");
        }
    }

    private void ensureState(SessionState expected) {
        if (state != expected) {
            throw new IllegalStateException(
                    "Session " + sessionId + " is " + state + ", expected " + expected);
        }
    }

    /// Builder for QuestionnaireSession.
    ///
    /// `sessionId`, at least one group, `answerStore` and `evaluator` are required.
    public static final class Builder {
        private String sessionId;
        private final Map<String, QuestionGroupDefinition> groups = new LinkedHashMap<>();
        private GroupFlow flow;
        private AnswerStore answerStore;
        private FlowEvaluator evaluator;
        private int pageSize;

        private Builder() {}

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        /// Adds a group. Without an explicit flow, groups are visited in the order added.
        ///
        /// @param group group definition, not null
        /// @return this builder for chaining
        public Builder group(QuestionGroupDefinition group) {
            groups.put(group.groupId(), group);
            return this;
        }

        public Builder groups(List<QuestionGroupDefinition> groups) {
            groups.forEach(this::group);
            return this;
        }

        public Builder flow(GroupFlow flow) {
            this.flow = flow;
            return this;
        }

        public Builder answerStore(AnswerStore answerStore) {
            this.answerStore = answerStore;
            return this;
        }

        public Builder evaluator(FlowEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        /// Sets the page size.
        ///
        /// @param pageSize questions per page, 0 for the evaluator's default
        /// @return this builder for chaining
        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        /// Builds the session in state {@link SessionState#LOADING}.
        ///
        /// @return new session, never null
        public QuestionnaireSession build() {
            Objects.requireNonNull(sessionId, "sessionId is required");
            Objects.requireNonNull(answerStore, "answerStore is required");
            Objects.requireNonNull(evaluator, "evaluator is required");
            if (groups.isEmpty()) {
                throw new IllegalStateException("At least one question group is required");
            }
            return new QuestionnaireSession(this);
        }
    }
}
