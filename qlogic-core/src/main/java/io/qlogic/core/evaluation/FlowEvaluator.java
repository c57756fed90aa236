package io.qlogic.core.evaluation;

import io.qlogic.core.answer.AnswerSheet;
import io.qlogic.core.answer.AnswerValue;
import io.qlogic.core.logic.ConditionalNode;
import io.qlogic.core.logic.LogicNode;
import io.qlogic.core.logic.LogicTree;
import io.qlogic.core.logic.QuestionNode;
import io.qlogic.core.logic.TreePath;
import io.qlogic.core.question.Question;
import io.qlogic.core.question.QuestionCatalog;
import io.qlogic.core.repeatable.FlatQuestion;
import io.qlogic.core.repeatable.RepeatableSet;
import io.qlogic.core.repeatable.RepeatableSetResolver;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Decides which questions of a group are visible for the current answers.
///
/// ### Evaluation
/// 1. Depth-first walk over the roots. A question node is shown once; later nodes for
///    the same question and nodes whose question cannot be resolved are skipped. A node
///    with `stopFlow` ends the walk after it is shown.
/// 2. A conditional whose condition holds shows its nested nodes; otherwise its subtree is
///    skipped. A holding conditional with a flow flag ends the walk after its subtree.
/// 3. Repeatable sets among the shown questions are expanded: the instance count is the
///    longest member answer list (at least 1) and each instance repeats the block with its
///    own answer entries.
/// 4. The shown list is paged; the requested page is clamped into range.
///
/// Evaluation is deterministic and has no side effects: the same tree, catalog and answers
/// always give the same result.
///
/// @implNote Stateless and thread-safe.
/// @see ConditionEvaluator for predicate rules
/// @see RepeatableSetResolver for set boundaries
public final class FlowEvaluator {

    private static final Logger logger = Logger.getLogger(FlowEvaluator.class.getName());

    /// Page size used when none is configured.
    public static final int DEFAULT_PAGE_SIZE = 5;

    private final ConditionEvaluator conditionEvaluator;
    private final RepeatableSetResolver setResolver;
    private final int defaultPageSize;

    public FlowEvaluator() {
        this(DEFAULT_PAGE_SIZE);
    }

    /// Creates an evaluator.
    ///
    /// @param defaultPageSize page size for {@link #evaluate(LogicTree, QuestionCatalog,
    ///     AnswerSheet, int)}, positive
    public FlowEvaluator(int defaultPageSize) {
        this(new ConditionEvaluator(), new RepeatableSetResolver(), defaultPageSize);
    }

    FlowEvaluator(
            ConditionEvaluator conditionEvaluator,
            RepeatableSetResolver setResolver,
            int defaultPageSize) {
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator);
        this.setResolver = Objects.requireNonNull(setResolver);
        this.defaultPageSize = requirePositive(defaultPageSize);
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public ConditionEvaluator getConditionEvaluator() {
        return conditionEvaluator;
    }

    /// Evaluates a page with the default page size.
    ///
    /// @param tree logic tree of the group, not null
    /// @param catalog questions of the group, not null
    /// @param answers current answers, not null
    /// @param page requested 1-based page, clamped into range
    /// @return evaluation result, never null
    public FlowEvaluation evaluate(
            LogicTree tree, QuestionCatalog catalog, AnswerSheet answers, int page) {
        return evaluate(tree, catalog, answers, page, defaultPageSize);
    }

    /// Evaluates a page.
    ///
    /// @param tree logic tree of the group, not null
    /// @param catalog questions of the group, not null
    /// @param answers current answers, not null
    /// @param page requested 1-based page, clamped into range
    /// @param pageSize questions per page, positive
    /// @return evaluation result, never null
    /// @throws IllegalArgumentException if `pageSize` is not positive
    public FlowEvaluation evaluate(
            LogicTree tree, QuestionCatalog catalog, AnswerSheet answers, int page, int pageSize) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(catalog, "catalog must not be null");
        Objects.requireNonNull(answers, "answers must not be null");
        requirePositive(pageSize);

        Walk walk = new Walk(catalog, answers);
        boolean stopped = walk.visit(tree.roots(), TreePath.root());

        List<RepeatableSet> sets = setResolver.resolveSets(walk.shown);
        List<ExpandedRepeatableSet> expanded = new ArrayList<>();
        List<VisibleQuestion> visible = expand(walk.shown, sets, answers, expanded);

        int totalPages = Math.max(1, (visible.size() + pageSize - 1) / pageSize);
        int currentPage = Math.min(Math.max(page, 1), totalPages);
        int from = Math.min((currentPage - 1) * pageSize, visible.size());
        int to = Math.min(from + pageSize, visible.size());

        return new FlowEvaluation(
                visible.subList(from, to),
                visible,
                currentPage,
                totalPages,
                pageSize,
                tree.conditionalIdentifiers(),
                expanded,
                stopped);
    }

    private List<VisibleQuestion> expand(
            List<FlatQuestion> shown,
            List<RepeatableSet> sets,
            AnswerSheet answers,
            List<ExpandedRepeatableSet> expanded) {
        List<VisibleQuestion> visible = new ArrayList<>();
        int index = 0;
        int setIndex = 0;
        while (index < shown.size()) {
            RepeatableSet set = setIndex < sets.size() ? sets.get(setIndex) : null;
            if (set != null && set.startIndex() == index) {
                List<FlatQuestion> members = shown.subList(set.startIndex(), set.endIndex());
                ExpandedRepeatableSet block = expandSet(setIndex, members, answers);
                expanded.add(block);
                for (RepeatableInstance instance : block.instances()) {
                    RepeatSlot slot =
                            new RepeatSlot(setIndex, instance.index(), block.instanceCount());
                    for (FlatQuestion member : members) {
                        Question question = member.question();
                        String identifier = question.getIdentifier().displayIdentifier();
                        AnswerValue entry = instance.answers().get(identifier);
                        visible.add(new VisibleQuestion(question, member.depth(), entry, slot));
                    }
                }
                index = set.endIndex();
                setIndex++;
            } else {
                FlatQuestion single = shown.get(index);
                AnswerValue answer =
                        answers.lookup(single.question().getIdentifier())
                                .orElse(AnswerValue.empty());
                visible.add(new VisibleQuestion(single.question(), single.depth(), answer, null));
                index++;
            }
        }
        return visible;
    }

    private static ExpandedRepeatableSet expandSet(
            int setIndex, List<FlatQuestion> members, AnswerSheet answers) {
        Map<Question, AnswerValue> memberAnswers = new LinkedHashMap<>();
        int instanceCount = 1;
        for (FlatQuestion member : members) {
            Optional<AnswerValue> answer = answers.lookup(member.question().getIdentifier());
            answer.ifPresent(a -> memberAnswers.put(member.question(), a));
            instanceCount = Math.max(instanceCount, answer.map(AnswerValue::length).orElse(1));
        }
        List<RepeatableInstance> instances = new ArrayList<>(instanceCount);
        for (int i = 0; i < instanceCount; i++) {
            Map<String, AnswerValue> slice = new LinkedHashMap<>();
            for (FlatQuestion member : members) {
                AnswerValue answer = memberAnswers.get(member.question());
                slice.put(
                        member.question().getIdentifier().displayIdentifier(),
                        answer != null ? answer.entryAt(i) : AnswerValue.empty());
            }
            instances.add(new RepeatableInstance(i, slice));
        }
        List<Question> questions = members.stream().map(FlatQuestion::question).toList();
        return new ExpandedRepeatableSet(setIndex, questions, instances);
    }

    private static int requirePositive(int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive, got " + pageSize);
        }
        return pageSize;
    }

    /// Depth-first walk state of one evaluation.
    private final class Walk {
        private final QuestionCatalog catalog;
        private final AnswerSheet answers;
        private final List<FlatQuestion> shown = new ArrayList<>();
        private final Set<String> shownLocalIds = new HashSet<>();

        private Walk(QuestionCatalog catalog, AnswerSheet answers) {
            this.catalog = catalog;
            this.answers = answers;
        }

        /// Returns true if the flow was stopped inside `nodes`.
        private boolean visit(List<LogicNode> nodes, TreePath path) {
            for (int i = 0; i < nodes.size(); i++) {
                LogicNode node = nodes.get(i);
                if (node instanceof QuestionNode questionNode) {
                    Optional<Question> question = catalog.resolve(questionNode.ref());
                    if (question.isEmpty()) {
                        logger.fine(() -> "Skipping dangling node " + questionNode.nodeId());
                        continue;
                    }
                    if (!shownLocalIds.add(question.get().getLocalId())) {
                        continue;
                    }
                    shown.add(new FlatQuestion(question.get(), questionNode.depth(), path, i));
                    if (questionNode.stopFlow()) {
                        return true;
                    }
                } else {
                    ConditionalNode conditional = (ConditionalNode) node;
                    if (!conditionEvaluator.test(conditional.condition(), answers)) {
                        continue;
                    }
                    if (visit(conditional.nestedItems(), path.child(conditional.nodeId()))) {
                        return true;
                    }
                    if (conditional.stopsFlow()) {
                        return true;
                    }
                }
            }
            return false;
        }
    }
}
