package io.qlogic.core.session;

import static org.assertj.core.api.Assertions.assertThat;

import io.qlogic.core.answer.AnswerSheet;
import io.qlogic.core.answer.AnswerValue;
import io.qlogic.core.evaluation.ConditionEvaluator;
import io.qlogic.core.logic.Condition;
import io.qlogic.core.logic.ConditionOperator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GroupFlowTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private final GroupFlow flow =
            new GroupFlow(
                    List.of(
                            new GroupStep.Group("intro"),
                            new GroupStep.Branch(
                                    Condition.equalTo("intro.has_pet", "yes"),
                                    "pets",
                                    List.of(
                                            new GroupStep.Branch(
                                                    new Condition(
                                                            "pets.names",
                                                            ConditionOperator.COUNT_GREATER_THAN,
                                                            "1"),
                                                    "multi_pet",
                                                    List.of()))),
                            new GroupStep.Group("outro")));

    @Test
    void shouldVisitPlainGroupsInOrder() {
        List<String> ordered = flow.orderedGroupIds(AnswerSheet.empty(), evaluator);

        assertThat(ordered).containsExactly("intro", "outro");
    }

    @Test
    void shouldEnterBranchWhenConditionHolds() {
        AnswerSheet answers = AnswerSheet.of(Map.of("intro.has_pet", AnswerValue.text("yes")));

        assertThat(flow.orderedGroupIds(answers, evaluator))
                .containsExactly("intro", "pets", "outro");
    }

    @Test
    void shouldEvaluateNestedBranches() {
        AnswerSheet answers =
                AnswerSheet.of(
                        Map.of(
                                "intro.has_pet", AnswerValue.text("yes"),
                                "pets.names", AnswerValue.texts("Rex", "Tom")));

        assertThat(flow.orderedGroupIds(answers, evaluator))
                .containsExactly("intro", "pets", "multi_pet", "outro");
    }

    @Test
    void shouldSkipNestedStepsOfFalseBranch() {
        AnswerSheet answers = AnswerSheet.of(Map.of("pets.names", AnswerValue.texts("Rex", "Tom")));

        assertThat(flow.orderedGroupIds(answers, evaluator)).containsExactly("intro", "outro");
    }

    @Test
    void shouldListEachGroupOnce() {
        GroupFlow repeated =
                new GroupFlow(
                        List.of(
                                new GroupStep.Group("intro"),
                                new GroupStep.Branch(Condition.on("intro.x"), "intro", List.of())));

        assertThat(repeated.orderedGroupIds(AnswerSheet.empty(), evaluator))
                .containsExactly("intro");
    }

    @Test
    void shouldBuildSequentialFlow() {
        GroupFlow sequential = GroupFlow.sequential(List.of("a", "b"));

        assertThat(sequential.orderedGroupIds(AnswerSheet.empty(), evaluator))
                .containsExactly("a", "b");
    }
}
