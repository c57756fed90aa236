package io.qlogic.core.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.qlogic.core.answer.AnswerSheet;
import io.qlogic.core.answer.AnswerValue;
import io.qlogic.core.question.Question;
import io.qlogic.core.question.QuestionEdit;
import io.qlogic.core.question.QuestionIdentifier;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryQuestionPersistenceTest {

    private InMemoryQuestionPersistence persistence;

    @BeforeEach
    void setUp() {
        persistence = new InMemoryQuestionPersistence();
    }

    private static Question question(String identifier) {
        return Question.builder()
                .text("Text")
                .identifier(QuestionIdentifier.of("household", identifier))
                .build();
    }

    @Test
    void shouldAssignIdsOnCreate() {
        String first = persistence.createQuestion("g1", question("pet")).join();
        String second = persistence.createQuestion("g1", question("age")).join();

        assertThat(first).isNotEqualTo(second);
        assertThat(persistence.findQuestion(first)).map(Question::getId).contains(first);
        assertThat(persistence.findQuestions("g1")).hasSize(2);
        assertThat(persistence.findQuestions("g2")).isEmpty();
    }

    @Test
    void shouldApplyUpdateKeepingNamespace() {
        String id = persistence.createQuestion("g1", question("pet")).join();

        persistence
                .updateQuestion(id, QuestionEdit.builder().identifier("owns_pet").build())
                .join();

        Question stored = persistence.findQuestion(id).orElseThrow();
        assertThat(stored.getIdentifier().qualifiedIdentifier()).isEqualTo("household.owns_pet");
    }

    @Test
    void shouldFailUpdateOfUnknownQuestion() {
        assertThat(persistence.updateQuestion("q-404", QuestionEdit.empty()))
                .failsWithin(Duration.ZERO)
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(PersistenceFailureException.class);
    }

    @Test
    void shouldDeleteQuestion() {
        String id = persistence.createQuestion("g1", question("pet")).join();

        persistence.deleteQuestion(id).join();

        assertThat(persistence.findQuestion(id)).isEmpty();
        assertThat(persistence.deleteQuestion(id)).isCompletedExceptionally();
    }

    @Test
    void shouldKeepLatestTreePerGroup() {
        persistence.saveLogicTree("g1", "[1]").join();
        persistence.saveLogicTree("g1", "[2]").join();

        assertThat(persistence.findLogicTree("g1")).contains("[2]");
        assertThat(persistence.findLogicTree("g2")).isEmpty();
    }

    @Test
    void shouldCheckUniquenessWithinGroupIgnoringCase() {
        String id = persistence.createQuestion("g1", question("pet")).join();

        assertThat(persistence.checkIdentifierUnique("household.PET", "g1", null).join())
                .isFalse();
        assertThat(persistence.checkIdentifierUnique("household.pet", "g1", id).join()).isTrue();
        assertThat(persistence.checkIdentifierUnique("household.pet", "g2", null).join())
                .isTrue();
    }

    @Test
    void shouldForgetEverythingOnClear() {
        String id = persistence.createQuestion("g1", question("pet")).join();
        persistence.saveLogicTree("g1", "[]").join();

        persistence.clear();

        assertThat(persistence.findQuestion(id)).isEmpty();
        assertThat(persistence.findLogicTree("g1")).isEmpty();
    }

    @Test
    void shouldSurfaceFailureThroughJoin() {
        assertThatThrownBy(() -> persistence.deleteQuestion("q-404").join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(PersistenceFailureException.class);
    }

    @Test
    void shouldMergeSavedAnswersPerSession() {
        InMemoryAnswerStore store = new InMemoryAnswerStore();

        store.saveAnswers("s1", AnswerSheet.empty().with("household.pet", AnswerValue.text("yes")))
                .join();
        store.saveAnswers("s1", AnswerSheet.empty().with("household.age", AnswerValue.text("4")))
                .join();

        AnswerSheet loaded = store.loadAnswers("s1").join();
        assertThat(loaded.get("household.pet")).contains(AnswerValue.text("yes"));
        assertThat(loaded.get("household.age")).contains(AnswerValue.text("4"));
        assertThat(store.loadAnswers("s2").join()).isEqualTo(AnswerSheet.empty());
    }
}
