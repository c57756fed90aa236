package io.qlogic.core.question;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class QuestionIdentifierTest {

    @Test
    void shouldQualifyBareIdentifier() {
        QuestionIdentifier identifier = QuestionIdentifier.of("household", "has_pet");

        assertThat(identifier.displayIdentifier()).isEqualTo("has_pet");
        assertThat(identifier.qualifiedIdentifier()).isEqualTo("household.has_pet");
    }

    @Test
    void shouldReplaceExistingNamespace() {
        QuestionIdentifier identifier = QuestionIdentifier.of("household", "vehicles.has_pet");

        assertThat(identifier.qualifiedIdentifier()).isEqualTo("household.has_pet");
    }

    @Test
    void shouldKeepBareFormWithoutGroupIdentifier() {
        QuestionIdentifier identifier = QuestionIdentifier.of(" ", " age ");

        assertThat(identifier.displayIdentifier()).isEqualTo("age");
        assertThat(identifier.qualifiedIdentifier()).isEqualTo("age");
    }

    @Test
    void shouldTreatNullOrBlankAsDraft() {
        assertThat(QuestionIdentifier.of("household", null)).isEqualTo(QuestionIdentifier.blank());
        assertThat(QuestionIdentifier.of("household", "  ").isBlank()).isTrue();
        assertThat(QuestionIdentifier.blank().isWellFormed()).isFalse();
    }

    @Test
    void shouldAcceptOnlyLettersDigitsAndUnderscores() {
        assertThat(QuestionIdentifier.of(null, "Pet_2").isWellFormed()).isTrue();
        assertThat(QuestionIdentifier.of(null, "pet-2").isWellFormed()).isFalse();
        assertThat(QuestionIdentifier.of(null, "pet name").isWellFormed()).isFalse();
    }

    @Test
    void shouldMatchEitherForm() {
        QuestionIdentifier identifier = QuestionIdentifier.of("household", "has_pet");

        assertThat(identifier.matches("has_pet")).isTrue();
        assertThat(identifier.matches("household.has_pet")).isTrue();
        assertThat(identifier.matches("other.has_pet")).isTrue();
        assertThat(identifier.matches("HAS_PET")).isFalse();
        assertThat(identifier.matches(null)).isFalse();
        assertThat(QuestionIdentifier.blank().matches("")).isFalse();
    }

    @Test
    void shouldCompareUniquenessIgnoringCase() {
        assertThat(QuestionIdentifier.of("a", "Has_Pet").uniquenessKey())
                .isEqualTo(QuestionIdentifier.of("b", "has_pet").uniquenessKey());
    }

    @Test
    void shouldStripUpToFirstDot() {
        assertThat(QuestionIdentifier.strip("household.has_pet")).isEqualTo("has_pet");
        assertThat(QuestionIdentifier.strip("has_pet")).isEqualTo("has_pet");
    }

    @Test
    void shouldListProblemsOfUnpersistableQuestion() {
        Question choice =
                Question.builder()
                        .type(QuestionType.DROPDOWN)
                        .options(List.of(new QuestionOption("y", "Yes")))
                        .build();

        assertThat(choice.validationProblems())
                .containsExactly(
                        "identifier is required",
                        "question text is required",
                        "DROPDOWN questions need at least 2 options");
        assertThat(choice.isPersistable()).isFalse();
    }

    @Test
    void shouldPersistWellFormedQuestion() {
        Question question =
                Question.builder()
                        .text("Your age?")
                        .identifier(QuestionIdentifier.of("household", "age"))
                        .build();

        assertThat(question.isPersistable()).isTrue();
        assertThat(question.isPersisted()).isFalse();
        assertThat(question.withId("q-1").isPersisted()).isTrue();
        assertThat(question.withId("q-1").getLocalId()).isEqualTo(question.getLocalId());
    }

    @Test
    void shouldDropLineageOfNonRepeatableQuestion() {
        Question question = Question.builder().repeatable(false).repeatableGroupId("set-1").build();

        assertThat(question.getRepeatableGroupId()).isNull();
    }
}
