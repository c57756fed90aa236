package io.qlogic.core.editor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.qlogic.core.logic.Condition;
import io.qlogic.core.logic.ConditionOperator;
import io.qlogic.core.logic.ConditionalNode;
import io.qlogic.core.logic.LogicNode;
import io.qlogic.core.logic.LogicTree;
import io.qlogic.core.logic.QuestionNode;
import io.qlogic.core.logic.RecordingTreeCodec;
import io.qlogic.core.logic.TreePath;
import io.qlogic.core.logic.TreeStructureException;
import io.qlogic.core.persistence.ControllablePersistence;
import io.qlogic.core.persistence.ControllablePersistence.DeleteCall;
import io.qlogic.core.persistence.InMemoryQuestionPersistence;
import io.qlogic.core.question.DuplicateIdentifierException;
import io.qlogic.core.question.Question;
import io.qlogic.core.question.QuestionEdit;
import io.qlogic.core.question.QuestionIdentifier;
import io.qlogic.core.question.QuestionRef;
import io.qlogic.core.util.ManualScheduler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TreeEditorTest {

    private static final TreePath ROOT = TreePath.root();

    private ControllablePersistence persistence;
    private RecordingTreeCodec codec;
    private ManualScheduler scheduler;
    private int nodeCounter;
    private List<TreeEditor> editors;

    @BeforeEach
    void setUp() {
        persistence = new ControllablePersistence();
        codec = new RecordingTreeCodec();
        scheduler = new ManualScheduler();
        nodeCounter = 0;
        editors = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        for (TreeEditor editor : editors) {
            editor.tree().validate();
        }
    }

    @Nested
    class StructuralEditsTest {

        @Test
        void shouldRestoreTreeWhenInsertedQuestionIsRemoved() {
            // Given
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());
            LogicTree original = editor.tree();

            // When
            LogicTree inserted = valid(editor.insertQuestionBefore(ROOT, 1));
            LogicTree restored = valid(editor.removeNode(inserted.roots().get(1).nodeId()));

            // Then
            assertThat(inserted.roots()).hasSize(4);
            assertThat(restored).isEqualTo(original);
            assertThat(editor.getRegistry().size()).isEqualTo(3);
            assertThat(persistence.deletes).isEmpty();
        }

        @Test
        void shouldKeepOrderWhenInsertingAtStartAndAddingAtEnd() {
            // Given
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());

            // When
            valid(editor.insertQuestionBefore(ROOT, 0));
            LogicTree tree = valid(editor.addQuestionAtEnd(ROOT));

            // Then
            List<QuestionRef> refs = tree.questionRefs();
            assertThat(refs).hasSize(5);
            assertThat(refs.get(0)).isInstanceOf(QuestionRef.Unresolved.class);
            assertThat(refs.subList(1, 4))
                    .containsExactly(
                            new QuestionRef.Resolved("q-1"),
                            new QuestionRef.Resolved("q-2"),
                            new QuestionRef.Resolved("q-3"));
            assertThat(refs.get(4))
                    .isInstanceOf(QuestionRef.Unresolved.class)
                    .isNotEqualTo(refs.get(0));
            assertThat(editor.getRegistry().size()).isEqualTo(5);
        }

        @Test
        void shouldRejectInsertIndexOutOfRange() {
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());

            assertThatThrownBy(() -> editor.insertQuestionBefore(ROOT, 4))
                    .isInstanceOf(TreeStructureException.class);
            assertThatThrownBy(() -> editor.insertQuestionBefore(ROOT, -1))
                    .isInstanceOf(TreeStructureException.class);
            assertThat(editor.getRegistry().size()).isEqualTo(3);
        }

        @Test
        void shouldInsertConditionalTestingPrecedingQuestion() {
            // Given
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());

            // When
            LogicTree tree = valid(editor.insertConditionalAfter(ROOT, 0));

            // Then
            assertThat(tree.roots()).hasSize(4);
            assertThat(tree.roots().get(1)).isInstanceOf(ConditionalNode.class);
            ConditionalNode conditional = (ConditionalNode) tree.roots().get(1);
            assertThat(conditional.depth()).isZero();
            assertThat(conditional.condition().ifIdentifier()).isEqualTo("household.pet");
            assertThat(conditional.condition().operator()).isEqualTo(ConditionOperator.EQUALS);
            assertThat(conditional.nestedItems()).hasSize(1);
            assertThat(conditional.nestedItems().get(0))
                    .isInstanceOf(QuestionNode.class)
                    .extracting(LogicNode::depth)
                    .isEqualTo(1);
            assertThat(editor.getRegistry().size()).isEqualTo(4);
        }

        @Test
        void shouldInsertConditionalAtStartWithEmptyCondition() {
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());

            LogicTree tree = valid(editor.insertConditionalAfter(ROOT, -1));

            ConditionalNode conditional = (ConditionalNode) tree.roots().get(0);
            assertThat(conditional.condition().hasIdentifier()).isFalse();
        }

        @Test
        void shouldRejectConditionalIndexOutOfRange() {
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());

            assertThatThrownBy(() -> editor.insertConditionalAfter(ROOT, 3))
                    .isInstanceOf(TreeStructureException.class);
        }

        @Test
        void shouldRefuseConditionalBeyondMaximumDepth() {
            // Given
            TreeEditor editor = editor(LogicTree.empty(), List.of());
            TreePath path = ROOT;
            for (int level = 0; level < LogicTree.MAX_DEPTH; level++) {
                LogicTree tree = valid(editor.insertConditionalAfter(path, -1));
                path = path.child(tree.listAt(path).get(0).nodeId());
            }
            int registered = editor.getRegistry().size();
            TreePath deepest = path;

            // When / Then
            assertThatThrownBy(() -> editor.insertConditionalAfter(deepest, -1))
                    .isInstanceOf(TreeStructureException.class);
            assertThat(editor.getRegistry().size()).isEqualTo(registered);
            assertThat(editor.tree().listAt(deepest)).hasSize(1);
            assertThat(editor.tree().listAt(deepest).get(0).depth())
                    .isEqualTo(LogicTree.MAX_DEPTH);
            editor.tree().validate();
        }

        @Test
        void shouldCascadeRemovalToNestedQuestions() {
            // Given
            ConditionalNode conditional =
                    ConditionalNode.of(
                            "c1",
                            Condition.equalTo("household.pet", "yes"),
                            List.of(
                                    node("n-1", "q-1", 1),
                                    node("n-2", "q-2", 1),
                                    node("n-3", "q-3", 1)),
                            0);
            LogicTree tree = LogicTree.of(conditional, node("n-4", "q-4", 0));
            List<Question> questions =
                    List.of(
                            persisted("q-1", "pet"),
                            persisted("q-2", "age"),
                            persisted("q-3", "name"),
                            persisted("q-4", "city"));
            TreeEditor editor = editor(tree, questions);

            // When
            LogicTree updated = valid(editor.removeNode("c1"));

            // Then
            assertThat(updated.roots()).hasSize(1);
            assertThat(editor.getRegistry().size()).isEqualTo(1);
            assertThat(editor.getRegistry().get("local-q-4")).isPresent();
            assertThat(persistence.deletes)
                    .extracting(DeleteCall::persistedId)
                    .containsExactly("q-1", "q-2", "q-3");
        }

        @Test
        void shouldMoveNestedNodeAfterItsConditional() {
            // Given
            ConditionalNode inner =
                    ConditionalNode.of(
                            "c2", Condition.on("household.age"), List.of(node("n-2", "q-2", 2)), 1);
            ConditionalNode outer =
                    ConditionalNode.of(
                            "c1",
                            Condition.on("household.pet"),
                            List.of(node("n-1", "q-1", 1), inner),
                            0);
            TreeEditor editor =
                    editor(
                            LogicTree.of(outer),
                            List.of(persisted("q-1", "pet"), persisted("q-2", "age")));

            // When
            LogicTree moved = valid(editor.moveNodeUpOneLevel("c2"));

            // Then
            assertThat(moved.roots()).extracting(LogicNode::nodeId).containsExactly("c1", "c2");
            ConditionalNode movedInner = (ConditionalNode) moved.roots().get(1);
            assertThat(movedInner.depth()).isZero();
            assertThat(movedInner.nestedItems().get(0).depth()).isEqualTo(1);
            assertThat(((ConditionalNode) moved.roots().get(0)).nestedItems())
                    .extracting(LogicNode::nodeId)
                    .containsExactly("n-1");
            moved.validate();
        }

        @Test
        void shouldLeaveRootNodeInPlaceOnMoveUp() {
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());
            LogicTree before = editor.tree();

            LogicTree after = valid(editor.moveNodeUpOneLevel("n-1"));

            assertThat(after).isSameAs(before);
        }

        @Test
        void shouldUpdateConditionOfConditionalOnly() {
            ConditionalNode conditional =
                    ConditionalNode.of("c1", Condition.on(""), List.of(node("n-1", "q-1", 1)), 0);
            TreeEditor editor = editor(LogicTree.of(conditional), List.of(persisted("q-1", "pet")));
            Condition condition =
                    new Condition("household.pet", ConditionOperator.NOT_EQUALS, "no");

            LogicTree updated = valid(editor.updateCondition("c1", condition));

            assertThat(((ConditionalNode) updated.roots().get(0)).condition()).isEqualTo(condition);
            assertThatThrownBy(() -> editor.updateCondition("n-1", condition))
                    .isInstanceOf(TreeStructureException.class);
        }

        @Test
        void shouldSetFlowFlags() {
            ConditionalNode conditional =
                    ConditionalNode.of("c1", Condition.on("household.pet"), List.of(), 0);
            TreeEditor editor =
                    editor(
                            LogicTree.of(node("n-1", "q-1", 0), conditional),
                            List.of(persisted("q-1", "pet")));

            valid(editor.setFlowFlags("c1", true, false));
            LogicTree updated = valid(editor.setFlowFlags("n-1", false, true));

            assertThat(((QuestionNode) updated.roots().get(0)).stopFlow()).isTrue();
            ConditionalNode flagged = (ConditionalNode) updated.roots().get(1);
            assertThat(flagged.endFlow()).isTrue();
            assertThat(flagged.stopsFlow()).isTrue();
        }

        @Test
        void shouldRejectLoadedQuestionsSharingAnIdentifier() {
            List<Question> questions = List.of(persisted("q-1", "pet"), persisted("q-2", "PET"));

            assertThatThrownBy(() -> editor(LogicTree.empty(), questions))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasCauseInstanceOf(DuplicateIdentifierException.class);
        }
    }

    @Nested
    class StructuralSaveTest {

        @Test
        void shouldCoalesceSavesWhileOneIsInFlight() {
            // Given
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());

            // When
            valid(editor.insertQuestionBefore(ROOT, 0));
            valid(editor.insertQuestionBefore(ROOT, 0));
            LogicTree latest = valid(editor.insertQuestionBefore(ROOT, 0));

            // Then
            assertThat(persistence.trees).hasSize(1);
            assertThat(editor.structuralSaveStatus()).isEqualTo(StructuralSaveStatus.IN_FLIGHT);

            persistence.trees.get(0).result().complete(null);

            assertThat(persistence.trees).hasSize(2);
            assertThat(codec.decode(persistence.lastTree().serializedTree())).isEqualTo(latest);

            persistence.lastTree().result().complete(null);

            assertThat(persistence.trees).hasSize(2);
            assertThat(editor.structuralSaveStatus()).isEqualTo(StructuralSaveStatus.IDLE);
        }

        @Test
        void shouldReportFailedSaveAndRetry() {
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());
            valid(editor.removeNode("n-3"));

            persistence.lastTree().result().completeExceptionally(new IllegalStateException());

            assertThat(editor.structuralSaveStatus()).isEqualTo(StructuralSaveStatus.FAILED);

            editor.retryStructuralSave();

            assertThat(persistence.trees).hasSize(2);
            assertThat(codec.decode(persistence.lastTree().serializedTree()))
                    .isEqualTo(editor.tree());
        }

        @Test
        void shouldSendGroupIdWithTree() {
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());

            valid(editor.removeNode("n-1"));

            assertThat(persistence.lastTree().groupId()).isEqualTo("g1");
        }
    }

    @Nested
    class ContentSaveTest {

        @Test
        void shouldCreateQuestionAndResolveItsNodes() throws Exception {
            // Given
            TreeEditor editor = editor(LogicTree.empty(), List.of());
            String localId = localIdOf(valid(editor.insertQuestionBefore(ROOT, 0)).roots().get(0));
            assertThat(editor.saveStatus(localId)).isEqualTo(SaveStatus.DRAFT);

            // When
            editor.updateQuestion(localId, petEdit());

            // Then
            assertThat(editor.saveStatus(localId)).isEqualTo(SaveStatus.PENDING);

            scheduler.advance(Duration.ofMillis(500));
            assertThat(persistence.checks).hasSize(1);
            assertThat(persistence.lastCheck().identifier()).isEqualTo("household.pet");
            assertThat(persistence.lastCheck().excludingQuestionId()).isNull();
            persistence.lastCheck().result().complete(true);

            scheduler.advance(Duration.ofMillis(500));
            assertThat(persistence.creates).hasSize(1);
            assertThat(persistence.lastCreate().groupId()).isEqualTo("g1");
            assertThat(persistence.lastCreate().question().getIdentifier().qualifiedIdentifier())
                    .isEqualTo("household.pet");

            persistence.lastCreate().result().complete("q-77");

            assertThat(editor.saveStatus(localId)).isEqualTo(SaveStatus.SAVED);
            assertThat(editor.getRegistry().get(localId).get().getId()).isEqualTo("q-77");
            assertThat(editor.tree().questionRefs())
                    .containsExactly(new QuestionRef.Resolved("q-77"));
        }

        @Test
        void shouldSaveResolvedTreeAfterCreate() throws Exception {
            // Given
            TreeEditor editor = editor(LogicTree.empty(), List.of());
            String localId = localIdOf(valid(editor.insertQuestionBefore(ROOT, 0)).roots().get(0));
            editor.updateQuestion(localId, petEdit());
            scheduler.advance(Duration.ofMillis(500));
            persistence.lastCheck().result().complete(true);
            scheduler.advance(Duration.ofMillis(500));

            // When
            persistence.lastCreate().result().complete("q-77");
            persistence.trees.get(0).result().complete(null);

            // Then
            assertThat(persistence.trees).hasSize(2);
            assertThat(codec.decode(persistence.lastTree().serializedTree()).questionRefs())
                    .containsExactly(new QuestionRef.Resolved("q-77"));
        }

        @Test
        void shouldDeleteQuestionCreatedAfterItsRemoval() throws Exception {
            // Given
            TreeEditor editor = editor(LogicTree.empty(), List.of());
            LogicNode node = valid(editor.insertQuestionBefore(ROOT, 0)).roots().get(0);
            String localId = localIdOf(node);
            editor.updateQuestion(localId, petEdit());
            scheduler.advance(Duration.ofMillis(500));
            persistence.lastCheck().result().complete(true);
            scheduler.advance(Duration.ofMillis(500));
            assertThat(persistence.creates).hasSize(1);

            // When
            valid(editor.removeNode(node.nodeId()));
            persistence.lastCreate().result().complete("q-9");

            // Then
            assertThat(editor.tree().isEmpty()).isTrue();
            assertThat(editor.getRegistry().size()).isZero();
            assertThat(persistence.deletes)
                    .extracting(DeleteCall::persistedId)
                    .containsExactly("q-9");
        }

        @Test
        void shouldUpdatePersistedQuestionWithFullContent() throws Exception {
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());

            editor.updateQuestion("local-q-2", QuestionEdit.builder().text("How old?").build());
            scheduler.advance(Duration.ofMillis(1000));

            assertThat(persistence.updates).hasSize(1);
            assertThat(persistence.updates.get(0).persistedId()).isEqualTo("q-2");
            assertThat(persistence.updates.get(0).edit().getText()).isEqualTo("How old?");
            assertThat(persistence.updates.get(0).edit().getIdentifier()).isEqualTo("age");
            assertThat(editor.saveStatus("local-q-2")).isEqualTo(SaveStatus.PENDING);

            persistence.updates.get(0).result().complete(null);

            assertThat(editor.saveStatus("local-q-2")).isEqualTo(SaveStatus.SAVED);
        }

        @Test
        void shouldDebounceRapidEditsIntoOneSave() throws Exception {
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());

            editor.updateQuestion("local-q-2", QuestionEdit.builder().text("H").build());
            scheduler.advance(Duration.ofMillis(400));
            editor.updateQuestion("local-q-2", QuestionEdit.builder().text("How").build());
            scheduler.advance(Duration.ofMillis(400));
            editor.updateQuestion("local-q-2", QuestionEdit.builder().text("How old").build());
            scheduler.advance(Duration.ofMillis(1000));

            assertThat(persistence.updates).hasSize(1);
            assertThat(persistence.updates.get(0).edit().getText()).isEqualTo("How old");
        }

        @Test
        void shouldMarkFailedSave() throws Exception {
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());
            editor.updateQuestion("local-q-1", QuestionEdit.builder().text("Pets?").build());
            scheduler.advance(Duration.ofMillis(1000));

            persistence.updates.get(0).result().completeExceptionally(new IllegalStateException());

            assertThat(editor.saveStatus("local-q-1")).isEqualTo(SaveStatus.FAILED);
        }

        @Test
        void shouldSendNewerEditAfterFailedSave() throws Exception {
            // Given
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());
            editor.updateQuestion("local-q-1", QuestionEdit.builder().text("Pets?").build());
            scheduler.advance(Duration.ofMillis(1000));
            editor.updateQuestion("local-q-1", QuestionEdit.builder().text("Any pets?").build());
            scheduler.advance(Duration.ofMillis(1000));
            assertThat(persistence.updates).hasSize(1);

            // When
            persistence.updates.get(0).result().completeExceptionally(new IllegalStateException());

            // Then
            assertThat(persistence.updates).hasSize(2);
            assertThat(persistence.updates.get(1).edit().getText()).isEqualTo("Any pets?");
            assertThat(editor.saveStatus("local-q-1")).isEqualTo(SaveStatus.PENDING);

            persistence.updates.get(1).result().complete(null);

            assertThat(editor.saveStatus("local-q-1")).isEqualTo(SaveStatus.SAVED);
        }

        @Test
        void shouldKeepDraftLocalUntilPersistable() throws Exception {
            TreeEditor editor = editor(LogicTree.empty(), List.of());
            String localId = localIdOf(valid(editor.insertQuestionBefore(ROOT, 0)).roots().get(0));

            editor.updateQuestion(localId, QuestionEdit.builder().text("Only text").build());
            scheduler.runAll();

            assertThat(editor.saveStatus(localId)).isEqualTo(SaveStatus.DRAFT);
            assertThat(persistence.creates).isEmpty();
        }

        @Test
        void shouldRejectUnknownQuestionStatus() {
            TreeEditor editor = editor(LogicTree.empty(), List.of());

            assertThatThrownBy(() -> editor.saveStatus("missing"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class IdentifierUniquenessTest {

        @Test
        void shouldBlockLocalDuplicateButKeepOtherContent() throws Exception {
            // Given
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());
            String localId = localIdOf(valid(editor.insertQuestionBefore(ROOT, 0)).roots().get(0));
            QuestionEdit edit = QuestionEdit.builder().identifier("PET").text("Pets?").build();

            // When / Then
            assertThatThrownBy(() -> editor.updateQuestion(localId, edit))
                    .isInstanceOf(DuplicateIdentifierException.class);
            Question question = editor.getRegistry().get(localId).get();
            assertThat(question.getText()).isEqualTo("Pets?");
            assertThat(question.getIdentifier().isBlank()).isTrue();
            assertThat(editor.saveStatus(localId)).isEqualTo(SaveStatus.BLOCKED_DUPLICATE);

            scheduler.runAll();
            assertThat(persistence.creates).isEmpty();
        }

        @Test
        void shouldBlockRemoteDuplicate() throws Exception {
            TreeEditor editor = editor(LogicTree.empty(), List.of());
            String localId = localIdOf(valid(editor.insertQuestionBefore(ROOT, 0)).roots().get(0));
            editor.updateQuestion(localId, petEdit());

            scheduler.advance(Duration.ofMillis(500));
            persistence.lastCheck().result().complete(false);
            scheduler.advance(Duration.ofMillis(500));

            assertThat(editor.saveStatus(localId)).isEqualTo(SaveStatus.BLOCKED_DUPLICATE);
            assertThat(persistence.creates).isEmpty();
        }

        @Test
        void shouldMarkSaveFailedWhenCheckFails() throws Exception {
            TreeEditor editor = editor(LogicTree.empty(), List.of());
            String localId = localIdOf(valid(editor.insertQuestionBefore(ROOT, 0)).roots().get(0));
            editor.updateQuestion(localId, petEdit());

            scheduler.advance(Duration.ofMillis(500));
            persistence.lastCheck().result().completeExceptionally(new IllegalStateException());
            scheduler.advance(Duration.ofMillis(500));

            assertThat(editor.saveStatus(localId)).isEqualTo(SaveStatus.FAILED);
            assertThat(persistence.creates).isEmpty();
        }

        @Test
        void shouldWaitForSlowCheckBeforeCreating() throws Exception {
            TreeEditor editor = editor(LogicTree.empty(), List.of());
            String localId = localIdOf(valid(editor.insertQuestionBefore(ROOT, 0)).roots().get(0));
            editor.updateQuestion(localId, petEdit());

            scheduler.advance(Duration.ofMillis(1000));
            assertThat(persistence.creates).isEmpty();

            persistence.lastCheck().result().complete(true);

            assertThat(persistence.creates).hasSize(1);
        }

        @Test
        void shouldCheckNamedDraftRemotelyBeforeCreating() throws Exception {
            // Given
            TreeEditor editor = editor(LogicTree.empty(), List.of());

            // When
            LogicTree tree = valid(editor.addQuestionAtEnd(ROOT, namedDraft("pet")));
            scheduler.advance(Duration.ofMillis(1500));

            // Then
            assertThat(persistence.checks).hasSize(1);
            assertThat(persistence.lastCheck().identifier()).isEqualTo("household.pet");
            assertThat(persistence.creates).isEmpty();

            persistence.lastCheck().result().complete(true);

            assertThat(persistence.creates).hasSize(1);
            assertThat(persistence.lastCreate().question().getLocalId())
                    .isEqualTo(localIdOf(tree.roots().get(0)));
        }

        @Test
        void shouldBlockNamedDraftTakenRemotely() throws Exception {
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());
            LogicTree tree = valid(editor.insertQuestionBefore(ROOT, 1, namedDraft("dog")));
            String localId = localIdOf(tree.roots().get(1));

            scheduler.advance(Duration.ofMillis(500));
            persistence.lastCheck().result().complete(false);
            scheduler.advance(Duration.ofMillis(1000));

            assertThat(editor.saveStatus(localId)).isEqualTo(SaveStatus.BLOCKED_DUPLICATE);
            assertThat(persistence.creates).isEmpty();
        }

        @Test
        void shouldRejectNamedDraftTakenLocally() {
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());

            assertThatThrownBy(() -> editor.addQuestionAtEnd(ROOT, namedDraft("AGE")))
                    .isInstanceOf(DuplicateIdentifierException.class);
            assertThat(editor.tree().roots()).hasSize(3);
            assertThat(persistence.checks).isEmpty();
        }

        @Test
        void shouldExcludePersistedIdOfEditedQuestionFromCheck() throws Exception {
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());

            editor.updateQuestion("local-q-1", QuestionEdit.builder().identifier("dog").build());
            scheduler.advance(Duration.ofMillis(500));

            assertThat(persistence.lastCheck().excludingQuestionId()).isEqualTo("q-1");
            assertThat(persistence.lastCheck().identifier()).isEqualTo("household.dog");
        }
    }

    @Nested
    class HealTest {

        @Test
        void shouldRelinkReportDanglingAndReattachOrphans() {
            // Given
            LogicTree tree =
                    LogicTree.of(
                            QuestionNode.of("a", new QuestionRef.Unresolved("local-q-1"), 0),
                            node("b", "q-404", 0));
            TreeEditor editor =
                    editor(tree, List.of(persisted("q-1", "pet"), persisted("q-2", "age")));

            // When
            HealReport report = healAndValidate(editor);

            // Then
            assertThat(report.relinkedNodeIds()).containsExactly("a");
            assertThat(report.danglingNodeIds()).containsExactly("b");
            assertThat(report.reattachedQuestionLocalIds()).containsExactly("local-q-2");
            assertThat(report.changedTree()).isTrue();
            assertThat(editor.tree().questionRefs())
                    .containsExactly(
                            new QuestionRef.Resolved("q-1"),
                            new QuestionRef.Resolved("q-404"),
                            new QuestionRef.Resolved("q-2"));
            assertThat(persistence.trees).hasSize(1);
        }

        @Test
        void shouldLeaveConsistentTreeUntouched() {
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());
            LogicTree before = editor.tree();

            HealReport report = healAndValidate(editor);

            assertThat(report.isClean()).isTrue();
            assertThat(editor.tree()).isSameAs(before);
            assertThat(persistence.trees).isEmpty();
        }
    }

    @Nested
    class CloseTest {

        @Test
        void shouldFlushPendingEditsOnClose() throws Exception {
            // Given
            InMemoryQuestionPersistence store = new InMemoryQuestionPersistence();
            TreeEditor editor =
                    TreeEditor.builder()
                            .groupId("g1")
                            .groupIdentifier("household")
                            .persistence(store)
                            .codec(codec)
                            .scheduler(scheduler)
                            .build();
            String localId = localIdOf(valid(editor.insertQuestionBefore(ROOT, 0)).roots().get(0));
            editor.updateQuestion(localId, petEdit());

            // When
            editor.close();

            // Then
            assertThat(store.findQuestions("g1"))
                    .extracting(q -> q.getIdentifier().qualifiedIdentifier())
                    .containsExactly("household.pet");
            assertThat(editor.saveStatus(localId)).isEqualTo(SaveStatus.SAVED);
            assertThat(store.findLogicTree("g1")).isPresent();
            String persistedId = editor.getRegistry().get(localId).get().getId();
            assertThat(codec.decode(store.findLogicTree("g1").get()).questionRefs())
                    .containsExactly(new QuestionRef.Resolved(persistedId));
        }

        @Test
        void shouldWaitForInFlightStructuralSave() {
            // Given
            TreeEditor editor = editor(threeQuestionTree(), threeQuestions());
            valid(editor.insertQuestionBefore(ROOT, 0));
            CompletableFuture<Void> inFlight = persistence.lastTree().result();
            CompletableFuture.runAsync(
                    () -> inFlight.complete(null),
                    CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS));

            // When
            editor.awaitPendingSaves();

            // Then
            assertThat(inFlight).isCompleted();
            assertThat(editor.structuralSaveStatus()).isEqualTo(StructuralSaveStatus.IDLE);
        }

        @Test
        void shouldRejectEditsAfterClose() {
            InMemoryQuestionPersistence store = new InMemoryQuestionPersistence();
            TreeEditor editor =
                    TreeEditor.builder()
                            .groupId("g1")
                            .persistence(store)
                            .codec(codec)
                            .scheduler(scheduler)
                            .build();

            editor.close();

            assertThatThrownBy(() -> editor.insertQuestionBefore(ROOT, 0))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    private TreeEditor editor(LogicTree tree, List<Question> questions) {
        TreeEditor editor =
                TreeEditor.builder()
                        .groupId("g1")
                        .groupIdentifier("household")
                        .persistence(persistence)
                        .codec(codec)
                        .scheduler(scheduler)
                        .tree(tree)
                        .questions(questions)
                        .nodeIds(() -> "n" + (++nodeCounter))
                        .build();
        editors.add(editor);
        return editor;
    }

    private static LogicTree valid(LogicTree tree) {
        tree.validate();
        return tree;
    }

    private static HealReport healAndValidate(TreeEditor editor) {
        HealReport report = editor.healDanglingReferences();
        editor.tree().validate();
        return report;
    }

    private static LogicTree threeQuestionTree() {
        return LogicTree.of(node("n-1", "q-1", 0), node("n-2", "q-2", 0), node("n-3", "q-3", 0));
    }

    private static List<Question> threeQuestions() {
        return List.of(persisted("q-1", "pet"), persisted("q-2", "age"), persisted("q-3", "name"));
    }

    private static QuestionNode node(String nodeId, String persistedId, int depth) {
        return QuestionNode.of(nodeId, new QuestionRef.Resolved(persistedId), depth);
    }

    private static Question persisted(String id, String identifier) {
        return Question.builder()
                .id(id)
                .localId("local-" + id)
                .identifier(QuestionIdentifier.of("household", identifier))
                .text("Question " + identifier)
                .build();
    }

    private static Question namedDraft(String identifier) {
        return Question.draft().toBuilder()
                .identifier(QuestionIdentifier.of("household", identifier))
                .text("Question " + identifier)
                .build();
    }

    private static QuestionEdit petEdit() {
        return QuestionEdit.builder().identifier("pet").text("Do you own a pet?").build();
    }

    private static String localIdOf(LogicNode node) {
        return ((QuestionRef.Unresolved) ((QuestionNode) node).ref()).localId();
    }
}
