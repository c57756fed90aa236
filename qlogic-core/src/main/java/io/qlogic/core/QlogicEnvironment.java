package io.qlogic.core;

import io.qlogic.core.editor.TreeEditor;
import io.qlogic.core.evaluation.FlowEvaluator;
import io.qlogic.core.logic.LogicTree;
import io.qlogic.core.logic.LogicTreeCodec;
import io.qlogic.core.persistence.AnswerStore;
import io.qlogic.core.persistence.QuestionPersistence;
import io.qlogic.core.question.Question;
import io.qlogic.core.session.GroupFlow;
import io.qlogic.core.session.QuestionGroupDefinition;
import io.qlogic.core.session.QuestionnaireSession;
import io.qlogic.core.util.Scheduler;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Container holding the qlogic components shared by editors and sessions.
///
/// Implements {@link AutoCloseable}: closing waits for every open editor's outstanding
/// saves, then releases the scheduler.
///
/// ### Contracts
/// - **Precondition**: all constructor parameters must be non-null
/// - **Invariant**: component references are immutable after construction
///
/// @implNote Safe for concurrent use. Editors and sessions it opens have their own
/// thread-safety guarantees.
///
/// @apiNote Create instances via {@link QlogicFactory} rather than direct construction.
public final class QlogicEnvironment implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(QlogicEnvironment.class.getName());

    private final QlogicConfig config;
    private final LogicTreeCodec codec;
    private final QuestionPersistence persistence;
    private final AnswerStore answerStore;
    private final FlowEvaluator evaluator;
    private final Scheduler scheduler;
    private final List<TreeEditor> editors = new ArrayList<>();

    /// Creates a new environment with the specified components.
    ///
    /// @param config configuration options, not null
    /// @param codec logic tree codec, not null
    /// @param persistence question persistence collaborator, not null
    /// @param answerStore answer store collaborator, not null
    /// @param evaluator flow evaluator, not null
    /// @param scheduler timer for debounced work, not null
    public QlogicEnvironment(
            QlogicConfig config,
            LogicTreeCodec codec,
            QuestionPersistence persistence,
            AnswerStore answerStore,
            FlowEvaluator evaluator,
            Scheduler scheduler) {
        this.config = config;
        this.codec = codec;
        this.persistence = persistence;
        this.answerStore = answerStore;
        this.evaluator = evaluator;
        this.scheduler = scheduler;
    }

    public QlogicConfig getConfig() {
        return config;
    }

    public LogicTreeCodec getCodec() {
        return codec;
    }

    public QuestionPersistence getPersistence() {
        return persistence;
    }

    public AnswerStore getAnswerStore() {
        return answerStore;
    }

    public FlowEvaluator getEvaluator() {
        return evaluator;
    }

    /// Opens an editor for a group.
    ///
    /// @param groupId group to edit, not null
    /// @param groupIdentifier namespace of the group's identifiers, may be null
    /// @param tree loaded logic tree, not null
    /// @param questions loaded questions of the group, not null
    /// @return new editor, closed together with this environment, never null
    public TreeEditor openEditor(
            String groupId, String groupIdentifier, LogicTree tree, List<Question> questions) {
        TreeEditor editor =
                TreeEditor.builder()
                        .groupId(groupId)
                        .groupIdentifier(groupIdentifier)
                        .persistence(persistence)
                        .codec(codec)
                        .scheduler(scheduler)
                        .autosaveDelay(config.getAutosaveDelay())
                        .identifierCheckDelay(config.getIdentifierCheckDelay())
                        .tree(tree)
                        .questions(questions)
                        .build();
        synchronized (editors) {
            editors.removeIf(TreeEditor::isClosed);
            editors.add(editor);
        }
        logger.info("Opened editor for group " + groupId);
        return editor;
    }

    /// Returns the editors opened here that have not been closed yet.
    ///
    /// @return snapshot of open editors, never null
    public List<TreeEditor> getOpenEditors() {
        synchronized (editors) {
            editors.removeIf(TreeEditor::isClosed);
            return List.copyOf(editors);
        }
    }

    /// Opens an editor for a group whose tree is in serialized form.
    ///
    /// @param groupId group to edit, not null
    /// @param groupIdentifier namespace of the group's identifiers, may be null
    /// @param serializedTree tree as stored by persistence, not null
    /// @param questions loaded questions of the group, not null
    /// @return new editor, never null
    /// @throws IllegalArgumentException if the tree cannot be decoded
    public TreeEditor openEditor(
            String groupId,
            String groupIdentifier,
            String serializedTree,
            List<Question> questions) {
        return openEditor(groupId, groupIdentifier, codec.decode(serializedTree), questions);
    }

    /// Creates a session over groups, visited through a flow.
    ///
    /// @param sessionId session whose answers are stored, not null
    /// @param groups groups the flow can route to, not empty
    /// @param flow group routing, null to visit groups in list order
    /// @return new session in state LOADING, never null
    public QuestionnaireSession openSession(
            String sessionId, List<QuestionGroupDefinition> groups, GroupFlow flow) {
        return QuestionnaireSession.builder()
                .sessionId(sessionId)
                .groups(groups)
                .flow(flow)
                .answerStore(answerStore)
                .evaluator(evaluator)
                .pageSize(config.getPageSize())
                .build();
    }

    /// Closes every open editor, waiting for their saves, then releases the scheduler.
    @Override
    public void close() {
        List<TreeEditor> open;
        synchronized (editors) {
            open = List.copyOf(editors);
            editors.clear();
        }
        open.forEach(TreeEditor::close);
        if (scheduler instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                logger.warning("Scheduler did not close cleanly: " + e.getMessage());
            }
        }
    }
}
