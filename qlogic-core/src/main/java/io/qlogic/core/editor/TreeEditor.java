package io.qlogic.core.editor;

import io.qlogic.core.logic.Condition;
import io.qlogic.core.logic.ConditionalNode;
import io.qlogic.core.logic.LogicNode;
import io.qlogic.core.logic.LogicTree;
import io.qlogic.core.logic.LogicTreeCodec;
import io.qlogic.core.logic.NodeIds;
import io.qlogic.core.logic.NodeLocation;
import io.qlogic.core.logic.QuestionNode;
import io.qlogic.core.logic.TreePath;
import io.qlogic.core.logic.TreeStructureException;
import io.qlogic.core.persistence.QuestionPersistence;
import io.qlogic.core.question.DuplicateIdentifierException;
import io.qlogic.core.question.IdentifierCheck;
import io.qlogic.core.question.IdentifierStatus;
import io.qlogic.core.question.IdentifierUniquenessChecker;
import io.qlogic.core.question.Question;
import io.qlogic.core.question.QuestionCatalog;
import io.qlogic.core.question.QuestionEdit;
import io.qlogic.core.question.QuestionRef;
import io.qlogic.core.question.QuestionRegistry;
import io.qlogic.core.util.Debouncer;
import io.qlogic.core.util.Scheduler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Authoring editor for the logic tree and questions of one group.
///
/// Every structural operation replaces the immutable tree snapshot and queues it for saving;
/// content edits go through a debounced per-question autosave. The editor owns all
/// outstanding persistence work: {@link #close()} sends debounced edits and waits for
/// everything in flight.
///
/// ### Structural Operations
/// - {@link #insertQuestionBefore(TreePath, int)} / {@link #addQuestionAtEnd(TreePath)}
/// - {@link #insertConditionalAfter(TreePath, int)}
/// - {@link #removeNode(String)}, cascading to questions only reachable through the node
/// - {@link #moveNodeUpOneLevel(String)}
/// - {@link #updateCondition(String, Condition)} / {@link #setFlowFlags(String, boolean,
///   boolean)}
/// - {@link #healDanglingReferences()}
///
/// ### Persisted Ids
/// A new question is referenced by its local id until its create call returns. The
/// returned id is committed to the registry and every reference in the tree is rewritten
/// in one step, followed by a structural save.
///
/// ### Usage
/// {@snippet :
/// try (TreeEditor editor = environment.openEditor("group-1", "household", tree, questions)) {
///     editor.addQuestionAtEnd(TreePath.root());
///     editor.insertConditionalAfter(TreePath.root(), 0);
/// }
/// }
///
/// @implNote Thread-safe. Editor state is guarded by this editor's monitor; collaborator
/// completions may arrive on any thread.
/// @see LogicTree for the snapshot model
/// @see QuestionRegistry for question content
public final class TreeEditor implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(TreeEditor.class.getName());

    private final String groupId;
    private final QuestionRegistry registry;
    private final QuestionPersistence persistence;
    private final Supplier<String> nodeIds;
    private final Debouncer<String> identifierChecks;
    private final PendingSaves pendingSaves = new PendingSaves();
    private final StructuralSaveQueue structuralSaves;
    private final ContentAutosaver autosaver;

    private LogicTree tree;
    private boolean closed;

    private TreeEditor(Builder builder) {
        this.groupId = builder.groupId;
        this.persistence = builder.persistence;
        this.nodeIds = builder.nodeIds;

        this.identifierChecks = new Debouncer<>(builder.scheduler, builder.identifierCheckDelay);
        IdentifierUniquenessChecker checker =
                new IdentifierUniquenessChecker(persistence, groupId, identifierChecks);
        this.registry = new QuestionRegistry(groupId, builder.groupIdentifier, checker);
        try {
            registry.createAll(builder.questions);
        } catch (DuplicateIdentifierException e) {
            throw new IllegalArgumentException("Loaded questions share an identifier", e);
        }
        this.structuralSaves =
                new StructuralSaveQueue(groupId, persistence, builder.codec, pendingSaves);
        this.autosaver =
                new ContentAutosaver(
                        this,
                        groupId,
                        registry,
                        persistence,
                        new Debouncer<>(builder.scheduler, builder.autosaveDelay),
                        pendingSaves,
                        this::onQuestionCreated);

        builder.tree.validate();
        this.tree = builder.tree;
    }

    /// Creates a new editor builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    public String getGroupId() {
        return groupId;
    }

    /// Returns the question registry of this group.
    ///
    /// @return registry, never null
    public QuestionRegistry getRegistry() {
        return registry;
    }

    /// Returns the current tree snapshot.
    ///
    /// @return immutable tree, never null
    public synchronized LogicTree tree() {
        return tree;
    }

    /// Returns a consistent view of the group's questions.
    ///
    /// @return immutable catalog, never null
    public QuestionCatalog catalog() {
        return registry.snapshot();
    }

    /// Inserts a new draft question node at a position.
    ///
    /// @param path list to insert into, not null
    /// @param index position of the new node, from 0 to the list size
    /// @return the new tree, never null
    /// @throws TreeStructureException if the path or index is invalid
    public LogicTree insertQuestionBefore(TreePath path, int index) {
        try {
            return insertQuestionBefore(path, index, Question.draft());
        } catch (DuplicateIdentifierException e) {
            throw new IllegalStateException("A blank draft cannot collide", e);
        }
    }

    /// Inserts a question node for a new question at a position.
    ///
    /// The question is registered and, if it is already persistable, scheduled for
    /// creation. A named draft is created only after the remote identifier check confirms
    /// it.
    ///
    /// @param path list to insert into, not null
    /// @param index position of the new node, from 0 to the list size
    /// @param draft content of the new question, not null
    /// @return the new tree, never null
    /// @throws DuplicateIdentifierException if the draft's identifier is already used
    /// @throws TreeStructureException if the path or index is invalid
    public synchronized LogicTree insertQuestionBefore(TreePath path, int index, Question draft)
            throws DuplicateIdentifierException {
        ensureOpen();
        List<LogicNode> list = new ArrayList<>(tree.listAt(path));
        if (index < 0 || index > list.size()) {
            throw new TreeStructureException(
                    "Insert index "
                            + index
                            + " out of range for "
                            + path
                            + ", size "
                            + list.size());
        }
        list.add(index, QuestionNode.of(nodeIds.get(), QuestionRef.of(draft), path.size()));
        LogicTree updated = tree.replaceListAt(path, list);

        Question registered = registry.create(draft);
        autosaver.schedule(registered.getLocalId(), remoteIdentifierCheck(registered));
        logger.fine(() -> "Inserted question " + registered.getLocalId() + " at " + path);
        return commit(updated);
    }

    private CompletableFuture<IdentifierStatus> remoteIdentifierCheck(Question registered) {
        if (registered.getIdentifier().isBlank()) {
            return null;
        }
        IdentifierCheck check =
                registry.checkIdentifierUnique(
                        registered.getIdentifier().displayIdentifier(), registered.getLocalId());
        return check.status() == IdentifierStatus.CHECKING ? check.result() : null;
    }

    /// Appends a new draft question node to a list.
    ///
    /// @param path list to append to, not null
    /// @return the new tree, never null
    /// @throws TreeStructureException if the path is invalid
    public synchronized LogicTree addQuestionAtEnd(TreePath path) {
        return insertQuestionBefore(path, tree.listAt(path).size());
    }

    /// Appends a question node for a new question to a list.
    ///
    /// @param path list to append to, not null
    /// @param draft content of the new question, not null
    /// @return the new tree, never null
    /// @throws DuplicateIdentifierException if the draft's identifier is already used
    public synchronized LogicTree addQuestionAtEnd(TreePath path, Question draft)
            throws DuplicateIdentifierException {
        return insertQuestionBefore(path, tree.listAt(path).size(), draft);
    }

    /// Inserts a conditional after a position, with one new draft question nested in it.
    ///
    /// The condition tests the nearest question at or before `index` in the same list,
    /// or nothing if there is none.
    ///
    /// @param path list to insert into, not null
    /// @param index position after which the conditional goes, from -1 to the list size - 1
    /// @return the new tree, never null
    /// @throws TreeStructureException if the path or index is invalid or the nested question
    ///     would exceed the maximum depth
    public synchronized LogicTree insertConditionalAfter(TreePath path, int index) {
        ensureOpen();
        List<LogicNode> list = new ArrayList<>(tree.listAt(path));
        if (index < -1 || index >= list.size()) {
            throw new TreeStructureException(
                    "Conditional index "
                            + index
                            + " out of range for "
                            + path
                            + ", size "
                            + list.size());
        }
        Question nested = Question.draft();
        QuestionNode body =
                QuestionNode.of(nodeIds.get(), QuestionRef.of(nested), path.size() + 1);
        ConditionalNode conditional =
                ConditionalNode.of(
                        nodeIds.get(),
                        Condition.on(precedingIdentifier(list, index)),
                        List.of(body),
                        path.size());
        list.add(index + 1, conditional);
        LogicTree updated = tree.replaceListAt(path, list);

        try {
            registry.create(nested);
        } catch (DuplicateIdentifierException e) {
            throw new IllegalStateException("A blank draft cannot collide", e);
        }
        autosaver.schedule(nested.getLocalId(), null);
        return commit(updated);
    }

    private String precedingIdentifier(List<LogicNode> list, int index) {
        for (int i = index; i >= 0; i--) {
            if (list.get(i) instanceof QuestionNode node) {
                return registry.resolve(node.ref())
                        .map(q -> q.getIdentifier().qualifiedIdentifier())
                        .orElse("");
            }
        }
        return "";
    }

    /// Removes a node and, for a conditional, its whole subtree.
    ///
    /// Questions no longer referenced by any remaining node are removed from the registry and
    /// deleted from persistence; a question whose create is in flight is deleted once the
    /// create returns.
    ///
    /// @param nodeId node to remove, not null
    /// @return the new tree, never null
    /// @throws TreeStructureException if no node has the id
    public synchronized LogicTree removeNode(String nodeId) {
        ensureOpen();
        NodeLocation location =
                tree.locate(nodeId)
                        .orElseThrow(() -> new TreeStructureException("Unknown node: " + nodeId));
        List<LogicNode> list = new ArrayList<>(tree.listAt(location.parentPath()));
        list.remove(location.index());
        LogicTree updated = tree.replaceListAt(location.parentPath(), list);

        Set<String> stillReferenced = new HashSet<>();
        for (QuestionRef ref : updated.questionRefs()) {
            registry.resolve(ref).ifPresent(q -> stillReferenced.add(q.getLocalId()));
        }
        List<Question> removed = new ArrayList<>();
        for (QuestionRef ref : LogicTree.of(location.node()).questionRefs()) {
            Optional<Question> question = registry.resolve(ref);
            if (question.isPresent() && !stillReferenced.contains(question.get().getLocalId())) {
                registry.remove(question.get().getLocalId()).ifPresent(removed::add);
            }
        }
        removed.forEach(this::discard);
        logger.fine(() -> "Removed node " + nodeId + " with " + removed.size() + " question(s)");
        return commit(updated);
    }

    private void discard(Question question) {
        boolean createInFlight = autosaver.forget(question.getLocalId());
        if (question.isPersisted()) {
            String persistedId = question.getId();
            pendingSaves
                    .track(callDelete(persistedId))
                    .whenComplete(
                            (v, error) -> {
                                if (error != null) {
                                    logger.log(
                                            Level.WARNING,
                                            "Delete failed for question " + persistedId,
                                            error);
                                }
                            });
        } else if (createInFlight) {
            logger.fine(() -> "Question " + question.getLocalId() + " deleted once created");
        }
    }

    private CompletableFuture<Void> callDelete(String persistedId) {
        try {
            return persistence.deleteQuestion(persistedId);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /// Moves a nested node out of its conditional, directly after that conditional.
    ///
    /// Depths of the node and its subtree are decreased by one. Root nodes are left where
    /// they are.
    ///
    /// @param nodeId node to move, not null
    /// @return the new tree, or the current tree for a root node
    /// @throws TreeStructureException if no node has the id
    public synchronized LogicTree moveNodeUpOneLevel(String nodeId) {
        ensureOpen();
        NodeLocation location =
                tree.locate(nodeId)
                        .orElseThrow(() -> new TreeStructureException("Unknown node: " + nodeId));
        TreePath parentPath = location.parentPath();
        if (parentPath.isRoot()) {
            return tree;
        }
        List<LogicNode> siblings = new ArrayList<>(tree.listAt(parentPath));
        siblings.remove(location.index());
        LogicTree detached = tree.replaceListAt(parentPath, siblings);

        TreePath outerPath = parentPath.parent();
        String conditionalId = parentPath.lastConditionalId();
        List<LogicNode> outer = new ArrayList<>(detached.listAt(outerPath));
        int conditionalIndex = indexOf(outer, conditionalId);
        outer.add(conditionalIndex + 1, location.node());
        return commit(detached.replaceListAt(outerPath, outer));
    }

    private static int indexOf(List<LogicNode> nodes, String nodeId) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).nodeId().equals(nodeId)) {
                return i;
            }
        }
        throw new TreeStructureException("Unknown node: " + nodeId);
    }

    /// Replaces the predicate of a conditional.
    ///
    /// @param nodeId conditional to change, not null
    /// @param condition new predicate, not null
    /// @return the new tree, never null
    /// @throws TreeStructureException if the node is unknown or not a conditional
    public synchronized LogicTree updateCondition(String nodeId, Condition condition) {
        ensureOpen();
        Objects.requireNonNull(condition, "condition must not be null");
        return commit(
                tree.replaceNode(
                        nodeId, node -> requireConditional(node).withCondition(condition)));
    }

    /// Sets the flow flags of a node.
    ///
    /// Question nodes only have a stop flag; either flag sets it.
    ///
    /// @param nodeId node to change, not null
    /// @param endFlow end the flow after a holding conditional's subtree
    /// @param stopFlow stop the flow after the node
    /// @return the new tree, never null
    /// @throws TreeStructureException if the node is unknown
    public synchronized LogicTree setFlowFlags(String nodeId, boolean endFlow, boolean stopFlow) {
        ensureOpen();
        return commit(
                tree.replaceNode(
                        nodeId,
                        node -> {
                            if (node instanceof QuestionNode question) {
                                return question.withStopFlow(endFlow || stopFlow);
                            }
                            return ((ConditionalNode) node).withFlowFlags(endFlow, stopFlow);
                        }));
    }

    private static ConditionalNode requireConditional(LogicNode node) {
        if (node instanceof ConditionalNode conditional) {
            return conditional;
        }
        throw new TreeStructureException("Node " + node.nodeId() + " is not a conditional");
    }

    /// Repairs references between the tree and the registry.
    ///
    /// - local references of persisted questions are rewritten to their persisted ids
    /// - nodes still referencing no known question are kept and reported
    /// - registered questions without a node are appended at the root
    ///
    /// A structural save is queued only if the tree changed.
    ///
    /// @return what was repaired, never null
    public synchronized HealReport healDanglingReferences() {
        ensureOpen();
        Map<String, String> persistedIds = registry.persistedIdsByLocalId();
        List<String> relinked = new ArrayList<>();
        LogicTree healed =
                tree.mapQuestionNodes(
                        node -> {
                            if (node.ref() instanceof QuestionRef.Unresolved unresolved
                                    && persistedIds.containsKey(unresolved.localId())) {
                                relinked.add(node.nodeId());
                                String persistedId = persistedIds.get(unresolved.localId());
                                return node.withRef(new QuestionRef.Resolved(persistedId));
                            }
                            return node;
                        });

        QuestionCatalog catalog = registry.snapshot();
        List<String> dangling = new ArrayList<>();
        Set<String> referenced = new HashSet<>();
        healed.flatten()
                .forEach(
                        flat ->
                                catalog.resolve(flat.node().ref())
                                        .ifPresentOrElse(
                                                q -> referenced.add(q.getLocalId()),
                                                () -> dangling.add(flat.node().nodeId())));

        List<String> reattached = new ArrayList<>();
        List<LogicNode> roots = new ArrayList<>(healed.roots());
        for (Question question : catalog.all()) {
            if (!referenced.contains(question.getLocalId())) {
                roots.add(QuestionNode.of(nodeIds.get(), QuestionRef.of(question), 0));
                reattached.add(question.getLocalId());
            }
        }

        HealReport report = new HealReport(relinked, dangling, reattached);
        if (!dangling.isEmpty()) {
            logger.warning("Logic tree of group " + groupId + " has dangling nodes " + dangling);
        }
        if (!reattached.isEmpty()) {
            logger.warning(
                    "Questions " + reattached + " of group " + groupId + " appended at root");
        }
        if (report.changedTree()) {
            commit(healed.replaceListAt(TreePath.root(), roots));
        }
        return report;
    }

    /// Applies a content edit to a question and schedules its autosave.
    ///
    /// A new identifier is checked at once against the group's other questions. On a
    /// collision the other fields are still applied, the identifier is kept and saving is
    /// blocked until a unique identifier is entered.
    ///
    /// @param localId question to edit, not null
    /// @param edit content changes, not null
    /// @return the updated question, never null
    /// @throws DuplicateIdentifierException if the new identifier is already used
    /// @throws IllegalArgumentException if no question has the local id
    public synchronized Question updateQuestion(String localId, QuestionEdit edit)
            throws DuplicateIdentifierException {
        ensureOpen();
        Objects.requireNonNull(edit, "edit must not be null");
        if (!edit.changesIdentifier()) {
            Question updated = registry.update(localId, edit);
            autosaver.schedule(localId, null);
            return updated;
        }
        IdentifierCheck check = registry.checkIdentifierUnique(edit.getIdentifier(), localId);
        if (check.status() == IdentifierStatus.DUPLICATE) {
            registry.updateContent(localId, edit);
            autosaver.block(localId);
            throw new DuplicateIdentifierException(edit.getIdentifier());
        }
        Question updated = registry.update(localId, edit);
        boolean remote = check.status() == IdentifierStatus.CHECKING;
        autosaver.schedule(localId, remote ? check.result() : null);
        return updated;
    }

    /// Returns the content save state of a question.
    ///
    /// @param localId question to inspect, not null
    /// @return save status, never null
    /// @throws IllegalArgumentException if no question has the local id
    public synchronized SaveStatus saveStatus(String localId) {
        Question question =
                registry.get(localId)
                        .orElseThrow(
                                () -> new IllegalArgumentException("Unknown question: " + localId));
        return autosaver.status(question);
    }

    /// Returns the state of the logic tree save queue.
    ///
    /// @return structural save status, never null
    public StructuralSaveStatus structuralSaveStatus() {
        return structuralSaves.status();
    }

    /// Queues the current tree for saving again, typically after a failed save.
    public synchronized void retryStructuralSave() {
        ensureOpen();
        structuralSaves.submit(tree);
    }

    /// Runs pending identifier checks and sends every debounced content save now instead of
    /// waiting for their delays.
    public void flushPendingEdits() {
        identifierChecks.flushAll();
        autosaver.flush();
    }

    /// Blocks until every persistence operation started by this editor has completed.
    ///
    /// Debounced edits that have not been sent yet are not waited for; use
    /// {@link #flushPendingEdits()} first to include them.
    public void awaitPendingSaves() {
        pendingSaves.awaitAll();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /// Sends pending edits, waits for all outstanding saves and rejects further edits.
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        flushPendingEdits();
        pendingSaves.awaitAll();
        logger.info("Closed editor for group " + groupId);
    }

    private void onQuestionCreated(String localId, String persistedId) {
        synchronized (this) {
            QuestionRef.Unresolved local = new QuestionRef.Unresolved(localId);
            QuestionRef.Resolved resolved = new QuestionRef.Resolved(persistedId);
            LogicTree rewritten =
                    tree.mapQuestionNodes(n -> n.ref().equals(local) ? n.withRef(resolved) : n);
            logger.fine(() -> "Question " + localId + " persisted as " + persistedId);
            if (rewritten != tree) {
                tree = rewritten;
                structuralSaves.submit(tree);
            }
        }
    }

    private LogicTree commit(LogicTree updated) {
        tree = updated;
        structuralSaves.submit(updated);
        return updated;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Editor for group " + groupId + " is closed");
        }
    }

    /// Builder for TreeEditor.
    ///
    /// `groupId`, `persistence`, `codec` and `scheduler` are required.
    public static final class Builder {
        private String groupId;
        private String groupIdentifier;
        private QuestionPersistence persistence;
        private LogicTreeCodec codec;
        private Scheduler scheduler;
        private Duration autosaveDelay = Duration.ofMillis(1000);
        private Duration identifierCheckDelay = Duration.ofMillis(500);
        private LogicTree tree = LogicTree.empty();
        private List<Question> questions = List.of();
        private Supplier<String> nodeIds = NodeIds::next;

        private Builder() {}

        public Builder groupId(String groupId) {
            this.groupId = groupId;
            return this;
        }

        /// Sets the namespace used to qualify question identifiers.
        ///
        /// @param groupIdentifier group identifier, may be null
        /// @return this builder for chaining
        public Builder groupIdentifier(String groupIdentifier) {
            this.groupIdentifier = groupIdentifier;
            return this;
        }

        public Builder persistence(QuestionPersistence persistence) {
            this.persistence = persistence;
            return this;
        }

        public Builder codec(LogicTreeCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder autosaveDelay(Duration autosaveDelay) {
            this.autosaveDelay = autosaveDelay;
            return this;
        }

        public Builder identifierCheckDelay(Duration identifierCheckDelay) {
            this.identifierCheckDelay = identifierCheckDelay;
            return this;
        }

        /// Sets the loaded tree.
        ///
        /// @param tree tree to edit, validated on build, not null
        /// @return this builder for chaining
        public Builder tree(LogicTree tree) {
            this.tree = tree;
            return this;
        }

        /// Sets the loaded questions of the group.
        ///
        /// @param questions questions to register, not null
        /// @return this builder for chaining
        public Builder questions(List<Question> questions) {
            this.questions = List.copyOf(questions);
            return this;
        }

        /// Sets the node id generator.
        ///
        /// @param nodeIds supplier of unique node ids, not null
        /// @return this builder for chaining
        public Builder nodeIds(Supplier<String> nodeIds) {
            this.nodeIds = nodeIds;
            return this;
        }

        /// Builds the editor.
        ///
        /// @return new editor, never null
        /// @throws NullPointerException if a required field is missing
        /// @throws IllegalArgumentException if loaded questions share an identifier
        /// @throws TreeStructureException if the loaded tree is invalid
        public TreeEditor build() {
            Objects.requireNonNull(groupId, "groupId is required");
            Objects.requireNonNull(persistence, "persistence is required");
            Objects.requireNonNull(codec, "codec is required");
            Objects.requireNonNull(scheduler, "scheduler is required");
            Objects.requireNonNull(tree, "tree is required");
            Objects.requireNonNull(nodeIds, "nodeIds is required");
            return new TreeEditor(this);
        }
    }
}
