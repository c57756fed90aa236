package io.qlogic.core.logic;

import io.qlogic.core.question.QuestionRef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/// Immutable ordered forest of logic nodes describing one question group's flow.
///
/// Every structural edit produces a new tree; unchanged subtrees are shared. Nodes are
/// addressed by id and lists by {@link TreePath}.
///
/// ### Invariants
/// - node ids are unique
/// - every node's depth equals its nesting level
/// - no node is deeper than {@link #MAX_DEPTH}
///
/// {@link #replaceListAt(TreePath, List)} re-depths the nodes it places and rejects
/// overflow, so trees built through it always satisfy the invariants. Trees decoded from
/// storage can be checked with {@link #validate()}.
///
/// @implNote Immutable and thread-safe.
/// @see io.qlogic.core.editor.TreeEditor for structural edits with persistence
public final class LogicTree {

    /// Deepest allowed nesting level. Root nodes are at depth 0.
    public static final int MAX_DEPTH = 4;

    private static final LogicTree EMPTY = new LogicTree(List.of());

    private final List<LogicNode> roots;

    private LogicTree(List<LogicNode> roots) {
        this.roots = List.copyOf(roots);
    }

    public static LogicTree empty() {
        return EMPTY;
    }

    /// Creates a tree from root nodes as given.
    ///
    /// Depths are not rewritten; call {@link #validate()} for untrusted input.
    ///
    /// @param roots ordered root nodes, not null
    /// @return tree, never null
    public static LogicTree of(List<LogicNode> roots) {
        return roots.isEmpty() ? EMPTY : new LogicTree(roots);
    }

    /// Creates a tree from root nodes as given.
    ///
    /// @param roots ordered root nodes
    /// @return tree, never null
    public static LogicTree of(LogicNode... roots) {
        return of(List.of(roots));
    }

    public List<LogicNode> roots() {
        return roots;
    }

    public boolean isEmpty() {
        return roots.isEmpty();
    }

    /// Finds a node anywhere in the tree.
    ///
    /// @param nodeId id to look up, not null
    /// @return the node, or empty if absent
    public Optional<LogicNode> find(String nodeId) {
        return locate(nodeId).map(NodeLocation::node);
    }

    /// Finds where a node sits.
    ///
    /// @param nodeId id to look up, not null
    /// @return the node's location, or empty if absent
    public Optional<NodeLocation> locate(String nodeId) {
        return locateIn(roots, TreePath.root(), nodeId);
    }

    private static Optional<NodeLocation> locateIn(
            List<LogicNode> nodes, TreePath path, String nodeId) {
        for (int i = 0; i < nodes.size(); i++) {
            LogicNode node = nodes.get(i);
            if (node.nodeId().equals(nodeId)) {
                return Optional.of(new NodeLocation(path, i, node));
            }
            if (node instanceof ConditionalNode conditional) {
                TreePath nestedPath = path.child(conditional.nodeId());
                Optional<NodeLocation> nested =
                        locateIn(conditional.nestedItems(), nestedPath, nodeId);
                if (nested.isPresent()) {
                    return nested;
                }
            }
        }
        return Optional.empty();
    }

    /// Returns the node list a path addresses.
    ///
    /// @param path list address, not null
    /// @return unmodifiable list, never null
    /// @throws TreeStructureException if a path segment is not a conditional of this tree
    public List<LogicNode> listAt(TreePath path) {
        List<LogicNode> current = roots;
        for (String conditionalId : path.conditionalIds()) {
            current = conditionalIn(current, conditionalId, path).nestedItems();
        }
        return current;
    }

    /// Returns a tree with the list at a path replaced.
    ///
    /// Placed nodes are moved to the path's depth, including their subtrees.
    ///
    /// @param path list address, not null
    /// @param nodes new content of the list, not null
    /// @return new tree, never null
    /// @throws TreeStructureException if the path is unknown or a node would exceed
    ///     {@link #MAX_DEPTH}
    public LogicTree replaceListAt(TreePath path, List<LogicNode> nodes) {
        List<LogicNode> placed = nodes.stream().map(n -> n.withDepth(path.size())).toList();
        placed.forEach(LogicTree::checkDepth);
        return new LogicTree(replaceIn(roots, path, 0, placed));
    }

    private static List<LogicNode> replaceIn(
            List<LogicNode> nodes, TreePath path, int level, List<LogicNode> replacement) {
        if (level == path.size()) {
            return replacement;
        }
        String conditionalId = path.conditionalIds().get(level);
        ConditionalNode target = conditionalIn(nodes, conditionalId, path);
        List<LogicNode> rebuilt = new ArrayList<>(nodes);
        List<LogicNode> nested = replaceIn(target.nestedItems(), path, level + 1, replacement);
        rebuilt.set(nodes.indexOf(target), target.withNestedItems(nested));
        return rebuilt;
    }

    private static ConditionalNode conditionalIn(
            List<LogicNode> nodes, String conditionalId, TreePath path) {
        for (LogicNode node : nodes) {
            if (node.nodeId().equals(conditionalId)) {
                if (node instanceof ConditionalNode conditional) {
                    return conditional;
                }
                throw new TreeStructureException(
                        "Path " + path + " passes through non-conditional node " + conditionalId);
            }
        }
        throw new TreeStructureException("Unknown path " + path + " at " + conditionalId);
    }

    private static void checkDepth(LogicNode node) {
        if (node.depth() > MAX_DEPTH) {
            throw new TreeStructureException(
                    "Node " + node.nodeId() + " would be nested deeper than " + MAX_DEPTH);
        }
        if (node instanceof ConditionalNode conditional) {
            conditional.nestedItems().forEach(LogicTree::checkDepth);
        }
    }

    /// Returns a tree with every question node transformed.
    ///
    /// @param mapper transformation applied to each question node, not null
    /// @return new tree, or this tree if nothing changed
    public LogicTree mapQuestionNodes(UnaryOperator<QuestionNode> mapper) {
        List<LogicNode> mapped = mapIn(roots, mapper);
        return mapped.equals(roots) ? this : new LogicTree(mapped);
    }

    private static List<LogicNode> mapIn(
            List<LogicNode> nodes, UnaryOperator<QuestionNode> mapper) {
        List<LogicNode> result = new ArrayList<>(nodes.size());
        for (LogicNode node : nodes) {
            if (node instanceof QuestionNode question) {
                result.add(mapper.apply(question));
            } else {
                ConditionalNode conditional = (ConditionalNode) node;
                result.add(conditional.withNestedItems(mapIn(conditional.nestedItems(), mapper)));
            }
        }
        return result;
    }

    /// Returns a tree with one node replaced in place.
    ///
    /// @param nodeId id of the node to replace, not null
    /// @param replacement function building the new node from the old one, not null
    /// @return new tree, never null
    /// @throws TreeStructureException if the node is unknown
    public LogicTree replaceNode(String nodeId, UnaryOperator<LogicNode> replacement) {
        NodeLocation location =
                locate(nodeId)
                        .orElseThrow(() -> new TreeStructureException("Unknown node: " + nodeId));
        List<LogicNode> list = new ArrayList<>(listAt(location.parentPath()));
        list.set(location.index(), replacement.apply(location.node()));
        return replaceListAt(location.parentPath(), list);
    }

    /// Returns all question nodes in depth-first order, ignoring conditions.
    ///
    /// @return unmodifiable list, never null
    public List<FlatNode> flatten() {
        List<FlatNode> flat = new ArrayList<>();
        flattenInto(roots, TreePath.root(), flat);
        return List.copyOf(flat);
    }

    private static void flattenInto(List<LogicNode> nodes, TreePath path, List<FlatNode> flat) {
        for (int i = 0; i < nodes.size(); i++) {
            LogicNode node = nodes.get(i);
            if (node instanceof QuestionNode question) {
                flat.add(new FlatNode(question, question.depth(), path, i));
            } else {
                ConditionalNode conditional = (ConditionalNode) node;
                flattenInto(conditional.nestedItems(), path.child(conditional.nodeId()), flat);
            }
        }
    }

    /// Returns the question references of all question nodes in depth-first order.
    ///
    /// @return unmodifiable list, never null
    public List<QuestionRef> questionRefs() {
        return flatten().stream().map(f -> f.node().ref()).toList();
    }

    /// Returns the identifiers tested by conditionals anywhere in the tree.
    ///
    /// @return unmodifiable set in depth-first order, blank identifiers excluded
    public Set<String> conditionalIdentifiers() {
        Set<String> identifiers = new LinkedHashSet<>();
        collectIdentifiers(roots, identifiers);
        return Collections.unmodifiableSet(identifiers);
    }

    private static void collectIdentifiers(List<LogicNode> nodes, Set<String> identifiers) {
        for (LogicNode node : nodes) {
            if (node instanceof ConditionalNode conditional) {
                if (conditional.condition().hasIdentifier()) {
                    identifiers.add(conditional.condition().ifIdentifier());
                }
                collectIdentifiers(conditional.nestedItems(), identifiers);
            }
        }
    }

    /// Returns the number of nodes of both kinds.
    ///
    /// @return node count
    public int size() {
        return count(roots);
    }

    private static int count(List<LogicNode> nodes) {
        int total = 0;
        for (LogicNode node : nodes) {
            total++;
            if (node instanceof ConditionalNode conditional) {
                total += count(conditional.nestedItems());
            }
        }
        return total;
    }

    /// Checks the structural invariants.
    ///
    /// @throws TreeStructureException if ids repeat, a depth does not match its nesting
    ///     level or a node is deeper than {@link #MAX_DEPTH}
    public void validate() {
        validateIn(roots, 0, new HashSet<>());
    }

    private static void validateIn(List<LogicNode> nodes, int expectedDepth, Set<String> seen) {
        for (LogicNode node : nodes) {
            if (!seen.add(node.nodeId())) {
                throw new TreeStructureException("Duplicate node id: " + node.nodeId());
            }
            if (node.depth() != expectedDepth) {
                throw new TreeStructureException(
                        "Node "
                                + node.nodeId()
                                + " has depth "
                                + node.depth()
                                + " but is nested at level "
                                + expectedDepth);
            }
            checkDepth(node);
            if (node instanceof ConditionalNode conditional) {
                validateIn(conditional.nestedItems(), expectedDepth + 1, seen);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogicTree that)) return false;
        return roots.equals(that.roots);
    }

    @Override
    public int hashCode() {
        return roots.hashCode();
    }

    @Override
    public String toString() {
        return "LogicTree{roots=" + roots + '}';
    }
}
