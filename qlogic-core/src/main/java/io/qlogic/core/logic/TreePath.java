package io.qlogic.core.logic;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Address of a node list inside a logic tree.
///
/// A path is the chain of conditional node ids leading from the root list to a nested list.
/// The empty path addresses the root list. Node ids stay valid across concurrent edits,
/// unlike positional indexes.
///
/// @param conditionalIds ids of the enclosing conditionals, outermost first, not null
public record TreePath(List<String> conditionalIds) {

    private static final TreePath ROOT = new TreePath(List.of());

    public TreePath {
        conditionalIds = List.copyOf(Objects.requireNonNull(conditionalIds, "conditionalIds"));
    }

    public static TreePath root() {
        return ROOT;
    }

    /// Creates a path from conditional ids.
    ///
    /// @param conditionalIds ids of the enclosing conditionals, outermost first
    /// @return path, never null
    public static TreePath of(String... conditionalIds) {
        return conditionalIds.length == 0 ? ROOT : new TreePath(List.of(conditionalIds));
    }

    /// Returns the path of a conditional's nested list.
    ///
    /// @param conditionalId id of a conditional in the list this path addresses, not null
    /// @return extended path, never null
    public TreePath child(String conditionalId) {
        List<String> ids = new ArrayList<>(conditionalIds);
        ids.add(Objects.requireNonNull(conditionalId, "conditionalId"));
        return new TreePath(ids);
    }

    /// Returns the path of the list containing this path's conditional.
    ///
    /// @return parent path, never null
    /// @throws IllegalStateException if this is the root path
    public TreePath parent() {
        if (isRoot()) {
            throw new IllegalStateException("Root path has no parent");
        }
        return new TreePath(conditionalIds.subList(0, conditionalIds.size() - 1));
    }

    /// Returns the id of the innermost conditional.
    ///
    /// @return conditional id, or null for the root path
    public String lastConditionalId() {
        return isRoot() ? null : conditionalIds.get(conditionalIds.size() - 1);
    }

    public boolean isRoot() {
        return conditionalIds.isEmpty();
    }

    /// Returns the depth of the nodes in the addressed list.
    ///
    /// @return number of enclosing conditionals
    public int size() {
        return conditionalIds.size();
    }

    @Override
    public String toString() {
        return isRoot() ? "/" : "/" + String.join("/", conditionalIds);
    }
}
