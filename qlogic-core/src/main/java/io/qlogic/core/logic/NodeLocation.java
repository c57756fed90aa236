package io.qlogic.core.logic;

/// Position of a node inside a logic tree.
///
/// @param parentPath path of the list containing the node, not null
/// @param index position within that list
/// @param node the located node, not null
public record NodeLocation(TreePath parentPath, int index, LogicNode node) {}
