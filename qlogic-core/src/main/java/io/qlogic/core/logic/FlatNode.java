package io.qlogic.core.logic;

/// Question node in depth-first order, with the position it occupies in its parent list.
///
/// @param node the question node, not null
/// @param depth nesting level
/// @param parentPath path of the list containing the node, not null
/// @param siblingIndex position within that list, counting conditional siblings
public record FlatNode(QuestionNode node, int depth, TreePath parentPath, int siblingIndex) {}
