package io.qlogic.core.repeatable;

import io.qlogic.core.logic.TreePath;
import io.qlogic.core.question.Question;

/// Question in depth-first order with the tree position used to decide sibling runs.
///
/// @param question the resolved question, not null
/// @param depth nesting level
/// @param parentPath path of the list containing the question's node, not null
/// @param siblingIndex position of the node within that list
public record FlatQuestion(Question question, int depth, TreePath parentPath, int siblingIndex) {}
