package io.qlogic.core.session;

import io.qlogic.core.logic.LogicTree;
import io.qlogic.core.question.QuestionCatalog;
import java.util.Objects;

/// Published question group as seen by a session.
///
/// @param groupId group id, not null
/// @param identifier namespace of the group's question identifiers, may be null
/// @param name display name, may be null
/// @param tree logic tree of the group, not null
/// @param catalog questions of the group, not null
public record QuestionGroupDefinition(
        String groupId, String identifier, String name, LogicTree tree, QuestionCatalog catalog) {

    public QuestionGroupDefinition {
        Objects.requireNonNull(groupId, "groupId must not be null");
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(catalog, "catalog must not be null");
    }
}
