package io.qlogic.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.qlogic.core.answer.AnswerSheet;
import io.qlogic.core.answer.AnswerValue;
import io.qlogic.core.logic.LogicNode;
import io.qlogic.core.logic.LogicTree;
import io.qlogic.core.question.Question;
import io.qlogic.core.question.QuestionIdentifier;
import io.qlogic.serialization.mixin.QuestionBuilderMixin;
import io.qlogic.serialization.mixin.QuestionIdentifierMixin;
import io.qlogic.serialization.mixin.QuestionMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all qlogic serialization configuration in one place.
///
/// **Custom serializer/deserializer pairs**:
/// - `LogicNode`: `LogicNodeSerializer` / `LogicNodeDeserializer`, discriminator: `"type"`
/// - `LogicTree`: array of root nodes
/// - `AnswerValue`: string, array or object depending on the variant
/// - `AnswerSheet`: flat object keyed by identifier
///
/// **Mixin/builder pairs**:
/// - `Question` + `Question.Builder`
/// - `QuestionIdentifier` (property filter, no builder)
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see LogicTreeSerializer for the convenience factory API
public class QlogicJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4620980953108794172L;

    public QlogicJacksonModule() {
        super("QlogicJacksonModule");

        addSerializer(LogicNode.class, new LogicNodeSerializer());
        addDeserializer(LogicNode.class, new LogicNodeDeserializer());

        addSerializer(LogicTree.class, new LogicTreeJsonSerializer());
        addDeserializer(LogicTree.class, new LogicTreeJsonDeserializer());

        addSerializer(AnswerValue.class, new AnswerValueSerializer());
        addDeserializer(AnswerValue.class, new AnswerValueDeserializer());

        addSerializer(AnswerSheet.class, new AnswerSheetJsonSerializer());
        addDeserializer(AnswerSheet.class, new AnswerSheetJsonDeserializer());
    }

    /// Applies mixin annotations to builder-pattern domain types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Question.class, QuestionMixin.class);
        context.setMixInAnnotations(Question.Builder.class, QuestionBuilderMixin.class);

        context.setMixInAnnotations(QuestionIdentifier.class, QuestionIdentifierMixin.class);
    }
}
