package io.qlogic.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import io.qlogic.core.answer.AnswerSheet;
import io.qlogic.core.answer.AnswerValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AnswerSheetCodecTest {

    private final AnswerSheetCodec codec = new AnswerSheetCodec();

    @Test
    void shouldStoreTextAsIs() {
        assertThat(codec.encodeValue(AnswerValue.text("yes"))).isEqualTo("yes");
        assertThat(codec.decodeValue("yes")).isEqualTo(AnswerValue.text("yes"));
    }

    @Test
    void shouldStoreRepeatableAnswersAsJsonArray() {
        AnswerValue names = AnswerValue.texts("Rex", "Tom");

        String stored = codec.encodeValue(names);

        assertThat(stored).isEqualTo("[\"Rex\",\"Tom\"]");
        assertThat(codec.decodeValue(stored)).isEqualTo(names);
    }

    @Test
    void shouldStoreCompositeAnswersAsJsonObject() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("first", "Ann");
        values.put("last", "Lee");
        AnswerValue person = AnswerValue.fields(values);

        String stored = codec.encodeValue(person);

        assertThat(stored).isEqualTo("{\"first\":\"Ann\",\"last\":\"Lee\"}");
        assertThat(codec.decodeValue(stored)).isEqualTo(person);
    }

    @Test
    void shouldKeepInstancesOfCompositeAnswers() {
        AnswerValue owners =
                AnswerValue.items(
                        List.of(
                                AnswerValue.fields(Map.of("first", "Ann")),
                                AnswerValue.empty()));

        assertThat(codec.decodeValue(codec.encodeValue(owners))).isEqualTo(owners);
    }

    @Test
    void shouldFallBackToTextForBracketedPlainText() {
        assertThat(codec.decodeValue("[draft")).isEqualTo(AnswerValue.text("[draft"));
    }

    @Test
    void shouldReadTextThatIsValidJsonAsStructuredAnswer() {
        AnswerValue typed = AnswerValue.text("[\"a\",\"b\"]");

        String stored = codec.encodeValue(typed);

        assertThat(stored).isEqualTo("[\"a\",\"b\"]");
        assertThat(codec.decodeValue(stored)).isEqualTo(AnswerValue.texts("a", "b"));
    }

    @Test
    void shouldDecodeMissingValueAsEmpty() {
        assertThat(codec.decodeValue(null).isEmpty()).isTrue();
    }

    @Test
    void shouldEncodeWholeSheet() {
        AnswerSheet sheet =
                AnswerSheet.of(
                        Map.of(
                                "household.pet", AnswerValue.text("yes"),
                                "household.names", AnswerValue.texts("Rex")));

        Map<String, String> stored = codec.encode(sheet);

        assertThat(stored)
                .containsEntry("household.pet", "yes")
                .containsEntry("household.names", "[\"Rex\"]");
        assertThat(codec.decode(stored)).isEqualTo(sheet);
    }
}
