package com.phillippitts.screentranslate.service.vision;

import com.phillippitts.screentranslate.domain.BoundingBox;
import com.phillippitts.screentranslate.domain.TextSegment;
import com.phillippitts.screentranslate.exception.AnalysisException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VisionResponseParserTest {

    @Test
    void parsesPlainSegmentsObject() {
        String reply = """
                {"segments":[
                  {"text":"Hello","bbox":[0.1,0.1,0.4,0.2],"confidence":0.95},
                  {"text":"World","bbox":[0.1,0.3,0.4,0.4]}
                ]}""";

        List<TextSegment> segments = VisionResponseParser.parse(reply, "openai");

        assertThat(segments).extracting(TextSegment::text).containsExactly("Hello", "World");
        assertThat(segments.get(0).confidence()).isEqualTo(0.95);
        assertThat(segments.get(1).confidence()).isEqualTo(1.0);
        assertThat(segments.get(0).boundingBox()).isEqualTo(new BoundingBox(0.1, 0.1, 0.4, 0.2));
    }

    @Test
    void stripsMarkdownFenceAndSurroundingProse() {
        String reply = """
                ```json
                {"segments":[{"text":"Menu","bbox":[0.0,0.0,0.2,0.1]}]}
                ```""";

        assertThat(VisionResponseParser.parse(reply, "openai"))
                .extracting(TextSegment::text).containsExactly("Menu");
        assertThat(VisionResponseParser.parse("Here you go: {\"segments\":[]} Hope that helps.", "openai"))
                .isEmpty();
    }

    @Test
    void acceptsOriginAndSizeBoxes() {
        String reply = "{\"segments\":[{\"text\":\"Title\",\"boundingBox\":"
                + "{\"x\":0.2,\"y\":0.1,\"width\":0.5,\"height\":0.1}}]}";

        TextSegment segment = VisionResponseParser.parse(reply, "claude").get(0);

        assertThat(segment.boundingBox().x1()).isEqualTo(0.2);
        assertThat(segment.boundingBox().x2()).isCloseTo(0.7, org.assertj.core.data.Offset.offset(1e-9));
    }

    @Test
    void clampsCoordinatesOutsideUnitRange() {
        String reply = "{\"segments\":[{\"text\":\"Edge\",\"bbox\":[-0.1,0.5,1.3,0.6]}]}";

        BoundingBox box = VisionResponseParser.parse(reply, "openai").get(0).boundingBox();

        assertThat(box.x1()).isEqualTo(0.0);
        assertThat(box.x2()).isEqualTo(1.0);
    }

    @Test
    void dropsBlankTextAndZeroAreaBoxes() {
        String reply = """
                {"segments":[
                  {"text":"  ","bbox":[0.1,0.1,0.4,0.2]},
                  {"text":"Line","bbox":[0.1,0.1,0.1,0.2]},
                  {"text":"Short","bbox":[0.1,0.1]},
                  {"text":"Kept","bbox":[0.1,0.1,0.4,0.2]}
                ]}""";

        assertThat(VisionResponseParser.parse(reply, "openai"))
                .extracting(TextSegment::text).containsExactly("Kept");
    }

    @Test
    void recoversCompleteSegmentsFromTruncatedReply() {
        String reply = "{\"segments\":[{\"text\":\"One\",\"bbox\":[0.1,0.1,0.3,0.2]},"
                + "{\"text\":\"Two {braces}\",\"bbox\":[0.1,0.3,0.3,0.4]},"
                + "{\"text\":\"Thr";

        List<TextSegment> segments = VisionResponseParser.parse(reply, "openai");

        assertThat(segments).extracting(TextSegment::text).containsExactly("One", "Two {braces}");
    }

    @Test
    void acceptsBareArray() {
        String reply = "[{\"text\":\"Solo\",\"bbox\":[0.1,0.1,0.3,0.2]}]";

        assertThat(VisionResponseParser.parse(reply, "ollama"))
                .extracting(TextSegment::text).containsExactly("Solo");
    }

    @Test
    void clampsConfidence() {
        String reply = "{\"segments\":[{\"text\":\"A\",\"bbox\":[0.1,0.1,0.3,0.2],\"confidence\":7}]}";

        assertThat(VisionResponseParser.parse(reply, "openai").get(0).confidence()).isEqualTo(1.0);
    }

    @Test
    void missingSegmentsKeyMeansNoText() {
        assertThat(VisionResponseParser.parse("{\"result\":\"nothing\"}", "openai")).isEmpty();
    }

    @Test
    void replyWithoutJsonIsInvalid() {
        assertThatThrownBy(() -> VisionResponseParser.parse("I cannot read this image.", "openai"))
                .isInstanceOf(AnalysisException.class)
                .satisfies(e -> assertThat(((AnalysisException) e).getKind())
                        .isEqualTo(AnalysisException.Kind.INVALID_RESPONSE))
                .hasMessageContaining("(vision: openai)");
    }
}
