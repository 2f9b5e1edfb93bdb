package org.dxworks.mathrules;

import org.approvaltests.Approvals;
import org.dxworks.mathrules.engine.RuleEngine;
import org.dxworks.mathrules.output.ConversionResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class AppConvertFileApprovalTest {
    private static final String SAMPLES_BASE_PATH = "src/test/resources/samples/";

    private static RuleEngine engine;

    @BeforeAll
    static void loadBundledRules() throws IOException {
        engine = MathRulesConfig.loadBundled().createEngine();
    }

    @Test
    void convert_MathML_Binomial() throws IOException {
        verify(Paths.get(SAMPLES_BASE_PATH + "mathml/binomial.xml"), InputFormat.MATHML);
    }

    @Test
    void convert_JsonTree_MatchesMathML() throws IOException {
        ConversionResult fromJson = App.convertFile(engine,
                Paths.get(SAMPLES_BASE_PATH + "json/binomial.json"), InputFormat.JSON, true);

        assertEquals("json", fromJson.format);
        assertEquals("n yli k", fromJson.speech);
        assertEquals("(n⠩k)", fromJson.braille);
    }

    @Test
    void bookmarksPointAtGeneratedIds() throws IOException {
        ConversionResult result = App.convertFile(engine,
                Paths.get(SAMPLES_BASE_PATH + "json/binomial.json"), InputFormat.JSON, false);

        List<String> ids = result.bookmarks.stream().map(range -> range.id).collect(Collectors.toList());
        assertEquals(List.of("m5", "m6"), ids);
        assertEquals("m2", result.intent.children.get(0).attributes.get("id"));
    }

    @Test
    void detectsInputFormat() {
        assertEquals(Optional.of(InputFormat.MATHML), InputFormatDetector.detectFormat(Path.of("a/b.mml")));
        assertEquals(Optional.of(InputFormat.MATHML), InputFormatDetector.detectFormat(Path.of("B.XML")));
        assertEquals(Optional.of(InputFormat.JSON), InputFormatDetector.detectFormat(Path.of("tree.json")));
        assertEquals(Optional.empty(), InputFormatDetector.detectFormat(Path.of("notes.txt")));
    }

    private static void verify(Path file, InputFormat format) throws IOException {
        ConversionResult result = App.convertFile(engine, file, format, true);
        Approvals.verify(TestUtils.APPROVAL_MAPPER.writeValueAsString(result));
    }
}
