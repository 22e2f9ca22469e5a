package com.cdlc.core.tags;

import com.cdlc.core.CdlTestBase;
import com.cdlc.core.ast.CdlAst;
import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.diagnostics.Diagnostic;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.model.CompositeBlock;
import com.cdlc.core.model.TagKind;
import com.cdlc.core.model.TagPayload;
import com.cdlc.core.parser.CdlSourceParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for {@link AnnotationTagExtractor}.
 */
class AnnotationTagExtractorTest extends CdlTestBase {

    @Test
    void extract_tagsOnBlockInstanceAndConnector_areIndexedVerbatim() {
        // Given
        String source = """
            block Ahu
              %s TSup "Supply air temperature"
                annotation (__cdl(haystack({"id": "@tSup", "air": "m:", "temp": "m:"})));
              %sReals.Abs fan
                annotation (__cdl(brick(:fan a brick:Supply_Fan .)));
              annotation (__cdl(brick(:ahu a brick:Air_Handling_Unit .), haystack="ahu"));
            end Ahu;
            """.formatted(REAL_INPUT, CDL);

        // When
        TagIndex tags = AnnotationTagExtractor.extract(parse(source));

        // Then
        assertThat(tags.blockTags()).containsExactly(
            new TagPayload(TagKind.BRICK, ":ahu a brick:Air_Handling_Unit ."),
            new TagPayload(TagKind.HAYSTACK, "ahu"));
        assertThat(tags.forElement("TSup")).containsExactly(
            new TagPayload(TagKind.HAYSTACK, "{\"id\": \"@tSup\", \"air\": \"m:\", \"temp\": \"m:\"}"));
        assertThat(tags.forElement("fan")).containsExactly(
            new TagPayload(TagKind.BRICK, ":fan a brick:Supply_Fan ."));
        assertThat(tags.forElement("missing")).isEmpty();
    }

    @Test
    void extract_noAnnotations_returnsEmptyIndex() {
        TagIndex tags = AnnotationTagExtractor.extract(parse("""
            block Plain
              %sReals.Abs abs1;
            end Plain;
            """.formatted(CDL)));

        assertThat(tags.isEmpty()).isTrue();
    }

    @Test
    void extract_brickOnInputConnector_reportsTagPlacement() {
        CdlException e = failure("""
            block Bad
              %s u annotation (__cdl(brick(:u a brick:Temperature_Sensor .)));
            end Bad;
            """.formatted(REAL_INPUT));

        assertThat(e.getDiagnostics()).singleElement()
            .satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.TAG_PLACEMENT);
                assertThat(d.subjects()).containsExactly("u");
                assertThat(d.location().line()).isEqualTo(2);
            });
    }

    @Test
    void extract_brickOnParameter_reportsTagPlacement() {
        CdlException e = failure("""
            block Bad
              parameter Real k = 1 annotation (__cdl(brick(:k a brick:Setpoint .)));
            end Bad;
            """);

        assertThat(e.kind()).isEqualTo(ErrorKind.TAG_PLACEMENT);
    }

    @Test
    void extract_tagOnConnectStatement_reportsTagPlacement() {
        CdlException e = failure("""
            block Bad
              %s u;
              %sReals.Abs abs1;
            equation
              connect(u, abs1.u) annotation (__cdl(haystack({"id": "@wire"})));
            end Bad;
            """.formatted(REAL_INPUT, CDL));

        assertThat(e.kind()).isEqualTo(ErrorKind.TAG_PLACEMENT);
        assertThat(e.getDiagnostics().get(0).subjects()).containsExactly("connect(u, abs1.u)");
    }

    @Test
    void extract_tagOutsideCdlWrapper_reportsTagPlacement() {
        CdlException e = failure("""
            block Bad
              annotation (brick(:bad a brick:AHU .));
            end Bad;
            """);

        assertThat(e.kind()).isEqualTo(ErrorKind.TAG_PLACEMENT);
        assertThat(e.getMessage()).contains("__cdl");
    }

    @Test
    void extract_severalMisplacedTags_reportsAllOfThem() {
        CdlException e = failure("""
            block Bad
              %s u annotation (__cdl(brick(:u a brick:Point .)));
              %s y annotation (__cdl(brick(:y a brick:Point .)));
            end Bad;
            """.formatted(REAL_INPUT, REAL_OUTPUT));

        assertThat(e.getDiagnostics()).extracting(Diagnostic::subjects)
            .containsExactly(List.of("u"), List.of("y"));
    }

    @Test
    void build_misplacedTag_isReportedByBuilderWithScope() {
        CdlException e = buildFailure("""
            within MyLib;
            block Bad
              %s u annotation (__cdl(brick(:u a brick:Point .)));
            end Bad;
            """.formatted(REAL_INPUT));

        assertThat(e.getDiagnostics()).singleElement()
            .satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.TAG_PLACEMENT);
                assertThat(d.scope()).isEqualTo("MyLib.Bad");
            });
    }

    @Test
    void build_tags_areCarriedIntoTheModel() {
        CompositeBlock block = build("""
            block Tagged
              %s u annotation (__cdl(haystack="sensor"));
              annotation (__cdl(brick(:tagged a brick:Controller .)));
            end Tagged;
            """.formatted(REAL_INPUT));

        assertThat(block.tags()).extracting(TagPayload::kind).containsExactly(TagKind.BRICK);
        assertThat(block.connector("u").orElseThrow().tags()).containsExactly(new TagPayload(TagKind.HAYSTACK, "sensor"));
    }

    private static CdlAst.ClassDefinition parse(String source) {
        return CdlSourceParser.parse(source, "Test.mo").classDefinition();
    }

    private static CdlException failure(String source) {
        CdlAst.ClassDefinition definition = parse(source);
        CdlException e = catchThrowableOfType(() -> AnnotationTagExtractor.extract(definition), CdlException.class);
        assertThat(e).as("expected a CdlException").isNotNull();
        return e;
    }
}
