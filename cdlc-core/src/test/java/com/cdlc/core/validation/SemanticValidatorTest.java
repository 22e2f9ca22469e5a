package com.cdlc.core.validation;

import com.cdlc.core.CdlTestBase;
import com.cdlc.core.diagnostics.Diagnostic;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.model.CompositeBlock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link SemanticValidator}.
 */
class SemanticValidatorTest extends CdlTestBase {

    @Test
    void validate_wellFormedChain_isValid() {
        // Given
        String source = """
            block Chain
              %s u;
              %s y;
              %sReals.MultiplyByParameter gain(k=2);
              %sReals.Abs maxValue;
            equation
              connect(u, gain.u);
              connect(gain.y, maxValue.u);
              connect(maxValue.y, y);
            end Chain;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL, CDL);

        // When
        ValidationReport report = validate(source);

        // Then
        assertThat(report.isValid()).isTrue();
        assertThat(report.qualifiedName()).isEqualTo("Chain");
        assertThat(report.dependencyGraph().connectionEdges())
            .extracting(e -> e.from().toString(), e -> e.to().toString())
            .contains(tuple("gain.y", "maxValue.u"));
    }

    @Test
    void validate_unconnectedInstanceInput_reportsUnconnectedInput() {
        ValidationReport report = validate("""
            block Open
              %s u;
              %s y;
              %sReals.MultiplyByParameter gain(k=2);
              %sReals.Abs maxValue;
            equation
              connect(u, gain.u);
              connect(maxValue.y, y);
            end Open;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL, CDL));

        assertThat(report.isValid()).isFalse();
        assertThat(report.diagnostics()).singleElement()
            .satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.UNCONNECTED_INPUT);
                assertThat(d.subjects()).containsExactly("maxValue.u");
                assertThat(d.location().line()).isEqualTo(5);
            });
    }

    @Test
    void validate_unconnectedOwnOutput_reportsUnconnectedInput() {
        ValidationReport report = validate("""
            block Open
              %s u;
              %s y;
              %sReals.Abs abs1;
            equation
              connect(u, abs1.u);
            end Open;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL));

        assertThat(report.diagnostics(ErrorKind.UNCONNECTED_INPUT))
            .extracting(Diagnostic::subjects)
            .containsExactly(List.of("y"));
    }

    @Test
    void validate_twoSourcesOnOneInput_reportsMultipleAssignment() {
        ValidationReport report = validate("""
            block Conflict
              %s u;
              %sReals.Abs src1;
              %sReals.Abs src2;
              %sReals.Abs sink;
            equation
              connect(u, src1.u);
              connect(u, src2.u);
              connect(src1.y, sink.u);
              connect(src2.y, sink.u);
            end Conflict;
            """.formatted(REAL_INPUT, CDL, CDL, CDL));

        assertThat(report.diagnostics()).singleElement()
            .satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.MULTIPLE_ASSIGNMENT);
                assertThat(d.subjects()).containsExactly("sink.u", "src1.y", "src2.y");
                assertThat(d.location().line()).isEqualTo(10);
            });
    }

    @Test
    void validate_arrayElementLeftOpen_reportsThatElement() {
        ValidationReport report = validate("""
            block Partial
              %s u;
              %s y;
              %sReals.MultiMax maxValue(nin=2);
            equation
              connect(u, maxValue.u[1]);
              connect(maxValue.y, y);
            end Partial;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL));

        assertThat(report.diagnostics()).singleElement()
            .satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.UNCONNECTED_INPUT);
                assertThat(d.subjects()).containsExactly("maxValue.u[2]");
            });
    }

    @Test
    void validate_wholeArrayConnection_assignsEveryElement() {
        ValidationReport report = validate("""
            block Fanout
              %s u;
              %s y;
              %sRouting.RealScalarReplicator rep(nout=2);
              %sReals.MultiMax maxValue(nin=2);
            equation
              connect(u, rep.u);
              connect(rep.y, maxValue.u);
              connect(maxValue.y, y);
            end Fanout;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL, CDL));

        assertThat(report.isValid()).isTrue();
    }

    @Test
    void validate_booleanOutputToRealInput_reportsTypeMismatch() {
        ValidationReport report = validate("""
            block Mixed
              %s u;
              %s y;
              %sLogical.Not not1;
              %sReals.Abs abs1;
            equation
              connect(u, not1.u);
              connect(not1.y, abs1.u);
              connect(abs1.y, y);
            end Mixed;
            """.formatted(BOOLEAN_INPUT, REAL_OUTPUT, CDL, CDL));

        assertThat(report.diagnostics()).singleElement()
            .satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
                assertThat(d.subjects()).containsExactly("not1.y", "abs1.u");
            });
    }

    @Test
    void validate_integerOutputToRealInput_reportsTypeMismatchWithoutCoercion() {
        ValidationReport report = validate("""
            block Counts
              %sInterfaces.IntegerInput n1;
              %sInterfaces.IntegerInput n2;
              %s y;
              %sIntegers.Add addInt;
              %sReals.Abs abs1;
            equation
              connect(n1, addInt.u1);
              connect(n2, addInt.u2);
              connect(addInt.y, abs1.u);
              connect(abs1.y, y);
            end Counts;
            """.formatted(CDL, CDL, REAL_OUTPUT, CDL, CDL));

        assertThat(report.diagnostics()).singleElement()
            .satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
                assertThat(d.subjects()).containsExactly("addInt.y", "abs1.u");
                assertThat(d.message()).contains("Integer output").contains("Real input");
            });
    }

    @Test
    void validate_integerConnectorOfBlockToRealInput_reportsTypeMismatch() {
        ValidationReport report = validate("""
            block Count
              %sInterfaces.IntegerInput n;
              %s y;
              %sReals.Abs abs1;
            equation
              connect(n, abs1.u);
              connect(abs1.y, y);
            end Count;
            """.formatted(CDL, REAL_OUTPUT, CDL));

        assertThat(report.diagnostics(ErrorKind.TYPE_MISMATCH)).singleElement()
            .satisfies(d -> assertThat(d.subjects()).containsExactly("n", "abs1.u"));
    }

    @Test
    void validate_differentUnits_reportsTypeMismatch() {
        ValidationReport report = validate(timerSource());

        assertThat(report.diagnostics()).singleElement()
            .satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
                assertThat(d.message()).contains("'s'", "'min'");
            });
    }

    @Test
    void validate_differentUnitsWithUnitCheckOff_isValid() {
        CompositeBlock block = build(timerSource());

        ValidationReport report = new SemanticValidator(new ValidationOptions(false)).validate(block);

        assertThat(report.isValid()).isTrue();
    }

    private String timerSource() {
        return """
            block Elapsed
              %s u;
              %s y(unit="min");
              %sLogical.Timer tim;
            equation
              connect(u, tim.u);
              connect(tim.y, y);
            end Elapsed;
            """.formatted(BOOLEAN_INPUT, REAL_OUTPUT, CDL);
    }

    @Test
    void validate_feedbackThroughFeedthroughBlocks_reportsAlgebraicLoop() {
        ValidationReport report = validate("""
            block Loop
              %sReals.Abs loop1;
              %sReals.Abs loop2;
            equation
              connect(loop1.y, loop2.u);
              connect(loop2.y, loop1.u);
            end Loop;
            """.formatted(CDL, CDL));

        assertThat(report.diagnostics()).singleElement()
            .satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.ALGEBRAIC_LOOP);
                assertThat(d.subjects()).containsExactly("loop1.y", "loop2.u", "loop2.y", "loop1.u");
            });
    }

    @Test
    void validate_feedbackThroughUnitDelay_isValid() {
        ValidationReport report = validate("""
            block Delayed
              %s y;
              %sReals.Abs abs1;
              %sDiscrete.UnitDelay del(samplePeriod=60);
            equation
              connect(abs1.y, del.u);
              connect(del.y, abs1.u);
              connect(abs1.y, y);
            end Delayed;
            """.formatted(REAL_OUTPUT, CDL, CDL));

        assertThat(report.isValid()).isTrue();
    }

    @Test
    void validate_selfLoopOnFeedthroughBlock_reportsAlgebraicLoop() {
        ValidationReport report = validate("""
            block Self
              %sReals.Abs abs1;
            equation
              connect(abs1.y, abs1.u);
            end Self;
            """.formatted(CDL));

        assertThat(report.diagnostics(ErrorKind.ALGEBRAIC_LOOP)).singleElement()
            .satisfies(d -> assertThat(d.subjects()).containsExactly("abs1.y", "abs1.u"));
    }

    @Test
    void validate_reportsEveryViolation() {
        ValidationReport report = validate("""
            block Broken
              %s y;
              %sReals.Abs loop1;
              %sReals.Abs loop2;
              %sReals.Abs idle;
            equation
              connect(loop1.y, loop2.u);
              connect(loop2.y, loop1.u);
            end Broken;
            """.formatted(REAL_OUTPUT, CDL, CDL, CDL));

        assertThat(report.diagnostics()).extracting(Diagnostic::kind)
            .containsExactlyInAnyOrder(ErrorKind.UNCONNECTED_INPUT, ErrorKind.UNCONNECTED_INPUT,
                ErrorKind.ALGEBRAIC_LOOP);
        assertThat(report.diagnostics()).allSatisfy(d -> assertThat(d.scope()).isEqualTo("Broken"));
        assertThat(report.diagnostics(ErrorKind.UNCONNECTED_INPUT))
            .flatExtracting(Diagnostic::subjects)
            .containsExactly("y", "idle.u");
    }
}
