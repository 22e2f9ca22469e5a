package com.cdlc.core.builder;

import com.cdlc.core.CdlTestBase;
import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.diagnostics.Diagnostic;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.expr.EnumValue;
import com.cdlc.core.model.BindingOrigin;
import com.cdlc.core.model.CompositeBlock;
import com.cdlc.core.model.Connection;
import com.cdlc.core.model.ConnectorRef;
import com.cdlc.core.model.Direction;
import com.cdlc.core.model.Instance;
import com.cdlc.core.model.ParameterBinding;
import com.cdlc.core.validation.SemanticValidator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link ModelBuilder}.
 */
class ModelBuilderTest extends CdlTestBase {

    @Test
    void build_gainChain_resolvesInstancesAndConnections() {
        // Given
        String source = """
            within MyLib;
            block Chain "Scaled absolute value"
              parameter Real p = 1.5 "Scale";
              %s u(unit="K");
              %s y;
              %sReals.MultiplyByParameter gain(k=2*p) "Gain";
              %sReals.Abs maxValue;
            equation
              connect(u, gain.u);
              connect(gain.y, maxValue.u);
              connect(maxValue.y, y);
            end Chain;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL, CDL);

        // When
        CompositeBlock block = build(source);

        // Then
        assertThat(block.qualifiedName()).isEqualTo("MyLib.Chain");
        assertThat(block.documentation()).isEqualTo("Scaled absolute value");
        assertThat(block.connector("u")).get()
            .satisfies(u -> {
                assertThat(u.direction()).isEqualTo(Direction.INPUT);
                assertThat(u.unit()).isEqualTo("K");
            });
        assertThat(block.instances()).extracting(Instance::name).containsExactly("gain", "maxValue");
        assertThat(block.instance("gain").orElseThrow().documentation()).isEqualTo("Gain");
        assertThat(block.connections()).extracting(Connection::source, Connection::sink)
            .containsExactly(
                tuple(ConnectorRef.own("u"), ConnectorRef.of("gain", "u")),
                tuple(ConnectorRef.of("gain", "y"), ConnectorRef.of("maxValue", "u")),
                tuple(ConnectorRef.of("maxValue", "y"), ConnectorRef.own("y")));
    }

    @Test
    void build_explicitBinding_isEvaluatedInEnclosingScope() {
        CompositeBlock block = build("""
            block Scaled
              parameter Real p = 1.5;
              %sReals.MultiplyByParameter gain(k=2*p);
            end Scaled;
            """.formatted(CDL));

        ParameterBinding k = block.instance("gain").orElseThrow().binding("k").orElseThrow();

        assertThat(k.origin()).isEqualTo(BindingOrigin.EXPLICIT);
        assertThat(k.expression().toSource()).isEqualTo("(2 * p)");
        assertThat(k.value()).isEqualTo(3.0);
    }

    @Test
    void build_instanceAndParameterNamedLikeClockOperators_areOrdinaryDeclarations() {
        CompositeBlock block = build("""
            block Timing
              parameter Real interval(unit="s") = 60;
              %s u;
              %s y;
              %sReals.MultiplyByParameter sample(k=interval);
            equation
              connect(u, sample.u);
              connect(sample.y, y);
            end Timing;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL));

        assertThat(block.parameterBindings()).singleElement().satisfies(interval ->
            assertThat(interval.value()).isEqualTo(60.0));
        assertThat(block.instance("sample").orElseThrow().binding("k").orElseThrow().value()).isEqualTo(60.0);
        assertThat(block.connections()).hasSize(2);
        assertThat(new SemanticValidator().validate(block).isValid()).isTrue();
    }

    @Test
    void build_partialModification_leavesOtherParametersUnbound() {
        CompositeBlock block = build("""
            block Bounded
              %sReals.Limiter lim(uMax=1);
            end Bounded;
            """.formatted(CDL));

        Instance lim = block.instance("lim").orElseThrow();

        assertThat(lim.binding("uMax").orElseThrow().origin()).isEqualTo(BindingOrigin.EXPLICIT);
        assertThat(lim.binding("uMax").orElseThrow().value()).isEqualTo(1.0);
        assertThat(lim.binding("uMin").orElseThrow().origin()).isEqualTo(BindingOrigin.UNBOUND);
    }

    @Test
    void build_parameterWithoutValue_isUnboundNotAnError() {
        CompositeBlock block = build("""
            block Delay
              %sDiscrete.UnitDelay del;
            end Delay;
            """.formatted(CDL));

        ParameterBinding samplePeriod = block.instance("del").orElseThrow().binding("samplePeriod").orElseThrow();

        assertThat(samplePeriod.origin()).isEqualTo(BindingOrigin.UNBOUND);
        assertThat(samplePeriod.hasValue()).isFalse();
    }

    @Test
    void build_enumerationDefault_resolvesToLiteral() {
        CompositeBlock block = build("""
            block Loop
              %sReals.PID conPID;
              %sReals.PID conP(controllerType=Buildings.Controls.OBC.CDL.Types.SimpleController.P);
            end Loop;
            """.formatted(CDL, CDL));

        ParameterBinding defaulted = block.instance("conPID").orElseThrow().binding("controllerType").orElseThrow();
        assertThat(defaulted.origin()).isEqualTo(BindingOrigin.DEFAULT);
        assertThat(defaulted.value()).isEqualTo(new EnumValue(CDL + "Types.SimpleController", "PI"));
        assertThat(block.instance("conP").orElseThrow().binding("controllerType").orElseThrow().value())
            .isEqualTo(new EnumValue(CDL + "Types.SimpleController", "P"));
    }

    @Test
    void build_enumerationParameterOfComposite_usesCatalogType() {
        CompositeBlock block = build("""
            block Loop
              parameter Buildings.Controls.OBC.CDL.Types.SimpleController controller = Buildings.Controls.OBC.CDL.Types.SimpleController.PI;
              %sReals.PID con(controllerType=controller);
            end Loop;
            """.formatted(CDL));

        assertThat(block.parameters()).singleElement()
            .satisfies(p -> assertThat(p.enumerationType()).isEqualTo(CDL + "Types.SimpleController"));
        assertThat(block.instance("con").orElseThrow().binding("controllerType").orElseThrow().value())
            .isEqualTo(new EnumValue(CDL + "Types.SimpleController", "PI"));
    }

    @Test
    void build_arrayConnectorSizedByParameter_evaluatesSize() {
        CompositeBlock block = build("""
            block Fanout
              parameter Integer n = 3;
              %s u;
              %s y[n];
              %sRouting.RealScalarReplicator rep(nout=n);
            equation
              connect(u, rep.u);
              connect(rep.y, y);
            end Fanout;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL));

        assertThat(block.arraySize("y")).contains(3);
        assertThat(block.instance("rep").orElseThrow().arraySize("y")).contains(3);
        assertThat(block.connections()).extracting(Connection::source, Connection::sink)
            .contains(tuple(ConnectorRef.of("rep", "y"), ConnectorRef.own("y")));
    }

    @Test
    void build_arrayElementConnection_keepsIndex() {
        CompositeBlock block = build("""
            block Pick
              %s u;
              %s y;
              %sReals.MultiSum sum(nin=2);
            equation
              connect(u, sum.u[1]);
              connect(u, sum.u[2]);
              connect(sum.y, y);
            end Pick;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL));

        assertThat(block.connections()).extracting(Connection::sink)
            .contains(ConnectorRef.of("sum", "u").element(1), ConnectorRef.of("sum", "u").element(2));
    }

    @Test
    void build_unknownParameterModification_reportsUnknownParameter() {
        CdlException e = buildFailure("""
            block Bad
              %sReals.MultiplyByParameter gain(gain=2);
            end Bad;
            """.formatted(CDL));

        assertThat(e.getDiagnostics()).singleElement()
            .satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.UNKNOWN_PARAMETER);
                assertThat(d.subjects()).containsExactly("gain.gain");
                assertThat(d.scope()).isEqualTo("Bad");
                assertThat(d.location().line()).isEqualTo(2);
            });
    }

    @Test
    void build_unknownNameInBinding_reportsUnknownParameter() {
        CdlException e = buildFailure("""
            block Bad
              %sReals.MultiplyByParameter gain(k=missing);
            end Bad;
            """.formatted(CDL));

        assertThat(e.kind()).isEqualTo(ErrorKind.UNKNOWN_PARAMETER);
    }

    @Test
    void build_bindingOfWrongType_reportsTypeMismatch() {
        CdlException e = buildFailure("""
            block Bad
              %sReals.MultiplyByParameter gain(k=true);
            end Bad;
            """.formatted(CDL));

        assertThat(e.kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
        assertThat(e.getDiagnostics().get(0).subjects()).containsExactly("gain.k");
    }

    @Test
    void build_duplicateInstanceName_reportsDuplicate() {
        CdlException e = buildFailure("""
            block Bad
              %sReals.Abs abs1;
              %sReals.Add abs1;
            end Bad;
            """.formatted(CDL, CDL));

        assertThat(e.kind()).isEqualTo(ErrorKind.DUPLICATE_INSTANCE_NAME);
        assertThat(e.getDiagnostics().get(0).location().line()).isEqualTo(3);
    }

    @Test
    void build_unknownBlockType_reportsUnknownBlock() {
        CdlException e = buildFailure("""
            block Bad
              %sReals.DoesNotExist thing;
            end Bad;
            """.formatted(CDL));

        Diagnostic diagnostic = e.getDiagnostics().get(0);
        assertThat(diagnostic.kind()).isEqualTo(ErrorKind.UNKNOWN_BLOCK);
        assertThat(diagnostic.scope()).isEqualTo("Bad");
        assertThat(diagnostic.location()).isNotNull();
    }

    @Test
    void build_unknownConnector_reportsUnknownConnector() {
        CdlException e = buildFailure("""
            block Bad
              %s y;
              %sReals.Abs abs1;
            equation
              connect(abs1.out, y);
            end Bad;
            """.formatted(REAL_OUTPUT, CDL));

        assertThat(e.kind()).isEqualTo(ErrorKind.UNKNOWN_CONNECTOR);
        assertThat(e.getDiagnostics().get(0).subjects()).containsExactly("abs1.out");
    }

    @Test
    void build_connectTwoOutputs_reportsInvalidDirection() {
        CdlException e = buildFailure("""
            block Bad
              %sReals.Abs a;
              %sReals.Abs b;
            equation
              connect(a.y, b.y);
            end Bad;
            """.formatted(CDL, CDL));

        assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_CONNECTION_DIRECTION);
        assertThat(e.getDiagnostics().get(0).subjects()).containsExactly("a.y", "b.y");
    }

    @Test
    void build_connectTwoOwnInputs_reportsInvalidDirection() {
        CdlException e = buildFailure("""
            block Bad
              %s u1;
              %s u2;
            equation
              connect(u1, u2);
            end Bad;
            """.formatted(REAL_INPUT, REAL_INPUT));

        assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_CONNECTION_DIRECTION);
    }

    @Test
    void build_arraysOfDifferentSize_reportsDimensionMismatch() {
        CdlException e = buildFailure("""
            block Bad
              %s y[2];
              %sRouting.RealScalarReplicator rep(nout=3);
            equation
              connect(rep.y, y);
            end Bad;
            """.formatted(REAL_OUTPUT, CDL));

        assertThat(e.kind()).isEqualTo(ErrorKind.ARRAY_DIMENSION_MISMATCH);
    }

    @Test
    void build_subscriptOutOfRange_reportsDimensionMismatch() {
        CdlException e = buildFailure("""
            block Bad
              %s u;
              %sReals.MultiSum sum(nin=2);
            equation
              connect(u, sum.u[3]);
            end Bad;
            """.formatted(REAL_INPUT, CDL));

        assertThat(e.kind()).isEqualTo(ErrorKind.ARRAY_DIMENSION_MISMATCH);
        assertThat(e.getDiagnostics().get(0).subjects()).containsExactly("sum.u[3]");
    }

    @Test
    void build_dimensionWithoutValue_reportsUnresolvedDimension() {
        CdlException e = buildFailure("""
            block Bad
              %sRouting.RealScalarReplicator rep;
            end Bad;
            """.formatted(CDL));

        assertThat(e.kind()).isEqualTo(ErrorKind.UNRESOLVED_DIMENSION);
        assertThat(e.getDiagnostics().get(0).subjects()).containsExactly("rep.y");
    }

    @Test
    void build_conditionalInstance_reportsUnsupportedConstruct() {
        CdlException e = buildFailure("""
            block Bad
              parameter Boolean use = true;
              %sReals.Abs abs1 if use;
            end Bad;
            """.formatted(CDL));

        assertThat(e.kind()).isEqualTo(ErrorKind.UNSUPPORTED_CONSTRUCT);
        assertThat(e.getDiagnostics().get(0).subjects()).containsExactly("abs1");
    }

    @Test
    void build_integerOverflowInBinding_isReportedNotWrapped() {
        CdlException e = buildFailure("""
            block Big
              parameter Integer n = 65536 * 65536;
              parameter Integer m = 2147483647 + 1;
            end Big;
            """);

        assertThat(e.getDiagnostics())
            .extracting(Diagnostic::kind, d -> d.subjects().get(0))
            .containsExactly(
                tuple(ErrorKind.UNSUPPORTED_CONSTRUCT, "n"),
                tuple(ErrorKind.UNSUPPORTED_CONSTRUCT, "m"));
        assertThat(e.getDiagnostics().get(0).message()).contains("Integer overflow");
    }

    @Test
    void build_variableDeclaration_reportsUnsupportedConstruct() {
        CdlException e = buildFailure("""
            block Bad
              Real x;
            end Bad;
            """);

        assertThat(e.kind()).isEqualTo(ErrorKind.UNSUPPORTED_CONSTRUCT);
    }

    @Test
    void build_severalErrors_reportsAllOfThem() {
        CdlException e = buildFailure("""
            block Bad
              %sReals.DoesNotExist thing;
              %sReals.MultiplyByParameter gain(gain=2);
            end Bad;
            """.formatted(CDL, CDL));

        assertThat(e.getDiagnostics()).extracting(Diagnostic::kind)
            .containsExactly(ErrorKind.UNKNOWN_BLOCK, ErrorKind.UNKNOWN_PARAMETER);
    }
}
