package com.cdlc.core.resolver;

import com.cdlc.core.CdlTestBase;
import com.cdlc.core.model.Connection;
import com.cdlc.core.model.ConnectorRef;
import com.cdlc.core.model.FlatInstance;
import com.cdlc.core.model.FlatModel;
import com.cdlc.core.model.ParameterBinding;
import com.cdlc.core.validation.ValidationOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link Flattener}.
 */
class FlattenerTest extends CdlTestBase {

    private CompositeBlockResolver resolver;
    private Flattener flattener;

    @BeforeEach
    void setUpResolver() throws IOException {
        resolver = new CompositeBlockResolver(symbols, new FileSystemSourceProvider(List.of(tempDir)),
            ValidationOptions.defaults());
        flattener = new Flattener(symbols);
        createLibraryClass("MyLib.Gain2", """
            within MyLib;
            block Gain2
              parameter Real k = 2;
              %s u;
              %s y;
              %sReals.MultiplyByParameter gain(k=k);
            equation
              connect(u, gain.u);
              connect(gain.y, y);
            end Gain2;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL));
    }

    @Test
    void flatten_nestedComposite_replacesItWithItsBody() throws IOException {
        // Given
        createLibraryClass("MyLib.Outer", """
            within MyLib;
            block Outer
              parameter Real scale = 6;
              %s u;
              %s y;
              MyLib.Gain2 g(k=scale/2);
              %sReals.Abs abs1;
            equation
              connect(u, g.u);
              connect(g.y, abs1.u);
              connect(abs1.y, y);
            end Outer;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL));

        // When
        FlatModel model = flattener.flatten(resolver.resolveComposite("MyLib.Outer"));

        // Then
        assertThat(model.qualifiedName()).isEqualTo("MyLib.Outer");
        assertThat(model.instances()).extracting(FlatInstance::path, FlatInstance::type)
            .containsExactly(
                tuple("g.gain", CDL + "Reals.MultiplyByParameter"),
                tuple("abs1", CDL + "Reals.Abs"));
        assertThat(model.connections()).extracting(Connection::source, Connection::sink)
            .containsExactly(
                tuple(ConnectorRef.own("u"), ConnectorRef.of("g.gain", "u")),
                tuple(ConnectorRef.of("g.gain", "y"), ConnectorRef.of("abs1", "u")),
                tuple(ConnectorRef.of("abs1", "y"), ConnectorRef.own("y")));
    }

    @Test
    void flatten_bindingThroughComposite_isEvaluatedWithOuterValues() throws IOException {
        createLibraryClass("MyLib.Outer", """
            within MyLib;
            block Outer
              parameter Real scale = 6;
              %s u;
              %s y;
              MyLib.Gain2 g(k=scale/2);
              MyLib.Gain2 h;
            equation
              connect(u, g.u);
              connect(g.y, h.u);
              connect(h.y, y);
            end Outer;
            """.formatted(REAL_INPUT, REAL_OUTPUT));

        FlatModel model = flattener.flatten(resolver.resolveComposite("MyLib.Outer"));

        assertThat(gainOf(model, "g.gain")).isEqualTo(3.0);
        assertThat(gainOf(model, "h.gain")).isEqualTo(2.0);
        assertThat(model.connections()).extracting(Connection::source, Connection::sink)
            .contains(tuple(ConnectorRef.of("g.gain", "y"), ConnectorRef.of("h.gain", "u")));
    }

    @Test
    void flatten_wholeArrayConnection_isExpandedPerElement() throws IOException {
        createLibraryClass("MyLib.Spread", """
            within MyLib;
            block Spread
              %s u;
              %s y;
              %sRouting.RealScalarReplicator rep(nout=2);
              %sReals.MultiMax maxValue(nin=2);
            equation
              connect(u, rep.u);
              connect(rep.y, maxValue.u);
              connect(maxValue.y, y);
            end Spread;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL, CDL));

        FlatModel model = flattener.flatten(resolver.resolveComposite("MyLib.Spread"));

        assertThat(model.connections()).extracting(Connection::source, Connection::sink)
            .containsExactly(
                tuple(ConnectorRef.own("u"), ConnectorRef.of("rep", "u")),
                tuple(ConnectorRef.of("rep", "y").element(1), ConnectorRef.of("maxValue", "u").element(1)),
                tuple(ConnectorRef.of("rep", "y").element(2), ConnectorRef.of("maxValue", "u").element(2)),
                tuple(ConnectorRef.of("maxValue", "y"), ConnectorRef.own("y")));
    }

    @Test
    void flatten_elementaryOnlyBlock_keepsConnections() {
        FlatModel model = flattener.flatten(build("""
            block Chain
              %s u;
              %s y;
              %sReals.Abs abs1;
            equation
              connect(u, abs1.u);
              connect(abs1.y, y);
            end Chain;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL)));

        assertThat(model.instances()).extracting(FlatInstance::path).containsExactly("abs1");
        assertThat(model.connections()).hasSize(2);
        assertThat(model.connectors()).extracting("name").containsExactly("u", "y");
    }

    private static Object gainOf(FlatModel model, String path) {
        return model.instances().stream()
            .filter(i -> i.path().equals(path))
            .flatMap(i -> i.bindings().stream())
            .filter(b -> b.name().equals("k"))
            .map(ParameterBinding::value)
            .findFirst()
            .orElseThrow();
    }
}
