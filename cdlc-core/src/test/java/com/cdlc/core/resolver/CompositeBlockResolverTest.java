package com.cdlc.core.resolver;

import com.cdlc.core.CdlTestBase;
import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.diagnostics.Diagnostic;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.model.BlockKind;
import com.cdlc.core.model.BlockType;
import com.cdlc.core.model.CompositeBlock;
import com.cdlc.core.model.DirectDependency;
import com.cdlc.core.validation.ValidationOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for {@link CompositeBlockResolver}.
 */
class CompositeBlockResolverTest extends CdlTestBase {

    private CompositeBlockResolver resolver;

    @BeforeEach
    void setUpResolver() {
        resolver = new CompositeBlockResolver(symbols, new FileSystemSourceProvider(List.of(tempDir)),
            ValidationOptions.defaults());
    }

    @Test
    void resolveComposite_nestedComposite_compilesAndRegistersBoth() throws IOException {
        // Given
        createLibraryClass("MyLib.Gain2", gain2());
        createLibraryClass("MyLib.Outer", """
            within MyLib;
            block Outer
              %s u;
              %s y;
              MyLib.Gain2 g;
            equation
              connect(u, g.u);
              connect(g.y, y);
            end Outer;
            """.formatted(REAL_INPUT, REAL_OUTPUT));

        // When
        CompositeBlock outer = resolver.resolveComposite("MyLib.Outer");

        // Then
        assertThat(outer.instance("g").orElseThrow().type().kind()).isEqualTo(BlockKind.COMPOSITE);
        assertThat(outer.sourcePath()).isEqualTo("MyLib/Outer.mo");
        assertThat(symbols.compositeNames()).containsExactlyInAnyOrder("MyLib.Gain2", "MyLib.Outer");
    }

    @Test
    void resolveComposite_calledTwice_returnsSameBody() throws IOException {
        createLibraryClass("MyLib.Gain2", gain2());

        CompositeBlock first = resolver.resolveComposite("MyLib.Gain2");
        CompositeBlock second = resolver.resolveComposite("MyLib.Gain2");

        assertThat(second).isSameAs(first);
    }

    @Test
    void resolveComposite_derivesDirectDependencies() throws IOException {
        createLibraryClass("MyLib.Gain2", gain2());
        createLibraryClass("MyLib.Delayed", """
            within MyLib;
            block Delayed
              %s u;
              %s y;
              %sDiscrete.UnitDelay del(samplePeriod=1);
            equation
              connect(u, del.u);
              connect(del.y, y);
            end Delayed;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL));

        resolver.resolveComposite("MyLib.Gain2");
        resolver.resolveComposite("MyLib.Delayed");

        assertThat(symbols.lookup("MyLib.Gain2").orElseThrow().directDependencies())
            .containsExactly(new DirectDependency("y", "u"));
        assertThat(symbols.lookup("MyLib.Delayed").orElseThrow().directDependencies()).isEmpty();
    }

    @Test
    void resolveComposite_delayInsideComposite_breaksLoopOneLevelUp() throws IOException {
        createLibraryClass("MyLib.Delayed", """
            within MyLib;
            block Delayed
              %s u;
              %s y;
              %sDiscrete.UnitDelay del(samplePeriod=1);
            equation
              connect(u, del.u);
              connect(del.y, y);
            end Delayed;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL));
        createLibraryClass("MyLib.Feedback", """
            within MyLib;
            block Feedback
              %s y;
              %sReals.Abs abs1;
              MyLib.Delayed del;
            equation
              connect(abs1.y, del.u);
              connect(del.y, abs1.u);
              connect(abs1.y, y);
            end Feedback;
            """.formatted(REAL_OUTPUT, CDL));

        CompositeBlock feedback = resolver.resolveComposite("MyLib.Feedback");

        assertThat(feedback.instances()).hasSize(2);
    }

    @Test
    void resolveComposite_infersUnitsFromInnerConnectors() throws IOException {
        createLibraryClass("MyLib.Elapsed", """
            within MyLib;
            block Elapsed
              %s u;
              %s y;
              %sLogical.Timer tim;
            equation
              connect(u, tim.u);
              connect(tim.y, y);
            end Elapsed;
            """.formatted(BOOLEAN_INPUT, REAL_OUTPUT, CDL));

        resolver.resolveComposite("MyLib.Elapsed");

        BlockType type = symbols.lookup("MyLib.Elapsed").orElseThrow();
        assertThat(type.connector("y").orElseThrow().unit()).isEqualTo("s");
        assertThat(type.connector("y").orElseThrow().quantity()).isEqualTo("Time");
        assertThat(type.connector("u").orElseThrow().unit()).isNull();
    }

    @Test
    void resolveComposite_fileDeclaresOtherName_reportsStorageConvention() throws IOException {
        createLibraryClass("MyLib.Wrong", """
            within MyLib;
            block Other
            end Other;
            """);

        CdlException e = catchThrowableOfType(() -> resolver.resolveComposite("MyLib.Wrong"), CdlException.class);

        assertThat(e.kind()).isEqualTo(ErrorKind.STORAGE_CONVENTION);
        assertThat(e.getDiagnostics().get(0).subjects()).containsExactly("MyLib.Other", "MyLib.Wrong");
        assertThat(symbols.lookup("MyLib.Wrong")).isEmpty();
    }

    @Test
    void resolveComposite_missingWithinClause_reportsStorageConvention() throws IOException {
        createLibraryClass("MyLib.Loose", """
            block Loose
            end Loose;
            """);

        CdlException e = catchThrowableOfType(() -> resolver.resolveComposite("MyLib.Loose"), CdlException.class);

        assertThat(e.kind()).isEqualTo(ErrorKind.STORAGE_CONVENTION);
    }

    @Test
    void resolveComposite_invalidBlock_isNotRegisteredAndCompilesAgainAfterFix() throws IOException {
        // Given
        createLibraryClass("MyLib.Gain2", """
            within MyLib;
            block Gain2
              %s u;
              %s y;
              %sReals.MultiplyByParameter gain(k=2);
            equation
              connect(gain.y, y);
            end Gain2;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL));

        // When
        CdlException e = catchThrowableOfType(() -> resolver.resolveComposite("MyLib.Gain2"), CdlException.class);

        // Then
        assertThat(e.getDiagnostics()).singleElement()
            .satisfies(d -> {
                assertThat(d.kind()).isEqualTo(ErrorKind.UNCONNECTED_INPUT);
                assertThat(d.scope()).isEqualTo("MyLib.Gain2");
                assertThat(d.location().file()).isEqualTo("MyLib/Gain2.mo");
            });
        assertThat(symbols.lookup("MyLib.Gain2")).isEmpty();

        createLibraryClass("MyLib.Gain2", gain2());
        assertThat(resolver.resolveComposite("MyLib.Gain2").instances()).hasSize(1);
    }

    @Test
    void resolveComposite_selfInstantiation_reportsCyclicImport() throws IOException {
        createLibraryClass("MyLib.Self", """
            within MyLib;
            block Self
              MyLib.Self nested;
            end Self;
            """);

        CdlException e = catchThrowableOfType(() -> resolver.resolveComposite("MyLib.Self"), CdlException.class);

        assertThat(e.kind()).isEqualTo(ErrorKind.CYCLIC_IMPORT);
        assertThat(e.getDiagnostics().get(0).subjects()).containsExactly("MyLib.Self", "MyLib.Self");
    }

    @Test
    void resolveComposite_mutualInstantiation_reportsCyclicImport() throws IOException {
        createLibraryClass("MyLib.A", """
            within MyLib;
            block A
              MyLib.B b;
            end A;
            """);
        createLibraryClass("MyLib.B", """
            within MyLib;
            block B
              MyLib.A a;
            end B;
            """);

        CdlException e = catchThrowableOfType(() -> resolver.resolveComposite("MyLib.A"), CdlException.class);

        assertThat(e.getDiagnostics()).extracting(Diagnostic::kind).containsOnly(ErrorKind.CYCLIC_IMPORT);
        assertThat(e.getDiagnostics().get(0).subjects()).containsExactly("MyLib.A", "MyLib.B", "MyLib.A");
        assertThat(symbols.compositeNames()).isEmpty();
    }

    @Test
    void resolveComposite_unknownName_reportsUnknownBlock() {
        CdlException e = catchThrowableOfType(() -> resolver.resolveComposite("MyLib.Missing"), CdlException.class);

        assertThat(e.kind()).isEqualTo(ErrorKind.UNKNOWN_BLOCK);
    }

    @Test
    void resolveComposite_elementaryName_reportsUnknownBlock() {
        CdlException e = catchThrowableOfType(() -> resolver.resolveComposite(CDL + "Reals.Abs"), CdlException.class);

        assertThat(e.kind()).isEqualTo(ErrorKind.UNKNOWN_BLOCK);
        assertThat(e.getMessage()).contains("elementary");
    }

    @Test
    void loadFile_fileBelowRoot_compilesDeclaredBlock() throws IOException {
        Path file = createLibraryClass("MyLib.Gain2", gain2());

        CompositeBlock block = resolver.loadFile(tempDir, file);

        assertThat(block.qualifiedName()).isEqualTo("MyLib.Gain2");
        assertThat(symbols.compositeBlock("MyLib.Gain2")).containsSame(block);
    }

    @Test
    void loadFile_fileOutsideRoot_reportsStorageConvention() throws IOException {
        Path file = createFile("other/Gain2.mo", gain2());

        CdlException e = catchThrowableOfType(() -> resolver.loadFile(tempDir.resolve("lib"), file),
            CdlException.class);

        assertThat(e.kind()).isEqualTo(ErrorKind.STORAGE_CONVENTION);
    }

    private static String gain2() {
        return """
            within MyLib;
            block Gain2 "Doubles its input"
              parameter Real k = 2;
              %s u;
              %s y;
              %sReals.MultiplyByParameter gain(k=k);
            equation
              connect(u, gain.u);
              connect(gain.y, y);
            end Gain2;
            """.formatted(REAL_INPUT, REAL_OUTPUT, CDL);
    }
}
