package com.cdlc.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The model, diagnostics and parser layers stay free of compiler stages</li>
 *   <li>Validation works on built models only</li>
 *   <li>Catalog providers follow the naming convention of the SPI</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.cdlc.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnCompilerStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..parser..", "..catalog..", "..builder..", "..validation..", "..resolver..", "..tags..", "..export..");

        rule.check(classes);
    }

    /**
     * Diagnostics are shared by every stage and must not depend on any of them.
     */
    @Test
    void diagnostics_shouldNotDependOnOtherPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..diagnostics..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..model..", "..parser..", "..catalog..", "..builder..", "..validation..", "..resolver..");

        rule.check(classes);
    }

    @Test
    void parser_shouldNotDependOnLaterStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..parser..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..catalog..", "..builder..", "..validation..", "..resolver..");

        rule.check(classes);
    }

    /**
     * Verifies the validator only sees built models, never source text or the library.
     */
    @Test
    void validation_shouldNotDependOnParserOrResolver() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..validation..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..parser..", "..ast..", "..builder..", "..resolver..", "..catalog..");

        rule.check(classes);
    }

    @Test
    void catalogProviders_shouldBeNamedAfterTheSpi() {
        ArchRule rule = classes()
            .that().implement("com.cdlc.core.catalog.CatalogProvider")
            .should().haveSimpleNameEndingWith("CatalogProvider");

        rule.check(classes);
    }
}
