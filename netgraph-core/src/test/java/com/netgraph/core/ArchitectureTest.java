package com.netgraph.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests for package boundaries.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are immutable records or enums</li>
 *   <li>The model package depends on nothing else in the project</li>
 *   <li>Parsing does not reach into output or exchange code</li>
 *   <li>Generators and renderers implement their SPI and live in impl packages</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.netgraph.core");
    }

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
    void models_shouldNotDependOnOtherProjectPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.parser..", "..core.codec..", "..core.generator..", "..core.renderer..",
                "..core.validator..", "..core.compare..", "..core.config..", "..core.pipeline..");

        rule.check(classes);
    }

    @Test
    void parser_shouldNotDependOnOutputPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.parser..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.generator..", "..core.codec..", "..core.renderer..", "..core.pipeline..");

        rule.check(classes);
    }

    @Test
    void generators_shouldImplementSpiInImplPackage() {
        ArchRule rule = classes()
            .that().resideInAPackage("..generator.impl..")
            .and().haveSimpleNameEndingWith("Generator")
            .should().implement("com.netgraph.core.generator.NetlistGenerator");

        rule.check(classes);
    }

    @Test
    void renderers_shouldImplementSpiInImplPackage() {
        ArchRule rule = classes()
            .that().resideInAPackage("..renderer.impl..")
            .and().haveSimpleNameEndingWith("Renderer")
            .should().implement("com.netgraph.core.renderer.OutputRenderer");

        rule.check(classes);
    }
}
