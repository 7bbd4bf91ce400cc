package com.terradrift.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the drift engine.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are immutable records</li>
 *   <li>The comparison engine only sees normalized values</li>
 *   <li>Renderers and sources are reached through their interfaces</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.terradrift.core");
    }

    /**
     * Verifies all domain models in the model package are records, apart from enums and the
     * sealed {@code ConfigValue} interface.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the model layer depends on nothing else in the project.
     */
    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..compare..", "..source..", "..renderer..", "..orchestration..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies the comparison engine is independent of where values come from and where reports go.
     */
    @Test
    void compare_shouldNotDependOnSourcesOrOutput() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..compare..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..source..", "..renderer..", "..orchestration..", "..config..", "software.amazon.awssdk..");

        rule.check(classes);
    }

    /**
     * Verifies the AWS SDK stays behind the live fetcher.
     */
    @Test
    void awsSdk_shouldOnlyBeUsedBySourceAws() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..source.aws..")
            .should().dependOnClassesThat().resideInAPackage("software.amazon.awssdk..");

        rule.check(classes);
    }

    /**
     * Verifies the orchestrator only knows sources through their interfaces.
     */
    @Test
    void orchestration_shouldNotDependOnSourceImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..orchestration..")
            .should().dependOnClassesThat().resideInAnyPackage("..source.aws..", "..source.terraform..");

        rule.check(classes);
    }

    /**
     * Verifies renderer implementations are reached through the ServiceLoader SPI.
     */
    @Test
    void rendererImplementations_shouldImplementReportRenderer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..renderer.impl..")
            .and().areTopLevelClasses()
            .should().implement("com.terradrift.core.renderer.ReportRenderer");

        rule.check(classes);
    }
}
