package com.textdiagram.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate the pipeline layering.
 *
 * <p>Source flows parser to layout to renderer; engines wire the three stages together and
 * nothing below the engine package knows about engines.
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.textdiagram.core");
    }

    /**
     * Verifies all engine implementations extend AbstractDiagramEngine.
     */
    @Test
    void engines_shouldExtendAbstractDiagramEngine() {
        ArchRule rule = classes()
            .that().resideInAPackage("..engine.impl..")
            .and().haveSimpleNameEndingWith("Engine")
            .should().beAssignableTo("com.textdiagram.core.engine.AbstractDiagramEngine");

        rule.check(classes);
    }

    /**
     * Verifies the syntax trees in the model package are immutable records.
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

    @Test
    void models_shouldNotDependOnPipelineStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..parser..", "..layout..", "..renderer..", "..engine..");

        rule.check(classes);
    }

    @Test
    void parsers_shouldNotDependOnLaterStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..parser..")
            .should().dependOnClassesThat().resideInAnyPackage("..layout..", "..renderer..", "..engine..");

        rule.check(classes);
    }

    @Test
    void layouts_shouldNotDependOnRenderersOrEngines() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..layout..")
            .should().dependOnClassesThat().resideInAnyPackage("..renderer..", "..engine..", "..parser..");

        rule.check(classes);
    }

    @Test
    void renderers_shouldNotDependOnParsersOrEngines() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..renderer..")
            .should().dependOnClassesThat().resideInAnyPackage("..parser..", "..engine..");

        rule.check(classes);
    }

    /**
     * Verifies the canvas and text utilities stay free of diagram concepts.
     */
    @Test
    void canvasAndUtil_shouldNotDependOnDiagrams() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..canvas..", "..util..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..model..", "..parser..", "..layout..", "..renderer..", "..engine..");

        rule.check(classes);
    }
}
