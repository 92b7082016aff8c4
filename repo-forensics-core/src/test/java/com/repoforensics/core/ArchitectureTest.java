package com.repoforensics.core;

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
 *   <li>Source loaders extend the shared base class</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Base classes don't depend on implementations</li>
 *   <li>The engine does not know about report formats or renderers</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.repoforensics.core");
    }

    /**
     * Verifies all loader implementations extend AbstractSourceLoader, directly or through
     * the CSV and JSON base classes.
     */
    @Test
    void loaders_shouldExtendAbstractSourceLoader() {
        ArchRule rule = classes()
            .that().resideInAPackage("..source.impl..")
            .and().haveSimpleNameEndingWith("Loader")
            .should().beAssignableTo("com.repoforensics.core.source.base.AbstractSourceLoader");

        rule.check(classes);
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
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void baseLoaders_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..source.base..")
            .should().dependOnClassesThat().resideInAPackage("..source.impl..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomainPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..engine..", "..source..", "..report..");

        rule.check(classes);
    }

    /**
     * Verifies the engine produces results without depending on report generators or renderers.
     */
    @Test
    void engine_shouldNotDependOnOutputPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..engine..")
            .should().dependOnClassesThat().resideInAnyPackage("..report..", "..renderer..");

        rule.check(classes);
    }

    /**
     * Verifies model layer has no dependencies on loaders, the engine or output packages.
     */
    @Test
    void models_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage("..engine..", "..source..", "..report..", "..renderer..");

        rule.check(classes);
    }
}
