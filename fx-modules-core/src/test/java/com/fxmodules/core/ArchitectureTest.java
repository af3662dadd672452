package com.fxmodules.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate package boundaries of the core module.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Exceptions share the {@code FxException} root</li>
 *   <li>Graph model types are immutable records</li>
 *   <li>The entity and autowire subsystems stay independent of each other</li>
 *   <li>Low-level packages don't depend on the subsystems built on them</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.fxmodules.core");
    }

    /**
     * Verifies every exception extends FxException so callers can catch one type at the boundary.
     */
    @Test
    void exceptions_shouldExtendFxException() {
        ArchRule rule = classes()
            .that().haveSimpleNameEndingWith("Exception")
            .should().beAssignableTo("com.fxmodules.core.error.FxException");

        rule.check(classes);
    }

    /**
     * Verifies graph model classes are records; handlers are the only interfaces.
     */
    @Test
    void graphModel_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..graph..")
            .and().areTopLevelClasses()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void graph_shouldNotDependOnSubsystems() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..graph..")
            .should().dependOnClassesThat().resideInAnyPackage("..entity..", "..autowire..", "..config..");

        rule.check(classes);
    }

    @Test
    void autowire_shouldNotDependOnEntities() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..autowire..")
            .should().dependOnClassesThat().resideInAnyPackage("..entity..", "..config..");

        rule.check(classes);
    }

    @Test
    void entities_shouldNotDependOnAutowire() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..entity..")
            .should().dependOnClassesThat().resideInAnyPackage("..autowire..", "..config..", "..repo..");

        rule.check(classes);
    }

    /**
     * Verifies the error and util packages stay at the bottom of the dependency graph.
     */
    @Test
    void errorAndUtil_shouldNotDependOnDomainPackages() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..error..", "..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..entity..", "..graph..", "..autowire..", "..config..", "..repo..");

        rule.check(classes);
    }
}
