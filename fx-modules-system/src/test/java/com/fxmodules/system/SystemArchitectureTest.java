package com.fxmodules.system;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit rules for the lifecycle module.
 */
class SystemArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.fxmodules.system");
    }

    @Test
    void exceptions_shouldExtendFxException() {
        ArchRule rule = classes()
            .that().haveSimpleNameEndingWith("Exception")
            .should().beAssignableTo("com.fxmodules.core.error.FxException");

        rule.check(classes);
    }

    /**
     * Verifies the lifecycle manager works on the declarative graph only, never on autowire internals.
     */
    @Test
    void lifecycle_shouldOnlyUseGraphModel() {
        ArchRule rule = noClasses()
            .that().haveSimpleNameStartingWith("SystemLifecycle")
            .or().haveSimpleNameStartingWith("RunningSystem")
            .should().dependOnClassesThat().resideInAnyPackage(
                "com.fxmodules.core.autowire..", "com.fxmodules.core.entity..", "com.fxmodules.core.config..");

        rule.check(classes);
    }
}
