package com.storesync;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Keeps package boundaries: the resilience and diff cores know nothing about the remote API,
 * and only config and cli see the whole application.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.storesync");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..resilience..", "..batch..", "..diff..",
                        "..reconcile..", "..remote..", "..deploy..", "..desired..", "..cli..", "..config..");
        rule.check(classes);
    }

    @Test
    void domain_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..resilience..", "..batch..", "..diff..",
                        "..reconcile..", "..remote..", "..deploy..", "..desired..", "..cli..", "..config..");
        rule.check(classes);
    }

    @Test
    void resilience_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..resilience..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..batch..", "..diff..",
                        "..reconcile..", "..remote..", "..deploy..", "..desired..", "..cli..", "..config..");
        rule.check(classes);
    }

    @Test
    void batch_must_not_depend_on_entities_or_remote() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..batch..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..diff..",
                        "..reconcile..", "..remote..", "..deploy..", "..cli..", "..config..");
        rule.check(classes);
    }

    @Test
    void diff_must_not_depend_on_resilience_or_remote() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..diff..")
                .should().dependOnClassesThat().resideInAnyPackage("..resilience..", "..batch..",
                        "..reconcile..", "..remote..", "..deploy..", "..cli..", "..config..");
        rule.check(classes);
    }

    @Test
    void reconcile_must_not_depend_on_remote_implementation() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..reconcile..")
                .should().dependOnClassesThat().resideInAnyPackage("..remote..", "..deploy..", "..cli..", "..config..");
        rule.check(classes);
    }

    @Test
    void deploy_must_not_depend_on_remote_or_cli() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..deploy..")
                .should().dependOnClassesThat().resideInAnyPackage("..remote..", "..cli..", "..config..");
        rule.check(classes);
    }

    @Test
    void config_must_not_depend_on_cli() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..config..")
                .should().dependOnClassesThat().resideInAPackage("..cli..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.storesync.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
