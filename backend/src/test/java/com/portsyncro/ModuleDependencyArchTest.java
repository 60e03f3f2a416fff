package com.portsyncro;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: domain and common at the bottom, pricing and valuation independent of each other,
 * snapshot composes them, api on top.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.portsyncro");
    }

    @Test
    void domain_must_not_depend_on_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..config..", "..api..", "..pricing..", "..valuation..", "..snapshot..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..config..", "..api..", "..pricing..", "..valuation..", "..snapshot..");
        rule.check(classes);
    }

    @Test
    void pricing_must_not_depend_on_valuation_snapshot_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..pricing..")
                .should().dependOnClassesThat().resideInAnyPackage("..valuation..", "..snapshot..", "..api..");
        rule.check(classes);
    }

    @Test
    void valuation_must_not_depend_on_pricing_snapshot_api_config() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..valuation..")
                .should().dependOnClassesThat().resideInAnyPackage("..pricing..", "..snapshot..", "..api..", "..config..");
        rule.check(classes);
    }

    @Test
    void snapshot_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..snapshot..")
                .should().dependOnClassesThat().resideInAPackage("..api..");
        rule.check(classes);
    }

    @Test
    void config_must_not_depend_on_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.portsyncro.config..")
                .should().dependOnClassesThat().resideInAnyPackage("com.portsyncro.pricing..", "com.portsyncro.valuation..",
                        "com.portsyncro.snapshot..", "com.portsyncro.api..", "com.portsyncro.domain..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.portsyncro.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
