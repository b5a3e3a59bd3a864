package com.omnioracle;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Keeps package boundaries: feeds and pools below aggregation, aggregation below the oracle facade,
 * the facade below jobs and the API.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.omnioracle");
    }

    @Test
    void domain_must_not_depend_on_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..chain..", "..feed..", "..pricing..",
                        "..liquidity..", "..state..", "..sync..", "..oracle..", "..job..", "..config..", "..api..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..chain..", "..feed..", "..pricing..",
                        "..liquidity..", "..state..", "..sync..", "..oracle..", "..job..", "..config..", "..api..");
        rule.check(classes);
    }

    @Test
    void chain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..chain..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..feed..", "..pricing..",
                        "..liquidity..", "..state..", "..sync..", "..oracle..", "..job..", "..api..");
        rule.check(classes);
    }

    @Test
    void feed_must_not_depend_on_aggregation_or_above() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..feed..")
                .should().dependOnClassesThat().resideInAnyPackage("..pricing..", "..liquidity..", "..state..",
                        "..sync..", "..oracle..", "..job..", "..api..");
        rule.check(classes);
    }

    @Test
    void pricing_and_liquidity_must_not_depend_on_oracle_sync_api() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..pricing..", "..liquidity..")
                .should().dependOnClassesThat().resideInAnyPackage("..state..", "..sync..", "..oracle..", "..job..",
                        "..api..");
        rule.check(classes);
    }

    @Test
    void state_must_not_depend_on_sync_oracle_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..state..")
                .should().dependOnClassesThat().resideInAnyPackage("..sync..", "..oracle..", "..job..", "..api..");
        rule.check(classes);
    }

    @Test
    void sync_must_not_depend_on_oracle_facade() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..sync..")
                .should().dependOnClassesThat().resideInAnyPackage("..oracle..", "..pricing..", "..job..", "..api..");
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
                .matching("com.omnioracle.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
