package com.ledgerimport;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: ingestion drives ledger and reconciliation, ledger may reconcile, reconciliation knows neither,
 * and nothing below api depends on it.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.ledgerimport");
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.ledgerimport.domain..")
                .should().dependOnClassesThat().resideInAnyPackage("com.ledgerimport.ingestion..", "com.ledgerimport.ledger..",
                        "com.ledgerimport.reconciliation..", "com.ledgerimport.api..", "com.ledgerimport.config..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.ledgerimport.common..")
                .should().dependOnClassesThat().resideInAnyPackage("com.ledgerimport.domain..", "com.ledgerimport.ingestion..",
                        "com.ledgerimport.ledger..", "com.ledgerimport.reconciliation..", "com.ledgerimport.api..",
                        "com.ledgerimport.config..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.ledgerimport.ingestion..")
                .should().dependOnClassesThat().resideInAPackage("com.ledgerimport.api..");
        rule.check(classes);
    }

    @Test
    void ledger_must_not_depend_on_ingestion_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.ledgerimport.ledger..")
                .should().dependOnClassesThat().resideInAnyPackage("com.ledgerimport.ingestion..", "com.ledgerimport.api..");
        rule.check(classes);
    }

    @Test
    void reconciliation_must_not_depend_on_ingestion_ledger_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.ledgerimport.reconciliation..")
                .should().dependOnClassesThat().resideInAnyPackage("com.ledgerimport.ingestion..",
                        "com.ledgerimport.ledger..", "com.ledgerimport.api..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.ledgerimport.api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.ledgerimport.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }

    @Test
    void ingestion_pipeline_must_not_depend_on_job_triggers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.ledgerimport.ingestion.pipeline..")
                .should().dependOnClassesThat().resideInAPackage("com.ledgerimport.ingestion.job..");
        rule.check(classes);
    }
}
