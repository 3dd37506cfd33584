package com.chainindexer;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Module dependency rules: common at the bottom, domain on top of it, ingestion and query reading domain,
 * api reading query only.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.chainindexer");
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..config..", "..api..", "..query..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..ingestion..", "..config..", "..api..", "..query..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_api_or_query() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion..")
                .should().dependOnClassesThat().resideInAnyPackage("..api..", "..query..");
        rule.check(classes);
    }

    @Test
    void query_must_not_depend_on_ingestion_or_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..query..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..api..");
        rule.check(classes);
    }

    @Test
    void transformers_must_not_depend_on_persistence_or_spring() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..ingestion.transformer..", "..ingestion.transform..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.store..", "org.springframework..");
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
                .matching("com.chainindexer.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
