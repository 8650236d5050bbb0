package com.docforge.core;

import com.docforge.core.discovery.AbstractUnitDiscovery;
import com.docforge.core.discovery.CompositeUnitDiscovery;
import com.docforge.core.discovery.UnitDiscovery;
import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit rules for the core module.
 *
 * <p>The orchestrator sits on top: adapters (sync, discovery, generation, validation,
 * testing, report) know nothing about it, and models know nothing about adapters.
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.docforge.core");
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnAdapters() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..sync..", "..discovery..", "..generation..", "..validation..", "..testing..",
                "..report..", "..renderer..", "..pipeline..", "..cache..");

        rule.check(classes);
    }

    @Test
    void adapters_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage(
                "..sync..", "..discovery..", "..generation..", "..validation..", "..testing..", "..report..",
                "..cache..", "..versions..")
            .should().dependOnClassesThat().resideInAPackage("..pipeline..");

        rule.check(classes);
    }

    @Test
    void languageDiscoveries_shouldExtendAbstractUnitDiscovery() {
        ArchRule rule = classes()
            .that().areAssignableTo(UnitDiscovery.class)
            .and().areNotInterfaces()
            .and().areNotAssignableTo(CompositeUnitDiscovery.class)
            .should().beAssignableTo(AbstractUnitDiscovery.class);

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnDomainPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..pipeline..", "..discovery..", "..generation..", "..validation..", "..report..");

        rule.check(classes);
    }
}
