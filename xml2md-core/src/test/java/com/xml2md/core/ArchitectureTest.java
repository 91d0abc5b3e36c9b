package com.xml2md.core;

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
 *   <li>Handlers extend the common base class and live in the handler package</li>
 *   <li>Tree and render state types are immutable records</li>
 *   <li>Sinks and the tree model stay independent of the conversion engine</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.xml2md.core");
    }

    /**
     * Verifies every node handler extends AbstractNodeHandler, so logging and the
     * inline-writing helpers behave the same for all kinds.
     */
    @Test
    void handlers_shouldExtendAbstractNodeHandler() {
        ArchRule rule = classes()
            .that().resideInAPackage("..convert.handler..")
            .and().haveSimpleNameEndingWith("Handler")
            .and().doNotHaveSimpleName("AbstractNodeHandler")
            .should().beAssignableTo("com.xml2md.core.convert.handler.AbstractNodeHandler");

        rule.check(classes);
    }

    /**
     * Verifies NodeHandler implementations are kept in the handler package.
     */
    @Test
    void handlers_shouldResideInHandlerPackage() {
        ArchRule rule = classes()
            .that().implement("com.xml2md.core.convert.NodeHandler")
            .should().resideInAPackage("..convert.handler..");

        rule.check(classes);
    }

    /**
     * Verifies the tree model classes are records.
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

    /**
     * Verifies the tree model does not depend on parsing, conversion or output.
     */
    @Test
    void model_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..convert..", "..parse..", "..sink..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies sinks know nothing about the conversion engine.
     */
    @Test
    void sinks_shouldNotDependOnConvert() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..sink..")
            .should().dependOnClassesThat().resideInAPackage("..convert..");

        rule.check(classes);
    }

    /**
     * Verifies handlers never write through anything but the sink they are given.
     */
    @Test
    void handlers_shouldNotUseSystemOut() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..convert..")
            .should().accessField(System.class, "out")
            .orShould().accessField(System.class, "err");

        rule.check(classes);
    }
}
