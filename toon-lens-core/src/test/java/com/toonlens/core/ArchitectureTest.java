package com.toonlens.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate the layering of the core library.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>The node model depends on nothing else in the library</li>
 *   <li>The parser only builds nodes and knows nothing about consumers of the tree</li>
 *   <li>Tree consumers never reach up into the service or configuration layers</li>
 *   <li>Validators share the common base class</li>
 *   <li>Value objects are records</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.toonlens.core");
    }

    @Test
    void ast_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.ast..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.parser..", "..core.visitor..", "..core.diagnostic..", "..core.query..",
                "..core.serializer..", "..core.service..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void parser_shouldOnlyDependOnAst() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.parser..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.visitor..", "..core.diagnostic..", "..core.query..",
                "..core.serializer..", "..core.service..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void treeConsumers_shouldNotDependOnServiceOrConfig() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.visitor..", "..core.diagnostic..", "..core.query..", "..core.serializer..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.service..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void validators_shouldExtendAbstractDocumentValidator() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.diagnostic..")
            .and().haveSimpleNameEndingWith("Validator")
            .and().areNotInterfaces()
            .should().beAssignableTo("com.toonlens.core.diagnostic.AbstractDocumentValidator");

        rule.check(classes);
    }

    @Test
    void valueObjects_shouldBeRecords() {
        ArchRule rule = classes()
            .that().haveSimpleNameEndingWith("Options")
            .or().haveSimpleName("Position")
            .or().haveSimpleName("Range")
            .or().haveSimpleName("Diagnostic")
            .or().haveSimpleName("Hover")
            .or().haveSimpleName("Location")
            .or().haveSimpleName("ParseError")
            .or().haveSimpleName("ParseResult")
            .should().beRecords();

        rule.check(classes);
    }
}
