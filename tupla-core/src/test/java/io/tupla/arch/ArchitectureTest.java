package io.tupla.arch;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

class ArchitectureTest {

    @Test
    void coreShouldNotDependOnOtherModules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.tupla.core..")
                .should().dependOnClassesThat()
                .resideInAnyPackage(
                        "io.tupla.kernel..",
                        "io.tupla.index..",
                        "io.tupla.storage..",
                        "io.tupla.query..",
                        "io.tupla.runtime..",
                        "io.tupla.api..");
        rule.check(importedMainClasses());
    }

    @Test
    void kernelShouldNotDependOnOtherModules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.tupla.kernel..")
                .should().dependOnClassesThat()
                .resideInAnyPackage(
                        "io.tupla.core..",
                        "io.tupla.index..",
                        "io.tupla.storage..",
                        "io.tupla.query..",
                        "io.tupla.runtime..",
                        "io.tupla.api..");
        rule.check(importedMainClasses());
    }

    @Test
    void indexShouldNotDependOnStorage() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.tupla.index..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.tupla.storage..", "io.tupla.query..", "io.tupla.runtime..");
        rule.check(importedMainClasses());
    }

    @Test
    void storageShouldNotDependOnRuntime() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.tupla.storage..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.tupla.query..", "io.tupla.runtime..", "io.tupla.api..");
        rule.check(importedMainClasses());
    }

    @Test
    void queryShouldNotDependOnRuntimeOrApi() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.tupla.query..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.tupla.runtime..", "io.tupla.api..");
        rule.check(importedMainClasses());
    }

    @Test
    void runtimeShouldNotDependOnApi() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.tupla.runtime..")
                .should().dependOnClassesThat().resideInAPackage("io.tupla.api..");
        rule.check(importedMainClasses());
    }

    @Test
    void mainCodeShouldNotDependOnTestPackages() {
        ArchRule rule = noClasses()
                .should().dependOnClassesThat().resideInAPackage("..test..");
        rule.check(importedMainClasses());
    }

    private static JavaClasses importedMainClasses() {
        return new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("io.tupla..");
    }
}
