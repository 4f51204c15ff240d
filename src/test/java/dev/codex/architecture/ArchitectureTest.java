package dev.codex.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.codex", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Feature packages should not depend on adapter packages
    @ArchTest
    static final ArchRule features_should_not_depend_on_adapters =
        noClasses().that().resideInAnyPackage(
                "..ingestion..", "..search..", "..embedding..", "..document.."
            )
            .should().dependOnClassesThat().resideInAnyPackage(
                "..mcp..", "..api.."
            );

    // Adapter packages should not depend on each other
    @ArchTest
    static final ArchRule adapters_should_not_depend_on_each_other =
        noClasses().that().resideInAPackage("..mcp..")
            .should().dependOnClassesThat().resideInAPackage("..api..");

    // Config package should not depend on adapter packages
    @ArchTest
    static final ArchRule config_should_not_depend_on_adapters =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..mcp..", "..api.."
            );

    // Embedding is the bottom layer: the cache and encoder know nothing about ordinances
    @ArchTest
    static final ArchRule embedding_should_not_depend_on_pipeline =
        noClasses().that().resideInAPackage("..embedding..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..ingestion..", "..search..", "..document.."
            );

    // Ingestion stages never reach into retrieval
    @ArchTest
    static final ArchRule ingestion_should_not_depend_on_search =
        noClasses().that().resideInAPackage("..ingestion..")
            .should().dependOnClassesThat().resideInAPackage("..search..");

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.codex.(*)..").should().beFreeOfCycles();

    // No cycles between ingestion stages either
    @ArchTest
    static final ArchRule no_ingestion_stage_cycles =
        slices().matching("dev.codex.ingestion.(*)..").should().beFreeOfCycles();
}
