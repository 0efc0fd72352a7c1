package org.driftlens.arch;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "org.driftlens", importOptions = ImportOption.DoNotIncludeTests.class)
class LayeringGuardTest {
    @ArchTest
    static final ArchRule core_does_not_depend_on_runtime_layers = noClasses()
            .that()
            .resideInAnyPackage(
                    "org.driftlens.error..",
                    "org.driftlens.data..",
                    "org.driftlens.unit..",
                    "org.driftlens.obs..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "org.driftlens.suite..",
                    "org.driftlens.report..",
                    "org.driftlens.store..",
                    "org.driftlens.dashboard..",
                    "org.driftlens.workspace..",
                    "org.driftlens.builtin..");

    @ArchTest
    static final ArchRule snapshots_and_renderers_do_not_depend_on_reports = noClasses()
            .that()
            .resideInAnyPackage("org.driftlens.snapshot..", "org.driftlens.render..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "org.driftlens.report..",
                    "org.driftlens.store..",
                    "org.driftlens.dashboard..",
                    "org.driftlens.workspace..");

    @ArchTest
    static final ArchRule reports_do_not_depend_on_storage_or_dashboards = noClasses()
            .that()
            .resideInAPackage("org.driftlens.report..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("org.driftlens.store..", "org.driftlens.dashboard..", "org.driftlens.workspace..");

    @ArchTest
    static final ArchRule only_the_workspace_wires_builtin_units = noClasses()
            .that()
            .resideOutsideOfPackages("org.driftlens.builtin..", "org.driftlens.workspace..")
            .should()
            .dependOnClassesThat()
            .resideInAPackage("org.driftlens.builtin..");
}
