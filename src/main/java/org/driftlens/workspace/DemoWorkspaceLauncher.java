package org.driftlens.workspace;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.driftlens.builtin.BuiltinUnits;
import org.driftlens.builtin.ColumnQuantileMetric;
import org.driftlens.builtin.DataQualityPreset;
import org.driftlens.builtin.DataQualityTestPreset;
import org.driftlens.data.ColumnMapping;
import org.driftlens.data.InMemoryDataset;
import org.driftlens.obs.JsonLinesLogger;
import org.driftlens.obs.LogLevel;
import org.driftlens.obs.StructuredJsonLinesLogger;
import org.driftlens.report.Report;
import org.driftlens.report.TestSuite;

/**
 * Command-line generator of a sample workspace: one project plus a daily report and test suite per batch of
 * synthetic data.
 *
 * <p>Prints a single stdout line on success: {@code DRIFTLENS_PROJECT=<project-id>}. Logs go to stderr.
 */
public final class DemoWorkspaceLauncher {
    static final String DEMO_PROJECT_RESOURCE = "/demo-project.yaml";
    private static final String READY_PREFIX = "DRIFTLENS_PROJECT=";
    private static final String FAILURE_PREFIX = "DRIFTLENS_FAILURE=";
    private static final int REFERENCE_ROWS = 200;
    private static final int BATCH_ROWS = 100;
    private static final List<String> WORKCLASSES = List.of("Private", "Self-emp", "Gov", "Without-pay");

    private DemoWorkspaceLauncher() {}

    public static void main(final String[] args) {
        final int exitCode = run(args, System.out, System.err, Clock.systemUTC());
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(final String[] args, final PrintStream out, final PrintStream err, final Clock clock) {
        final LaunchConfig config;
        try {
            config = LaunchConfig.parse(args);
        } catch (final IllegalArgumentException e) {
            err.println(FAILURE_PREFIX + e.getMessage());
            return 2;
        }
        // closing the logger closes stderr
        try (JsonLinesLogger logger = new StructuredJsonLinesLogger(err, config.logLevel())) {
            try {
                final Project project = generate(config, logger, clock);
                out.println(READY_PREFIX + project.id());
                out.flush();
                return 0;
            } catch (final IOException | RuntimeException e) {
                err.println(FAILURE_PREFIX + e.getMessage());
                e.printStackTrace(err);
                return 1;
            }
        }
    }

    static Project generate(final LaunchConfig config, final JsonLinesLogger logger, final Clock clock)
            throws IOException {
        final Workspace workspace = Workspace.create(
                config.workspace(), BuiltinUnits.registry(), BuiltinUnits.renderers(), logger);
        final ProjectConfigLoader loader = new ProjectConfigLoader();
        final ProjectConfig projectConfig = config.projectConfig() == null
                ? loadDemoConfig(loader)
                : loader.load(config.projectConfig());
        final Project project = workspace.createProject(projectConfig);

        final Random random = new Random(config.seed());
        final InMemoryDataset reference = batch(random, REFERENCE_ROWS, 0);
        final ColumnMapping mapping = ColumnMapping.builder()
                .target(null)
                .prediction(null)
                .textFeatures(List.of("notes"))
                .build();
        final Instant start = Instant.now(clock).truncatedTo(ChronoUnit.DAYS)
                .minus(Duration.ofDays(config.snapshots()));
        for (int i = 0; i < config.snapshots(); i++) {
            final InMemoryDataset current = batch(random, BATCH_ROWS, i);
            final Instant timestamp = start.plus(Duration.ofDays(i));

            final Report report = Report.builder()
                    .timestamp(timestamp)
                    .metadata("type", "data_quality")
                    .logger(logger)
                    .preset(new DataQualityPreset())
                    .unit(new ColumnQuantileMetric("age", 0.9))
                    .build();
            report.setBatchSize("daily").setDatasetId("synthetic-census");
            report.run(reference, current, mapping);
            workspace.addReport(project.id(), report);

            final TestSuite testSuite = TestSuite.builder()
                    .timestamp(timestamp)
                    .metadata("type", "data_quality")
                    .logger(logger)
                    .preset(new DataQualityTestPreset())
                    .build();
            testSuite.run(reference, current, mapping);
            workspace.addReport(project.id(), testSuite);
        }
        return project;
    }

    static ProjectConfig loadDemoConfig(final ProjectConfigLoader loader) throws IOException {
        try (InputStream input = DemoWorkspaceLauncher.class.getResourceAsStream(DEMO_PROJECT_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("missing classpath resource " + DEMO_PROJECT_RESOURCE);
            }
            return loader.parse(new String(input.readAllBytes(), StandardCharsets.UTF_8), DEMO_PROJECT_RESOURCE);
        }
    }

    /**
     * Rows drift slowly with the batch number; about one age in twenty is missing.
     */
    private static InMemoryDataset batch(final Random random, final int rows, final int batchNumber) {
        final List<Object> age = new ArrayList<>(rows);
        final List<Object> educationNum = new ArrayList<>(rows);
        final List<Object> workclass = new ArrayList<>(rows);
        final List<Object> notes = new ArrayList<>(rows);
        for (int row = 0; row < rows; row++) {
            age.add(random.nextInt(20) == 0 ? null : 38.0 + batchNumber * 0.5 + random.nextGaussian() * 12.0);
            educationNum.add(1 + random.nextInt(16));
            workclass.add(WORKCLASSES.get(random.nextInt(WORKCLASSES.size())));
            notes.add("note " + "x".repeat(random.nextInt(40)));
        }
        return InMemoryDataset.builder()
                .column("age", age)
                .column("education_num", educationNum)
                .column("workclass", workclass)
                .column("notes", notes)
                .build();
    }

    record LaunchConfig(Path workspace, int snapshots, Path projectConfig, LogLevel logLevel, long seed) {
        LaunchConfig {
            Objects.requireNonNull(workspace, "workspace");
            Objects.requireNonNull(logLevel, "logLevel");
        }

        static LaunchConfig parse(final String[] args) {
            Path workspace = Path.of("workspace");
            int snapshots = 19;
            Path projectConfig = null;
            LogLevel logLevel = LogLevel.INFO;
            long seed = 42L;

            for (final String arg : args) {
                if (arg == null || arg.isBlank()) {
                    continue;
                }
                if (arg.startsWith("--workspace=")) {
                    workspace = Path.of(requireValue(arg, "--workspace="));
                    continue;
                }
                if (arg.startsWith("--snapshots=")) {
                    snapshots = parseCount(requireValue(arg, "--snapshots="));
                    continue;
                }
                if (arg.startsWith("--project-config=")) {
                    projectConfig = Path.of(requireValue(arg, "--project-config="));
                    continue;
                }
                if (arg.startsWith("--log-level=")) {
                    logLevel = LogLevel.parse(requireValue(arg, "--log-level="));
                    continue;
                }
                if (arg.startsWith("--seed=")) {
                    seed = parseSeed(requireValue(arg, "--seed="));
                    continue;
                }
                throw new IllegalArgumentException("unsupported argument: " + arg);
            }

            return new LaunchConfig(workspace, snapshots, projectConfig, logLevel, seed);
        }

        private static String requireValue(final String arg, final String prefix) {
            final String value = Objects.requireNonNull(arg, "arg").substring(prefix.length()).trim();
            if (value.isEmpty()) {
                throw new IllegalArgumentException("argument value is empty for " + prefix);
            }
            return value;
        }

        private static int parseCount(final String value) {
            try {
                final int parsed = Integer.parseInt(value);
                if (parsed < 1 || parsed > 365) {
                    throw new IllegalArgumentException("snapshots must be between 1 and 365: " + parsed);
                }
                return parsed;
            } catch (final NumberFormatException numberFormatException) {
                throw new IllegalArgumentException("invalid snapshot count: " + value, numberFormatException);
            }
        }

        private static long parseSeed(final String value) {
            try {
                return Long.parseLong(value);
            } catch (final NumberFormatException numberFormatException) {
                throw new IllegalArgumentException("invalid seed: " + value, numberFormatException);
            }
        }
    }
}
