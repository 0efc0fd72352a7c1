package org.driftlens.workspace;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;
import org.driftlens.dashboard.AggregationCatalog;
import org.driftlens.dashboard.DashboardConfig;
import org.driftlens.error.ConfigurationException;
import org.driftlens.error.NotFoundException;
import org.driftlens.obs.JsonLinesLogger;
import org.driftlens.obs.LogContext;
import org.driftlens.render.RendererRegistry;
import org.driftlens.report.ReportBase;
import org.driftlens.report.ReportSnapshots;
import org.driftlens.snapshot.Snapshot;
import org.driftlens.unit.UnitRegistry;

/**
 * Directory of projects, one subdirectory per project id.
 */
public final class Workspace {
    private final Path path;
    private final UnitRegistry unitRegistry;
    private final RendererRegistry rendererRegistry;
    private final AggregationCatalog aggregations;
    private final JsonLinesLogger logger;
    private final LogContext logContext;
    private final Map<String, Project> projects = new LinkedHashMap<>();

    private Workspace(
            final Path path,
            final UnitRegistry unitRegistry,
            final RendererRegistry rendererRegistry,
            final AggregationCatalog aggregations,
            final JsonLinesLogger logger) {
        this.path = path;
        this.unitRegistry = Objects.requireNonNull(unitRegistry, "unitRegistry");
        this.rendererRegistry = Objects.requireNonNull(rendererRegistry, "rendererRegistry");
        this.aggregations = Objects.requireNonNull(aggregations, "aggregations");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.logContext = LogContext.of("workspace");
    }

    /**
     * Creates the directory if needed and loads any projects already in it.
     */
    public static Workspace create(
            final Path path,
            final UnitRegistry unitRegistry,
            final RendererRegistry rendererRegistry,
            final JsonLinesLogger logger) {
        final Path normalized = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        try {
            Files.createDirectories(normalized);
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to create workspace " + normalized, e);
        }
        return open(normalized, unitRegistry, rendererRegistry, logger);
    }

    public static Workspace create(
            final Path path, final UnitRegistry unitRegistry, final RendererRegistry rendererRegistry) {
        return create(path, unitRegistry, rendererRegistry, JsonLinesLogger.noop());
    }

    /**
     * @throws NotFoundException if the directory does not exist
     */
    public static Workspace open(
            final Path path,
            final UnitRegistry unitRegistry,
            final RendererRegistry rendererRegistry,
            final JsonLinesLogger logger) {
        final Path normalized = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        if (!Files.isDirectory(normalized)) {
            throw new NotFoundException("workspace", normalized);
        }
        final Workspace workspace = new Workspace(
                normalized, unitRegistry, rendererRegistry, AggregationCatalog.standard(), logger);
        workspace.reload();
        return workspace;
    }

    public Path path() {
        return path;
    }

    public Project createProject(final String name) {
        return addProject(ProjectInfo.named(name, ""), DashboardConfig.empty(name));
    }

    public Project createProject(final ProjectConfig config) {
        Objects.requireNonNull(config, "config");
        return addProject(ProjectInfo.named(config.name(), config.description()), config.dashboard());
    }

    /**
     * Registers and saves a project.
     *
     * @throws IllegalArgumentException if a project with the same id exists
     */
    public Project addProject(final ProjectInfo info, final DashboardConfig dashboard) {
        Objects.requireNonNull(info, "info");
        if (projects.containsKey(info.id())) {
            throw new IllegalArgumentException("duplicate project id: " + info.id());
        }
        final Project project = new Project(
                path.resolve(info.id()), info, dashboard, unitRegistry, rendererRegistry, logger);
        project.save();
        projects.put(project.id(), project);
        logger.info("workspace.project.added", logContext, Map.of("projectId", project.id(), "name", project.name()));
        return project;
    }

    public List<Project> listProjects() {
        return List.copyOf(projects.values());
    }

    /**
     * @throws NotFoundException for an unknown id
     */
    public Project getProject(final String projectId) {
        final Project project = projects.get(projectId);
        if (project == null) {
            throw new NotFoundException("project", projectId);
        }
        return project;
    }

    /**
     * Projects whose name equals {@code name}.
     */
    public List<Project> searchProjects(final String name) {
        final List<Project> matches = new ArrayList<>();
        for (final Project project : projects.values()) {
            if (project.name().equals(name)) {
                matches.add(project);
            }
        }
        return matches;
    }

    public void addSnapshot(final String projectId, final Snapshot snapshot) {
        getProject(projectId).addSnapshot(Objects.requireNonNull(snapshot, "snapshot"));
    }

    public Snapshot addReport(final String projectId, final ReportBase report) {
        final Snapshot snapshot = ReportSnapshots.capture(report);
        addSnapshot(projectId, snapshot);
        return snapshot;
    }

    private void reload() {
        projects.clear();
        final List<Path> directories;
        try (Stream<Path> entries = Files.list(path)) {
            directories = entries.filter(Files::isDirectory).sorted().toList();
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to list workspace " + path, e);
        }
        for (final Path directory : directories) {
            final Path projectFile = directory.resolve(Project.PROJECT_FILE);
            if (!Files.isRegularFile(projectFile)) {
                continue;
            }
            final String json;
            try {
                json = Files.readString(projectFile, StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw new UncheckedIOException("Failed to read project " + projectFile, e);
            }
            final ProjectCodec.Decoded decoded = ProjectCodec.fromJson(json, projectFile.toString(), aggregations);
            if (!decoded.info().id().equals(directory.getFileName().toString())) {
                throw new ConfigurationException(
                        projectFile + ": id " + decoded.info().id() + " does not match its directory");
            }
            projects.put(decoded.info().id(), new Project(
                    directory, decoded.info(), decoded.dashboard(), unitRegistry, rendererRegistry, logger));
        }
        logger.debug("workspace.loaded", logContext, Map.of("path", path.toString(), "projects", projects.size()));
    }
}
