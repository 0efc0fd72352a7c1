package org.driftlens.suite;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.driftlens.data.DatasetColumns;
import org.driftlens.data.InputData;
import org.driftlens.error.ConfigurationException;
import org.driftlens.error.GenerationException;
import org.driftlens.unit.CheckItem;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.Generator;
import org.driftlens.unit.Preset;
import org.driftlens.unit.UnitKind;

/**
 * Flattens a check list into units. The whole list is expanded before anything is returned, so a failing
 * preset or generator leaves nothing half-registered.
 */
public final class ItemExpander {
    public Expansion expand(final List<CheckItem> items, final InputData data, final UnitKind kind) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(kind, "kind");
        final DatasetColumns columns = data.columns();
        final List<ComputationalUnit> units = new ArrayList<>();
        final List<String> presets = new ArrayList<>();
        final List<String> generators = new ArrayList<>();

        for (final CheckItem item : items) {
            if (item instanceof CheckItem.UnitItem unitItem) {
                final ComputationalUnit unit = unitItem.unit();
                if (unit.kind() != kind) {
                    throw new ConfigurationException(
                            "unit " + unit.type() + " is a " + unit.kind().key() + ", expected a " + kind.key());
                }
                units.add(unit);
            } else if (item instanceof CheckItem.GeneratorItem generatorItem) {
                final Generator generator = generatorItem.generator();
                units.addAll(runGenerator(generator, columns, kind));
                generators.add(generator.name());
            } else if (item instanceof CheckItem.PresetItem presetItem) {
                final Preset preset = presetItem.preset();
                units.addAll(runPreset(preset, data, columns, kind));
                presets.add(preset.name());
            } else {
                throw new ConfigurationException("unsupported check item: " + item);
            }
        }
        return new Expansion(units, presets, generators);
    }

    private static List<ComputationalUnit> runPreset(
            final Preset preset, final InputData data, final DatasetColumns columns, final UnitKind kind) {
        final List<CheckItem> elements = preset.generate(data, columns);
        if (elements == null) {
            throw new GenerationException(preset.name(), "preset " + preset.name() + " returned no elements");
        }
        final List<ComputationalUnit> units = new ArrayList<>();
        for (final CheckItem element : elements) {
            if (element instanceof CheckItem.UnitItem unitItem) {
                units.add(requireKind(unitItem.unit(), kind, preset.name()));
            } else if (element instanceof CheckItem.GeneratorItem generatorItem) {
                units.addAll(runGenerator(generatorItem.generator(), columns, kind));
            } else if (element instanceof CheckItem.PresetItem nested) {
                throw new GenerationException(preset.name(),
                        "preset " + preset.name() + " nests preset " + nested.preset().name());
            } else {
                throw new GenerationException(preset.name(), "preset " + preset.name() + " returned a null element");
            }
        }
        return units;
    }

    private static List<ComputationalUnit> runGenerator(
            final Generator generator, final DatasetColumns columns, final UnitKind kind) {
        final List<? extends ComputationalUnit> generated = generator.generate(columns);
        if (generated == null) {
            throw new GenerationException(generator.name(), "generator " + generator.name() + " returned no units");
        }
        final List<ComputationalUnit> units = new ArrayList<>(generated.size());
        for (final Object element : generated) {
            if (!(element instanceof ComputationalUnit unit)) {
                throw new GenerationException(generator.name(),
                        "incorrect element in generator " + generator.name() + ": " + element);
            }
            units.add(requireKind(unit, kind, generator.name()));
        }
        return units;
    }

    private static ComputationalUnit requireKind(
            final ComputationalUnit unit, final UnitKind kind, final String source) {
        if (unit == null) {
            throw new GenerationException(source, source + " produced a null unit");
        }
        if (unit.kind() != kind) {
            throw new GenerationException(source,
                    source + " produced " + unit.kind().key() + " " + unit.type() + " where a " + kind.key() + " was expected");
        }
        return unit;
    }
}
