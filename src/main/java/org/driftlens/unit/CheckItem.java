package org.driftlens.unit;

import java.util.Objects;

/**
 * One entry of a declarative check list.
 */
public sealed interface CheckItem permits CheckItem.UnitItem, CheckItem.PresetItem, CheckItem.GeneratorItem {
    static CheckItem unit(final ComputationalUnit unit) {
        return new UnitItem(unit);
    }

    static CheckItem preset(final Preset preset) {
        return new PresetItem(preset);
    }

    static CheckItem generator(final Generator generator) {
        return new GeneratorItem(generator);
    }

    record UnitItem(ComputationalUnit unit) implements CheckItem {
        public UnitItem {
            Objects.requireNonNull(unit, "unit");
        }
    }

    record PresetItem(Preset preset) implements CheckItem {
        public PresetItem {
            Objects.requireNonNull(preset, "preset");
        }
    }

    record GeneratorItem(Generator generator) implements CheckItem {
        public GeneratorItem {
            Objects.requireNonNull(generator, "generator");
        }
    }
}
