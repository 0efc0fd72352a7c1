package org.driftlens.builtin;

import org.driftlens.render.RendererRegistry;
import org.driftlens.unit.UnitRegistry;

/**
 * Registries for the reference units shipped with the library.
 */
public final class BuiltinUnits {
    private BuiltinUnits() {}

    public static UnitRegistry registry() {
        return UnitRegistry.builder()
                .register("DatasetMissingValuesMetric", args -> new DatasetMissingValuesMetric())
                .register("ColumnQuantileMetric", ColumnQuantileMetric::fromArgs)
                .register("TextLengthMetric", TextLengthMetric::fromArgs)
                .register("TestShareOfMissingValues", TestShareOfMissingValues::fromArgs)
                .register("TestColumnQuantile", TestColumnQuantile::fromArgs)
                .build();
    }

    public static RendererRegistry renderers() {
        return RendererRegistry.standard();
    }
}
