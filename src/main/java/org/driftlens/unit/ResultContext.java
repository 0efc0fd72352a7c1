package org.driftlens.unit;

import java.util.Optional;

/**
 * Read side of the per-run result cache, as seen by units.
 */
public interface ResultContext {
    Optional<UnitResult> find(UnitIdentity identity);

    /**
     * Result of a unit that must already have been computed in this run.
     *
     * @throws IllegalStateException if the unit has no result yet
     */
    default UnitResult resultOf(final ComputationalUnit unit) {
        return find(unit.identity()).orElseThrow(() -> new IllegalStateException(
                "unit " + unit.identity() + " has not been computed in this context"));
    }
}
