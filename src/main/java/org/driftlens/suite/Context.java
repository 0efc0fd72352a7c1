package org.driftlens.suite;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.driftlens.data.InputData;
import org.driftlens.error.ComputationException;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.ResultContext;
import org.driftlens.unit.UnitIdentity;
import org.driftlens.unit.UnitResult;

/**
 * Per-run result cache keyed by unit identity. An entry is written once and never replaced until
 * {@link #clear()}.
 */
public final class Context implements ResultContext {
    private final Map<UnitIdentity, UnitResult> results = new LinkedHashMap<>();

    @Override
    public Optional<UnitResult> find(final UnitIdentity identity) {
        return Optional.ofNullable(results.get(Objects.requireNonNull(identity, "identity")));
    }

    public boolean contains(final UnitIdentity identity) {
        return results.containsKey(identity);
    }

    public int size() {
        return results.size();
    }

    public Map<UnitIdentity, UnitResult> results() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public void clear() {
        results.clear();
    }

    UnitResult computeOnce(final ComputationalUnit unit, final InputData data) {
        final UnitIdentity identity = unit.identity();
        final UnitResult cached = results.get(identity);
        if (cached != null) {
            return cached;
        }
        final UnitResult computed;
        try {
            computed = unit.compute(data, this);
        } catch (ComputationException nested) {
            throw nested;
        } catch (RuntimeException failure) {
            throw new ComputationException(identity.toString(), failure);
        }
        if (computed == null) {
            throw new ComputationException(
                    identity.toString(), new IllegalStateException("unit " + unit.type() + " produced no result"));
        }
        put(identity, computed);
        return computed;
    }

    void restore(final UnitIdentity identity, final UnitResult result) {
        put(identity, Objects.requireNonNull(result, "result"));
    }

    private void put(final UnitIdentity identity, final UnitResult result) {
        if (results.putIfAbsent(identity, result) != null) {
            throw new IllegalStateException("result for " + identity + " is already present");
        }
    }
}
