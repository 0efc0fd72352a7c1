package org.driftlens.unit;

import java.util.Objects;
import org.bson.BsonDocument;
import org.driftlens.data.InputData;

/**
 * Base class holding the context binding. The type tag defaults to the simple class name.
 */
public abstract class AbstractUnit implements ComputationalUnit {
    private ResultContext context;

    @Override
    public String type() {
        return getClass().getSimpleName();
    }

    @Override
    public final UnitResult compute(final InputData data, final ResultContext context) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(context, "context");
        final BsonDocument document = calculate(data, context);
        if (document == null) {
            throw new IllegalStateException("unit " + type() + " produced no result");
        }
        return UnitResult.of(document);
    }

    protected abstract BsonDocument calculate(InputData data, ResultContext context);

    @Override
    public final void bindContext(final ResultContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public final UnitResult result() {
        if (context == null) {
            throw new IllegalStateException("unit " + type() + " is not bound to a context");
        }
        return context.resultOf(this);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ComputationalUnit)) {
            return false;
        }
        return identity().equals(((ComputationalUnit) other).identity());
    }

    @Override
    public int hashCode() {
        return identity().hashCode();
    }

    @Override
    public String toString() {
        return identity().toString();
    }
}
