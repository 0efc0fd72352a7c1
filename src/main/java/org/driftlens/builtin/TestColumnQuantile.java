package org.driftlens.builtin;

import java.util.List;
import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.driftlens.data.InputData;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.ResultContext;
import org.driftlens.unit.TestStatus;
import org.driftlens.unit.TestUnit;
import org.driftlens.unit.UnitResult;

/**
 * Checks a column quantile against explicit bounds, or against the reference quantile plus or minus
 * {@value #REFERENCE_TOLERANCE} relative when no bound is given. Without bounds or reference the test is skipped.
 */
public final class TestColumnQuantile extends TestUnit {
    static final double REFERENCE_TOLERANCE = 0.1;

    private final Double gte;
    private final Double lte;
    private final ColumnQuantileMetric metric;

    public TestColumnQuantile(final String column, final double quantile, final Double gte, final Double lte) {
        this.metric = new ColumnQuantileMetric(Objects.requireNonNull(column, "column"), quantile);
        this.gte = gte;
        this.lte = lte;
    }

    public TestColumnQuantile(final String column, final double quantile) {
        this(column, quantile, null, null);
    }

    static TestColumnQuantile fromArgs(final BsonDocument args) {
        return new TestColumnQuantile(
                args.getString("column").getValue(),
                args.getNumber("quantile").doubleValue(),
                optionalNumber(args, "gte"),
                optionalNumber(args, "lte"));
    }

    private static Double optionalNumber(final BsonDocument args, final String key) {
        final BsonValue value = args.get(key);
        return value == null || value.isNull() ? null : value.asNumber().doubleValue();
    }

    @Override
    public BsonDocument args() {
        final BsonDocument args = new BsonDocument()
                .append("column", new BsonString(metric.column()))
                .append("quantile", new BsonDouble(metric.quantile()));
        if (gte != null) {
            args.append("gte", new BsonDouble(gte));
        }
        if (lte != null) {
            args.append("lte", new BsonDouble(lte));
        }
        return args;
    }

    @Override
    public List<ComputationalUnit> dependencies() {
        return List.of(metric);
    }

    @Override
    public String name() {
        return "Quantile Value (" + metric.quantile() + ") of " + metric.column();
    }

    @Override
    protected Outcome check(final InputData data, final ResultContext context) {
        final UnitResult result = context.resultOf(metric);
        final double value = result.field("current.value").asNumber().doubleValue();
        Double lower = gte;
        Double upper = lte;
        if (lower == null && upper == null) {
            if (!result.has("reference.value")) {
                return new Outcome(TestStatus.SKIPPED, "No bounds and no reference data for column "
                        + metric.column() + ".", new BsonDocument("value", new BsonDouble(value)));
            }
            final double reference = result.field("reference.value").asNumber().doubleValue();
            final double delta = Math.abs(reference) * REFERENCE_TOLERANCE;
            lower = reference - delta;
            upper = reference + delta;
        }
        final boolean passed = (lower == null || value >= lower) && (upper == null || value <= upper);
        final BsonDocument parameters = new BsonDocument("value", new BsonDouble(value));
        if (lower != null) {
            parameters.append("gte", new BsonDouble(lower));
        }
        if (upper != null) {
            parameters.append("lte", new BsonDouble(upper));
        }
        return Outcome.of(
                passed,
                "The " + metric.quantile() + " quantile of " + metric.column() + " is " + value + ".",
                parameters);
    }
}
