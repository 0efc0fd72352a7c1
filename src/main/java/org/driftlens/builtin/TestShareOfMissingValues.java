package org.driftlens.builtin;

import java.util.List;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.driftlens.data.InputData;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.ResultContext;
import org.driftlens.unit.TestUnit;

/**
 * Passes when the share of missing cells in the current data is below a threshold.
 */
public final class TestShareOfMissingValues extends TestUnit {
    private final double lt;
    private final DatasetMissingValuesMetric metric = new DatasetMissingValuesMetric();

    public TestShareOfMissingValues(final double lt) {
        this.lt = lt;
    }

    static TestShareOfMissingValues fromArgs(final BsonDocument args) {
        return new TestShareOfMissingValues(args.getNumber("lt").doubleValue());
    }

    @Override
    public BsonDocument args() {
        return new BsonDocument("lt", new BsonDouble(lt));
    }

    @Override
    public List<ComputationalUnit> dependencies() {
        return List.of(metric);
    }

    @Override
    public String name() {
        return "Share of Missing Values";
    }

    @Override
    protected Outcome check(final InputData data, final ResultContext context) {
        final double share = context.resultOf(metric).field("current.share_of_missing_values").asNumber().doubleValue();
        return Outcome.of(
                share < lt,
                "The share of missing values is " + share + ". The test threshold is lt=" + lt + ".",
                new BsonDocument()
                        .append("share_of_missing_values", new BsonDouble(share))
                        .append("lt", new BsonDouble(lt)));
    }
}
