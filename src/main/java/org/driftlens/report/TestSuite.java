package org.driftlens.report;

import java.util.EnumMap;
import java.util.Map;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.driftlens.snapshot.SnapshotKind;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.TestStatus;
import org.driftlens.unit.TestUnit;
import org.driftlens.unit.UnitKind;

/**
 * A set of pass/fail tests computed over one pair of datasets.
 */
public final class TestSuite extends ReportBase {
    private TestSuite(final Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public UnitKind unitKind() {
        return UnitKind.TEST;
    }

    @Override
    public SnapshotKind snapshotKind() {
        return SnapshotKind.TEST_SUITE;
    }

    @Override
    protected String dashboardName() {
        return "Test Suite";
    }

    @Override
    protected String collectionKey() {
        return "tests";
    }

    /**
     * Count of first-level tests per status. Statuses with no tests are reported as zero.
     */
    public Map<TestStatus, Integer> statusCounts() {
        final Map<TestStatus, Integer> counts = new EnumMap<>(TestStatus.class);
        for (final TestStatus status : TestStatus.values()) {
            counts.put(status, 0);
        }
        for (final ComputationalUnit unit : firstLevelUnits()) {
            counts.merge(TestUnit.statusOf(resultOf(unit)), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * True when no first-level test failed or errored.
     */
    public boolean allPassed() {
        final Map<TestStatus, Integer> counts = statusCounts();
        return counts.get(TestStatus.FAIL) == 0 && counts.get(TestStatus.ERROR) == 0;
    }

    @Override
    protected void completeDict(final BsonDocument dict) {
        final Map<TestStatus, Integer> counts = statusCounts();
        final BsonDocument byStatus = new BsonDocument();
        counts.forEach((status, count) -> {
            if (count > 0) {
                byStatus.append(status.name(), new BsonInt32(count));
            }
        });
        dict.append("summary", new BsonDocument()
                .append("all_passed", BsonBoolean.valueOf(allPassed()))
                .append("total_tests", new BsonInt32(firstLevelUnits().size()))
                .append("success_tests", new BsonInt32(counts.get(TestStatus.SUCCESS) + counts.get(TestStatus.WARNING)))
                .append("failed_tests", new BsonInt32(counts.get(TestStatus.FAIL)))
                .append("by_status", byStatus));
    }

    public static final class Builder extends ReportBase.Builder<TestSuite, Builder> {
        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public TestSuite build() {
            return new TestSuite(this);
        }
    }
}
