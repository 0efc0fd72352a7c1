package org.driftlens.report;

import org.driftlens.snapshot.SnapshotKind;
import org.driftlens.unit.UnitKind;

/**
 * A set of metrics computed over one pair of datasets.
 */
public final class Report extends ReportBase {
    private Report(final Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public UnitKind unitKind() {
        return UnitKind.METRIC;
    }

    @Override
    public SnapshotKind snapshotKind() {
        return SnapshotKind.REPORT;
    }

    @Override
    protected String dashboardName() {
        return "Report";
    }

    @Override
    protected String collectionKey() {
        return "metrics";
    }

    public static final class Builder extends ReportBase.Builder<Report, Builder> {
        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public Report build() {
            return new Report(this);
        }
    }
}
