package org.driftlens.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.bson.BsonDocument;
import org.driftlens.builtin.DataQualityTestPreset;
import org.driftlens.builtin.TestColumnQuantile;
import org.driftlens.builtin.TestShareOfMissingValues;
import org.driftlens.render.TabularView;
import org.driftlens.snapshot.SnapshotKind;
import org.driftlens.unit.TestStatus;
import org.driftlens.unit.TestUnit;
import org.junit.jupiter.api.Test;

class TestSuiteSummaryTest {
    @Test
    void summaryCountsFirstLevelStatuses() {
        TestSuite suite = TestSuite.builder()
            .unit(new TestShareOfMissingValues(0.2))
            .unit(new TestColumnQuantile("age", 0.5, 15.0, 30.0))
            .unit(new TestColumnQuantile("age", 0.5))
            .build();

        suite.run(ReportTest.REFERENCE, ReportTest.CURRENT, null);

        Map<TestStatus, Integer> counts = suite.statusCounts();
        assertEquals(2, counts.get(TestStatus.SUCCESS));
        assertEquals(1, counts.get(TestStatus.FAIL));
        assertEquals(0, counts.get(TestStatus.SKIPPED));
        assertFalse(suite.allPassed());

        BsonDocument summary = suite.asDict().getDocument("summary");
        assertEquals(3, summary.getInt32("total_tests").getValue());
        assertEquals(2, summary.getInt32("success_tests").getValue());
        assertEquals(1, summary.getInt32("failed_tests").getValue());
        assertFalse(summary.getBoolean("all_passed").getValue());
        assertEquals(BsonDocument.parse("{\"SUCCESS\": 2, \"FAIL\": 1}"), summary.getDocument("by_status"));
    }

    @Test
    void referenceBandIsTenPercentAroundTheReferenceQuantile() {
        TestSuite suite = TestSuite.builder()
            .unit(new TestColumnQuantile("age", 0.5))
            .build();

        suite.run(ReportTest.REFERENCE, ReportTest.CURRENT, null);

        BsonDocument parameters = suite.firstLevelUnits().get(0).result().field("parameters").asDocument();
        assertEquals(20.0, parameters.getDouble("value").getValue());
        assertEquals(22.5, parameters.getDouble("gte").getValue(), 1e-9);
        assertEquals(27.5, parameters.getDouble("lte").getValue(), 1e-9);
    }

    @Test
    void quantileTestWithoutBoundsOrReferenceIsSkipped() {
        TestSuite suite = TestSuite.builder()
            .unit(new TestColumnQuantile("age", 0.5))
            .build();

        suite.run(null, ReportTest.CURRENT, null);

        assertEquals(TestStatus.SKIPPED, TestUnit.statusOf(suite.firstLevelUnits().get(0).result()));
        assertTrue(suite.allPassed());
        assertEquals(0, suite.asDict().getDocument("summary").getInt32("success_tests").getValue());
    }

    @Test
    void presetContributesOneTestPerNumericalColumn() {
        TestSuite suite = TestSuite.builder()
            .preset(new DataQualityTestPreset())
            .build();

        suite.run(ReportTest.REFERENCE, ReportTest.CURRENT, null);

        assertEquals(SnapshotKind.TEST_SUITE, suite.snapshotKind());
        assertEquals(2, suite.firstLevelUnits().size());
        assertEquals(List.of("DataQualityTestPreset"), suite.metadata().get("test_presets"));
        // 1 missing cell out of 8 is above the default 0.1 threshold
        assertEquals(TestStatus.FAIL, TestUnit.statusOf(suite.firstLevelUnits().get(0).result()));

        TabularView table = suite.asTable("TestShareOfMissingValues");
        assertEquals("Share of Missing Values", table.cell(0, "name"));
        assertEquals("FAIL", table.cell(0, "status"));
        assertEquals("Test Suite", suite.asDashboard().info().name());
    }
}
