package org.driftlens.data;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.driftlens.error.ConfigurationException;
import org.junit.jupiter.api.Test;

class ColumnInferenceTest {
    private static final InMemoryDataset CURRENT = InMemoryDataset.builder()
        .column("age", Arrays.asList(31.0, null, 45.0))
        .column("city", List.of("Oslo", "Lima", "Oslo"))
        .column("joined", List.of(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 2), LocalDate.of(2026, 1, 3)))
        .column("target", List.of(0, 1, 0))
        .column("prediction", List.of(0, 1, 1))
        .build();

    @Test
    void infersFeatureTypesAndSkipsUtilityColumns() {
        DatasetColumns columns = ColumnInference.processColumns(CURRENT, ColumnMapping.defaults());

        assertEquals(List.of("age"), columns.numericalFeatures());
        assertEquals(List.of("city"), columns.categoricalFeatures());
        assertEquals(List.of("joined"), columns.datetimeFeatures());
        assertEquals(List.of(), columns.textFeatures());
        assertEquals("target", columns.utilityColumns().targetColumn().orElseThrow());
        assertEquals(List.of("prediction"), columns.utilityColumns().prediction());
    }

    @Test
    void explicitMappingWinsOverInference() {
        ColumnMapping mapping = ColumnMapping.builder()
            .target(null)
            .prediction(null)
            .numericalFeatures(List.of("target"))
            .textFeatures(List.of("city"))
            .build();

        DatasetColumns columns = ColumnInference.processColumns(CURRENT, mapping);

        assertEquals(List.of("target"), columns.numericalFeatures());
        assertEquals(List.of("city"), columns.textFeatures());
        assertFalse(columns.categoricalFeatures().contains("city"));
        assertTrue(columns.categoricalFeatures().isEmpty());
    }

    @Test
    void dataDefinitionDescribesEveryColumnRole() {
        DataDefinition definition = ColumnInference.createDataDefinition(null, CURRENT, ColumnMapping.defaults());

        assertEquals(ColumnType.NUMERICAL, definition.column("age").orElseThrow().type());
        assertEquals(ColumnType.NUMERICAL, definition.target().orElseThrow().type());
        assertEquals("prediction", definition.predictionColumns().orElseThrow().predictedValues());
        assertEquals(List.of("age"), definition.columnsOfType(ColumnType.NUMERICAL).stream()
            .map(ColumnDefinition::name)
            .toList());
        assertFalse(definition.referencePresent());
    }

    @Test
    void mappedColumnMissingFromCurrentDataIsAConfigurationError() {
        ColumnMapping mapping = ColumnMapping.builder().numericalFeatures(List.of("income")).build();

        ConfigurationException error = assertThrows(
            ConfigurationException.class,
            () -> ColumnInference.processColumns(CURRENT, mapping));
        assertEquals("numerical feature column 'income' is not present in current data", error.getMessage());
    }

    @Test
    void datasetRejectsColumnsOfDifferentLength() {
        InMemoryDataset.Builder builder = InMemoryDataset.builder()
            .column("a", List.of(1, 2))
            .column("b", List.of(1));

        assertThrows(IllegalArgumentException.class, builder::build);
    }
}
