package org.driftlens.unit;

import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.driftlens.data.InputData;

/**
 * A unit that asserts a condition. Its result always carries {@code name}, {@code status} and
 * {@code description}, with test-specific values under {@code parameters}.
 */
public abstract class TestUnit extends AbstractUnit {
    public static final String NAME_FIELD = "name";
    public static final String STATUS_FIELD = "status";
    public static final String DESCRIPTION_FIELD = "description";
    public static final String PARAMETERS_FIELD = "parameters";

    @Override
    public final UnitKind kind() {
        return UnitKind.TEST;
    }

    /**
     * Human-readable test name shown in renders.
     */
    public abstract String name();

    @Override
    protected final BsonDocument calculate(final InputData data, final ResultContext context) {
        final Outcome outcome = check(data, context);
        return new BsonDocument()
                .append(NAME_FIELD, new BsonString(name()))
                .append(STATUS_FIELD, new BsonString(outcome.status().name()))
                .append(DESCRIPTION_FIELD, new BsonString(outcome.description()))
                .append(PARAMETERS_FIELD, outcome.parameters());
    }

    protected abstract Outcome check(InputData data, ResultContext context);

    public static TestStatus statusOf(final UnitResult result) {
        return TestStatus.parse(result.field(STATUS_FIELD).asString().getValue());
    }

    public record Outcome(TestStatus status, String description, BsonDocument parameters) {
        public Outcome {
            Objects.requireNonNull(status, "status");
            description = description == null ? "" : description;
            parameters = parameters == null ? new BsonDocument() : parameters.clone();
        }

        public static Outcome of(final boolean passed, final String description, final BsonDocument parameters) {
            return new Outcome(passed ? TestStatus.SUCCESS : TestStatus.FAIL, description, parameters);
        }
    }
}
