package clean.engine.pipeline;

import static clean.engine.function.EvalFunctions.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.Test;

import clean.engine.PipelineConfigurationException;
import clean.engine.exec.RowCountConsumer;
import clean.engine.group.Aggregate;
import clean.engine.group.Aggregates;
import clean.engine.profile.ColumnProfile;
import clean.engine.schema.ColumnRef;
import clean.engine.schema.Schema;
import clean.engine.storage.CsvOptions;
import clean.engine.storage.Table;
import clean.engine.stream.RowReader;

public class DataPipelineTest {

    private static Table inspections() {
        return Table.of(List.of("borough", "grade", "score"), Arrays.asList(
            Arrays.asList("Bronx", "A", 12),
            Arrays.asList("Queens", "B", 20),
            Arrays.asList("bronx", "C", 35),
            Arrays.asList("Manhattan", "A", 9),
            Arrays.asList("Queens", null, null),
            Arrays.asList("Manhattan", "B", 18)));
    }

    private static DataPipeline ds() {
        return DataPipeline.of(inspections());
    }

    @Test
    void transformationsDoNotReadData() {
        DataPipeline p = ds().select("borough", "score").filter(gt(col("score"), 10)).limit(2);
        assertEquals(List.of("borough", "score"), p.columns());
        assertEquals(3, p.operators().size());
        assertEquals(0, ds().operators().size());
    }

    @Test
    void countAndFilter() {
        assertEquals(6, ds().count());
        assertEquals(2, ds().where(eq(col("grade"), "A")).count());
        assertEquals(4, ds().delete(eq(col("grade"), "A")).count());
        assertEquals(1, ds().filter(isEmpty(col("grade"))).count());
        assertEquals(2, ds().filter(gt(col("score"), 10), 2).count());
    }

    @Test
    void distinctWithCaseNormalization() {
        Map<Object, Long> boroughs = ds()
            .update("borough", (Function<Object, Object>) v -> ((String) v).toUpperCase())
            .distinct("borough");
        assertEquals(Map.of("BRONX", 2L, "QUEENS", 2L, "MANHATTAN", 2L), boroughs);
        assertEquals(List.of("A", "B", "C"), new ArrayList<>(ds().filter(isNotEmpty(col("grade"))).distinctValues("grade")));
    }

    @Test
    void updateWithLookupConstantAndConditional() {
        Table t = ds()
            .update("grade", Map.of("A", "good", "C", "bad"))
            .update("score", ifThenReplace(isEmpty(col("score")), 0))
            .toTable();
        assertEquals(Arrays.asList("good", "B", "bad", "good", null, "B"), t.column("grade"));
        assertEquals(List.of(12, 20, 35, 9, 0, 18), t.column("score"));

        Table both = ds().update(ColumnRef.names("grade", "score"), "?").head(1);
        assertEquals(List.of("Bronx", "?", "?"), both.row(0).values());
    }

    @Test
    void selectRenameMoveInsert() {
        Table t = ds()
            .select(ColumnRef.names("score", "borough"), List.of("points", "area"))
            .rename("area", "boro")
            .insert("double", -1, multiply(col("points"), 2))
            .move("boro", 0)
            .head(2);
        assertEquals(Schema.of("boro", "points", "double"), t.schema());
        assertEquals(List.of("Queens", 20, 40L), t.row(1).values());
    }

    @Test
    void collectWithCustomConsumer() {
        Object count = ds().where(eq(col("borough"), "Queens")).collect(RowCountConsumer::new);
        assertEquals(2L, count);
    }

    @Test
    void headDefaultsToTenRows() {
        assertEquals(6, ds().head().size());
        assertEquals(3, ds().head(3).size());
    }

    @Test
    void sampleIsSeeded() {
        assertEquals(ds().sample(3, 11L).toTable().rowIds(), ds().sample(3, 11L).toTable().rowIds());
        assertEquals(3, ds().sample(3).count());
    }

    @Test
    void normalizationIsPreparedOnFilteredRows() {
        Table t = ds()
            .filter(isNotEmpty(col("score")))
            .update("score", minMaxScale(col("score")))
            .toTable();
        assertEquals(0.0, t.column("score").get(3));
        assertEquals(1.0, t.column("score").get(2));
    }

    @Test
    void iterationStreamsTransformedRows() {
        List<Object> boroughs = new ArrayList<>();
        try (RowReader reader = ds().filter(eq(col("grade"), "B")).select("borough").open()) {
            while (reader.hasNext()) boroughs.add(reader.next().get(0));
        }
        assertEquals(List.of("Queens", "Manhattan"), boroughs);
    }

    @Test
    void writeAndPersistToFile() throws IOException {
        Path file = Path.of("target", "pipeline-" + System.nanoTime() + ".tsv");
        DataPipeline persisted = ds().select("borough", "grade").persist(file);
        assertTrue(Files.exists(file));
        assertEquals("borough\tgrade", Files.readAllLines(file).get(0));
        assertEquals(6, persisted.count());
        assertEquals(List.of("Bronx", "A"), persisted.head(1).row(0).values());
        // without a null token the missing grade comes back as an empty string
        assertEquals("", persisted.toTable().row(4).get(1));

        Path nulls = Path.of("target", "pipeline-nulls-" + System.nanoTime() + ".csv");
        CsvOptions options = CsvOptions.defaults().withNullToken("NULL");
        ds().write(nulls, options);
        assertNull(DataPipeline.of(nulls, options).toTable().row(4).get(2));
    }

    @Test
    void persistInMemoryRunsTransformationsOnce() {
        int[] calls = new int[1];
        DataPipeline p = ds().update("score", (Function<Object, Object>) v -> {
            calls[0]++;
            return v;
        }).persist();
        p.count();
        p.count();
        assertEquals(6, calls[0]);
    }

    @Test
    void groupAndAggregate() {
        Table out = new Aggregate(Aggregates.count(), List.of("inspections"))
            .reduce(ds().filter(isNotEmpty(col("grade"))).groupBy("grade"));
        assertEquals(List.of("A", "B", "C"), out.rowIds());
        assertEquals(List.of(2L, 2L, 1L), out.column("inspections"));
    }

    @Test
    void profileSelectedColumn() {
        List<ColumnProfile> profiles = ds().profile("grade");
        assertEquals(1, profiles.size());
        assertEquals(1, profiles.get(0).emptyCount());
    }

    @Test
    void unknownColumnFailsBeforeReading() {
        assertThrows(PipelineConfigurationException.class, () -> ds().select("nope"));
        DataPipeline renamed = ds().select(ColumnRef.names("nope"), List.of("yes"));
        assertEquals(List.of("yes"), renamed.columns());
        assertThrows(PipelineConfigurationException.class, renamed::count);
    }
}
