package clean.engine.group;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import clean.engine.PipelineConfigurationException;
import clean.engine.schema.Schema;
import clean.engine.storage.Table;

public class AggregateTest {

    private static DataGrouping byRegion() {
        return GroupBy.columns("region").map(GroupByTest.sales());
    }

    @Test
    void scalarFunctionYieldsOneRowPerGroup() {
        Table out = new Aggregate(Aggregates.on("amount", "total", Aggregates.SUM)).reduce(byRegion());
        assertEquals(Schema.of("total"), out.schema());
        assertEquals(List.of("east", "west", "north"), out.rowIds());
        assertEquals(List.of(11L, 5L, 2L), out.column("total"));
    }

    @Test
    void explicitSchemaRenamesColumns() {
        Table out = new Aggregate(Aggregates.count(), List.of("n")).reduce(byRegion());
        assertEquals(Schema.of("n"), out.schema());
        assertEquals(List.of(3L, 1L, 1L), out.column("n"));
    }

    @Test
    void schemaOfWrongLengthIsRejected() {
        Aggregate agg = new Aggregate(Aggregates.count(), List.of("n", "extra"));
        assertThrows(PipelineConfigurationException.class, () -> agg.reduce(byRegion()));
    }

    @Test
    void mapResultFansOut() {
        AggregateFunction stats = AggregateFunction.of("stats", t -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("min", Aggregates.MIN.apply(t.column("amount")));
            m.put("max", Aggregates.MAX.apply(t.column("amount")));
            return m;
        });
        Table out = new Aggregate(stats).reduce(byRegion());
        assertEquals(Schema.of("min", "max"), out.schema());
        assertEquals(List.of(1, 7), out.row(0).values());

        Aggregate renamed = new Aggregate(stats, List.of("lo", "hi"));
        assertEquals(Schema.of("lo", "hi"), renamed.reduce(byRegion()).schema());
        assertThrows(PipelineConfigurationException.class,
            () -> new Aggregate(stats, List.of("only")).reduce(byRegion()));
    }

    @Test
    void perColumnFunctions() {
        Map<String, ColumnAggregate> funcs = new LinkedHashMap<>();
        funcs.put("amount", Aggregates.MEAN);
        funcs.put("product", Aggregates.COUNT);
        Table out = new Aggregate(funcs, null).reduce(byRegion());
        assertEquals(Schema.of("amount", "product"), out.schema());
        assertEquals(List.of(11.0 / 3, 3L), out.row(0).values());
    }

    @Test
    void perColumnMapResultsArePrefixed() {
        Map<String, ColumnAggregate> funcs = Map.of("amount", values -> Map.of("sum", Aggregates.SUM.apply(values)));
        Table out = new Aggregate(funcs, null).reduce(byRegion());
        assertEquals(Schema.of("amount.sum"), out.schema());
    }

    @Test
    void unknownAggregationColumn() {
        Aggregate agg = new Aggregate(Map.of("price", Aggregates.SUM), null);
        assertThrows(PipelineConfigurationException.class, () -> agg.reduce(byRegion()));
    }

    @Test
    void collectionResultIsRejected() {
        Aggregate agg = new Aggregate(AggregateFunction.of("ids", Table::rowIds));
        assertThrows(PipelineConfigurationException.class, () -> agg.reduce(byRegion()));
    }

    @Test
    void extremesOfStrings() {
        assertEquals("apple", Aggregates.MIN.apply(Arrays.<Object>asList("pear", null, "apple")));
        assertEquals("pear", Aggregates.MAX.apply(Arrays.<Object>asList("pear", null, "apple")));
    }
}
