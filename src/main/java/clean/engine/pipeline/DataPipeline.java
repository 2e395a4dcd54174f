package clean.engine.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import clean.engine.PipelineConfigurationException;
import clean.engine.exec.CollectOperator;
import clean.engine.exec.DistinctOperator;
import clean.engine.exec.FilterOperator;
import clean.engine.exec.InsertOperator;
import clean.engine.exec.LimitOperator;
import clean.engine.exec.MoveOperator;
import clean.engine.exec.RenameOperator;
import clean.engine.exec.RowCountOperator;
import clean.engine.exec.SampleOperator;
import clean.engine.exec.SelectOperator;
import clean.engine.exec.TableOperator;
import clean.engine.exec.UpdateOperator;
import clean.engine.exec.WriteOperator;
import clean.engine.format.TablePrinter;
import clean.engine.function.Apply;
import clean.engine.function.Const;
import clean.engine.function.EvalFunction;
import clean.engine.function.EvalFunctions;
import clean.engine.group.DataGrouping;
import clean.engine.group.GroupBy;
import clean.engine.profile.ColumnProfile;
import clean.engine.profile.ProfileOperator;
import clean.engine.schema.ColumnRef;
import clean.engine.schema.Schema;
import clean.engine.storage.CsvFile;
import clean.engine.storage.CsvOptions;
import clean.engine.storage.Table;
import clean.engine.stream.DataSource;
import clean.engine.stream.DataStream;
import clean.engine.stream.RowReader;
import clean.engine.stream.StreamConsumer;
import clean.engine.stream.StreamOperator;

/**
 * Fluent, immutable pipeline over a row source.
 * <p>
 * Transforming methods (select, filter, update, ...) return a new pipeline
 * with one more operator and never read data. Terminal methods (count,
 * toTable, write, ...) run the whole pipeline once and return the result of
 * the final collector. Iterating through {@link #open()} streams the
 * transformed rows lazily.
 */
public class DataPipeline implements DataSource {
    private static final Logger LOG = LoggerFactory.getLogger(DataPipeline.class);

    private final DataStream stream;

    public DataPipeline(DataSource source) {
        this(new DataStream(source));
    }

    private DataPipeline(DataStream stream) {
        this.stream = stream;
    }

    public static DataPipeline of(DataSource source) {
        return new DataPipeline(source);
    }

    /** Pipeline over a delimited text file; the format is inferred from the file name. */
    public static DataPipeline of(Path file) {
        return new DataPipeline(new CsvFile(file));
    }

    public static DataPipeline of(Path file, CsvOptions options) {
        return new DataPipeline(new CsvFile(file, options));
    }

    @Override
    public Schema schema() { return stream.schema(); }

    public List<String> columns() { return stream.schema().columns(); }

    public List<StreamOperator> operators() { return stream.operators(); }

    @Override
    public RowReader open() { return stream.open(); }

    public DataPipeline append(StreamOperator op) {
        if (op == null) throw new IllegalArgumentException("operator must not be null");
        return new DataPipeline(stream.append(op));
    }

    // -- Transformations ---------------------------------------------------

    public DataPipeline select(String... columns) {
        return select(ColumnRef.names(columns), null);
    }

    /** Select columns in the given order; the optional names rename them. */
    public DataPipeline select(List<ColumnRef> columns, List<String> names) {
        return append(new SelectOperator(columns, names));
    }

    public DataPipeline rename(String column, String name) {
        return rename(List.of(ColumnRef.name(column)), List.of(name));
    }

    public DataPipeline rename(List<ColumnRef> columns, List<String> names) {
        return append(new RenameOperator(columns, names));
    }

    public DataPipeline move(String column, int position) {
        return move(List.of(ColumnRef.name(column)), position);
    }

    public DataPipeline move(List<ColumnRef> columns, int position) {
        return append(new MoveOperator(columns, position));
    }

    /**
     * Insert a column at a position (-1 appends). The value is a function or a
     * constant.
     */
    public DataPipeline insert(String name, int position, Object value) {
        return insert(List.of(name), position, EvalFunctions.valueOf(value));
    }

    public DataPipeline insert(List<String> names, int position, EvalFunction values) {
        return append(new InsertOperator(names, position, values));
    }

    public DataPipeline filter(EvalFunction predicate) {
        return append(new FilterOperator(predicate));
    }

    /** Filter and stop after {@code limit} matching rows. */
    public DataPipeline filter(EvalFunction predicate, long limit) {
        return filter(predicate).limit(limit);
    }

    /** Filter on a predicate that uses another value than {@code true} to signal a match. */
    public DataPipeline filter(EvalFunction predicate, Object truthValue) {
        return append(new FilterOperator(predicate, truthValue, false));
    }

    public DataPipeline where(EvalFunction predicate) {
        return filter(predicate);
    }

    public DataPipeline where(EvalFunction predicate, long limit) {
        return filter(predicate, limit);
    }

    /** Remove the rows that satisfy the predicate. */
    public DataPipeline delete(EvalFunction predicate) {
        return append(FilterOperator.delete(predicate));
    }

    public DataPipeline update(String column, Object fn) {
        return update(List.of(ColumnRef.name(column)), fn);
    }

    /**
     * Update column values. The update is an evaluation function, a
     * {@link Function} over the current value (or tuple of values), a
     * {@link Map} used as a lookup table (unmapped values are kept), or a
     * constant. A constant for several columns is either a list with one value
     * per column or a single value used for all of them.
     */
    public DataPipeline update(List<ColumnRef> columns, Object fn) {
        if (columns == null || columns.isEmpty()) throw new PipelineConfigurationException("columns must be non-empty");
        EvalFunction f;
        if (fn instanceof EvalFunction ef) {
            f = ef;
        } else if (fn instanceof Map<?, ?> mapping) {
            f = EvalFunctions.lookup(EvalFunctions.select(columns), mapping);
        } else if (fn instanceof Function<?, ?> g) {
            f = new Apply(EvalFunctions.select(columns), typed(g));
        } else if (columns.size() > 1 && !(fn instanceof List<?>)) {
            f = new Const(Collections.nCopies(columns.size(), fn));
        } else {
            f = new Const(fn);
        }
        return append(new UpdateOperator(columns, f));
    }

    public DataPipeline limit(long count) {
        return append(new LimitOperator(count));
    }

    public DataPipeline sample(int n) {
        return append(new SampleOperator(n));
    }

    public DataPipeline sample(int n, long seed) {
        return append(new SampleOperator(n, seed));
    }

    // -- Terminal operations -----------------------------------------------

    /** Run the pipeline with the given operator as its last stage. */
    public Object stream(StreamOperator op) {
        return append(op).run();
    }

    /** Run the pipeline; the result is that of its last operator (null without operators). */
    public Object run() {
        return stream.run();
    }

    public Object collect(Function<Schema, ? extends StreamConsumer> factory) {
        return stream(new CollectOperator(factory));
    }

    public long count() {
        return (Long) stream(new RowCountOperator());
    }

    /** Value frequencies over the given columns (all columns when none are given). */
    public Map<Object, Long> distinct(String... columns) {
        return result(new DistinctOperator(ColumnRef.names(columns)));
    }

    public List<Object> distinctValues(String... columns) {
        return new ArrayList<>(distinct(columns).keySet());
    }

    public Table toTable() {
        return (Table) stream(new TableOperator());
    }

    public Table head() {
        return head(10);
    }

    public Table head(int count) {
        return limit(count).toTable();
    }

    public Path write(Path file) {
        return write(file, CsvOptions.forFile(file));
    }

    public Path write(Path file, CsvOptions options) {
        return (Path) stream(new WriteOperator(file, options));
    }

    public List<ColumnProfile> profile(String... columns) {
        return result(new ProfileOperator(ColumnRef.names(columns)));
    }

    public DataGrouping groupBy(String... columns) {
        return GroupBy.columns(columns).map(toTable());
    }

    /**
     * Materialize the current rows in memory and continue from there. The
     * transformations run once, here, not on every later terminal call.
     */
    public DataPipeline persist() {
        Table table = toTable();
        LOG.info("Persisted {} row(s) in memory", table.size());
        if (LOG.isDebugEnabled()) LOG.debug("Persisted rows:\n{}", TablePrinter.render(table, 10));
        return new DataPipeline(table);
    }

    /** Write the current rows to a file and continue streaming from that file. */
    public DataPipeline persist(Path file) {
        CsvOptions options = CsvOptions.forFile(file);
        write(file, options);
        return new DataPipeline(new CsvFile(file, options));
    }

    /** Run the pipeline with the given last stage and return its result as the caller's type. */
    private <T> T result(StreamOperator op) {
        return typed(stream(op));
    }

    private static <T> T typed(Object value) {
        return (T) value;
    }

    @Override
    public String toString() { return "DataPipeline" + stream.operators(); }
}
