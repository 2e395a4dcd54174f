package clean.engine.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

import clean.engine.PipelineConfigurationException;
import clean.engine.schema.Schema;
import clean.engine.stream.LimitReachedException;

public class LimitConsumerTest {

    @Test
    void forwardsExactlyLimitRows() {
        Schema schema = Schema.of("A");
        RecordingConsumer sink = new RecordingConsumer(schema);
        LimitConsumer limit = new LimitConsumer(schema, sink, 3);
        for (int i = 0; i < 3; i++) limit.consume(i, List.of(i));
        assertEquals(3, limit.close());
        assertEquals(3, sink.rows.size());
    }

    @Test
    void extraRowSignalsExhaustion() {
        Schema schema = Schema.of("A");
        RecordingConsumer sink = new RecordingConsumer(schema);
        LimitConsumer limit = new LimitConsumer(schema, sink, 2);
        limit.consume(0, List.of("a"));
        limit.consume(1, List.of("b"));
        LimitReachedException e = assertThrows(LimitReachedException.class, () -> limit.consume(2, List.of("c")));
        assertEquals(2, e.limit());
        assertEquals(2, sink.rows.size());
    }

    @Test
    void zeroLimitStopsAtFirstRow() {
        LimitConsumer limit = new LimitConsumer(Schema.of("A"), null, 0);
        assertThrows(LimitReachedException.class, () -> limit.consume(0, List.of(1)));
        assertNull(limit.close());
    }

    @Test
    void negativeLimitIsRejected() {
        assertThrows(PipelineConfigurationException.class, () -> new LimitOperator(-1));
    }

    @Test
    void closingTwiceFails() {
        LimitConsumer limit = new LimitConsumer(Schema.of("A"), null, 1);
        limit.close();
        assertThrows(IllegalStateException.class, limit::close);
    }
}
