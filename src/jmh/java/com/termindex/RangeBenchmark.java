package com.termindex;

import com.termindex.codec.Field;
import com.termindex.codec.FieldCodec;
import com.termindex.codec.FieldKey;
import com.termindex.codec.TermMetadata;
import com.termindex.codec.TermType;
import com.termindex.codec.Terms;
import com.termindex.index.FieldIterator;
import com.termindex.index.KvTermIndex;
import com.termindex.index.RangeOpts;
import com.termindex.index.SortOrder;
import com.termindex.kv.MemoryKvStore;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * 倒排查询性能基准测试
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class RangeBenchmark {
    private static final FieldKey STATUS = FieldKey.of(0, 1);
    private static final FieldKey LATENCY = FieldKey.of(0, 2);
    private static final TermMetadata METADATA = TermMetadata.strings().withField(LATENCY.fieldId(), TermType.INT64);

    private KvTermIndex index;

    @Setup
    public void setup() {
        MemoryKvStore store = new MemoryKvStore();
        // 100000 条记录，状态码 10 个词项，延迟 1000 个词项
        for (long itemId = 0; itemId < 100_000; itemId++) {
            byte[] status = Terms.of(String.valueOf(200 + itemId % 10));
            byte[] latency = Terms.of(itemId % 1000 - 500);
            store.put(FieldCodec.marshal(Field.of(STATUS, status, itemId), METADATA), FieldCodec.encodeItemId(itemId));
            store.put(FieldCodec.marshal(Field.of(LATENCY, latency, itemId), METADATA), FieldCodec.encodeItemId(itemId));
        }
        index = new KvTermIndex(store, METADATA);
    }

    @Benchmark
    public long matchTerms() throws IOException {
        return index.matchTerms(Field.of(STATUS, Terms.of("204"))).len();
    }

    @Benchmark
    public long matchField() throws IOException {
        return index.matchField(STATUS).len();
    }

    @Benchmark
    public long numericRange() throws IOException {
        return index.range(LATENCY, RangeOpts.between(Terms.of(-50L), true, Terms.of(50L), false)).len();
    }

    @Benchmark
    public int descendingTopTerms() throws IOException {
        int terms = 0;
        try (FieldIterator iterator = index.iterator(LATENCY, RangeOpts.unbounded(), SortOrder.DESC)) {
            while (terms < 10 && iterator.next()) {
                terms++;
            }
        }
        return terms;
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(RangeBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
