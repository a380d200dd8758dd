package io.tupla.benchmarks;

import io.tupla.api.TupleSet;
import io.tupla.core.TuplaConfiguration;
import io.tupla.kernel.Tuple;
import io.tupla.runtime.TuplaArena;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Group;
import org.openjdk.jmh.annotations.GroupThreads;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@State(Scope.Benchmark)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 5, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ConcurrentReadWriteBenchmark {

    @Param({"100000"})
    public int initialRows;

    @Param({"true", "false"})
    public boolean readConcurrency;

    private TuplaArena arena;
    private TupleSet users;
    private final AtomicLong nextKey = new AtomicLong(0);

    @Setup(Level.Trial)
    public void setup() {
        arena = new TuplaArena(TuplaConfiguration.defaults());
        users = TupleSet.createOrThrow(arena, Map.of(
                "visibility", "public",
                "read_concurrency", readConcurrency));

        // Pre-populate
        for (long i = 0; i < initialRows; i++) {
            users.putOrThrow(Tuple.of(i, "user" + i, i % 100));
        }
        nextKey.set(initialRows);
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        if (arena != null) {
            arena.close();
        }
    }

    @Group("write1_read1")
    @GroupThreads(1)
    @Benchmark
    public void writer_1thread(Blackhole blackhole) {
        doWrite(blackhole);
    }

    @Group("write1_read1")
    @GroupThreads(1)
    @Benchmark
    public void reader_1thread(Blackhole blackhole) {
        doRead(blackhole);
    }

    @Group("write1_read4")
    @GroupThreads(1)
    @Benchmark
    public void writer_1thread_4readers(Blackhole blackhole) {
        doWrite(blackhole);
    }

    @Group("write1_read4")
    @GroupThreads(4)
    @Benchmark
    public void reader_4threads(Blackhole blackhole) {
        doRead(blackhole);
    }

    @Group("write4_read4")
    @GroupThreads(4)
    @Benchmark
    public void writer_4threads(Blackhole blackhole) {
        doWrite(blackhole);
    }

    @Group("write4_read4")
    @GroupThreads(4)
    @Benchmark
    public void reader_4threads_4writers(Blackhole blackhole) {
        doRead(blackhole);
    }

    private void doWrite(Blackhole blackhole) {
        var key = nextKey.getAndIncrement();
        blackhole.consume(users.put(Tuple.of(key, "user" + key, key % 100)));
    }

    private void doRead(Blackhole blackhole) {
        long key = ThreadLocalRandom.current().nextLong(initialRows);
        blackhole.consume(users.get(key));
    }
}
