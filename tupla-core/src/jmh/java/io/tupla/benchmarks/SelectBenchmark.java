package io.tupla.benchmarks;

import io.tupla.api.TupleSet;
import io.tupla.core.TuplaConfiguration;
import io.tupla.kernel.Tuple;
import io.tupla.query.Expr;
import io.tupla.query.MatchClause;
import io.tupla.query.MatchSpec;
import io.tupla.query.Op;
import io.tupla.runtime.TuplaArena;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
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

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static io.tupla.query.Pattern.ANY;
import static io.tupla.query.Pattern.tuple;
import static io.tupla.query.Pattern.var;

/**
 * Full scans through compiled match specs, with and without paging.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class SelectBenchmark {

    @Param({"10000"})
    public int rows;

    @Param({"true", "false"})
    public boolean ordered;

    private TuplaArena arena;
    private TupleSet table;
    private MatchSpec youngNames;
    private MatchSpec all;

    @Setup(Level.Trial)
    public void setup() {
        arena = new TuplaArena(TuplaConfiguration.defaults());
        table = TupleSet.createOrThrow(arena, Map.of("ordered", ordered));
        for (int i = 0; i < rows; i++) {
            table.putOrThrow(Tuple.of(i, "user" + i, i % 100));
        }
        youngNames = MatchSpec.of(MatchClause.of(tuple(ANY, var(1), var(2)),
                List.of(Op.LT.of(Expr.var(2), Expr.constant(30))), Expr.var(1)));
        all = MatchSpec.matching(tuple(ANY, ANY, ANY));
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        arena.close();
    }

    @Benchmark
    public void selectWithGuard(Blackhole blackhole) {
        blackhole.consume(table.selectOrThrow(youngNames));
    }

    @Benchmark
    public void selectCount(Blackhole blackhole) {
        blackhole.consume(table.selectCountOrThrow(all));
    }

    @Benchmark
    public void selectPaged(Blackhole blackhole) {
        var page = table.selectOrThrow(youngNames, 500);
        blackhole.consume(page.results());
        while (page.hasMore()) {
            page = table.selectOrThrow(page.continuation());
            blackhole.consume(page.results());
        }
    }
}
