package ldeque.concurrent;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

/*
 * Lookups walk from the nearer end, so both ends should be
 * equally cheap and the middle the most expensive.
 */
@State(Scope.Benchmark)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@BenchmarkMode(Mode.AverageTime)
@Warmup(iterations = 2, time = 1)
@Measurement(iterations = 5, time = 1)
@Threads(1)
@Fork(1)
public class PeekByPosition {

    @Param({"16", "1024", "65536"})
    public int size;

    private BoundedDeque<Integer> deque;

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(PeekByPosition.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }

    @Setup
    public void prepare() {
        deque = LockedLinkedDeque.of(IntStream.range(0, size).iterator(), size);
    }

    @Benchmark
    public Integer first() {
        return deque.peek(0);
    }

    @Benchmark
    public Integer last() {
        return deque.peek(size - 1);
    }

    @Benchmark
    public Integer middle() {
        return deque.peek(size >> 1);
    }

    @Benchmark
    public int rotateHalf() {
        deque.rotate(size >> 1);
        return deque.size();
    }
}
