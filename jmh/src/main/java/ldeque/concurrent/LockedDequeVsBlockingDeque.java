package ldeque.concurrent;

import ldeque.concurrent.exceptions.PopException;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@OutputTimeUnit(TimeUnit.MILLISECONDS)
@BenchmarkMode(Mode.Throughput)
@Warmup(iterations = 2, time = 1)
@Measurement(iterations = 5, time = 1)
@Threads(Threads.MAX)
@Fork(1)
public class LockedDequeVsBlockingDeque {

    @State(Scope.Group)
    public static class LockedState {
        final BoundedDeque<Integer> deque
                = new LockedLinkedDeque<>(1024);
    }
    @State(Scope.Group)
    public static class BlockingState {
        final LinkedBlockingDeque<Integer> deque
                = new LinkedBlockingDeque<>(1024);
    }
    @Benchmark
    @Group("locked")
    public int append(LockedState state) {
        int i = ThreadLocalRandom.current().nextInt(100);
        state.deque.append(i);
        return i;
    }

    @Benchmark
    @Group("locked")
    public Integer popLeft(LockedState state) {
        try {
            return state.deque.tryPopLeft();
        } catch (PopException e) {
            return null;
        }
    }
    @Benchmark
    @Group("blocking")
    public int append(BlockingState state) {
        int i = ThreadLocalRandom.current().nextInt(100);
        // mirror the eviction of the locked deque
        while (!state.deque.offerLast(i)) {
            state.deque.pollFirst();
        }
        return i;
    }

    @Benchmark
    @Group("blocking")
    public Integer popLeft(BlockingState state) {
        return state.deque.pollFirst();
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(LockedDequeVsBlockingDeque.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
