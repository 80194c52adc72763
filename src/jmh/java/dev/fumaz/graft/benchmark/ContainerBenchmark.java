package dev.fumaz.graft.benchmark;

import dev.fumaz.graft.container.Container;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ContainerBenchmark {

    @State(Scope.Benchmark)
    public static class ContainerState {

        Container container;

        @Setup(Level.Trial)
        public void setUp() {
            container = Container.create();
            container.singleton(SingletonService.class);
            container.set("threshold", 42);
            container.setAlias("composite", CompositeService.class);
        }
    }

    @Benchmark
    public Object getSingleton(ContainerState state) {
        return state.container.get(SingletonService.class);
    }

    @Benchmark
    public Object autowireCompositeGraph(ContainerState state) {
        return state.container.get(CompositeService.class);
    }

    @Benchmark
    public Object getThroughAlias(ContainerState state) {
        return state.container.get("composite");
    }

    @Benchmark
    public void unresolvedLookup(ContainerState state, Blackhole blackhole) {
        try {
            blackhole.consume(state.container.get("unbound.Missing"));
        } catch (RuntimeException exception) {
            blackhole.consume(exception);
        }
    }

    public static class SingletonService {
        private final HeavyComputation heavyComputation;

        public SingletonService(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }
    }

    public static class HeavyComputation {
        private final long seed = System.nanoTime();
    }

    public static class TransientService {
        private final int threshold;

        public TransientService(int threshold) {
            this.threshold = threshold;
        }
    }

    public static class CompositeService {
        private final SingletonService singletonService;
        private final TransientService transientService;

        public CompositeService(SingletonService singletonService, TransientService transientService) {
            this.singletonService = singletonService;
            this.transientService = transientService;
        }
    }

}
