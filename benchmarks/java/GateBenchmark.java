package qg.benchmarks.java;

import org.openjdk.jmh.annotations.*;
import qg.core.clock.SystemClock;
import qg.java.engine.AdmissionGate;

import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for AdmissionGate.
 *
 * Measures throughput (ops/sec) of the uncontended paths and of the fair lock under contention.
 * The bucket is sized so it never runs dry during a run; an empty bucket would measure sleeps.
 *
 * Run from the test classpath:
 *   java -cp target/test-classes:target/classes:... org.openjdk.jmh.Main Gate
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class GateBenchmark {

    private AdmissionGate gate;

    @Setup
    public void setup() {
        gate = new AdmissionGate(SystemClock.instance(), 1e12);
    }

    /**
     * Single caller, lock always free.
     */
    @Benchmark
    public void admit() {
        gate.admit();
    }

    /**
     * 8 callers queueing on the fair lock.
     */
    @Benchmark
    @Threads(8)
    public void admitContended() {
        gate.admit();
    }

    /**
     * Status snapshot; takes the bucket monitor but not the queue.
     */
    @Benchmark
    public Object status() {
        return gate.status();
    }

    /**
     * Status reads racing admissions.
     */
    @Benchmark
    @Threads(8)
    public long availableTokensWhileAdmitting() {
        gate.admit();
        return gate.availableTokens();
    }
}
