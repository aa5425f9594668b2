package express.mvp.myra.objects.benchmark;

import express.mvp.myra.objects.RemoteObjectsRegistry;
import express.mvp.myra.objects.endpoint.HostedEndpoint;
import java.util.concurrent.TimeUnit;
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
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Micro-benchmark of the registry hot paths.
 *
 * <p>Scenarios:
 * <ul>
 *   <li>Repeated registration of an already-known object (tag lookup + set membership)
 *   <li>Register then remove of a fresh object (allocation + release)
 *   <li>Full owner lifecycle: register a batch, then destroy the endpoint
 * </ul>
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class RegistryBenchmark {

    private static final int CONTEXT = 1;

    @Param({"16", "256"})
    public int batchSize;

    private RemoteObjectsRegistry registry;
    private HostedEndpoint endpoint;
    private Object known;
    private int nextProcessId;

    @Setup(Level.Iteration)
    public void setup() {
        registry = new RemoteObjectsRegistry();
        endpoint = new HostedEndpoint(1, 1);
        known = new Object();
        registry.add(endpoint, CONTEXT, known);
        nextProcessId = 2;
    }

    @Benchmark
    public int addKnownObject() {
        return registry.add(endpoint, CONTEXT, known);
    }

    @Benchmark
    public void addThenRemove(Blackhole bh) {
        int handle = registry.add(endpoint, CONTEXT, new Object());
        registry.remove(endpoint, CONTEXT, handle);
        bh.consume(handle);
    }

    @Benchmark
    public void ownerLifecycle(Blackhole bh) {
        HostedEndpoint peer = new HostedEndpoint(2, nextProcessId++);
        for (int i = 0; i < batchSize; i++) {
            bh.consume(registry.add(peer, CONTEXT, new Object()));
        }
        peer.destroy();
    }
}
