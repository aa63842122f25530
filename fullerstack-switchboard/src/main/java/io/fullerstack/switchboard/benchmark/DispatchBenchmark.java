package io.fullerstack.switchboard.benchmark;

import io.fullerstack.switchboard.Hub;
import io.fullerstack.switchboard.cell.DispatchContext;
import io.fullerstack.switchboard.cell.ExclusivityCell;
import io.fullerstack.switchboard.config.SwitchboardConfig;
import io.fullerstack.switchboard.container.Channel;
import io.fullerstack.switchboard.registry.HandlerIdentity;
import io.fullerstack.switchboard.subscriber.Subscriber;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Dispatch-path and subscribe-path costs:
 * <ul>
 *   <li>exclusive dispatch on a single cell</li>
 *   <li>suspend plus re-entry of the same cell</li>
 *   <li>channel dispatch over N members</li>
 *   <li>subscribing into a chain of channels, which folds and cycle-checks the graph</li>
 * </ul>
 *
 * <p>Run with:
 * <pre>
 * mvn clean package && java -jar fullerstack-switchboard/target/benchmarks.jar Dispatch
 * </pre>
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 2)
@Fork(1)
@State(Scope.Thread)
public class DispatchBenchmark {

    /** Handler used throughout; counts deliveries so nothing is optimised away. */
    public static final class Counter {
        long hits;

        void hit() {
            hits++;
        }
    }

    @Param({"1", "16", "256"})
    private int members;

    private ExclusivityCell<Counter> cell;
    private Channel<Counter> channel;
    private Hub hub;
    private Channel<Counter>[] chain;
    private int next;

    @Setup(Level.Iteration)
    @SuppressWarnings("unchecked")
    public void setup() {
        DispatchContext context = new DispatchContext();
        cell = ExclusivityCell.of(new Counter(), context);

        channel = new Channel<>("bench");
        for (int i = 0; i < members; i++) {
            channel.insert(ExclusivityCell.of(new Counter(), context));
        }

        hub = new Hub("bench", SwitchboardConfig.global());
        chain = new Channel[members + 1];
        for (int i = 0; i <= members; i++) {
            chain[i] = hub.channel("link-" + i);
        }
        next = 0;
    }

    @Benchmark
    public void cellDispatch(Blackhole bh) {
        Counter counter = cell.dispatch(hold -> {
            hold.payload().hit();
            return hold.payload();
        });
        bh.consume(counter);
    }

    @Benchmark
    public void cellSuspendReentry(Blackhole bh) {
        Counter counter = cell.dispatch(hold ->
            hold.suspend(() -> cell.dispatch(inner -> {
                inner.payload().hit();
                return inner.payload();
            })));
        bh.consume(counter);
    }

    @Benchmark
    public void channelDispatch(Blackhole bh) {
        channel.dispatch(Counter::hit);
        bh.consume(channel);
    }

    @Benchmark
    public void subscribeWithCycleCheck(Blackhole bh) {
        int from = next++ % members;
        Channel<Counter> in = chain[from];
        Channel<Counter> out = chain[from + 1];
        ExclusivityCell<Counter> subscribed = hub.subscribe(Subscriber.<Counter>of(
            HandlerIdentity.of("Link"),
            emitters -> {
                emitters.channel(out);
                return new Counter();
            },
            listeners -> listeners.listen(in)));
        bh.consume(subscribed);
    }
}
