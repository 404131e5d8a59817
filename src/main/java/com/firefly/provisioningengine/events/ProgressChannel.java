package com.firefly.provisioningengine.events;

import com.firefly.provisioningengine.core.ProgressEvent;
import com.firefly.provisioningengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Best-effort progress stream for one run: a single producer (the executor) and any number of consumers
 * that may come and go.
 * <p>
 * Events are held in a bounded replay buffer only; nothing is persisted. A consumer that reconnects should
 * start from the run's current snapshot ({@link #resume(ProgressEvent)}) instead of expecting missed events.
 * Every subscriber sees non-decreasing percentages; the terminal event is always delivered.
 */
public class ProgressChannel {
    private static final Logger log = LoggerFactory.getLogger(ProgressChannel.class);

    private final String runId;
    private final Sinks.Many<ProgressEvent> sink;

    public ProgressChannel(String runId, int bufferSize) {
        this.runId = runId;
        this.sink = Sinks.many().replay().limit(Math.max(1, bufferSize));
    }

    public String runId() {
        return runId;
    }

    public synchronized void emit(ProgressEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure()) {
            log.debug(JsonUtils.json(
                    "progress_channel", "dropped",
                    "runId", runId,
                    "percent", Integer.toString(event.percent()),
                    "result", result.name()
            ));
        }
    }

    public synchronized void complete() {
        sink.tryEmitComplete();
    }

    /** Buffered and live events; what the consumer that started the run receives. */
    public Flux<ProgressEvent> stream() {
        return monotonic(sink.asFlux());
    }

    /**
     * Stream for a reconnecting consumer: {@code current} (derived from the run snapshot) first, then only
     * events beyond it.
     */
    public Flux<ProgressEvent> resume(ProgressEvent current) {
        int floor = current.percent();
        Flux<ProgressEvent> live = sink.asFlux().filter(e -> e.isTerminal() || e.percent() > floor);
        return monotonic(Flux.concat(Mono.just(current), live))
                .takeUntil(ProgressEvent::isTerminal);
    }

    static Flux<ProgressEvent> monotonic(Flux<ProgressEvent> source) {
        return Flux.defer(() -> {
            AtomicInteger last = new AtomicInteger(-1);
            return source.filter(e -> {
                if (e.isTerminal()) {
                    return true;
                }
                if (e.percent() < last.get()) {
                    return false;
                }
                last.set(e.percent());
                return true;
            });
        });
    }
}
