package com.firefly.provisioningengine.events;

import com.firefly.provisioningengine.core.FailureReason;
import com.firefly.provisioningengine.core.ProgressEvent;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgressChannelTest {

    private static ProgressEvent at(int percent) {
        return ProgressEvent.progress("run-1", "step", percent, "at " + percent);
    }

    @Test
    void lateSubscriberReceivesBufferedEvents() {
        ProgressChannel channel = new ProgressChannel("run-1", 16);
        channel.emit(at(0));
        channel.emit(at(10));
        channel.emit(ProgressEvent.succeeded("run-1", "done", List.of("step")));
        channel.complete();

        StepVerifier.create(channel.stream())
                .expectNext(at(0), at(10))
                .assertNext(e -> assertEquals("succeeded", e.status()))
                .verifyComplete();
    }

    @Test
    void regressingPercentagesAreDropped() {
        ProgressChannel channel = new ProgressChannel("run-1", 16);
        channel.emit(at(20));
        channel.emit(at(15));
        channel.emit(at(20));
        channel.emit(at(40));
        channel.complete();

        StepVerifier.create(channel.stream().map(ProgressEvent::percent))
                .expectNext(20, 20, 40)
                .verifyComplete();
    }

    @Test
    void terminalFailureIsDeliveredEvenBelowTheHighWaterMark() {
        ProgressEvent failed = ProgressEvent.failed("run-1", 40, FailureReason.permanent("tables", "bad"), List.of());

        StepVerifier.create(ProgressChannel.monotonic(Flux.just(at(60), failed)))
                .expectNext(at(60), failed)
                .verifyComplete();
    }

    @Test
    void bufferKeepsOnlyTheMostRecentEvents() {
        ProgressChannel channel = new ProgressChannel("run-1", 2);
        channel.emit(at(0));
        channel.emit(at(10));
        channel.emit(at(20));
        channel.complete();

        StepVerifier.create(channel.stream().map(ProgressEvent::percent))
                .expectNext(10, 20)
                .verifyComplete();
    }

    @Test
    void resumeStartsFromTheCurrentEventAndSkipsOlderOnes() {
        ProgressChannel channel = new ProgressChannel("run-1", 16);
        channel.emit(at(0));
        channel.emit(at(10));
        channel.emit(at(20));

        StepVerifier.create(channel.resume(at(20)).map(ProgressEvent::percent))
                .expectNext(20)
                .then(() -> {
                    channel.emit(at(45));
                    channel.emit(ProgressEvent.succeeded("run-1", "done", List.of()));
                })
                .expectNext(45, 100)
                .verifyComplete();
    }
}
