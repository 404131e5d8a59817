package com.firefly.provisioningengine.engine;

import com.firefly.provisioningengine.adapter.DiscoveredResource;
import com.firefly.provisioningengine.adapter.ResourceAdapter;
import com.firefly.provisioningengine.adapter.ResourceTarget;
import com.firefly.provisioningengine.registry.StepDefinition;
import com.firefly.provisioningengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps every step in an existence check so re-running a step never duplicates its resource.
 * <p>
 * {@code exists} is consulted first for the exact same target; only when it completes empty are
 * {@code create} and {@code populate} invoked. Transient failures are retried per the step's retry/backoff
 * settings (each attempt repeats the existence check). All errors are classified here, so the executor only
 * ever sees a {@link StepResult}.
 */
public class IdempotencyGuard {
    private static final Logger log = LoggerFactory.getLogger(IdempotencyGuard.class);

    private final ErrorClassifier classifier;

    public IdempotencyGuard(ErrorClassifier classifier) {
        this.classifier = classifier;
    }

    public Mono<StepResult> execute(StepDefinition step, ResourceAdapter adapter, ResourceTarget target) {
        AtomicInteger attempts = new AtomicInteger();
        if (log.isDebugEnabled()) {
            log.debug(JsonUtils.json(
                    "provisioning_guard", "exec_config",
                    "stepId", step.id,
                    "adapter", adapter.key(),
                    "target", target.name(),
                    "retry", Integer.toString(step.retry),
                    "backoffMs", step.backoff != null ? Long.toString(step.backoff.toMillis()) : "0",
                    "timeoutMs", step.timeout != null ? Long.toString(step.timeout.toMillis()) : "0"
            ));
        }
        Mono<StepResult> attempt = Mono.defer(() -> {
            int n = attempts.incrementAndGet();
            return adapter.exists(target)
                    .map(existing -> StepResult.alreadyExists(existing, n))
                    .switchIfEmpty(Mono.defer(() -> adapter.create(target)
                            .defaultIfEmpty(DiscoveredResource.none())
                            .flatMap(created -> adapter.populate(target, created).thenReturn(created))
                            .map(created -> StepResult.created(created, n))));
        });
        if (step.timeout != null && !step.timeout.isZero()) {
            attempt = attempt.timeout(step.timeout);
        }
        if (step.retry > 0) {
            attempt = attempt
                    .doOnError(err -> log.info(JsonUtils.json(
                            "provisioning_guard", "attempt_failed",
                            "stepId", step.id,
                            "attempt", Integer.toString(attempts.get()),
                            "transient", Boolean.toString(classifier.isTransient(err)),
                            "error_msg", JsonUtils.errorMessage(err, 300)
                    )))
                    .retryWhen(retrySpec(step));
        }
        return attempt.onErrorResume(err -> Mono.just(StepResult.failed(classifier.toReason(step.id, err), attempts.get())));
    }

    /**
     * Existence check only, used to re-verify steps a previous run already completed. Never creates anything.
     * Errors propagate to the caller.
     */
    public Mono<Optional<DiscoveredResource>> verify(StepDefinition step, ResourceAdapter adapter, ResourceTarget target) {
        Mono<Optional<DiscoveredResource>> check = Mono.defer(() -> adapter.exists(target))
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
        if (step.timeout != null && !step.timeout.isZero()) {
            check = check.timeout(step.timeout);
        }
        return check;
    }

    private Retry retrySpec(StepDefinition step) {
        if (step.backoff != null && !step.backoff.isZero()) {
            return Retry.backoff(step.retry, step.backoff)
                    .jitter(0.5d)
                    .filter(classifier::isTransient)
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure());
        }
        return Retry.max(step.retry)
                .filter(classifier::isTransient)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
