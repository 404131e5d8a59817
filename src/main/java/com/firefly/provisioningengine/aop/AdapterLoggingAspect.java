package com.firefly.provisioningengine.aop;

import com.firefly.provisioningengine.adapter.ResourceAdapter;
import com.firefly.provisioningengine.util.JsonUtils;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicLong;

import static com.firefly.provisioningengine.util.JsonUtils.safeString;
import static com.firefly.provisioningengine.util.JsonUtils.summarize;

/**
 * Logs every reactive {@link ResourceAdapter} call ({@code exists}, {@code create}, {@code populate}) with its
 * latency and outcome. Latency is measured from subscription, not from assembly.
 */
@Aspect
public class AdapterLoggingAspect {
    private static final Logger log = LoggerFactory.getLogger(AdapterLoggingAspect.class);

    @Around("within(com.firefly.provisioningengine.adapter.ResourceAdapter+) && execution(reactor.core.publisher.Mono *(..))")
    public Object aroundAdapterCall(ProceedingJoinPoint pjp) throws Throwable {
        MethodSignature ms = (MethodSignature) pjp.getSignature();
        String adapter = pjp.getTarget() instanceof ResourceAdapter ra ? ra.key() : ms.getDeclaringTypeName();
        String method = ms.getMethod().getName();

        Object result = pjp.proceed();
        if (!(result instanceof Mono<?> mono)) {
            return result;
        }
        AtomicLong start = new AtomicLong();
        return mono
                .doOnSubscribe(s -> {
                    start.set(System.currentTimeMillis());
                    if (log.isDebugEnabled()) {
                        log.debug(JsonUtils.json(
                                "adapter_aspect", "invocation_start",
                                "adapter", adapter,
                                "method", method,
                                "thread", Thread.currentThread().getName()
                        ));
                    }
                })
                .doOnSuccess(value -> log.info(JsonUtils.json(
                        "adapter_aspect", "invocation_success",
                        "adapter", adapter,
                        "method", method,
                        "latencyMs", Long.toString(System.currentTimeMillis() - start.get()),
                        "result", value == null ? "empty" : summarize(value, 200)
                )))
                .doOnError(t -> log.info(JsonUtils.json(
                        "adapter_aspect", "invocation_error",
                        "adapter", adapter,
                        "method", method,
                        "latencyMs", Long.toString(System.currentTimeMillis() - start.get()),
                        "error_class", t.getClass().getName(),
                        "error_msg", safeString(t.getMessage(), 300)
                )));
    }
}
