package bbt.tao.lexroute.resilience;

import bbt.tao.lexroute.exception.CircuitOpenException;
import bbt.tao.lexroute.exception.RetriesExhaustedException;
import bbt.tao.lexroute.exception.TimeoutExceededException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;

/**
 * Оборачивает вызовы внешних ресурсов в таймаут, circuit breaker и retry.
 *
 * <p>Порядок слоёв (снаружи внутрь) фиксирован: таймаут, circuit breaker, retry, сам вызов.
 * Таймаут может прервать цикл повторов, а открытая цепь отклоняет вызов до любых повторов.
 * Для трёх форм вызова (блокирующий, {@link Mono}, {@link Flux}) возвращается обёртка той же формы.</p>
 *
 * <p>Потоковая форма не повторяется: состояние цепи обновляется по завершению потока,
 * а таймаут отсчитывается от подписки и перепроверяется на каждом чанке.</p>
 */
@Slf4j
public class ResilienceMiddleware {

    private final CircuitRegistry registry;
    private final Scheduler blockingScheduler;

    public ResilienceMiddleware(CircuitRegistry registry) {
        this(registry, Schedulers.boundedElastic());
    }

    public ResilienceMiddleware(CircuitRegistry registry, Scheduler blockingScheduler) {
        this.registry = registry;
        this.blockingScheduler = blockingScheduler;
    }

    public <T> BlockingOperation<T> blocking(BlockingOperation<T> operation, ResiliencePolicy policy) {
        return () -> {
            try {
                return offload(policy, operation).block();
            } catch (RuntimeException e) {
                Throwable cause = Exceptions.unwrap(e);
                if (cause instanceof Exception checked) {
                    throw checked;
                }
                throw e;
            }
        };
    }

    public <T> AsyncOperation<T> async(AsyncOperation<T> operation, ResiliencePolicy policy) {
        return () -> guard(Mono.defer(operation::execute), policy);
    }

    public <T> StreamOperation<T> stream(StreamOperation<T> operation, ResiliencePolicy policy) {
        return () -> guardStream(Flux.defer(operation::execute), policy);
    }

    public <T> Mono<T> call(ResiliencePolicy policy, AsyncOperation<T> operation) {
        return async(operation, policy).execute();
    }

    public <T> Flux<T> callStream(ResiliencePolicy policy, StreamOperation<T> operation) {
        return stream(operation, policy).execute();
    }

    /**
     * Выполняет блокирующий вызов на {@code boundedElastic} и отдаёт результат как {@link Mono}.
     * Пустой результат ({@code null}) превращается в пустой {@link Mono}.
     */
    public <T> Mono<T> offload(ResiliencePolicy policy, BlockingOperation<T> operation) {
        Mono<T> attempt = Mono.fromCallable(operation::execute).subscribeOn(blockingScheduler);
        return guard(attempt, policy);
    }

    private <T> Mono<T> guard(Mono<T> attempt, ResiliencePolicy policy) {
        CircuitBreaker circuit = registry.circuit(policy);
        Mono<T> retried = policy.maxAttempts() > 1 ? attempt.retryWhen(retrySpec(policy)) : attempt;

        Mono<T> protectedCall = Mono.defer(() -> {
            if (!circuit.tryAcquire()) {
                log.debug("Circuit '{}' открыт, вызов отклонён", policy.resource());
                return Mono.error(new CircuitOpenException(policy.resource()));
            }
            return retried
                    .doOnSuccess(value -> circuit.onSuccess())
                    .doOnError(circuit::onFailure)
                    .doOnCancel(circuit::releaseProbe);
        });

        return protectedCall.timeout(policy.timeout(), Mono.defer(() -> {
            TimeoutExceededException timeout = new TimeoutExceededException(policy.resource(), policy.timeout());
            log.warn("Таймаут вызова '{}' ({} мс)", policy.resource(), policy.timeout().toMillis());
            circuit.onFailure(timeout);
            return Mono.error(timeout);
        }));
    }

    private RetryBackoffSpec retrySpec(ResiliencePolicy policy) {
        return Retry.backoff(policy.maxAttempts() - 1L, policy.minWait())
                .maxBackoff(policy.maxWait())
                .jitter(0d)
                .filter(policy.retryOn())
                .doBeforeRetry(signal -> log.warn("Повтор {} для '{}' через {} мс: {}",
                        signal.totalRetries() + 1,
                        policy.resource(),
                        policy.backoffBeforeRetry(signal.totalRetries()).toMillis(),
                        signal.failure().toString()))
                .onRetryExhaustedThrow((spec, signal) -> {
                    long attempts = signal.totalRetries() + 1;
                    log.error("Попытки для '{}' исчерпаны ({}): {}", policy.resource(), attempts, signal.failure().toString());
                    return policy.wrapExhausted()
                            ? new RetriesExhaustedException(policy.resource(), attempts, signal.failure())
                            : signal.failure();
                });
    }

    private <T> Flux<T> guardStream(Flux<T> source, ResiliencePolicy policy) {
        CircuitBreaker circuit = registry.circuit(policy);
        return Flux.defer(() -> {
            if (!circuit.tryAcquire()) {
                log.debug("Circuit '{}' открыт, поток отклонён", policy.resource());
                return Flux.error(new CircuitOpenException(policy.resource()));
            }
            long deadline = System.nanoTime() + policy.timeout().toNanos();
            Flux<T> observed = source
                    .doOnComplete(circuit::onSuccess)
                    .doOnError(circuit::onFailure)
                    .doOnCancel(circuit::releaseProbe);
            return observed.timeout(
                    Mono.delay(policy.timeout()),
                    chunk -> Mono.delay(remaining(deadline)),
                    Flux.defer(() -> {
                        TimeoutExceededException timeout = new TimeoutExceededException(policy.resource(), policy.timeout());
                        log.warn("Таймаут потока '{}' ({} мс)", policy.resource(), policy.timeout().toMillis());
                        circuit.onFailure(timeout);
                        return Flux.error(timeout);
                    }));
        });
    }

    private static Duration remaining(long deadlineNanos) {
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }
}
