package bbt.tao.lexroute.resilience;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Неизменяемые параметры защиты одного вызова: имя ресурса (ключ circuit breaker),
 * таймаут, retry с экспоненциальной задержкой и пороги circuit breaker.
 * Пресеты строит {@link ResiliencePolicies}; точка вызова переопределяет нужные поля через with-методы.
 *
 * <p>Задержка перед повтором n (n с нуля) равна {@code min(2^n * minWait, maxWait)}.</p>
 */
public record ResiliencePolicy(
        String resource,
        Duration timeout,
        int maxAttempts,
        Duration minWait,
        Duration maxWait,
        int failMax,
        Duration resetTimeout,
        Predicate<Throwable> retryOn,
        boolean wrapExhausted
) {

    public ResiliencePolicy {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(minWait, "minWait");
        Objects.requireNonNull(maxWait, "maxWait");
        Objects.requireNonNull(resetTimeout, "resetTimeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (maxWait.compareTo(minWait) < 0) {
            throw new IllegalArgumentException("maxWait < minWait: " + maxWait + " < " + minWait);
        }
        maxAttempts = Math.max(1, maxAttempts);
        failMax = Math.max(1, failMax);
        retryOn = retryOn == null ? FailureClassifier::isTransient : retryOn;
    }

    public ResiliencePolicy withResource(String resource) {
        return new ResiliencePolicy(resource, timeout, maxAttempts, minWait, maxWait, failMax, resetTimeout, retryOn, wrapExhausted);
    }

    public ResiliencePolicy withTimeout(Duration timeout) {
        return new ResiliencePolicy(resource, timeout, maxAttempts, minWait, maxWait, failMax, resetTimeout, retryOn, wrapExhausted);
    }

    public ResiliencePolicy withMaxAttempts(int maxAttempts) {
        return new ResiliencePolicy(resource, timeout, maxAttempts, minWait, maxWait, failMax, resetTimeout, retryOn, wrapExhausted);
    }

    public ResiliencePolicy withWaits(Duration minWait, Duration maxWait) {
        return new ResiliencePolicy(resource, timeout, maxAttempts, minWait, maxWait, failMax, resetTimeout, retryOn, wrapExhausted);
    }

    public ResiliencePolicy withCircuit(int failMax, Duration resetTimeout) {
        return new ResiliencePolicy(resource, timeout, maxAttempts, minWait, maxWait, failMax, resetTimeout, retryOn, wrapExhausted);
    }

    public ResiliencePolicy withRetryOn(Predicate<Throwable> retryOn) {
        return new ResiliencePolicy(resource, timeout, maxAttempts, minWait, maxWait, failMax, resetTimeout, retryOn, wrapExhausted);
    }

    /**
     * После исчерпания попыток бросать {@link bbt.tao.lexroute.exception.RetriesExhaustedException}
     * вместо последней исходной ошибки.
     */
    public ResiliencePolicy wrappingExhausted() {
        return new ResiliencePolicy(resource, timeout, maxAttempts, minWait, maxWait, failMax, resetTimeout, retryOn, true);
    }

    public Duration backoffBeforeRetry(long retryIndex) {
        double millis = minWait.toMillis() * Math.pow(2, retryIndex);
        return Duration.ofMillis((long) Math.min(millis, maxWait.toMillis()));
    }
}
