package bbt.tao.lexroute.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker одного ресурса. Всё состояние лежит в одном неизменяемом снимке,
 * переходы выполняются через compare-and-set, блокировки не используются.
 *
 * <ul>
 *   <li>CLOSED: ошибки накапливаются, при {@code failMax} подряд переход в OPEN;</li>
 *   <li>OPEN: вызовы отклоняются, пока не пройдёт {@code resetTimeout};</li>
 *   <li>HALF_OPEN: пропускается один пробный вызов; успех закрывает цепь, ошибка снова открывает
 *   её с новым отсчётом.</li>
 * </ul>
 */
@Slf4j
public class CircuitBreaker {

    private record Snapshot(CircuitState state, int failures, long openedAtMillis, boolean probeInFlight) {
        static final Snapshot CLOSED = new Snapshot(CircuitState.CLOSED, 0, 0L, false);
    }

    private final String name;
    private final int failMax;
    private final Duration resetTimeout;
    private final Clock clock;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.CLOSED);

    public CircuitBreaker(String name, int failMax, Duration resetTimeout, Clock clock) {
        this.name = name;
        this.failMax = Math.max(1, failMax);
        this.resetTimeout = resetTimeout;
        this.clock = clock;
    }

    /**
     * @return {@code true}, если вызов можно выполнить; в HALF_OPEN разрешение получает только один вызов
     */
    public boolean tryAcquire() {
        while (true) {
            Snapshot current = snapshot.get();
            if (current.state() == CircuitState.CLOSED) {
                return true;
            }
            if (current.state() == CircuitState.OPEN) {
                if (clock.millis() - current.openedAtMillis() < resetTimeout.toMillis()) {
                    return false;
                }
                Snapshot probe = new Snapshot(CircuitState.HALF_OPEN, current.failures(), current.openedAtMillis(), true);
                if (snapshot.compareAndSet(current, probe)) {
                    log.info("Circuit '{}': OPEN -> HALF_OPEN, пропускаем пробный вызов", name);
                    return true;
                }
                continue;
            }
            if (current.probeInFlight()) {
                return false;
            }
            Snapshot probe = new Snapshot(CircuitState.HALF_OPEN, current.failures(), current.openedAtMillis(), true);
            if (snapshot.compareAndSet(current, probe)) {
                return true;
            }
        }
    }

    public void onSuccess() {
        while (true) {
            Snapshot current = snapshot.get();
            if (current.state() == CircuitState.OPEN) {
                // поздний успех вызова, допущенного до открытия цепи
                return;
            }
            if (current == Snapshot.CLOSED || snapshot.compareAndSet(current, Snapshot.CLOSED)) {
                if (current.state() == CircuitState.HALF_OPEN) {
                    log.info("Circuit '{}': HALF_OPEN -> CLOSED", name);
                }
                return;
            }
        }
    }

    public void onFailure(Throwable error) {
        while (true) {
            Snapshot current = snapshot.get();
            Snapshot next;
            if (current.state() == CircuitState.HALF_OPEN) {
                next = new Snapshot(CircuitState.OPEN, current.failures(), clock.millis(), false);
            } else if (current.state() == CircuitState.CLOSED) {
                int failures = current.failures() + 1;
                next = failures >= failMax
                        ? new Snapshot(CircuitState.OPEN, failures, clock.millis(), false)
                        : new Snapshot(CircuitState.CLOSED, failures, 0L, false);
            } else {
                // ответ вызова, допущенного до открытия цепи
                return;
            }
            if (snapshot.compareAndSet(current, next)) {
                if (next.state() == CircuitState.OPEN) {
                    log.warn("Circuit '{}': {} -> OPEN после ошибки: {}", name, current.state(),
                            error == null ? "unknown" : error.toString());
                }
                return;
            }
        }
    }

    /**
     * Пробный вызов отменён без результата: освобождаем слот, следующий вызов снова станет пробным.
     */
    public void releaseProbe() {
        while (true) {
            Snapshot current = snapshot.get();
            if (current.state() != CircuitState.HALF_OPEN || !current.probeInFlight()) {
                return;
            }
            Snapshot released = new Snapshot(CircuitState.HALF_OPEN, current.failures(), current.openedAtMillis(), false);
            if (snapshot.compareAndSet(current, released)) {
                return;
            }
        }
    }

    public void reset() {
        snapshot.set(Snapshot.CLOSED);
    }

    public String getName() {
        return name;
    }

    public CircuitState getState() {
        return snapshot.get().state();
    }

    public int getFailureCount() {
        return snapshot.get().failures();
    }

    public CircuitStatus status() {
        Snapshot current = snapshot.get();
        return new CircuitStatus(name, current.state(), current.failures(), failMax, resetTimeout);
    }
}
