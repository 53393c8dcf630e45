package bbt.tao.lexroute.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Реестр circuit breaker'ов по имени ресурса. Цепь создаётся лениво
 * с порогами политики, которая обратилась к ней первой.
 */
@Slf4j
public class CircuitRegistry {

    private final ConcurrentMap<String, CircuitBreaker> circuits = new ConcurrentHashMap<>();
    private final Clock clock;

    public CircuitRegistry(Clock clock) {
        this.clock = clock;
    }

    public CircuitBreaker circuit(ResiliencePolicy policy) {
        return circuits.computeIfAbsent(policy.resource(), name -> {
            log.info("Создан circuit breaker '{}': failMax={}, resetTimeout={}", name, policy.failMax(), policy.resetTimeout());
            return new CircuitBreaker(name, policy.failMax(), policy.resetTimeout(), clock);
        });
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(circuits.get(name));
    }

    public List<CircuitStatus> status() {
        return circuits.values().stream()
                .map(CircuitBreaker::status)
                .sorted(Comparator.comparing(CircuitStatus::name))
                .toList();
    }

    public boolean reset(String name) {
        CircuitBreaker circuit = circuits.get(name);
        if (circuit == null) {
            return false;
        }
        circuit.reset();
        log.info("Circuit '{}' сброшен вручную", name);
        return true;
    }

    public void resetAll() {
        circuits.values().forEach(CircuitBreaker::reset);
        log.info("Все circuit breaker'ы сброшены ({})", circuits.size());
    }
}
