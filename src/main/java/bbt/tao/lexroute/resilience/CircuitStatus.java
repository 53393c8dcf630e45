package bbt.tao.lexroute.resilience;

import java.time.Duration;

public record CircuitStatus(
        String name,
        CircuitState state,
        int failureCount,
        int failMax,
        Duration resetTimeout
) {
}
