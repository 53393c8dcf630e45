package bbt.tao.lexroute.controller;

import bbt.tao.lexroute.cache.QueryCache;
import bbt.tao.lexroute.resilience.CircuitRegistry;
import bbt.tao.lexroute.resilience.CircuitState;
import bbt.tao.lexroute.resilience.CircuitStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final CircuitRegistry registry;
    private final QueryCache cache;

    public HealthController(CircuitRegistry registry, QueryCache cache) {
        this.registry = registry;
        this.cache = cache;
    }

    @GetMapping
    public Mono<Map<String, Object>> health() {
        return Mono.fromCallable(cache::isHealthy)
                .subscribeOn(Schedulers.boundedElastic())
                .map(cacheUp -> {
                    List<CircuitStatus> circuits = registry.status();
                    boolean anyOpen = circuits.stream().anyMatch(c -> c.state() == CircuitState.OPEN);
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("status", cacheUp && !anyOpen ? "ok" : "degraded");
                    body.put("cache", cacheUp ? "up" : "down");
                    body.put("circuits", circuits);
                    return body;
                });
    }
}
