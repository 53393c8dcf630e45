package bbt.tao.lexroute.controller;

import bbt.tao.lexroute.resilience.CircuitRegistry;
import bbt.tao.lexroute.resilience.CircuitStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/resilience/circuits")
public class ResilienceController {

    private final CircuitRegistry registry;

    public ResilienceController(CircuitRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<CircuitStatus> circuits() {
        return registry.status();
    }

    @PostMapping("/{name}/reset")
    public ResponseEntity<Void> reset(@PathVariable String name) {
        if (!registry.reset(name)) {
            return ResponseEntity.notFound().build();
        }
        log.info("Circuit '{}' сброшен вручную", name);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/reset")
    public ResponseEntity<Void> resetAll() {
        registry.resetAll();
        log.info("Все circuit'ы сброшены вручную");
        return ResponseEntity.noContent().build();
    }
}
