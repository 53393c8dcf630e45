package bbt.tao.lexroute.controller;

import bbt.tao.lexroute.conf.LexRouteProperties;
import bbt.tao.lexroute.resilience.ResilienceMiddleware;
import bbt.tao.lexroute.resilience.ResiliencePolicies;
import bbt.tao.lexroute.service.law.CaseDetails;
import bbt.tao.lexroute.service.law.LegalCase;
import bbt.tao.lexroute.service.law.LegalSearchBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Прямой доступ к поиску судебной практики, в обход маршрутизатора.
 */
@RestController
@RequestMapping("/api/law")
public class LawController {

    private static final Logger log = LoggerFactory.getLogger(LawController.class);

    private final LegalSearchBackend legal;
    private final ResilienceMiddleware middleware;
    private final ResiliencePolicies policies;
    private final LexRouteProperties.Law settings;

    public LawController(LegalSearchBackend legal,
                         ResilienceMiddleware middleware,
                         ResiliencePolicies policies,
                         LexRouteProperties properties) {
        this.legal = legal;
        this.middleware = middleware;
        this.policies = policies;
        this.settings = properties.getLaw();
    }

    @GetMapping(value = "/cases", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<LegalCase>> searchCases(@RequestParam String query,
                                             @RequestParam(required = false) String instance,
                                             @RequestParam(required = false) Integer limit) {
        String effectiveInstance = instance != null ? instance : settings.getInstance();
        int effectiveLimit = limit != null && limit > 0 ? limit : settings.getSearchLimit();
        log.info("Поиск дел: instance={}, limit={}", effectiveInstance, effectiveLimit);
        return middleware.call(policies.legalSearch(),
                () -> legal.searchCases(query, effectiveInstance, effectiveLimit));
    }

    @GetMapping(value = "/case/{caseNumber}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<CaseDetails>> caseDetails(@PathVariable String caseNumber) {
        return middleware.call(policies.legalSearch(), () -> legal.getCaseDetails(caseNumber))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}
