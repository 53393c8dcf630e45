package bbt.tao.lexroute.service.law;

import bbt.tao.lexroute.exception.TransientNetworkException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * HTTP клиент MCP-сервера судебной практики (zakononline).
 * 404 означает "не найдено", 5xx и 429 считаются временными сбоями.
 */
@Slf4j
public class ZakonOnlineLegalClient implements LegalSearchBackend {

    static final String SEARCH_PATH = "/mcp/zakononline/search_cases";
    static final String DETAILS_PATH = "/mcp/zakononline/get_case_details";
    static final String FULL_TEXT_PATH = "/mcp/zakononline/get_case_full_text";

    private static final Pattern CASE_NUMBER = Pattern.compile("\\d+/\\d+/\\d+");
    private static final ParameterizedTypeReference<List<LegalCase>> CASE_LIST = new ParameterizedTypeReference<>() {};

    private final WebClient webClient;

    public ZakonOnlineLegalClient(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<List<LegalCase>> searchCases(String query, String instance, int limit) {
        Map<String, Object> body = Map.of("query", query, "instance", instance, "limit", limit);
        return webClient.post()
                .uri(SEARCH_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(CASE_LIST)
                .doOnNext(cases -> log.info("Поиск дел '{}': найдено {}", query, cases.size()))
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.just(List.of()))
                .onErrorMap(WebClientResponseException.class, ZakonOnlineLegalClient::classify)
                .defaultIfEmpty(List.of());
    }

    @Override
    public Mono<CaseDetails> getCaseDetails(String caseNumberOrDocId) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (CASE_NUMBER.matcher(caseNumberOrDocId).matches()) {
            body.put("caseNumber", caseNumberOrDocId);
        } else {
            body.put("docId", caseNumberOrDocId);
        }
        return webClient.post()
                .uri(DETAILS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(CaseDetails.class)
                .doOnNext(details -> log.info("Детали дела {}: docId={}", caseNumberOrDocId, details.docId()))
                .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                    log.info("Дело {} не найдено", caseNumberOrDocId);
                    return Mono.empty();
                })
                .onErrorMap(WebClientResponseException.class, ZakonOnlineLegalClient::classify);
    }

    @Override
    public Mono<String> getCaseFullText(String docId) {
        return webClient.post()
                .uri(FULL_TEXT_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("docId", docId))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(node -> Mono.justOrEmpty(extractText(node)))
                .doOnNext(text -> log.info("Полный текст документа {}: {} символов", docId, text.length()))
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                .onErrorMap(WebClientResponseException.class, ZakonOnlineLegalClient::classify);
    }

    private static String extractText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        for (String field : List.of("text", "full_text", "fullText", "content")) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private static Throwable classify(WebClientResponseException e) {
        if (e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return new TransientNetworkException("Legal search HTTP " + e.getStatusCode().value(), e);
        }
        return e;
    }
}
