package bbt.tao.lexroute.controller;

import bbt.tao.lexroute.dto.api.AnswerMetadata;
import bbt.tao.lexroute.dto.api.QueryAnswer;
import bbt.tao.lexroute.dto.api.QueryOptions;
import bbt.tao.lexroute.dto.api.QueryRequest;
import bbt.tao.lexroute.service.QueryRouterService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/query")
public class QueryController {

    private static final Logger log = LoggerFactory.getLogger(QueryController.class);

    private final QueryRouterService router;

    public QueryController(QueryRouterService router) {
        this.router = router;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<QueryAnswer>> query(@RequestBody QueryRequest request) {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            return Mono.just(ResponseEntity.badRequest().body(rejected("Field 'query' is required")));
        }
        log.info("Received query request: provider={}, model={}", request.getProvider(), request.getModel());
        return router.answer(request.getQuery(), QueryOptions.from(request))
                .map(ResponseEntity::ok)
                .onErrorResume(error -> {
                    log.error("Error in query endpoint: {}", error.getMessage(), error);
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(rejected(error.getMessage())));
                });
    }

    @PostMapping(value = "/stream", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> stream(@RequestBody QueryRequest request) {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            return Flux.just(ServerSentEvent.<String>builder().event("error").data("Field 'query' is required").build());
        }
        log.info("Received stream query request: provider={}", request.getProvider());
        return router.answerStream(request.getQuery(), QueryOptions.from(request))
                .map(chunk -> ServerSentEvent.<String>builder().event("chunk").data(chunk).build())
                .doOnCancel(() -> log.warn("Query stream was canceled"))
                .doOnComplete(() -> log.info("Query stream completed"));
    }

    private static QueryAnswer rejected(String message) {
        return QueryAnswer.builder()
                .answer("")
                .sources(List.of())
                .metadata(AnswerMetadata.builder().errors(List.of(message)).build())
                .error(message)
                .build();
    }
}
