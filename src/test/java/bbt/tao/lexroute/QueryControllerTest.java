package bbt.tao.lexroute;

import bbt.tao.lexroute.controller.QueryController;
import bbt.tao.lexroute.dto.api.AnswerMetadata;
import bbt.tao.lexroute.dto.api.QueryAnswer;
import bbt.tao.lexroute.dto.api.QueryOptions;
import bbt.tao.lexroute.service.QueryRouterService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryControllerTest {

    private QueryRouterService router;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        router = mock(QueryRouterService.class);
        client = WebTestClient.bindToController(new QueryController(router)).build();
    }

    @Test
    void answersQueryWithRequestOptions() {
        QueryAnswer answer = QueryAnswer.builder()
                .answer("Орендна плата становить 10 000 грн")
                .sources(List.of("RAG"))
                .model("test-model")
                .metadata(AnswerMetadata.builder().intent("GENERAL").usedRetrieval(true).build())
                .build();
        when(router.answer(anyString(), any())).thenReturn(Mono.just(answer));

        client.post().uri("/api/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "Яка орендна плата?", "useLegal", false, "topK", 3))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.answer").isEqualTo("Орендна плата становить 10 000 грн")
                .jsonPath("$.sources[0]").isEqualTo("RAG")
                .jsonPath("$.metadata.intent").isEqualTo("GENERAL");

        ArgumentCaptor<QueryOptions> options = ArgumentCaptor.forClass(QueryOptions.class);
        verify(router).answer(eq("Яка орендна плата?"), options.capture());
        assertThat(options.getValue().getUseLegal()).isFalse();
        assertThat(options.getValue().getUseRetrieval()).isNull();
        assertThat(options.getValue().getTopK()).isEqualTo(3);
        assertThat(options.getValue().isDirectFullText()).isTrue();
    }

    @Test
    void blankQueryIsRejected() {
        client.post().uri("/api/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "   "))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Field 'query' is required");

        verify(router, never()).answer(anyString(), any());
    }

    @Test
    void unexpectedRouterErrorBecomesServerError() {
        when(router.answer(anyString(), any())).thenReturn(Mono.error(new IllegalStateException("boom")));

        client.post().uri("/api/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "Що таке позовна давність?"))
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("boom");
    }

    @Test
    void streamsChunksAsServerSentEvents() {
        when(router.answerStream(anyString(), any())).thenReturn(Flux.just("Позовна ", "давність ", "3 роки"));

        Flux<ServerSentEvent<String>> events = client.post().uri("/api/query/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(Map.of("query", "Що таке позовна давність?"))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .returnResult(new ParameterizedTypeReference<ServerSentEvent<String>>() {
                })
                .getResponseBody();

        StepVerifier.create(events.map(ServerSentEvent::data))
                .expectNext("Позовна ", "давність ", "3 роки")
                .verifyComplete();
    }

    @Test
    void blankStreamQueryEmitsErrorEvent() {
        Flux<ServerSentEvent<String>> events = client.post().uri("/api/query/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(Map.of("query", ""))
                .exchange()
                .expectStatus().isOk()
                .returnResult(new ParameterizedTypeReference<ServerSentEvent<String>>() {
                })
                .getResponseBody();

        StepVerifier.create(events)
                .assertNext(event -> {
                    assertThat(event.event()).isEqualTo("error");
                    assertThat(event.data()).isEqualTo("Field 'query' is required");
                })
                .verifyComplete();
        verify(router, never()).answerStream(anyString(), any());
    }
}
