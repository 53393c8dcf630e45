package bbt.tao.lexroute;

import bbt.tao.lexroute.exception.TransientNetworkException;
import bbt.tao.lexroute.service.law.LegalCase;
import bbt.tao.lexroute.service.law.ZakonOnlineLegalClient;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class ZakonOnlineLegalClientTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    @Test
    void searchParsesCasesWithSnakeCaseFields() {
        ZakonOnlineLegalClient client = clientReplying(HttpStatus.OK, """
                [{"doc_id": "101", "case_number": "756/655/23", "title": "Про стягнення боргу",
                  "court_name": "Київський районний суд", "description": "Позов задоволено"}]
                """);

        StepVerifier.create(client.searchCases("стягнення боргу", "3", 5))
                .assertNext(cases -> {
                    assertThat(cases).hasSize(1);
                    LegalCase first = cases.get(0);
                    assertThat(first.docId()).isEqualTo("101");
                    assertThat(first.caseNumber()).isEqualTo("756/655/23");
                    assertThat(first.court()).isEqualTo("Київський районний суд");
                })
                .verifyComplete();
        assertThat(requests.get(0).url().getPath()).isEqualTo("/mcp/zakononline/search_cases");
    }

    @Test
    void missingCaseIsEmpty() {
        ZakonOnlineLegalClient client = clientReplying(HttpStatus.NOT_FOUND, "{}");

        StepVerifier.create(client.getCaseDetails("756/655/23")).verifyComplete();
    }

    @Test
    void serverErrorIsTransient() {
        ZakonOnlineLegalClient client = clientReplying(HttpStatus.SERVICE_UNAVAILABLE, "{}");

        StepVerifier.create(client.searchCases("q", "3", 5)).expectError(TransientNetworkException.class).verify();
    }

    @Test
    void clientErrorIsNotTransient() {
        ZakonOnlineLegalClient client = clientReplying(HttpStatus.BAD_REQUEST, "{}");

        StepVerifier.create(client.getCaseFullText("101"))
                .expectErrorSatisfies(e -> assertThat(e).isNotInstanceOf(TransientNetworkException.class))
                .verify();
    }

    @Test
    void fullTextIsReadFromTextField() {
        ZakonOnlineLegalClient client = clientReplying(HttpStatus.OK, "{\"text\": \"ПОСТАНОВА ІМЕНЕМ УКРАЇНИ\"}");

        StepVerifier.create(client.getCaseFullText("101")).expectNext("ПОСТАНОВА ІМЕНЕМ УКРАЇНИ").verifyComplete();
    }

    private ZakonOnlineLegalClient clientReplying(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://law.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new ZakonOnlineLegalClient(webClient);
    }
}
