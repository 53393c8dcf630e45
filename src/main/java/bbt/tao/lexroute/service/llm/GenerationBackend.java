package bbt.tao.lexroute.service.llm;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Генерирующий бэкенд. Транспортные ошибки сообщаются как
 * {@link bbt.tao.lexroute.exception.TransientNetworkException} или исключения сетевого клиента,
 * чтобы слой отказоустойчивости мог их повторить.
 */
public interface GenerationBackend {

    Mono<GenerationResult> generate(List<ChatTurn> messages, double temperature, Integer maxTokens);

    Flux<String> streamGenerate(List<ChatTurn> messages, double temperature, Integer maxTokens);

    String provider();

    String model();
}
