package bbt.tao.lexroute.resilience;

import reactor.core.publisher.Flux;

/**
 * Асинхронный поток чанков (например, потоковая генерация LLM).
 */
@FunctionalInterface
public interface StreamOperation<T> {

    Flux<T> execute();
}
