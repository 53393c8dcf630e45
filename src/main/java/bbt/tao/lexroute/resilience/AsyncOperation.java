package bbt.tao.lexroute.resilience;

import reactor.core.publisher.Mono;

/**
 * Асинхронный вызов с единственным результатом. Реализация должна быть ленивой:
 * работа начинается только при подписке на возвращённый {@link Mono}.
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    Mono<T> execute();
}
