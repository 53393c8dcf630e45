package bbt.tao.lexroute.resilience;

/**
 * Блокирующий вызов внешнего ресурса.
 */
@FunctionalInterface
public interface BlockingOperation<T> {

    T execute() throws Exception;
}
