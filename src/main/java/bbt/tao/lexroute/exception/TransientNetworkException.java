package bbt.tao.lexroute.exception;

/**
 * Временный сбой транспорта (соединение, таймаут чтения). Единственный вид ошибок,
 * который повторяется политикой retry без дополнительной настройки.
 */
public class TransientNetworkException extends RuntimeException {

    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
