package bbt.tao.lexroute.exception;

import lombok.Getter;

/**
 * Базовое исключение слоя отказоустойчивости. Всегда несёт имя ресурса,
 * к которому относился защищённый вызов.
 */
@Getter
public abstract class ResilienceException extends RuntimeException {

    private final String resource;

    protected ResilienceException(String resource, String message) {
        super(message);
        this.resource = resource;
    }

    protected ResilienceException(String resource, String message, Throwable cause) {
        super(message, cause);
        this.resource = resource;
    }
}
