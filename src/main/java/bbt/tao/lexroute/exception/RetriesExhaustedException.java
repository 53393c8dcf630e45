package bbt.tao.lexroute.exception;

import lombok.Getter;

@Getter
public class RetriesExhaustedException extends ResilienceException {

    private final long attempts;

    public RetriesExhaustedException(String resource, long attempts, Throwable lastError) {
        super(resource, "Исчерпаны попытки (" + attempts + ") для '" + resource + "': " + lastError.getMessage(), lastError);
        this.attempts = attempts;
    }

    public Throwable getLastError() {
        return getCause();
    }
}
