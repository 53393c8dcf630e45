package bbt.tao.lexroute.exception;

public class CircuitOpenException extends ResilienceException {

    public CircuitOpenException(String resource) {
        super(resource, "Circuit breaker '" + resource + "' is OPEN");
    }
}
