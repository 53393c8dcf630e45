package bbt.tao.lexroute.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class TimeoutExceededException extends ResilienceException {

    private final Duration duration;

    public TimeoutExceededException(String resource, Duration duration) {
        super(resource, "Операция '" + resource + "' превысила таймаут " + duration.toMillis() + " мс");
        this.duration = duration;
    }
}
