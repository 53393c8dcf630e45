package bbt.tao.lexroute.resilience;

import bbt.tao.lexroute.exception.TransientNetworkException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Разделяет ошибки на временные (соединение, таймаут транспорта) и прикладные.
 * Повторяются только временные.
 */
public final class FailureClassifier {

    private static final List<Class<? extends Throwable>> TRANSIENT = List.of(
            TransientNetworkException.class,
            ConnectException.class,
            SocketTimeoutException.class,
            TimeoutException.class,
            WebClientRequestException.class,
            ResourceAccessException.class
    );

    private static final int MAX_CAUSE_DEPTH = 8;

    private FailureClassifier() {
    }

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            for (Class<? extends Throwable> type : TRANSIENT) {
                if (type.isInstance(current)) {
                    return true;
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
