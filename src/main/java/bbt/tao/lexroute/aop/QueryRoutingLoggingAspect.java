package bbt.tao.lexroute.aop;

import bbt.tao.lexroute.dto.api.QueryAnswer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Логирует итог маршрутизации каждого запроса: намерение, источники, ошибки фрагментов и длительность.
 */
@Slf4j
@Aspect
@Component
public class QueryRoutingLoggingAspect {

    @Pointcut("execution(reactor.core.publisher.Mono bbt.tao.lexroute.service.QueryRouterService.answer(..))")
    public void answerCall() {}

    @Around("answerCall()")
    public Object logAnswer(ProceedingJoinPoint joinPoint) throws Throwable {
        Object[] args = joinPoint.getArgs();
        String query = args.length > 0 && args[0] != null ? args[0].toString() : "";
        Object result = joinPoint.proceed();
        if (!(result instanceof Mono<?> mono)) {
            return result;
        }
        return Mono.defer(() -> {
            long started = System.nanoTime();
            log.info("[ROUTE-REQUEST] '{}'", abbreviate(query));
            return mono.doOnNext(value -> {
                        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
                        if (value instanceof QueryAnswer answer) {
                            log.info("[ROUTE-RESPONSE] intent={}, sources={}, model={}, cached={}, errors={}, {} мс",
                                    answer.getMetadata() != null ? answer.getMetadata().getIntent() : null,
                                    answer.getSources(),
                                    answer.getModel(),
                                    answer.getMetadata() != null && answer.getMetadata().isCached(),
                                    answer.getMetadata() != null ? answer.getMetadata().getErrors() : null,
                                    elapsedMs);
                        }
                    })
                    .doOnError(e -> log.error("[ROUTE-ERROR] '{}': {}", abbreviate(query), e.toString()));
        });
    }

    static String abbreviate(String text) {
        return text.length() <= 120 ? text : text.substring(0, 120) + "...";
    }
}
