package bbt.tao.lexroute;

import bbt.tao.lexroute.aop.QueryRoutingLoggingAspect;
import bbt.tao.lexroute.dto.api.QueryAnswer;
import bbt.tao.lexroute.dto.api.QueryOptions;
import bbt.tao.lexroute.service.QueryRouterService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QueryRoutingLoggingAspectTest {

    private QueryRouterService target;
    private QueryRouterService proxy;

    @BeforeEach
    void setUp() {
        target = mock(QueryRouterService.class);
        AspectJProxyFactory factory = new AspectJProxyFactory(target);
        factory.setProxyTargetClass(true);
        factory.addAspect(new QueryRoutingLoggingAspect());
        proxy = factory.getProxy();
    }

    @Test
    void passesAnswerThroughUnchanged() {
        QueryAnswer answer = QueryAnswer.builder().answer("Так").model("test-model").build();
        when(target.answer(anyString(), any())).thenReturn(Mono.just(answer));

        StepVerifier.create(proxy.answer("Чи можна розірвати договір оренди достроково?", QueryOptions.defaults()))
                .expectNext(answer)
                .verifyComplete();
    }

    @Test
    void propagatesRoutingErrors() {
        when(target.answer(anyString(), any())).thenReturn(Mono.error(new IllegalStateException("boom")));

        StepVerifier.create(proxy.answer("x".repeat(300), QueryOptions.defaults()))
                .expectErrorMessage("boom")
                .verify();
    }

    @Test
    void subscribesToRouterResultOnlyOnce() {
        AtomicInteger subscriptions = new AtomicInteger();
        when(target.answer(anyString(), any())).thenReturn(Mono.fromSupplier(() -> {
            subscriptions.incrementAndGet();
            return new QueryAnswer();
        }));

        StepVerifier.create(proxy.answer("Що таке позовна давність?", QueryOptions.defaults()))
                .expectNextCount(1)
                .verifyComplete();
        assertThat(subscriptions).hasValue(1);
    }
}
