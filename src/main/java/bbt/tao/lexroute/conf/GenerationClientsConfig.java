package bbt.tao.lexroute.conf;

import bbt.tao.lexroute.service.llm.GenerationBackendRegistry;
import bbt.tao.lexroute.service.llm.LlmProvider;
import bbt.tao.lexroute.service.llm.SpringAiGenerationBackend;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Один {@link ChatClient} на каждого настроенного провайдера из {@code lexroute.llm.providers}.
 * Повторы Spring AI отключены: повторяет только {@link bbt.tao.lexroute.resilience.ResilienceMiddleware}.
 */
@Configuration
public class GenerationClientsConfig {

    private static final Logger log = LoggerFactory.getLogger(GenerationClientsConfig.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final String NO_KEY = "not-needed";

    @Bean
    public GenerationBackendRegistry generationBackendRegistry(LexRouteProperties properties) {
        LexRouteProperties.Llm llm = properties.getLlm();
        Map<LlmProvider, SpringAiGenerationBackend> backends = new EnumMap<>(LlmProvider.class);

        llm.getProviders().forEach((id, settings) -> {
            LlmProvider provider = LlmProvider.from(id).orElse(null);
            if (provider == null) {
                log.warn("Неизвестный LLM провайдер '{}' в конфигурации, пропускаем", id);
                return;
            }
            if (!StringUtils.hasText(settings.getBaseUrl()) || !StringUtils.hasText(settings.getModel())) {
                log.warn("LLM провайдер '{}' без base-url или model, пропускаем", id);
                return;
            }
            ChatClient client = buildClient(provider, settings);
            backends.put(provider, new SpringAiGenerationBackend(client, provider.id(), settings.getModel()));
            log.info("LLM провайдер '{}' настроен: baseUrl={}, model={}", provider.id(), settings.getBaseUrl(), settings.getModel());
        });

        LlmProvider defaultProvider = LlmProvider.from(llm.getDefaultProvider()).orElse(LlmProvider.OPENAI);
        return new GenerationBackendRegistry(backends, defaultProvider);
    }

    private ChatClient buildClient(LlmProvider provider, LexRouteProperties.Provider settings) {
        String apiKey = StringUtils.hasText(settings.getApiKey()) ? settings.getApiKey() : NO_KEY;

        OpenAiApi openAiApi = OpenAiApi.builder()
                .apiKey(apiKey)
                .baseUrl(settings.getBaseUrl())
                .restClientBuilder(createRestClientBuilder(provider.id(), settings.getReadTimeout()))
                .webClientBuilder(createWebClientBuilder(provider.id(), settings.getReadTimeout()))
                .build();

        OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .openAiApi(openAiApi)
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(settings.getModel())
                        .temperature(0.7)
                        .build())
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();

        return ChatClient.builder(chatModel).build();
    }

    private RestClient.Builder createRestClientBuilder(String provider, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(CONNECT_TIMEOUT);
        factory.setReadTimeout(readTimeout);

        return RestClient.builder()
                .requestFactory(factory)
                .requestInterceptor((request, body, execution) -> {
                    log.debug("[{}] REST {} {} headers={} bodyLength={}",
                            provider, request.getMethod(), request.getURI(),
                            maskAuthorization(request.getHeaders()), body == null ? 0 : body.length);
                    var response = execution.execute(request, body);
                    log.debug("[{}] REST response {}", provider, response.getStatusCode().value());
                    return response;
                });
    }

    private WebClient.Builder createWebClientBuilder(String provider, Duration readTimeout) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) CONNECT_TIMEOUT.toMillis())
                .responseTimeout(readTimeout)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler((int) readTimeout.getSeconds()))
                        .addHandlerLast(new WriteTimeoutHandler((int) readTimeout.getSeconds())));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .filter(loggingFilter(provider));
    }

    static ExchangeFilterFunction loggingFilter(String target) {
        return ExchangeFilterFunction.ofRequestProcessor(request -> {
                    log.debug("[{}] WebClient {} {}", target, request.method(), request.url());
                    return Mono.just(request);
                })
                .andThen(ExchangeFilterFunction.ofResponseProcessor(response -> {
                    log.debug("[{}] WebClient response status={}", target, response.statusCode());
                    return Mono.just(response);
                }));
    }

    static HttpHeaders maskAuthorization(HttpHeaders headers) {
        HttpHeaders masked = new HttpHeaders();
        headers.forEach((key, values) -> {
            if (HttpHeaders.AUTHORIZATION.equalsIgnoreCase(key)) {
                masked.put(key, values.stream().map(GenerationClientsConfig::mask).toList());
            } else {
                masked.put(key, values);
            }
        });
        return masked;
    }

    static String mask(String value) {
        if (!StringUtils.hasText(value)) {
            return value;
        }
        if (value.length() <= 8) {
            return "****";
        }
        return value.substring(0, 4) + "****" + value.substring(value.length() - 4);
    }
}
