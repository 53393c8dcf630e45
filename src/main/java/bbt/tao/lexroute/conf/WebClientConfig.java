package bbt.tao.lexroute.conf;

import bbt.tao.lexroute.service.law.LegalSearchBackend;
import bbt.tao.lexroute.service.law.ZakonOnlineLegalClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Slf4j
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient lawWebClient(WebClient.Builder builder, LexRouteProperties properties) {
        LexRouteProperties.Law law = properties.getLaw();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) law.getConnectTimeout().toMillis())
                .responseTimeout(law.getReadTimeout())
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler((int) law.getReadTimeout().getSeconds()))
                        .addHandlerLast(new WriteTimeoutHandler((int) law.getReadTimeout().getSeconds())));

        WebClient.Builder configured = builder
                .baseUrl(law.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .filter(GenerationClientsConfig.loggingFilter("law"))
                .codecs(conf -> conf.defaultCodecs().maxInMemorySize(10 * 1024 * 1024));
        if (StringUtils.hasText(law.getApiKey())) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + law.getApiKey());
        }
        log.info("WebClient судебной практики: {}", law.getBaseUrl());
        return configured.build();
    }

    @Bean
    public LegalSearchBackend legalSearchBackend(WebClient lawWebClient) {
        return new ZakonOnlineLegalClient(lawWebClient);
    }
}
