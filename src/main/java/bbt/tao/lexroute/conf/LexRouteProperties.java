package bbt.tao.lexroute.conf;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "lexroute")
public class LexRouteProperties {

    private Resilience resilience = new Resilience();
    private CacheSettings cache = new CacheSettings();
    private Rag rag = new Rag();
    private Law law = new Law();
    private Llm llm = new Llm();

    @Data
    public static class Resilience {
        private RetrySettings retry = new RetrySettings();
        private CircuitSettings circuit = new CircuitSettings();
        private Timeouts timeouts = new Timeouts();
        /**
         * Переопределения по имени пресета: generation, retrieval, legal-search, generic-http.
         */
        private Map<String, PresetOverride> presets = new LinkedHashMap<>();
    }

    @Data
    public static class RetrySettings {
        private int maxAttempts = 3;
        private Duration minWait = Duration.ofSeconds(1);
        private Duration maxWait = Duration.ofSeconds(10);
    }

    @Data
    public static class CircuitSettings {
        private int failMax = 5;
        private Duration resetTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Timeouts {
        private Duration generation = Duration.ofSeconds(120);
        private Duration retrieval = Duration.ofSeconds(60);
        private Duration legalSearch = Duration.ofSeconds(45);
        private Duration genericHttp = Duration.ofSeconds(30);
    }

    @Data
    public static class PresetOverride {
        private Duration timeout;
        private Integer maxAttempts;
        private Integer failMax;
        private Duration resetTimeout;
    }

    @Data
    public static class CacheSettings {
        private boolean enabled = true;
        private Ttl ttl = new Ttl();
    }

    @Data
    public static class Ttl {
        private Duration classification = Duration.ofHours(1);
        private Duration caseNumber = Duration.ofHours(1);
        private Duration retrievalResults = Duration.ofHours(1);
        private Duration retrievalContext = Duration.ofHours(1);
        private Duration legalContext = Duration.ofHours(1);
        private Duration answer = Duration.ofMinutes(30);
    }

    @Data
    public static class Rag {
        private int topK = 5;
        private String catalogPrefix = "lexroute:doc:";
    }

    @Data
    public static class Law {
        private String baseUrl = "http://localhost:8081";
        private String apiKey;
        private String instance = "3";
        private int searchLimit = 5;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Llm {
        private String defaultProvider = "openai";
        private Map<String, Provider> providers = new LinkedHashMap<>();
    }

    @Data
    public static class Provider {
        private String baseUrl;
        private String apiKey;
        private String model;
        private Duration readTimeout = Duration.ofMinutes(3);
    }
}
