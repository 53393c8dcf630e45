package bbt.tao.lexroute.resilience;

import bbt.tao.lexroute.conf.LexRouteProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Собирает политики для четырёх пресетов из {@code lexroute.resilience.*}.
 * Общие значения retry и circuit берутся из корня, таймаут из {@code timeouts},
 * затем применяются переопределения {@code presets.<name>}.
 */
public class ResiliencePolicies {

    private final Map<ResiliencePreset, ResiliencePolicy> policies = new EnumMap<>(ResiliencePreset.class);

    public ResiliencePolicies(LexRouteProperties.Resilience settings) {
        for (ResiliencePreset preset : ResiliencePreset.values()) {
            policies.put(preset, build(preset, settings));
        }
    }

    public ResiliencePolicy forPreset(ResiliencePreset preset) {
        return policies.get(preset);
    }

    public ResiliencePolicy generation() {
        return forPreset(ResiliencePreset.GENERATION);
    }

    public ResiliencePolicy retrieval() {
        return forPreset(ResiliencePreset.RETRIEVAL);
    }

    public ResiliencePolicy legalSearch() {
        return forPreset(ResiliencePreset.LEGAL_SEARCH);
    }

    public ResiliencePolicy genericHttp() {
        return forPreset(ResiliencePreset.GENERIC_HTTP);
    }

    private static ResiliencePolicy build(ResiliencePreset preset, LexRouteProperties.Resilience settings) {
        LexRouteProperties.RetrySettings retry = settings.getRetry();
        LexRouteProperties.CircuitSettings circuit = settings.getCircuit();

        Duration timeout = defaultTimeout(preset, settings.getTimeouts());
        int maxAttempts = retry.getMaxAttempts();
        int failMax = circuit.getFailMax();
        Duration resetTimeout = circuit.getResetTimeout();

        LexRouteProperties.PresetOverride override = settings.getPresets().get(preset.resourceName());
        if (override != null) {
            if (override.getTimeout() != null) {
                timeout = override.getTimeout();
            }
            if (override.getMaxAttempts() != null) {
                maxAttempts = override.getMaxAttempts();
            }
            if (override.getFailMax() != null) {
                failMax = override.getFailMax();
            }
            if (override.getResetTimeout() != null) {
                resetTimeout = override.getResetTimeout();
            }
        }

        return new ResiliencePolicy(
                preset.resourceName(),
                timeout,
                maxAttempts,
                retry.getMinWait(),
                retry.getMaxWait(),
                failMax,
                resetTimeout,
                FailureClassifier::isTransient,
                false
        );
    }

    private static Duration defaultTimeout(ResiliencePreset preset, LexRouteProperties.Timeouts timeouts) {
        return switch (preset) {
            case GENERATION -> timeouts.getGeneration();
            case RETRIEVAL -> timeouts.getRetrieval();
            case LEGAL_SEARCH -> timeouts.getLegalSearch();
            case GENERIC_HTTP -> timeouts.getGenericHttp();
        };
    }
}
