package bbt.tao.lexroute.service.context;

import bbt.tao.lexroute.cache.CacheKeys;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Собранный контекст запроса. Фрагменты всегда упорядочены: сводка, документы, практика.
 */
public record AggregatedContext(List<ContextFragment> fragments, List<String> errors) {

    public AggregatedContext {
        fragments = fragments.stream()
                .sorted(Comparator.comparingInt(fragment -> fragment.kind().ordinal()))
                .toList();
        errors = List.copyOf(errors);
    }

    public static AggregatedContext empty() {
        return new AggregatedContext(List.of(), List.of());
    }

    public List<String> sources() {
        return fragments.stream()
                .map(fragment -> fragment.kind().source())
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }

    public boolean has(ContextFragment.Kind kind) {
        return fragments.stream().anyMatch(fragment -> fragment.kind() == kind);
    }

    public String fingerprint() {
        return CacheKeys.fingerprint(fragments.stream().map(ContextFragment::render).toArray(String[]::new));
    }

    public AggregatedContext withErrors(List<String> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(extra);
        merged.addAll(errors);
        return new AggregatedContext(fragments, merged);
    }
}
