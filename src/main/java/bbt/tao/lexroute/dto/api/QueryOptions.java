package bbt.tao.lexroute.dto.api;

import lombok.Builder;
import lombok.Value;

/**
 * Параметры одного запроса к маршрутизатору. Явные флаги источников важнее классификации.
 */
@Value
@Builder(toBuilder = true)
public class QueryOptions {
    String provider;
    String model;
    Boolean useRetrieval;
    Boolean useLegal;
    Integer topK;
    @Builder.Default
    boolean directFullText = true;

    public static QueryOptions defaults() {
        return QueryOptions.builder().build();
    }

    public static QueryOptions from(QueryRequest request) {
        return QueryOptions.builder()
                .provider(request.getProvider())
                .model(request.getModel())
                .useRetrieval(request.getUseRetrieval())
                .useLegal(request.getUseLegal())
                .topK(request.getTopK())
                .directFullText(request.getDirectFullText() == null || request.getDirectFullText())
                .build();
    }
}
