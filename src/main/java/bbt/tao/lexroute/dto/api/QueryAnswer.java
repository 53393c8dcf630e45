package bbt.tao.lexroute.dto.api;

import bbt.tao.lexroute.service.llm.TokenUsage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ответ на запрос пользователя. {@code error} заполнен только если не удалась генерация.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueryAnswer {
    private String answer;
    @Builder.Default
    private List<String> sources = new ArrayList<>();
    private String model;
    private TokenUsage usage;
    private AnswerMetadata metadata;
    private String error;
}
