package bbt.tao.lexroute.service.llm;

public record TokenUsage(Integer promptTokens, Integer completionTokens, Integer totalTokens) {

    public static final TokenUsage EMPTY = new TokenUsage(0, 0, 0);
}
