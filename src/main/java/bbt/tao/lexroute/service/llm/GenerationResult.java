package bbt.tao.lexroute.service.llm;

public record GenerationResult(String content, String model, TokenUsage usage) {

    public GenerationResult {
        content = content == null ? "" : content;
        usage = usage == null ? TokenUsage.EMPTY : usage;
    }
}
