package bbt.tao.lexroute.service.rag;

import java.util.Map;

public record DocumentChunk(String text, Map<String, Object> metadata) {

    public DocumentChunk {
        text = text == null ? "" : text;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
