package bbt.tao.lexroute.service.rag;

import java.util.Map;

public record RetrievedChunk(String text, Map<String, Object> metadata, double score) {

    public RetrievedChunk {
        text = text == null ? "" : text;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String source() {
        Object name = metadata.get(DocumentMetadata.DOCUMENT_NAME);
        return name == null ? "unknown" : name.toString();
    }
}
