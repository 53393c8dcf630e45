package bbt.tao.lexroute.service.rag;

/**
 * Ключи метаданных чанков в векторном хранилище.
 */
public final class DocumentMetadata {

    public static final String DOCUMENT_NAME = "document_name";
    public static final String DOCUMENT_TYPE = "document_type";
    public static final String CHUNK_INDEX = "chunk_index";

    private DocumentMetadata() {
    }
}
