package bbt.tao.lexroute.service.rag;

/**
 * Краткое описание сохранённого документа для сводки и списков.
 */
public record StoredDocumentInfo(String name, String type, int chunkCount) {
}
