package bbt.tao.lexroute.service.rag;

import java.util.List;

/**
 * Локальное хранилище документов с семантическим поиском. Методы блокирующие.
 * Отсутствующий документ даёт пустой список или {@code false}, а не исключение.
 */
public interface RetrievalBackend {

    List<RetrievedChunk> search(String query, int topK);

    List<StoredDocumentInfo> listDocuments();

    List<DocumentChunk> getDocumentChunks(String name);

    boolean deleteDocument(String name);

    StoredDocumentInfo addDocument(String name, String text);
}
