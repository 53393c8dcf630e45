package bbt.tao.lexroute.service.rag;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.transformer.splitter.TokenTextSplitter;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Хранилище документов: чанки в {@link VectorStore}, состав документов в {@link DocumentCatalog}.
 */
@Slf4j
public class VectorStoreRetrievalBackend implements RetrievalBackend {

    private final VectorStore vectorStore;
    private final TokenTextSplitter textSplitter;
    private final DocumentCatalog catalog;
    private final DocumentTypeDetector typeDetector;

    public VectorStoreRetrievalBackend(VectorStore vectorStore,
                                       TokenTextSplitter textSplitter,
                                       DocumentCatalog catalog,
                                       DocumentTypeDetector typeDetector) {
        this.vectorStore = vectorStore;
        this.textSplitter = textSplitter;
        this.catalog = catalog;
        this.typeDetector = typeDetector;
    }

    @Override
    public List<RetrievedChunk> search(String query, int topK) {
        log.debug("Поиск по документам: q='{}', k={}", query, topK);
        List<Document> hits = vectorStore.similaritySearch(SearchRequest.builder().query(query).topK(topK).build());
        if (hits == null) {
            return List.of();
        }
        return hits.stream()
                .map(doc -> new RetrievedChunk(doc.getText(), doc.getMetadata(), doc.getScore() == null ? 0.0 : doc.getScore()))
                .toList();
    }

    @Override
    public List<StoredDocumentInfo> listDocuments() {
        return catalog.names().stream()
                .map(catalog::find)
                .flatMap(Optional::stream)
                .map(CatalogEntry::info)
                .toList();
    }

    @Override
    public List<DocumentChunk> getDocumentChunks(String name) {
        return catalog.find(name)
                .map(entry -> {
                    List<DocumentChunk> chunks = new ArrayList<>(entry.chunkTexts().size());
                    for (int i = 0; i < entry.chunkTexts().size(); i++) {
                        chunks.add(new DocumentChunk(entry.chunkTexts().get(i), Map.of(
                                DocumentMetadata.DOCUMENT_NAME, name,
                                DocumentMetadata.DOCUMENT_TYPE, entry.type(),
                                DocumentMetadata.CHUNK_INDEX, i)));
                    }
                    return List.copyOf(chunks);
                })
                .orElse(List.of());
    }

    @Override
    public boolean deleteDocument(String name) {
        Optional<CatalogEntry> entry = catalog.find(name);
        if (entry.isEmpty()) {
            log.info("Документ '{}' не найден, удалять нечего", name);
            return false;
        }
        if (!entry.get().chunkIds().isEmpty()) {
            vectorStore.delete(entry.get().chunkIds());
        }
        catalog.remove(name);
        log.info("Документ '{}' удалён ({} чанков)", name, entry.get().chunkIds().size());
        return true;
    }

    @Override
    public StoredDocumentInfo addDocument(String name, String text) {
        if (catalog.find(name).isPresent()) {
            log.info("Документ '{}' уже есть в каталоге, заменяем", name);
            deleteDocument(name);
        }
        DocumentTypeDetector.Detection detection = typeDetector.detect(text, name);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put(DocumentMetadata.DOCUMENT_NAME, name);
        metadata.put(DocumentMetadata.DOCUMENT_TYPE, detection.type());

        List<Document> chunks = textSplitter.apply(List.of(new Document(text, metadata)));
        for (int i = 0; i < chunks.size(); i++) {
            chunks.get(i).getMetadata().put(DocumentMetadata.CHUNK_INDEX, i);
        }
        vectorStore.add(chunks);

        CatalogEntry entry = new CatalogEntry(
                name,
                detection.type(),
                chunks.stream().map(Document::getId).toList(),
                chunks.stream().map(Document::getText).toList());
        catalog.save(entry);
        log.info("Документ '{}' проиндексирован: тип={} (уверенность {}), чанков={}",
                name, detection.type(), String.format("%.2f", detection.confidence()), chunks.size());
        return entry.info();
    }
}
