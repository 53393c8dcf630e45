package bbt.tao.lexroute.service.rag;

import java.util.List;

/**
 * Запись каталога: документ и его чанки в векторном хранилище.
 */
public record CatalogEntry(String name, String type, List<String> chunkIds, List<String> chunkTexts) {

    public CatalogEntry {
        chunkIds = chunkIds == null ? List.of() : List.copyOf(chunkIds);
        chunkTexts = chunkTexts == null ? List.of() : List.copyOf(chunkTexts);
    }

    public StoredDocumentInfo info() {
        return new StoredDocumentInfo(name, type, chunkIds.size());
    }
}
