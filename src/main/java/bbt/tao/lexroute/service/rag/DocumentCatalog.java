package bbt.tao.lexroute.service.rag;

import java.util.List;
import java.util.Optional;

public interface DocumentCatalog {

    void save(CatalogEntry entry);

    Optional<CatalogEntry> find(String name);

    /**
     * @return имена документов в алфавитном порядке
     */
    List<String> names();

    boolean remove(String name);
}
