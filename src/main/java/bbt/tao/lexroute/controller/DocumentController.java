package bbt.tao.lexroute.controller;

import bbt.tao.lexroute.dto.api.DocumentRequest;
import bbt.tao.lexroute.service.rag.DocumentChunk;
import bbt.tao.lexroute.service.rag.DocumentService;
import bbt.tao.lexroute.service.rag.StoredDocumentInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private final DocumentService documents;

    public DocumentController(DocumentService documents) {
        this.documents = documents;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<StoredDocumentInfo>> list() {
        return documents.listDocuments();
    }

    @GetMapping(value = "/{name}/chunks", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<List<DocumentChunk>>> chunks(@PathVariable String name) {
        return documents.getDocumentChunks(name)
                .map(chunks -> chunks.isEmpty()
                        ? ResponseEntity.notFound().<List<DocumentChunk>>build()
                        : ResponseEntity.ok(chunks));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<StoredDocumentInfo>> add(@RequestBody DocumentRequest request) {
        if (request.getName() == null || request.getName().isBlank()
                || request.getText() == null || request.getText().isBlank()) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        log.info("Загрузка документа '{}' ({} символов)", request.getName(), request.getText().length());
        return documents.addDocument(request.getName(), request.getText())
                .map(info -> ResponseEntity.status(HttpStatus.CREATED).body(info));
    }

    @DeleteMapping("/{name}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String name) {
        return documents.deleteDocument(name)
                .map(deleted -> deleted
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }
}
