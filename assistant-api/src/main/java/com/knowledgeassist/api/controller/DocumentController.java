package com.knowledgeassist.api.controller;

import com.knowledgeassist.api.model.DocumentListItem;
import com.knowledgeassist.api.model.DocumentUploadResponse;
import com.knowledgeassist.api.model.IngestTextRequest;
import com.knowledgeassist.api.security.TenantPrincipal;
import com.knowledgeassist.api.service.ingestion.DocumentIngestionService;
import com.knowledgeassist.api.service.ingestion.DocumentRejectedException;
import jakarta.validation.Valid;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api/v1/documents")
public class DocumentController {

    private final DocumentIngestionService ingestionService;

    public DocumentController(DocumentIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<DocumentUploadResponse> upload(@AuthenticationPrincipal TenantPrincipal tenant,
                                               @RequestPart("file") Mono<FilePart> file) {
        return file
                .switchIfEmpty(Mono.error(() -> new DocumentRejectedException("File payload is required")))
                .flatMap(part -> DataBufferUtils.join(part.content())
                        .map(buffer -> {
                            byte[] bytes = new byte[buffer.readableByteCount()];
                            buffer.read(bytes);
                            DataBufferUtils.release(buffer);
                            return bytes;
                        })
                        .defaultIfEmpty(new byte[0])
                        .publishOn(Schedulers.boundedElastic())
                        .map(bytes -> ingestionService.ingestDocument(tenant.tenantId(), part.filename(), bytes,
                                contentType(part))));
    }

    @PostMapping(path = "/text", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<DocumentUploadResponse> uploadText(@AuthenticationPrincipal TenantPrincipal tenant,
                                                   @Valid @RequestBody IngestTextRequest request) {
        return Mono.fromCallable(() -> ingestionService.ingestText(tenant.tenantId(), request.name(), request.text(),
                        request.contentType()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<DocumentListItem>> list(@AuthenticationPrincipal TenantPrincipal tenant) {
        return Mono.fromCallable(() -> ingestionService.listDocuments(tenant.tenantId()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static String contentType(FilePart part) {
        MediaType mediaType = part.headers().getContentType();
        return mediaType == null ? null : mediaType.toString();
    }
}
