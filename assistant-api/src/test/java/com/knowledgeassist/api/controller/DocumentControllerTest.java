package com.knowledgeassist.api.controller;

import com.knowledgeassist.api.model.DocumentListItem;
import com.knowledgeassist.api.model.DocumentUploadResponse;
import com.knowledgeassist.api.model.IngestTextRequest;
import com.knowledgeassist.api.persistence.repository.TenantRepository;
import com.knowledgeassist.api.security.SecurityConfig;
import com.knowledgeassist.api.service.ingestion.DocumentIngestionService;
import com.knowledgeassist.api.service.ingestion.DocumentRejectedException;
import com.knowledgeassist.api.service.retrieval.VectorIndex;
import com.knowledgeassist.api.service.store.KeyValueStore;
import com.knowledgeassist.api.service.tenant.TenantAccount;
import com.knowledgeassist.api.service.tenant.TenantDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.springframework.http.MediaType.MULTIPART_FORM_DATA;

@WebFluxTest(controllers = {DocumentController.class, HealthController.class})
@Import(SecurityConfig.class)
class DocumentControllerTest {

    private static final String API_KEY = "acme-key";

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private DocumentIngestionService ingestionService;

    @MockBean
    private TenantDirectory tenantDirectory;

    @MockBean
    private TenantRepository tenantRepository;

    @MockBean
    private KeyValueStore keyValueStore;

    @MockBean
    private VectorIndex vectorIndex;

    @BeforeEach
    void setUp() {
        Mockito.when(tenantDirectory.findByApiKey(API_KEY))
                .thenReturn(Optional.of(new TenantAccount("tenant-a", "Acme Corp", true)));
    }

    @Test
    void uploadsMultipartFileForAuthenticatedTenant() {
        Mockito.when(ingestionService.ingestDocument(eq("tenant-a"), eq("handbook.txt"), any(), any()))
                .thenReturn(new DocumentUploadResponse("doc-1", "handbook.txt", 3, "Document uploaded and processed successfully"));

        webTestClient.post()
                .uri("/api/v1/documents")
                .header("X-API-Key", API_KEY)
                .contentType(MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(sampleMultipart()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.documentId").isEqualTo("doc-1")
                .jsonPath("$.chunksCount").isEqualTo(3);

        Mockito.verify(ingestionService).ingestDocument(eq("tenant-a"), eq("handbook.txt"),
                eq("Employees receive 20 vacation days.".getBytes(StandardCharsets.UTF_8)), any());
    }

    @Test
    void uploadsTextDocument() {
        Mockito.when(ingestionService.ingestText("tenant-a", "policy.md", "Remote work twice a week.", null))
                .thenReturn(new DocumentUploadResponse("doc-2", "policy.md", 1, "Document uploaded and processed successfully"));

        webTestClient.post()
                .uri("/api/v1/documents/text")
                .header("X-API-Key", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new IngestTextRequest("policy.md", "Remote work twice a week.", null))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.name").isEqualTo("policy.md");
    }

    @Test
    void rejectedDocumentReturnsBadRequest() {
        Mockito.when(ingestionService.ingestText(anyString(), anyString(), anyString(), any()))
                .thenThrow(new DocumentRejectedException("No content chunks were produced for policy.md"));

        webTestClient.post()
                .uri("/api/v1/documents/text")
                .header("X-API-Key", API_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new IngestTextRequest("policy.md", "x", null))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("No content chunks were produced for policy.md");
    }

    @Test
    void listsTenantDocuments() {
        Mockito.when(ingestionService.listDocuments("tenant-a")).thenReturn(List.of(
                new DocumentListItem("doc-1", "handbook.txt", "text/plain", OffsetDateTime.parse("2024-05-01T10:00:00Z"))));

        webTestClient.get()
                .uri("/api/v1/documents")
                .header("X-API-Key", API_KEY)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo("doc-1")
                .jsonPath("$[0].contentType").isEqualTo("text/plain");
    }

    @Test
    void healthIsPublicAndReportsDegradedDependencies() {
        Mockito.when(tenantRepository.count()).thenReturn(1L);
        Mockito.when(keyValueStore.isAvailable()).thenReturn(true);
        Mockito.when(vectorIndex.isAvailable()).thenReturn(false);

        webTestClient.get()
                .uri("/api/v1/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("degraded")
                .jsonPath("$.services.api").isEqualTo("healthy")
                .jsonPath("$.services.database").isEqualTo("healthy")
                .jsonPath("$.services.redis").isEqualTo("healthy")
                .jsonPath("$.services.qdrant").isEqualTo("unhealthy");
    }

    private MultiValueMap<String, Object> sampleMultipart() {
        ByteArrayResource file = new ByteArrayResource("Employees receive 20 vacation days.".getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return "handbook.txt";
            }
        };

        LinkedMultiValueMap<String, Object> data = new LinkedMultiValueMap<>();
        data.add("file", file);
        return data;
    }
}
