package com.knowledgeassist.api.security;

import com.knowledgeassist.api.controller.QueryController;
import com.knowledgeassist.api.model.QueryRequest;
import com.knowledgeassist.api.model.QueryResponse;
import com.knowledgeassist.api.model.Source;
import com.knowledgeassist.api.service.query.KnowledgeQueryService;
import com.knowledgeassist.api.service.query.RateLimitExceededException;
import com.knowledgeassist.api.service.query.TenantIsolationViolationException;
import com.knowledgeassist.api.service.query.UpstreamFailureException;
import com.knowledgeassist.api.service.tenant.TenantAccount;
import com.knowledgeassist.api.service.tenant.TenantDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;

@WebFluxTest(controllers = QueryController.class)
@Import(SecurityConfig.class)
@TestPropertySource(properties = "assistant.security.api-key-header=X-API-Key")
class ApiKeySecurityIntegrationTest {

    private static final String VALID_KEY = "acme-key";

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private KnowledgeQueryService queryService;

    @MockBean
    private TenantDirectory tenantDirectory;

    @BeforeEach
    void setUp() {
        Mockito.when(tenantDirectory.findByApiKey(anyString())).thenReturn(Optional.empty());
        Mockito.when(tenantDirectory.findByApiKey(VALID_KEY))
                .thenReturn(Optional.of(new TenantAccount("tenant-a", "Acme Corp", true)));
        Mockito.when(tenantDirectory.findByApiKey("inactive-key"))
                .thenReturn(Optional.of(new TenantAccount("tenant-b", "Dormant Inc", false)));
    }

    @Test
    void rejectsQueryWithoutApiKey() {
        webTestClient.post()
                .uri("/api/v1/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new QueryRequest("How many vacation days?"))
                .exchange()
                .expectStatus().isUnauthorized();

        verifyNoInteractions(queryService);
    }

    @Test
    void rejectsQueryWithUnknownApiKey() {
        webTestClient.post()
                .uri("/api/v1/query")
                .header("X-API-Key", "wrong")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new QueryRequest("How many vacation days?"))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid API key");

        verifyNoInteractions(queryService);
    }

    @Test
    void rejectsInactiveTenantWithForbidden() {
        webTestClient.post()
                .uri("/api/v1/query")
                .header("X-API-Key", "inactive-key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new QueryRequest("How many vacation days?"))
                .exchange()
                .expectStatus().isForbidden();

        verifyNoInteractions(queryService);
    }

    @Test
    void answersQueryForAuthenticatedTenant() {
        Mockito.when(queryService.query(eq(new TenantPrincipal("tenant-a", "Acme Corp")), eq("How many vacation days?")))
                .thenReturn(new QueryResponse("Twenty days.", List.of(new Source("handbook.md", "20 days")),
                        0.92, false, 120, false));

        webTestClient.post()
                .uri("/api/v1/query")
                .header("X-API-Key", VALID_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new QueryRequest("How many vacation days?"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.answer").isEqualTo("Twenty days.")
                .jsonPath("$.sources[0].documentName").isEqualTo("handbook.md")
                .jsonPath("$.confidence").isEqualTo(0.92)
                .jsonPath("$.cached").isEqualTo(false);
    }

    @Test
    void questionIsPassedThroughVerbatim() {
        Mockito.when(queryService.query(any(), anyString()))
                .thenReturn(new QueryResponse(null, List.of(), 0.0, true, 5, false));

        webTestClient.post()
                .uri("/api/v1/query")
                .header("X-API-Key", VALID_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new QueryRequest("  How many vacation days?\n"))
                .exchange()
                .expectStatus().isOk();

        Mockito.verify(queryService).query(new TenantPrincipal("tenant-a", "Acme Corp"), "  How many vacation days?\n");
    }

    @Test
    void throttledQueryReturnsTooManyRequests() {
        Mockito.when(queryService.query(any(), anyString())).thenThrow(new RateLimitExceededException(10));

        webTestClient.post()
                .uri("/api/v1/query")
                .header("X-API-Key", VALID_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new QueryRequest("How many vacation days?"))
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Rate limit exceeded: 10 queries per minute");
    }

    @Test
    void isolationViolationIsReportedWithoutDetail() {
        Mockito.when(queryService.query(any(), anyString()))
                .thenThrow(new TenantIsolationViolationException("tenant-a", "tenant_tenanta_documents", "tenant-b"));

        webTestClient.post()
                .uri("/api/v1/query")
                .header("X-API-Key", VALID_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new QueryRequest("How many vacation days?"))
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Security violation detected");
    }

    @Test
    void upstreamFailureReturnsBadGateway() {
        Mockito.when(queryService.query(any(), anyString())).thenThrow(new UpstreamFailureException("Qdrant search failed"));

        webTestClient.post()
                .uri("/api/v1/query")
                .header("X-API-Key", VALID_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new QueryRequest("How many vacation days?"))
                .exchange()
                .expectStatus().isEqualTo(502);
    }

    @Test
    void blankQuestionIsRejected() {
        webTestClient.post()
                .uri("/api/v1/query")
                .header("X-API-Key", VALID_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new QueryRequest(""))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("question is invalid");

        verifyNoInteractions(queryService);
    }
}
