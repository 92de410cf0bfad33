package com.knowledgeassist.api.controller;

import com.knowledgeassist.api.model.QueryRequest;
import com.knowledgeassist.api.model.QueryResponse;
import com.knowledgeassist.api.security.TenantPrincipal;
import com.knowledgeassist.api.service.query.KnowledgeQueryService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/v1")
public class QueryController {

    private final KnowledgeQueryService queryService;

    public QueryController(KnowledgeQueryService queryService) {
        this.queryService = queryService;
    }

    @PostMapping(path = "/query", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<QueryResponse> query(@AuthenticationPrincipal TenantPrincipal tenant,
                                     @Valid @RequestBody QueryRequest request) {
        return Mono.fromCallable(() -> queryService.query(tenant, request.question()))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
