package com.knowledgeassist.api.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.web.server.authentication.ServerAuthenticationConverter;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

public class ApiKeyAuthenticationConverter implements ServerAuthenticationConverter {

    private final String headerName;

    public ApiKeyAuthenticationConverter(String headerName) {
        this.headerName = headerName;
    }

    @Override
    public Mono<Authentication> convert(ServerWebExchange exchange) {
        String apiKey = exchange.getRequest().getHeaders().getFirst(headerName);
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.empty();
        }
        return Mono.just(TenantAuthenticationToken.unauthenticated(apiKey.trim()));
    }
}
