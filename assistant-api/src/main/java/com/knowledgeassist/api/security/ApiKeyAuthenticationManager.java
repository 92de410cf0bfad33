package com.knowledgeassist.api.security;

import com.knowledgeassist.api.service.tenant.TenantDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.core.Authentication;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

public class ApiKeyAuthenticationManager implements ReactiveAuthenticationManager {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthenticationManager.class);

    private final TenantDirectory tenantDirectory;

    public ApiKeyAuthenticationManager(TenantDirectory tenantDirectory) {
        this.tenantDirectory = tenantDirectory;
    }

    @Override
    public Mono<Authentication> authenticate(Authentication authentication) {
        if (!(authentication instanceof TenantAuthenticationToken token) || token.getCredentials() == null) {
            return Mono.error(new BadCredentialsException("Unsupported authentication token"));
        }
        String apiKey = (String) token.getCredentials();
        return Mono.fromCallable(() -> tenantDirectory.findByApiKey(apiKey))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(Mono::justOrEmpty)
                .switchIfEmpty(Mono.error(() -> new BadCredentialsException("Invalid API key")))
                .flatMap(account -> {
                    if (!account.active()) {
                        log.warn("Rejected request for inactive tenant {}", account.id());
                        return Mono.error(new DisabledException("Tenant account is inactive"));
                    }
                    return Mono.just(TenantAuthenticationToken.authenticated(
                            new TenantPrincipal(account.id(), account.name())));
                });
    }
}
