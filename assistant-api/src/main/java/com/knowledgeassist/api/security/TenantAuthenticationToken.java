package com.knowledgeassist.api.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;

public class TenantAuthenticationToken extends AbstractAuthenticationToken {

    private final String apiKey;
    private final TenantPrincipal principal;

    private TenantAuthenticationToken(String apiKey, TenantPrincipal principal) {
        super(principal == null ? AuthorityUtils.NO_AUTHORITIES : AuthorityUtils.createAuthorityList("ROLE_TENANT"));
        this.apiKey = apiKey;
        this.principal = principal;
        setAuthenticated(principal != null);
    }

    public static TenantAuthenticationToken unauthenticated(String apiKey) {
        return new TenantAuthenticationToken(apiKey, null);
    }

    public static TenantAuthenticationToken authenticated(TenantPrincipal principal) {
        return new TenantAuthenticationToken(null, principal);
    }

    @Override
    public Object getCredentials() {
        return apiKey;
    }

    @Override
    public Object getPrincipal() {
        return principal;
    }

    @Override
    public String getName() {
        return principal == null ? "" : principal.tenantId();
    }
}
