package com.knowledgeassist.api.config;

import com.knowledgeassist.api.service.tenant.TenantAccount;
import com.knowledgeassist.api.service.tenant.TenantDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@EnableConfigurationProperties(TenantBootstrapProperties.class)
public class TenantBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(TenantBootstrap.class);

    private final TenantBootstrapProperties properties;
    private final TenantDirectory tenantDirectory;

    public TenantBootstrap(TenantBootstrapProperties properties, TenantDirectory tenantDirectory) {
        this.properties = properties;
        this.tenantDirectory = tenantDirectory;
    }

    @Override
    public void run(ApplicationArguments args) {
        for (TenantBootstrapProperties.Tenant tenant : properties.getTenants()) {
            if (tenant.getApiKey() == null || tenant.getApiKey().isBlank()) {
                log.warn("Skipping bootstrap tenant {} without an API key", tenant.getName());
                continue;
            }
            TenantAccount account = tenantDirectory.register(tenant.getName(), tenant.getApiKey());
            log.info("Bootstrap tenant {} available as {}", account.name(), account.id());
        }
    }
}
