package org.iceforge.bifrost.gateway.config;

import org.iceforge.bifrost.audit.AlertSink;
import org.iceforge.bifrost.audit.AuditSink;
import org.iceforge.bifrost.audit.JdbcAccessLogSink;
import org.iceforge.bifrost.audit.LoggingAlertSink;
import org.iceforge.bifrost.audit.Slf4jAuditSink;
import org.iceforge.bifrost.links.PasswordHasher;
import org.iceforge.bifrost.links.SharedLinkManager;
import org.iceforge.bifrost.pipeline.ProxyPipeline;
import org.iceforge.bifrost.registry.ConnectorRegistry;
import org.iceforge.bifrost.store.ConnectorStore;
import org.iceforge.bifrost.store.JdbcConnectorStore;
import org.iceforge.bifrost.store.JdbcSharedLinkStore;
import org.iceforge.bifrost.store.SchemaInitializer;
import org.iceforge.bifrost.store.SharedLinkStore;
import org.iceforge.bifrost.token.HmacIdentityVerifier;
import org.iceforge.bifrost.token.IdentityVerifier;
import org.iceforge.bifrost.token.TokenGenerator;
import org.iceforge.bifrost.token.TokenResolver;
import org.iceforge.bifrost.usage.UsageAccountant;
import org.iceforge.bifrost.vault.CredentialVault;
import org.iceforge.bifrost.vault.VaultKeys;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Wires the gateway core onto the durable store. The schema is applied before any store
 * bean is created.
 */
@Configuration
public class CoreConfig {

    private final DataSource dataSource;

    public CoreConfig(DataSource dataSource) {
        this.dataSource = dataSource;
        SchemaInitializer.apply(dataSource);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LoggingAlertSink alertSink() {
        return new LoggingAlertSink();
    }

    @Bean(destroyMethod = "close")
    public JdbcAccessLogSink accessLogSink() {
        return new JdbcAccessLogSink(dataSource, 10_000);
    }

    @Bean
    @Primary
    public AuditSink auditSink(JdbcAccessLogSink accessLog) {
        return AuditSink.composite(List.of(new Slf4jAuditSink(), accessLog));
    }

    @Bean
    public CredentialVault credentialVault(VaultProperties props, AlertSink alerts) {
        Path keyFile = props.keyFile() == null || props.keyFile().isBlank() ? null : Path.of(props.keyFile());
        return new CredentialVault(VaultKeys.load(props.key(), keyFile, props.generateIfMissing()), alerts);
    }

    @Bean
    public TokenGenerator tokenGenerator() {
        return new TokenGenerator();
    }

    @Bean
    public PasswordHasher passwordHasher() {
        return new PasswordHasher();
    }

    @Bean
    public ConnectorStore connectorStore() {
        return new JdbcConnectorStore(dataSource);
    }

    @Bean
    public SharedLinkStore sharedLinkStore() {
        return new JdbcSharedLinkStore(dataSource);
    }

    @Bean
    public ConnectorRegistry connectorRegistry(ConnectorStore store, CredentialVault vault, TokenGenerator tokens,
                                               Clock clock, RegistryProperties props) {
        return new ConnectorRegistry(store, vault, tokens, clock, props.cacheTtl());
    }

    @Bean
    public SharedLinkManager sharedLinkManager(SharedLinkStore store, ConnectorRegistry registry,
                                               PasswordHasher hasher, TokenGenerator tokens, Clock clock) {
        return new SharedLinkManager(store, registry, hasher, tokens, clock);
    }

    @Bean
    public IdentityVerifier identityVerifier(IdentityProperties props, Clock clock) {
        return new HmacIdentityVerifier(props.secret(), props.allowedSkew(), clock);
    }

    @Bean
    public UsageAccountant usageAccountant(ConnectorRegistry registry, SharedLinkStore links, AuditSink audit,
                                           Clock clock) {
        return new UsageAccountant(registry, links, audit, clock);
    }

    @Bean
    public TokenResolver tokenResolver(ConnectorRegistry registry, SharedLinkStore links, PasswordHasher hasher,
                                       IdentityVerifier identities, UsageAccountant usage, CredentialVault vault,
                                       Clock clock) {
        return new TokenResolver(registry, links, hasher, identities, usage, vault, clock);
    }

    @Bean
    public ProxyPipeline proxyPipeline(TokenResolver resolver, UsageAccountant usage, Clock clock,
                                       GatewayProperties props) {
        return new ProxyPipeline(resolver, usage, clock, props.timeouts().retryBackoff());
    }
}
