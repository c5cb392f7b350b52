package org.iceforge.bifrost.gateway.config;

import org.iceforge.bifrost.gateway.clickhouse.ClickHouseCredentials;
import org.iceforge.bifrost.gateway.http.ApiCredentials;
import org.iceforge.bifrost.gateway.http.HttpBackend;
import org.iceforge.bifrost.gateway.jdbc.Dialect;
import org.iceforge.bifrost.gateway.jdbc.JdbcBackend;
import org.iceforge.bifrost.gateway.mongo.DriverMongoClientFactory;
import org.iceforge.bifrost.gateway.mongo.MongoBackend;
import org.iceforge.bifrost.gateway.mongo.MongoClientFactory;
import org.iceforge.bifrost.gateway.s3.AwsS3ClientFactory;
import org.iceforge.bifrost.gateway.s3.S3Backend;
import org.iceforge.bifrost.gateway.s3.S3ClientFactory;
import org.iceforge.bifrost.registry.ConnectorRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Backend connection pools, one bean per backend family. Each pool drops a connector's
 * connections when the registry invalidates it.
 */
@Configuration
public class BackendConfig {

    private final ConnectorRegistry registry;
    private final GatewayProperties props;

    public BackendConfig(ConnectorRegistry registry, GatewayProperties props) {
        this.registry = registry;
        this.props = props;
    }

    @Bean(destroyMethod = "close")
    public JdbcBackend mysqlJdbcBackend() {
        JdbcBackend backend = new JdbcBackend(Dialect.MYSQL, props);
        registry.onInvalidate(backend::evict);
        return backend;
    }

    @Bean(destroyMethod = "close")
    public JdbcBackend postgresJdbcBackend() {
        JdbcBackend backend = new JdbcBackend(Dialect.POSTGRESQL, props);
        registry.onInvalidate(backend::evict);
        return backend;
    }

    @Bean(destroyMethod = "close")
    public HttpBackend apiHttpBackend(WebClient.Builder builder) {
        HttpBackend backend = new HttpBackend("api", ApiCredentials::endpoint, builder, props);
        registry.onInvalidate(backend::evict);
        return backend;
    }

    @Bean(destroyMethod = "close")
    public HttpBackend clickhouseHttpBackend(WebClient.Builder builder) {
        HttpBackend backend = new HttpBackend("clickhouse", ClickHouseCredentials::endpoint, builder, props);
        registry.onInvalidate(backend::evict);
        return backend;
    }

    @Bean
    public S3ClientFactory s3ClientFactory() {
        return new AwsS3ClientFactory(props.timeouts().backendResponse());
    }

    @Bean(destroyMethod = "close")
    public S3Backend s3Backend(S3ClientFactory clients) {
        S3Backend backend = new S3Backend(clients, props.maxResponseBytes());
        registry.onInvalidate(backend::evict);
        return backend;
    }

    @Bean
    public MongoClientFactory mongoClientFactory() {
        return new DriverMongoClientFactory(props);
    }

    @Bean(destroyMethod = "close")
    public MongoBackend mongoBackend(MongoClientFactory clients) {
        MongoBackend backend = new MongoBackend(clients);
        registry.onInvalidate(backend::evict);
        return backend;
    }
}
