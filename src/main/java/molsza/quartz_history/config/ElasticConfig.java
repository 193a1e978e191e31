package molsza.quartz_history.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import molsza.quartz_history.run_store.ElasticsearchJobRunStoreProvider;
import molsza.quartz_history.run_store.JobRunStoreProvider;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.CredentialsProvider;
import org.apache.http.conn.ssl.TrustAllStrategy;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.http.ssl.SSLContexts;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.security.GeneralSecurityException;

/**
 * Elasticsearch client and run store, active with
 * {@code jobs.tracking.provider=elasticsearch}.
 */
@Slf4j
@Configuration
@Setter
@ConfigurationProperties(prefix = "elastic")
@ConditionalOnProperty(prefix = "jobs.tracking", name = "provider", havingValue = "elasticsearch")
public class ElasticConfig {

  private String serverUrl = "localhost";
  private String user;
  private String password;
  private int port = 9200;
  private String scheme = "https";
  private String serverPathPrefix;
  private String proxy;
  private boolean trustAllCertificates = false;
  private int connectionRequestTimeout = 45000;

  @Bean
  @ConditionalOnMissingBean
  public ElasticsearchClient elasticsearchClient() {

    log.info("Connecting to elasticsearch {}://{}:{}", scheme, serverUrl, port);

    RestClientBuilder builder = RestClient.builder(new HttpHost(serverUrl, port, scheme))
        .setHttpClientConfigCallback(httpClientBuilder -> {
          if (StringUtils.hasText(user)) {
            CredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(AuthScope.ANY, new UsernamePasswordCredentials(user, password));
            httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider);
          }
          if (StringUtils.hasText(proxy)) {
            log.info("Connecting to elasticsearch through proxy {}", proxy);
            httpClientBuilder.setProxy(HttpHost.create(proxy));
          }
          if (trustAllCertificates) {
            log.warn("Elasticsearch certificates are not verified");
            try {
              httpClientBuilder
                  .setSSLContext(SSLContexts.custom().loadTrustMaterial(null, TrustAllStrategy.INSTANCE).build())
                  .setSSLHostnameVerifier((host, sslSession) -> true);
            } catch (GeneralSecurityException e) {
              throw new IllegalStateException("Could not set up trust-all SSL context", e);
            }
          }
          return httpClientBuilder;
        });
    if (StringUtils.hasText(serverPathPrefix)) builder.setPathPrefix(serverPathPrefix);
    builder.setCompressionEnabled(true);
    builder.setRequestConfigCallback(r -> r.setConnectionRequestTimeout(connectionRequestTimeout));
    ElasticsearchTransport transport = new RestClientTransport(builder.build(), new JacksonJsonpMapper());

    return new ElasticsearchClient(transport);
  }

  @Bean
  @ConditionalOnMissingBean(JobRunStoreProvider.class)
  public ElasticsearchJobRunStoreProvider elasticsearchJobRunStoreProvider(ElasticsearchClient client, JobTrackingProperties properties) {
    var provider = new ElasticsearchJobRunStoreProvider(client, properties.getIndexName(), properties.isRefreshOnWrite());
    provider.createIndex();
    return provider;
  }
}
