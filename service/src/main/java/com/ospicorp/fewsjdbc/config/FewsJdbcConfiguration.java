package com.ospicorp.fewsjdbc.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.fewsjdbc.cache.CacheStore;
import com.ospicorp.fewsjdbc.cache.CaffeineCacheStore;
import com.ospicorp.fewsjdbc.gateway.Jdbc2EiClientFactory;
import com.ospicorp.fewsjdbc.gateway.RemoteQueryGateway;
import com.ospicorp.fewsjdbc.resolver.JdbcSourceResolver;
import com.ospicorp.fewsjdbc.source.CustomFilterParser;
import com.ospicorp.fewsjdbc.source.PropertiesSourceProvider;
import com.ospicorp.fewsjdbc.source.SourceProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the resolver stack. The hosting service imports this class and contributes a
 * {@link Jdbc2EiClientFactory} for its XML-RPC transport.
 */
@Configuration
@EnableConfigurationProperties(FewsJdbcProperties.class)
public class FewsJdbcConfiguration {

  @Bean(destroyMethod = "close")
  RemoteQueryGateway remoteQueryGateway(Jdbc2EiClientFactory clientFactory,
      FewsJdbcProperties properties) {
    return new RemoteQueryGateway(clientFactory, properties.getGateway().getTimeout(),
        properties.getGateway().getThreadsPerEndpoint());
  }

  @Bean
  @ConditionalOnMissingBean(CacheStore.class)
  CacheStore fewsJdbcCacheStore(FewsJdbcProperties properties) {
    return new CaffeineCacheStore(properties.getCache().getMaximumSize());
  }

  @Bean
  CustomFilterParser customFilterParser(ObjectProvider<ObjectMapper> mapper) {
    return new CustomFilterParser(mapper.getIfAvailable(ObjectMapper::new));
  }

  @Bean
  @ConditionalOnMissingBean(SourceProvider.class)
  SourceProvider sourceProvider(FewsJdbcProperties properties, CustomFilterParser parser) {
    return new PropertiesSourceProvider(properties.getSources(), parser);
  }

  @Bean
  JdbcSourceResolver jdbcSourceResolver(RemoteQueryGateway gateway, CacheStore cacheStore,
      FewsJdbcProperties properties) {
    return new JdbcSourceResolver(gateway, cacheStore, properties.getCache().getDefaultTtl(),
        properties.getCache().getLocationTtl());
  }
}
