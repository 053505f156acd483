package io.intellixity.reportql.server.config;

import io.intellixity.reportql.catalog.ReportCatalog;
import io.intellixity.reportql.catalog.SourceRegistry;
import io.intellixity.reportql.catalog.yaml.YamlSourceRegistryLoader;
import io.intellixity.reportql.exec.ReportEngine;
import io.intellixity.reportql.jdbc.JdbcReportEngine;
import io.intellixity.reportql.jdbc.dialect.JdbcReportDialect;
import io.intellixity.reportql.jdbc.postgres.PostgresReportDialect;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(ReportsProperties.class)
public class ReportqlConfig {
  static final String FILE_PREFIX = "file:";

  @Bean
  public SourceRegistry sourceRegistry(ReportsProperties props) throws IOException {
    String location = props.getRegistry();
    YamlSourceRegistryLoader loader = new YamlSourceRegistryLoader();
    if (location.startsWith(FILE_PREFIX)) return loader.loadFile(Path.of(location.substring(FILE_PREFIX.length())));
    return loader.loadResource(location);
  }

  @Bean
  public ReportCatalog reportCatalog(SourceRegistry registry) {
    return new ReportCatalog(registry);
  }

  @Bean
  public HikariStoreResolver storeResolver(ReportsProperties props) {
    return new HikariStoreResolver(props.getStores());
  }

  @Bean
  public JdbcReportDialect reportDialect() {
    return new PostgresReportDialect();
  }

  @Bean
  public ReportEngine reportEngine(JdbcReportDialect dialect,
                                   SourceRegistry registry,
                                   HikariStoreResolver stores,
                                   ReportsProperties props) {
    return new JdbcReportEngine(dialect, registry, stores, props.getLimits().toReportLimits());
  }
}
