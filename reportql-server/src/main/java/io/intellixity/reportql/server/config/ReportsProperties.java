package io.intellixity.reportql.server.config;

import io.intellixity.reportql.exec.ReportLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "reportql")
public class ReportsProperties {
  /** Source registry YAML: a classpath resource, or a filesystem path prefixed with {@code file:}. */
  private String registry = "reportql/sources.yaml";
  private final Map<String, StoreDb> stores = new HashMap<>();
  private final Limits limits = new Limits();

  public String getRegistry() { return registry; }
  public void setRegistry(String registry) { this.registry = registry; }
  public Map<String, StoreDb> getStores() { return stores; }
  public Limits getLimits() { return limits; }

  public static class StoreDb {
    private String jdbcUrl;
    private String username;
    private String password;
    private int maximumPoolSize = 10;
    private Duration idleTimeout = Duration.ofSeconds(30);
    private Duration connectionTimeout = Duration.ofSeconds(5);

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    public Duration getIdleTimeout() { return idleTimeout; }
    public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }
    public Duration getConnectionTimeout() { return connectionTimeout; }
    public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }
  }

  public static class Limits {
    private int maxRows = ReportLimits.DEFAULT_MAX_ROWS;
    private Duration timeout = ReportLimits.DEFAULT_TIMEOUT;
    private int previewRows = ReportLimits.DEFAULT_PREVIEW_ROWS;

    public int getMaxRows() { return maxRows; }
    public void setMaxRows(int maxRows) { this.maxRows = maxRows; }
    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
    public int getPreviewRows() { return previewRows; }
    public void setPreviewRows(int previewRows) { this.previewRows = previewRows; }

    public ReportLimits toReportLimits() {
      return new ReportLimits(maxRows, timeout, previewRows);
    }
  }
}
