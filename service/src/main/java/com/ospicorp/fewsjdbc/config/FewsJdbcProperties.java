package com.ospicorp.fewsjdbc.config;

import com.ospicorp.fewsjdbc.source.SourceProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "fewsjdbc")
@Validated
public class FewsJdbcProperties {

  @Valid
  private final Gateway gateway = new Gateway();

  @Valid
  private final Cache cache = new Cache();

  @Valid
  private List<SourceProperties> sources = new ArrayList<>();

  public Gateway getGateway() {
    return gateway;
  }

  public Cache getCache() {
    return cache;
  }

  public List<SourceProperties> getSources() {
    return sources;
  }

  public void setSources(List<SourceProperties> sources) {
    this.sources = sources;
  }

  public static class Gateway {
    /** Bound on each remote call: ping, config get/put and statement execution. */
    @NotNull
    private Duration timeout = Duration.ofSeconds(30);

    /** Threads available for remote calls to a single endpoint. */
    @Min(1)
    private int threadsPerEndpoint = 8;

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public int getThreadsPerEndpoint() {
      return threadsPerEndpoint;
    }

    public void setThreadsPerEndpoint(int threadsPerEndpoint) {
      this.threadsPerEndpoint = threadsPerEndpoint;
    }
  }

  public static class Cache {
    @Min(1)
    private long maximumSize = 10_000;

    @NotNull
    private Duration defaultTtl = Duration.ofHours(8);

    /** Unset keeps locations until the store evicts them. */
    private Duration locationTtl;

    public long getMaximumSize() {
      return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
      this.maximumSize = maximumSize;
    }

    public Duration getDefaultTtl() {
      return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
      this.defaultTtl = defaultTtl;
    }

    public Duration getLocationTtl() {
      return locationTtl;
    }

    public void setLocationTtl(Duration locationTtl) {
      this.locationTtl = locationTtl;
    }
  }
}
