package com.ospicorp.fewsjdbc.resolver;

import com.ospicorp.fewsjdbc.cache.CacheKeys;
import com.ospicorp.fewsjdbc.cache.CacheStore;
import com.ospicorp.fewsjdbc.error.NotFoundException;
import com.ospicorp.fewsjdbc.error.RemoteQueryException;
import com.ospicorp.fewsjdbc.error.RemoteUnavailableException;
import com.ospicorp.fewsjdbc.filter.model.FilterNode;
import com.ospicorp.fewsjdbc.filter.model.FilterRecord;
import com.ospicorp.fewsjdbc.filter.model.FilterTree;
import com.ospicorp.fewsjdbc.filter.service.FilterTreeBuilder;
import com.ospicorp.fewsjdbc.gateway.RemoteQueryGateway;
import com.ospicorp.fewsjdbc.resolver.model.Location;
import com.ospicorp.fewsjdbc.resolver.model.Parameter;
import com.ospicorp.fewsjdbc.resolver.model.TimeSeriesPoint;
import com.ospicorp.fewsjdbc.rows.Rows;
import com.ospicorp.fewsjdbc.rows.Scalars;
import com.ospicorp.fewsjdbc.source.JdbcSource;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Lookups over a {@link JdbcSource}: the filter hierarchy, the parameters of a filter, the
 * locations of a parameter and the time series of a location. Everything except time series is
 * cached per source.
 */
public class JdbcSourceResolver {
  private static final Logger log = LoggerFactory.getLogger(JdbcSourceResolver.class);

  /** Parent id the FEWS filters table uses for top level filters. */
  public static final String JDBC_NONE = "-999";

  static final String SERVER_UNAVAILABLE = "Jdbc2Ei server not available.";
  static final String SOURCE_UNAVAILABLE = "Jdbc data source not available.";

  private static final List<String> FILTER_COLUMNS = List.of("id", "name", "parentid");
  private static final List<String> PARAMETER_COLUMNS =
      List.of("name", "parameterid", "parameter");
  private static final List<String> LOCATION_COLUMNS =
      List.of("longitude", "latitude", "location", "locationid");
  private static final List<String> TIME_SERIES_COLUMNS =
      List.of("time", "value", "flag", "detection", "comment");

  private final RemoteQueryGateway gateway;
  private final CacheStore cache;
  private final Duration defaultTtl;
  private final Duration locationTtl;

  /**
   * @param locationTtl TTL of cached locations; {@code null} keeps them until the store evicts
   *     them
   */
  public JdbcSourceResolver(RemoteQueryGateway gateway, CacheStore cache, Duration defaultTtl,
      Duration locationTtl) {
    this.gateway = gateway;
    this.cache = cache;
    this.defaultTtl = defaultTtl;
    this.locationTtl = locationTtl;
  }

  public FilterTree getFilterTree(JdbcSource source) {
    return getFilterTree(source, false);
  }

  /**
   * Builds the filter hierarchy of {@code source}. Remote failures do not propagate: the result
   * is then a degraded tree with one diagnostic node, which is not cached.
   */
  public FilterTree getFilterTree(JdbcSource source, boolean ignoreCache) {
    String key = CacheKeys.key(CacheKeys.FILTER_TREE, source.slug());
    if (!ignoreCache) {
      Optional<FilterTree> hit = lookup(key);
      if (hit.isPresent()) {
        return hit.get();
      }
    }

    List<FilterRecord> records;
    String rootParent;
    if (source.usesCustomFilter()) {
      records = source.customFilter();
      rootParent = null;
    } else {
      try {
        records = fetchFilterRecords(source);
      } catch (RemoteUnavailableException ex) {
        return FilterTree.degraded(SERVER_UNAVAILABLE, ex);
      } catch (RemoteQueryException ex) {
        log.error("JdbcSource {} returned an error: {}", source.slug(), ex.getMessage());
        return FilterTree.degraded(SOURCE_UNAVAILABLE, ex);
      }
      rootParent = StringUtils.hasText(source.filterTreeRoot()) ? source.filterTreeRoot()
          : JDBC_NONE;
    }

    List<FilterNode> nodes = FilterTreeBuilder.build(records, rootParent, source.slug());
    FilterTree tree = FilterTree.of(nodes);
    cache.set(key, tree, defaultTtl);
    return tree;
  }

  public List<Parameter> getParameters(JdbcSource source, String filterId) {
    return getParameters(source, filterId, false);
  }

  public List<Parameter> getParameters(JdbcSource source, String filterId, boolean ignoreCache) {
    requireText(filterId, "filterId");
    String key = CacheKeys.key(CacheKeys.PARAMETERS, source.slug(), filterId);
    return cached(key, defaultTtl, ignoreCache, () -> {
      List<List<Object>> rows = gateway.query(source, QueryStatements.parameters(filterId));
      List<Parameter> parameters = new ArrayList<>();
      for (Map<String, Object> row : Rows.named(Rows.dedup(rows), PARAMETER_COLUMNS)) {
        parameters.add(new Parameter(
            Scalars.asId(row.get("parameterid")),
            Scalars.asString(row.get("parameter")),
            Scalars.asString(row.get("name"))));
      }
      return List.copyOf(parameters);
    });
  }

  /**
   * @throws NotFoundException if the parameter is unknown to the source
   */
  public String getParameterName(JdbcSource source, String parameterId) {
    requireText(parameterId, "parameterId");
    String key = CacheKeys.key(CacheKeys.PARAMETER_NAME, source.slug(), parameterId);
    return cached(key, defaultTtl, false,
        () -> firstValue(source, QueryStatements.parameterName(parameterId),
            "Parameter not found: " + parameterId));
  }

  public List<Location> getLocations(JdbcSource source, String filterId, String parameterId) {
    requireText(filterId, "filterId");
    requireText(parameterId, "parameterId");
    String key = CacheKeys.key(CacheKeys.LOCATIONS, source.slug(), filterId, parameterId);
    return cached(key, locationTtl, false, () -> {
      List<List<Object>> rows =
          gateway.query(source, QueryStatements.locations(filterId, parameterId));
      List<Location> locations = new ArrayList<>();
      for (Map<String, Object> row : Rows.named(Rows.dedup(rows), LOCATION_COLUMNS)) {
        locations.add(new Location(
            Scalars.asId(row.get("locationid")),
            Scalars.asString(row.get("location")),
            Scalars.asDouble(row.get("longitude")),
            Scalars.asDouble(row.get("latitude"))));
      }
      return List.copyOf(locations);
    });
  }

  /**
   * Fetches measurements between {@code start} and {@code end} inclusive. Never cached.
   */
  public List<TimeSeriesPoint> getTimeSeries(JdbcSource source, String filterId,
      String locationId, String parameterId, LocalDateTime start, LocalDateTime end) {
    requireText(filterId, "filterId");
    requireText(locationId, "locationId");
    requireText(parameterId, "parameterId");
    if (start == null || end == null) {
      throw new IllegalArgumentException("start and end must be provided");
    }
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("Start date " + start + " is later than end date " + end);
    }
    List<List<Object>> rows = gateway.query(source,
        QueryStatements.timeSeries(filterId, locationId, parameterId, start, end));
    List<TimeSeriesPoint> points = new ArrayList<>(rows.size());
    for (Map<String, Object> row : Rows.named(rows, TIME_SERIES_COLUMNS)) {
      points.add(new TimeSeriesPoint(
          RemoteTimestamps.parse(row.get("time")),
          Scalars.asDouble(row.get("value")),
          Scalars.asString(row.get("flag")),
          Scalars.asString(row.get("detection")),
          Scalars.asString(row.get("comment"))));
    }
    return points;
  }

  /**
   * @throws NotFoundException if the parameter has no unit row
   */
  public String getUnit(JdbcSource source, String parameterId) {
    requireText(parameterId, "parameterId");
    String key = CacheKeys.key(CacheKeys.UNIT, source.slug(), parameterId);
    return cached(key, defaultTtl, false,
        () -> firstValue(source, QueryStatements.unit(parameterId),
            "No unit for parameter: " + parameterId));
  }

  /**
   * Drops every cached lookup of {@code source}.
   */
  public void evict(JdbcSource source) {
    cache.removeIf(key -> CacheKeys.belongsTo(key, source.slug()));
  }

  private List<FilterRecord> fetchFilterRecords(JdbcSource source) {
    List<List<Object>> rows = gateway.query(source, QueryStatements.FILTERS);
    List<FilterRecord> records = new ArrayList<>();
    for (Map<String, Object> row : Rows.named(Rows.dedup(rows), FILTER_COLUMNS)) {
      records.add(new FilterRecord(
          Scalars.asId(row.get("id")),
          Scalars.asString(row.get("name")),
          Scalars.asId(row.get("parentid"))));
    }
    return records;
  }

  private String firstValue(JdbcSource source, String statement, String notFoundMessage) {
    List<List<Object>> rows = gateway.query(source, statement);
    if (rows.isEmpty() || rows.get(0).isEmpty()) {
      throw new NotFoundException(notFoundMessage);
    }
    return Scalars.asString(rows.get(0).get(0));
  }

  private <T> T cached(String key, Duration ttl, boolean ignoreCache, Supplier<T> loader) {
    if (!ignoreCache) {
      Optional<T> hit = lookup(key);
      if (hit.isPresent()) {
        return hit.get();
      }
    }
    T value = loader.get();
    if (value != null) {
      cache.set(key, value, ttl);
    }
    return value;
  }

  @SuppressWarnings("unchecked")
  private <T> Optional<T> lookup(String key) {
    Optional<Object> hit = cache.get(key);
    log.debug("Cache {} for {}", hit.isPresent() ? "hit" : "miss", key);
    return (Optional<T>) hit;
  }

  private static void requireText(String value, String name) {
    if (!StringUtils.hasText(value)) {
      throw new IllegalArgumentException(name + " must be provided");
    }
  }
}
