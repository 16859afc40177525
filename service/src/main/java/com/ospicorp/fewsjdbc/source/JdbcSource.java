package com.ospicorp.fewsjdbc.source;

import com.ospicorp.fewsjdbc.filter.model.FilterRecord;
import java.util.List;

/**
 * A configured Jdbc2Ei endpoint. {@code customFilter} is {@code null} unless the source
 * replaces the remote filter hierarchy with a fixed one.
 */
public record JdbcSource(
    String slug,
    String name,
    String jdbcUrl,
    String tagName,
    String connectorString,
    String filterTreeRoot,
    List<FilterRecord> customFilter) {

  public JdbcSource {
    customFilter = customFilter == null ? null : List.copyOf(customFilter);
  }

  public boolean usesCustomFilter() {
    return customFilter != null;
  }
}
