package com.ospicorp.fewsjdbc.filter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ospicorp.fewsjdbc.error.FewsJdbcException;
import java.util.List;

/**
 * Top-level filter nodes of a source. A degraded tree holds a single diagnostic node and the
 * error that prevented building the real one.
 */
public record FilterTree(List<FilterNode> nodes, @JsonIgnore FewsJdbcException error) {

  public FilterTree {
    nodes = List.copyOf(nodes);
  }

  public static FilterTree of(List<FilterNode> nodes) {
    return new FilterTree(nodes, null);
  }

  public static FilterTree degraded(String diagnostic, FewsJdbcException error) {
    return new FilterTree(List.of(new FilterNode(null, diagnostic, List.of(), null)), error);
  }

  @JsonIgnore
  public boolean isDegraded() {
    return error != null;
  }
}
