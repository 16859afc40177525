package com.ospicorp.fewsjdbc.filter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FilterNode(String id, String name, List<FilterNode> childNodes,
    ParameterLookupKey parameters) {

  public FilterNode {
    childNodes = childNodes == null ? List.of() : List.copyOf(childNodes);
  }

  @JsonIgnore
  public boolean isLeaf() {
    return childNodes.isEmpty();
  }
}
