package com.ospicorp.fewsjdbc.filter.service;

import com.ospicorp.fewsjdbc.filter.model.FilterNode;
import com.ospicorp.fewsjdbc.filter.model.FilterRecord;
import com.ospicorp.fewsjdbc.filter.model.ParameterLookupKey;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns flat {@link FilterRecord}s into a forest. Records whose parent chain does not reach
 * {@code rootParent} are left out. Sibling order follows input order.
 */
public final class FilterTreeBuilder {
  private FilterTreeBuilder() {
  }

  public static List<FilterNode> build(List<FilterRecord> records, String rootParent) {
    return build(records, rootParent, null);
  }

  /**
   * Same as {@link #build(List, String)}, and every leaf additionally carries a
   * {@link ParameterLookupKey} for {@code sourceSlug} when one is given.
   */
  public static List<FilterNode> build(List<FilterRecord> records, String rootParent,
      String sourceSlug) {
    Map<String, List<FilterRecord>> byParent = new HashMap<>();
    for (FilterRecord record : records) {
      byParent.computeIfAbsent(record.parentId(), k -> new ArrayList<>()).add(record);
    }
    return children(byParent, rootParent, sourceSlug, new HashSet<>());
  }

  // path holds the ids on the current branch; a record repeating one of them would recurse
  // forever when ids are not unique.
  private static List<FilterNode> children(Map<String, List<FilterRecord>> byParent,
      String parentId, String sourceSlug, Set<String> path) {
    List<FilterRecord> direct = byParent.getOrDefault(parentId, List.of());
    List<FilterNode> out = new ArrayList<>(direct.size());
    for (FilterRecord record : direct) {
      if (!path.add(record.id())) {
        continue;
      }
      List<FilterNode> childNodes = children(byParent, record.id(), sourceSlug, path);
      path.remove(record.id());
      ParameterLookupKey lookup = childNodes.isEmpty() && sourceSlug != null
          ? new ParameterLookupKey(sourceSlug, record.id())
          : null;
      out.add(new FilterNode(record.id(), record.name(), childNodes, lookup));
    }
    return out;
  }
}
