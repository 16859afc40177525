package com.ospicorp.fewsjdbc.filter.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.fewsjdbc.filter.model.FilterNode;
import com.ospicorp.fewsjdbc.filter.model.FilterRecord;
import com.ospicorp.fewsjdbc.filter.model.ParameterLookupKey;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FilterTreeBuilderTest {
  private static final String ROOT = "-999";

  @Test
  void orphansAreDropped() {
    var records = List.of(
        new FilterRecord("a", "A", ROOT),
        new FilterRecord("b", "B", "missing"));

    var tree = FilterTreeBuilder.build(records, ROOT);

    assertThat(tree).extracting(FilterNode::id).containsExactly("a");
    assertThat(tree.get(0).isLeaf()).isTrue();
  }

  @Test
  void childrenKeepInputOrder() {
    var records = List.of(
        new FilterRecord("z", "Z", ROOT),
        new FilterRecord("z2", "Z2", "z"),
        new FilterRecord("a", "A", ROOT),
        new FilterRecord("z1", "Z1", "z"));

    var tree = FilterTreeBuilder.build(records, ROOT);

    assertThat(tree).extracting(FilterNode::id).containsExactly("z", "a");
    assertThat(tree.get(0).childNodes()).extracting(FilterNode::id).containsExactly("z2", "z1");
  }

  @Test
  void leavesAreExactlyRecordsWithoutChildrenAndDepthFollowsParentChain() {
    var records = List.of(
        new FilterRecord("1", "Water", ROOT),
        new FilterRecord("1.1", "Rivers", "1"),
        new FilterRecord("1.1.1", "Rhine", "1.1"),
        new FilterRecord("1.2", "Lakes", "1"),
        new FilterRecord("2", "Air", ROOT));

    var tree = FilterTreeBuilder.build(records, ROOT);

    List<String> leaves = new ArrayList<>();
    collectLeaves(tree, 1, leaves);
    assertThat(leaves).containsExactly("1.1.1@3", "1.2@2", "2@1");
  }

  @Test
  void nullRootParentForCustomFilters() {
    var records = List.of(
        new FilterRecord("a", "A", null),
        new FilterRecord("b", "B", "a"));

    var tree = FilterTreeBuilder.build(records, null);

    assertThat(tree).singleElement()
        .satisfies(a -> assertThat(a.childNodes()).extracting(FilterNode::id).containsExactly("b"));
  }

  @Test
  void selfReferencingDuplicateIdDoesNotRecurse() {
    var records = List.of(
        new FilterRecord("a", "A", ROOT),
        new FilterRecord("a", "A again", "a"));

    var tree = FilterTreeBuilder.build(records, ROOT);

    assertThat(tree).singleElement().satisfies(a -> assertThat(a.isLeaf()).isTrue());
  }

  @Test
  void leavesCarryParameterLookupWhenSlugGiven() {
    var records = List.of(
        new FilterRecord("1", "Rivers", ROOT),
        new FilterRecord("2", "Lake A", "1"));

    var tree = FilterTreeBuilder.build(records, ROOT, "demo");

    assertThat(tree.get(0).parameters()).isNull();
    assertThat(tree.get(0).childNodes().get(0).parameters())
        .isEqualTo(new ParameterLookupKey("demo", "2"));
  }

  private static void collectLeaves(List<FilterNode> nodes, int depth, List<String> out) {
    for (FilterNode node : nodes) {
      if (node.isLeaf()) {
        out.add(node.id() + "@" + depth);
      } else {
        collectLeaves(node.childNodes(), depth + 1, out);
      }
    }
  }
}
