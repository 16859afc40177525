package com.ospicorp.fewsjdbc.cache;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CacheKeysTest {

  @Test
  void separatorsInIdsDoNotCollide() {
    String a = CacheKeys.key(CacheKeys.LOCATIONS, "demo", "F::1", "P");
    String b = CacheKeys.key(CacheKeys.LOCATIONS, "demo", "F", "1::P");

    assertThat(a).isNotEqualTo(b);
  }

  @Test
  void namespacesAndSourcesAreSeparate() {
    assertThat(CacheKeys.key(CacheKeys.PARAMETERS, "demo", "F1"))
        .isNotEqualTo(CacheKeys.key(CacheKeys.PARAMETER_NAME, "demo", "F1"))
        .isNotEqualTo(CacheKeys.key(CacheKeys.PARAMETERS, "other", "F1"));
  }

  @Test
  void nullPartDiffersFromLiteralText() {
    assertThat(CacheKeys.key(CacheKeys.UNIT, "demo", (String) null))
        .isNotEqualTo(CacheKeys.key(CacheKeys.UNIT, "demo", "null"));
  }

  @Test
  void belongsToMatchesOnlyTheSlugSegment() {
    String key = CacheKeys.key(CacheKeys.FILTER_TREE, "demo");

    assertThat(CacheKeys.belongsTo(key, "demo")).isTrue();
    assertThat(CacheKeys.belongsTo(key, "dem")).isFalse();
    assertThat(CacheKeys.belongsTo(CacheKeys.key(CacheKeys.PARAMETERS, "other", "demo"), "demo"))
        .isFalse();
  }
}
