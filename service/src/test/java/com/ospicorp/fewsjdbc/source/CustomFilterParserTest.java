package com.ospicorp.fewsjdbc.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.fewsjdbc.filter.model.FilterRecord;
import org.junit.jupiter.api.Test;

class CustomFilterParserTest {

  private final CustomFilterParser parser = new CustomFilterParser(new ObjectMapper());

  @Test
  void parsesListWithNullRoot() {
    var records = parser.parse(
        "[{\"id\":\"id\",\"name\":\"name\",\"parentid\":null},"
            + "{\"id\":\"id2\",\"name\":\"name2\",\"parentid\":\"id\"}]");

    assertThat(records).containsExactly(
        new FilterRecord("id", "name", null),
        new FilterRecord("id2", "name2", "id"));
  }

  @Test
  void acceptsCamelCaseParent() {
    assertThat(parser.parse("[{\"id\":\"a\",\"name\":\"A\",\"parentId\":\"r\"}]"))
        .containsExactly(new FilterRecord("a", "A", "r"));
  }

  @Test
  void rejectsExpressionsThatAreNotJson() {
    assertThatThrownBy(() -> parser.parse("[{'id': __import__('os').getcwd()}]"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsEntriesWithoutId() {
    assertThatThrownBy(() -> parser.parse("[{\"name\":\"A\"}]"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void blankIsEmpty() {
    assertThat(parser.parse("  ")).isEmpty();
  }
}
