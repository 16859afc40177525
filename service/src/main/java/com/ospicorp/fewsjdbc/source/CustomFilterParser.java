package com.ospicorp.fewsjdbc.source;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.fewsjdbc.filter.model.FilterRecord;
import java.util.ArrayList;
import java.util.List;
import org.springframework.util.StringUtils;

/**
 * Reads a custom filter hierarchy stored as JSON text, e.g.
 * {@code [{"id":"a","name":"A","parentid":null},{"id":"b","name":"B","parentid":"a"}]}.
 */
public class CustomFilterParser {

  private final ObjectMapper mapper;

  public CustomFilterParser(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public List<FilterRecord> parse(String json) {
    if (!StringUtils.hasText(json)) {
      return List.of();
    }
    List<Entry> entries;
    try {
      entries = mapper.readValue(json, new TypeReference<List<Entry>>() {});
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Custom filter is not a valid JSON list: "
          + ex.getOriginalMessage(), ex);
    }
    List<FilterRecord> records = new ArrayList<>(entries.size());
    for (Entry entry : entries) {
      if (entry == null || !StringUtils.hasText(entry.getId())) {
        throw new IllegalArgumentException("Custom filter entries need an id: " + entry);
      }
      records.add(new FilterRecord(entry.getId(), entry.getName(), entry.getParentId()));
    }
    return records;
  }

  static class Entry {
    private String id;
    private String name;
    @JsonAlias({"parentid", "parent_id", "parent-id"})
    private String parentId;

    public String getId() {
      return id;
    }

    public void setId(String id) {
      this.id = id;
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getParentId() {
      return parentId;
    }

    public void setParentId(String parentId) {
      this.parentId = parentId;
    }

    @Override
    public String toString() {
      return "{id=" + id + ", name=" + name + ", parentId=" + parentId + "}";
    }
  }
}
