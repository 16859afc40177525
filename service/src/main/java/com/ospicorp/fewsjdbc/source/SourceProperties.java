package com.ospicorp.fewsjdbc.source;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.ArrayList;
import java.util.List;

/**
 * Bound form of one {@code fewsjdbc.sources[]} entry.
 */
public class SourceProperties {
  static final String SLUG_REGEX = "^[A-Za-z0-9_-]{1,64}$";

  @NotBlank
  @Pattern(regexp = SLUG_REGEX)
  private String slug;
  private String name;
  @NotBlank
  private String jdbcUrl;
  @NotBlank
  private String tagName;
  private String connectorString = "";
  private String filterTreeRoot;
  private boolean useCustomFilter;
  private List<CustomFilterEntry> customFilter = new ArrayList<>();
  private String customFilterJson;

  public String getSlug() {
    return slug;
  }

  public void setSlug(String slug) {
    this.slug = slug;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getJdbcUrl() {
    return jdbcUrl;
  }

  public void setJdbcUrl(String jdbcUrl) {
    this.jdbcUrl = jdbcUrl;
  }

  public String getTagName() {
    return tagName;
  }

  public void setTagName(String tagName) {
    this.tagName = tagName;
  }

  public String getConnectorString() {
    return connectorString;
  }

  public void setConnectorString(String connectorString) {
    this.connectorString = connectorString;
  }

  public String getFilterTreeRoot() {
    return filterTreeRoot;
  }

  public void setFilterTreeRoot(String filterTreeRoot) {
    this.filterTreeRoot = filterTreeRoot;
  }

  public boolean isUseCustomFilter() {
    return useCustomFilter;
  }

  public void setUseCustomFilter(boolean useCustomFilter) {
    this.useCustomFilter = useCustomFilter;
  }

  public List<CustomFilterEntry> getCustomFilter() {
    return customFilter;
  }

  public void setCustomFilter(List<CustomFilterEntry> customFilter) {
    this.customFilter = customFilter;
  }

  public String getCustomFilterJson() {
    return customFilterJson;
  }

  public void setCustomFilterJson(String customFilterJson) {
    this.customFilterJson = customFilterJson;
  }

  public static class CustomFilterEntry {
    private String id;
    private String name;
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
  }
}
