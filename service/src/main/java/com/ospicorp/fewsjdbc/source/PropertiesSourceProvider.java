package com.ospicorp.fewsjdbc.source;

import com.ospicorp.fewsjdbc.filter.model.FilterRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * {@link SourceProvider} over the sources declared in application configuration. The set is
 * fixed at startup.
 */
public class PropertiesSourceProvider implements SourceProvider {
  private static final Logger log = LoggerFactory.getLogger(PropertiesSourceProvider.class);

  private final Map<String, JdbcSource> sources;

  public PropertiesSourceProvider(List<SourceProperties> declared, CustomFilterParser parser) {
    Map<String, JdbcSource> bySlug = new LinkedHashMap<>();
    for (SourceProperties props : declared) {
      JdbcSource source = toSource(props, parser);
      if (bySlug.putIfAbsent(source.slug(), source) != null) {
        throw new IllegalStateException("Duplicate jdbc source slug: " + source.slug());
      }
    }
    this.sources = bySlug;
    log.info("Configured {} jdbc source(s): {}", bySlug.size(), bySlug.keySet());
  }

  @Override
  public Optional<JdbcSource> findBySlug(String slug) {
    return Optional.ofNullable(sources.get(slug));
  }

  @Override
  public List<JdbcSource> findAll() {
    return List.copyOf(sources.values());
  }

  private static JdbcSource toSource(SourceProperties props, CustomFilterParser parser) {
    if (!StringUtils.hasText(props.getSlug())
        || !props.getSlug().matches(SourceProperties.SLUG_REGEX)) {
      throw new IllegalStateException("Invalid jdbc source slug: " + props.getSlug());
    }
    if (!StringUtils.hasText(props.getJdbcUrl()) || !StringUtils.hasText(props.getTagName())) {
      throw new IllegalStateException(
          "Jdbc source " + props.getSlug() + " needs both jdbc-url and tag-name");
    }
    List<FilterRecord> customFilter = null;
    if (props.isUseCustomFilter()) {
      try {
        customFilter = customFilter(props, parser);
      } catch (IllegalArgumentException ex) {
        throw new IllegalStateException(
            "Invalid custom filter for jdbc source " + props.getSlug(), ex);
      }
    }
    String name = StringUtils.hasText(props.getName()) ? props.getName() : props.getSlug();
    String root = StringUtils.hasText(props.getFilterTreeRoot()) ? props.getFilterTreeRoot()
        : null;
    return new JdbcSource(props.getSlug(), name, props.getJdbcUrl(), props.getTagName(),
        props.getConnectorString(), root, customFilter);
  }

  private static List<FilterRecord> customFilter(SourceProperties props,
      CustomFilterParser parser) {
    if (StringUtils.hasText(props.getCustomFilterJson())) {
      return parser.parse(props.getCustomFilterJson());
    }
    List<FilterRecord> records = new ArrayList<>();
    for (SourceProperties.CustomFilterEntry entry : props.getCustomFilter()) {
      if (!StringUtils.hasText(entry.getId())) {
        throw new IllegalArgumentException("Custom filter entries need an id");
      }
      records.add(new FilterRecord(entry.getId(), entry.getName(), entry.getParentId()));
    }
    return records;
  }
}
