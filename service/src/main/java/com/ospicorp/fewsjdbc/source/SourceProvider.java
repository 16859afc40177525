package com.ospicorp.fewsjdbc.source;

import com.ospicorp.fewsjdbc.error.NotFoundException;
import java.util.List;
import java.util.Optional;

public interface SourceProvider {

  Optional<JdbcSource> findBySlug(String slug);

  List<JdbcSource> findAll();

  default JdbcSource getBySlug(String slug) {
    return findBySlug(slug)
        .orElseThrow(() -> new NotFoundException("Jdbc source not found: " + slug));
  }
}
