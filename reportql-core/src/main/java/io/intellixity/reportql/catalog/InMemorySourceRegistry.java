package io.intellixity.reportql.catalog;

import io.intellixity.reportql.query.ErrorKind;
import io.intellixity.reportql.query.QueryValidationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Immutable map-backed {@link SourceRegistry}. Safe for concurrent readers. */
public final class InMemorySourceRegistry implements SourceRegistry {
  private final Map<String, SourceDefinition> sources;

  public InMemorySourceRegistry(List<SourceDefinition> defs) {
    Map<String, SourceDefinition> m = new LinkedHashMap<>();
    for (SourceDefinition sd : defs) {
      if (m.putIfAbsent(sd.key(), sd) != null) {
        throw new IllegalArgumentException("Duplicate source key: " + sd.key());
      }
    }
    this.sources = Collections.unmodifiableMap(m);
  }

  @Override
  public SourceDefinition getSource(String key) {
    SourceDefinition sd = (key == null) ? null : sources.get(key);
    if (sd == null) {
      throw new QueryValidationException(ErrorKind.UNKNOWN_SOURCE, key, "Unknown data source: " + key);
    }
    return sd;
  }

  @Override
  public Collection<SourceDefinition> allSources() { return sources.values(); }
}
