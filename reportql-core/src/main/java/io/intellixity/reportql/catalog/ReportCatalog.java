package io.intellixity.reportql.catalog;

import io.intellixity.reportql.query.Aggregation;
import io.intellixity.reportql.query.DateTransform;
import io.intellixity.reportql.query.Operator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Read-only projection of the registry and fixed vocabularies for report-builder UIs. */
public final class ReportCatalog {
  private final SourceRegistry registry;

  public ReportCatalog(SourceRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public record FieldEntry(String name, String label, FieldType type) {}

  public record SourceEntry(String label, String description, Map<String, List<FieldEntry>> categories) {}

  public record SourceSummary(String key, String label, String description, int fieldCount) {}

  public record Descriptor(Map<String, SourceEntry> sources,
                           Map<String, List<Aggregation>> aggregations,
                           List<String> dateTransforms,
                           List<String> operators) {}

  /** Sources keyed by source key; fields grouped by category in declaration order. */
  public Map<String, SourceEntry> sources() {
    Map<String, SourceEntry> out = new LinkedHashMap<>();
    for (SourceDefinition sd : registry.allSources()) {
      Map<String, List<FieldEntry>> categories = new LinkedHashMap<>();
      for (FieldDefinition fd : sd.fields().values()) {
        categories.computeIfAbsent(fd.category(), k -> new ArrayList<>())
            .add(new FieldEntry(fd.name(), fd.label(), fd.type()));
      }
      out.put(sd.key(), new SourceEntry(sd.label(), sd.description(), categories));
    }
    return out;
  }

  public List<SourceSummary> summaries() {
    List<SourceSummary> out = new ArrayList<>();
    for (SourceDefinition sd : registry.allSources()) {
      out.add(new SourceSummary(sd.key(), sd.label(), sd.description(), sd.fields().size()));
    }
    return out;
  }

  public Map<String, List<Aggregation>> aggregationsByType() {
    Map<String, List<Aggregation>> out = new LinkedHashMap<>();
    for (FieldType ft : FieldType.values()) out.put(ft.token(), ft.suggestedAggregations());
    return out;
  }

  public List<String> dateTransforms() {
    List<String> out = new ArrayList<>();
    for (DateTransform dt : DateTransform.values()) out.add(dt.token());
    return out;
  }

  public List<String> operators() {
    return Operator.tokens();
  }

  public Descriptor describe() {
    return new Descriptor(sources(), aggregationsByType(), dateTransforms(), operators());
  }
}
