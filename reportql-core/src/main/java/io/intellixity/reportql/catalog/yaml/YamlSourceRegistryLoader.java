package io.intellixity.reportql.catalog.yaml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.intellixity.reportql.catalog.FieldDefinition;
import io.intellixity.reportql.catalog.FieldType;
import io.intellixity.reportql.catalog.InMemorySourceRegistry;
import io.intellixity.reportql.catalog.SourceDefinition;
import io.intellixity.reportql.validate.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads source definitions from YAML.
 *
 * <pre>
 * sources:
 *   facilities:
 *     table: snf_facilities
 *     store: market
 *     label: Facilities
 *     description: ...
 *     fields:
 *       state: { type: string, label: State, category: Location }
 * </pre>
 *
 * Every source key, field name and store id must be a plain SQL identifier; tables may be schema-qualified.
 * Violations fail the load with {@link IllegalArgumentException}.
 */
public final class YamlSourceRegistryLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlSourceRegistryLoader.class);

  private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

  public InMemorySourceRegistry loadResource(String classpathResource) throws IOException {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = YamlSourceRegistryLoader.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(classpathResource)) {
      if (in == null) throw new IOException("Source registry resource not found: " + classpathResource);
      return load(in, classpathResource);
    }
  }

  public InMemorySourceRegistry loadFile(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return load(in, file.toString());
    }
  }

  public InMemorySourceRegistry load(InputStream in, String origin) throws IOException {
    JsonNode root = yaml.readTree(in);
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("Source registry must be a YAML mapping: " + origin);
    }
    JsonNode sources = root.get("sources");
    if (sources == null || !sources.isObject() || sources.isEmpty()) {
      throw new IllegalArgumentException("Source registry has no 'sources' mapping: " + origin);
    }

    List<SourceDefinition> out = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> it = sources.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      out.add(parseSource(e.getKey(), e.getValue()));
    }

    if (log.isDebugEnabled()) {
      log.debug("reportql.registry loaded origin={} sources={}", origin, out.stream().map(SourceDefinition::key).toList());
    }
    return new InMemorySourceRegistry(out);
  }

  private static SourceDefinition parseSource(String key, JsonNode n) {
    requireIdent(key, "source key");
    if (n == null || !n.isObject()) throw new IllegalArgumentException("Source '" + key + "' must be a mapping");

    String table = requiredText(n, "table", key);
    if (!Identifiers.isTableName(table)) {
      throw new IllegalArgumentException("Invalid table name for source '" + key + "': " + table);
    }
    String store = requiredText(n, "store", key);
    requireIdent(store, "store id of source '" + key + "'");

    JsonNode fieldsNode = n.get("fields");
    if (fieldsNode == null || !fieldsNode.isObject() || fieldsNode.isEmpty()) {
      throw new IllegalArgumentException("Source '" + key + "' declares no fields");
    }

    Map<String, FieldDefinition> fields = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = fieldsNode.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> fe = it.next();
      String name = fe.getKey();
      requireIdent(name, "field of source '" + key + "'");
      JsonNode fn = fe.getValue();

      String typeToken = (fn != null && fn.isObject()) ? textOrNull(fn.get("type")) : textOrNull(fn);
      FieldType type = FieldType.fromToken(typeToken);
      if (type == null) {
        throw new IllegalArgumentException("Unknown type '" + typeToken + "' for field '" + key + "." + name + "'");
      }
      String label = (fn != null && fn.isObject()) ? textOrNull(fn.get("label")) : null;
      String category = (fn != null && fn.isObject()) ? textOrNull(fn.get("category")) : null;
      fields.put(name, new FieldDefinition(name, type, label, category));
    }

    return new SourceDefinition(key, table, store, textOrNull(n.get("label")), textOrNull(n.get("description")), fields);
  }

  private static void requireIdent(String s, String what) {
    if (!Identifiers.isIdentifier(s)) throw new IllegalArgumentException("Invalid " + what + ": " + s);
  }

  private static String requiredText(JsonNode n, String member, String sourceKey) {
    String v = textOrNull(n.get(member));
    if (v == null || v.isBlank()) {
      throw new IllegalArgumentException("Source '" + sourceKey + "' is missing '" + member + "'");
    }
    return v.trim();
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
