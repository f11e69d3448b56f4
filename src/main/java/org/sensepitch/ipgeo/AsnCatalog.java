package org.sensepitch.ipgeo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Optional catalog of localized operator names and network categories per autonomous system.
 * Read from a JSON file in the form {@code {"asn_info": {"4134": {"name": "电信", "type":
 * "isp"}}}}.
 *
 * @author Jens Wilke
 */
@Slf4j
public final class AsnCatalog {

  public static final AsnCatalog EMPTY = new AsnCatalog(Map.of());

  /** Category of an entry without a type. */
  public static final String OTHER_NETWORK = "其他网络";

  private final Map<Long, Entry> entries;

  public AsnCatalog(Map<Long, Entry> entries) {
    this.entries = Map.copyOf(entries);
  }

  /**
   * Load the catalog. A missing file yields the empty catalog.
   *
   * @throws DatabaseLoadException if the file cannot be read or parsed
   */
  public static AsnCatalog load(Path file) {
    if (file == null) {
      return EMPTY;
    }
    if (!Files.exists(file)) {
      log.warn("ASN catalog " + file + " not present, operator names and categories unavailable");
      return EMPTY;
    }
    JsonNode root;
    try {
      root = new ObjectMapper().readTree(file.toFile());
    } catch (IOException e) {
      throw new DatabaseLoadException(TableKind.ASN_CATALOG, "Cannot read " + file, e);
    }
    JsonNode info = root == null ? null : root.get("asn_info");
    if (info == null || !info.isObject()) {
      throw new DatabaseLoadException(TableKind.ASN_CATALOG, "Missing asn_info object in " + file);
    }
    Map<Long, Entry> map = new HashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = info.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> field = it.next();
      long number;
      try {
        number = Long.parseLong(field.getKey());
      } catch (NumberFormatException e) {
        throw new DatabaseLoadException(
            TableKind.ASN_CATALOG, "Illegal ASN key '" + field.getKey() + "' in " + file, e);
      }
      JsonNode value = field.getValue();
      String type = textOrNull(value, "type");
      map.put(
          number, new Entry(textOrNull(value, "name"), type == null ? OTHER_NETWORK : type));
    }
    log.info("ASN catalog loaded, file=" + file + ", entries=" + map.size());
    return new AsnCatalog(map);
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    String text = value.asText();
    return text.isEmpty() ? null : text;
  }

  public Entry get(long asn) {
    return entries.get(asn);
  }

  public int size() {
    return entries.size();
  }

  /**
   * @param name localized operator name, e.g. "电信"
   * @param type network category, e.g. "isp", "idc" or "hosting"
   */
  public record Entry(String name, String type) {}
}
