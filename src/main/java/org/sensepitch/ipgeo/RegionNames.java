package org.sensepitch.ipgeo;

import java.util.List;
import java.util.Map;

/**
 * Picks localized names from the database name maps and derives the abbreviated region codes.
 * Chinese province and city names get their administrative suffix normalized.
 *
 * @author Jens Wilke
 */
public class RegionNames {

  public static final List<String> DEFAULT_LANGUAGES = List.of("zh-CN", "en");

  private static final List<String> PROVINCE_SUFFIXES = List.of("省", "自治区", "特别行政区");

  private static final List<String> STRIPPED_SUFFIXES =
      List.of("省", "自治区", "维吾尔", "壮族", "回族", "市", "特别行政区");

  private static final List<String> KEPT_NAMES = List.of("北京", "上海", "天津", "重庆", "香港", "澳门");

  private final List<String> languages;

  public RegionNames(List<String> languages) {
    this.languages =
        languages == null || languages.isEmpty() ? DEFAULT_LANGUAGES : List.copyOf(languages);
  }

  public List<String> languages() {
    return languages;
  }

  /** Name in the first configured language present in the map, or {@code null}. */
  public String pick(Map<String, String> names) {
    if (names == null) {
      return null;
    }
    for (String language : languages) {
      String name = names.get(language);
      if (name != null && !name.isBlank()) {
        return name.trim();
      }
    }
    return null;
  }

  public static String provinceName(String name) {
    if (!isChinese(name)) {
      return name;
    }
    for (String suffix : PROVINCE_SUFFIXES) {
      if (name.endsWith(suffix)) {
        return name;
      }
    }
    return name + "省";
  }

  public static String cityName(String name) {
    if (!isChinese(name) || name.endsWith("市")) {
      return name;
    }
    return name + "市";
  }

  /**
   * Short form of a Chinese region name: administrative suffixes and ethnic designations are
   * removed, municipalities and special administrative regions are kept, anything else is cut to
   * its first two characters.
   */
  public static String abbreviate(String name) {
    String shortName = name.trim();
    for (String suffix : STRIPPED_SUFFIXES) {
      shortName = shortName.replace(suffix, "");
    }
    if (shortName.isEmpty()) {
      return name.trim();
    }
    if (KEPT_NAMES.contains(shortName)) {
      return shortName;
    }
    if (shortName.codePointCount(0, shortName.length()) <= 2) {
      return shortName;
    }
    return shortName.substring(0, shortName.offsetByCodePoints(0, 2));
  }

  /** Abbreviation for a name, with a fallback code used for non Chinese names. */
  public static String abbreviate(String name, String fallbackCode) {
    if (isChinese(name)) {
      return abbreviate(name);
    }
    return fallbackCode != null ? fallbackCode : name;
  }

  static boolean isChinese(String name) {
    return name != null
        && name.codePoints()
            .anyMatch(cp -> Character.UnicodeScript.of(cp) == Character.UnicodeScript.HAN);
  }
}
