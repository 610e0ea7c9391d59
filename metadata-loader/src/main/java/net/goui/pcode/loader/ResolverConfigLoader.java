/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode.loader;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.goui.pcode.ResolverConfig;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a {@link ResolverConfig} from a YAML document. Recognized top level keys are:
 *
 * <ul>
 *   <li>{@code countries_fuzzy_try}: list of countries for which fuzzy matching is attempted.
 *   <li>{@code admin_name_mappings}: map of (optionally scoped) names to codes.
 *   <li>{@code admin_name_replacements}: map of (optionally scoped) text replacements.
 *   <li>{@code admin_fuzzy_dont}: list of names never fuzzy matched.
 *   <li>{@code admin_level_overrides}: map of countries to admin levels.
 *   <li>{@code fuzzy_min_length}: minimum input length for fuzzy matching.
 *   <li>{@code max_phonetic_distance}: maximum accepted phonetic distance.
 * </ul>
 *
 * <p>Other keys are ignored, so a config may be shared with other tools.
 */
public final class ResolverConfigLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String FUZZY_COUNTRIES = "countries_fuzzy_try";
  static final String NAME_MAPPINGS = "admin_name_mappings";
  static final String NAME_REPLACEMENTS = "admin_name_replacements";
  static final String FUZZY_DENY_LIST = "admin_fuzzy_dont";
  static final String ADMIN_LEVEL_OVERRIDES = "admin_level_overrides";
  static final String MIN_FUZZY_LENGTH = "fuzzy_min_length";
  static final String MAX_PHONETIC_DISTANCE = "max_phonetic_distance";

  private static final ImmutableSet<String> KNOWN_KEYS =
      ImmutableSet.of(
          FUZZY_COUNTRIES,
          NAME_MAPPINGS,
          NAME_REPLACEMENTS,
          FUZZY_DENY_LIST,
          ADMIN_LEVEL_OVERRIDES,
          MIN_FUZZY_LENGTH,
          MAX_PHONETIC_DISTANCE);

  /** Loads the configuration file at the given path. */
  public static ResolverConfig load(Path configPath) throws IOException {
    logger.atInfo().log("Loading config: %s", configPath);
    try (Reader reader = Files.newBufferedReader(configPath, UTF_8)) {
      return load(reader, configPath.toString());
    }
  }

  /** Loads a configuration from a class path resource. */
  public static ResolverConfig loadResource(String resourcePath) throws IOException {
    String path = resourcePath.startsWith("/") ? resourcePath : "/" + resourcePath;
    logger.atInfo().log("Loading config resource: %s", path);
    try (InputStream is = ResolverConfigLoader.class.getResourceAsStream(path)) {
      if (is == null) {
        throw new FileNotFoundException("cannot find config resource: " + path);
      }
      return load(new InputStreamReader(is, UTF_8), path);
    }
  }

  /**
   * Loads a configuration from the given reader, which is not closed.
   *
   * @throws IOException if the document is not valid YAML.
   * @throws IllegalArgumentException if a recognized key has a value of the wrong type.
   */
  public static ResolverConfig load(Reader reader, String source) throws IOException {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException e) {
      throw new IOException("error parsing config: " + source, e);
    }
    if (document == null) {
      return ResolverConfig.defaults();
    }
    checkArgument(document instanceof Map, "config must be a mapping: %s", source);
    return from((Map<?, ?>) document, source);
  }

  /** Creates a configuration from a parsed YAML mapping. */
  public static ResolverConfig from(Map<?, ?> yaml, String source) {
    ResolverConfig.Builder config = ResolverConfig.builder();
    for (Object key : yaml.keySet()) {
      if (!KNOWN_KEYS.contains(String.valueOf(key))) {
        logger.atFine().log("Ignoring config key '%s' in: %s", key, source);
      }
    }
    if (yaml.containsKey(FUZZY_COUNTRIES)) {
      config.setFuzzyCountries(stringSet(yaml, FUZZY_COUNTRIES, source));
    }
    config.setNameMappings(stringMap(yaml, NAME_MAPPINGS, source));
    config.setNameReplacements(stringMap(yaml, NAME_REPLACEMENTS, source));
    config.setFuzzyDenyList(stringSet(yaml, FUZZY_DENY_LIST, source));
    Map<String, Integer> overrides = new LinkedHashMap<>();
    stringMap(yaml, ADMIN_LEVEL_OVERRIDES, source)
        .forEach((k, v) -> overrides.put(k, toInt(v, ADMIN_LEVEL_OVERRIDES, source)));
    config.setAdminLevelOverrides(overrides);
    Integer minLength = intValue(yaml, MIN_FUZZY_LENGTH, source);
    if (minLength != null) {
      config.setMinFuzzyLength(minLength);
    }
    Integer maxDistance = intValue(yaml, MAX_PHONETIC_DISTANCE, source);
    if (maxDistance != null) {
      config.setMaxPhoneticDistance(maxDistance);
    }
    ResolverConfig resolverConfig = config.build();
    logger.atFine().log(
        "Config from %s: %d mappings, %d replacements, %d deny listed names",
        source,
        resolverConfig.getNameMappings().size(),
        resolverConfig.getNameReplacements().size(),
        resolverConfig.getFuzzyDenyList().size());
    return resolverConfig;
  }

  private static Set<String> stringSet(Map<?, ?> yaml, String key, String source) {
    Object value = yaml.get(key);
    if (value == null) {
      return ImmutableSet.of();
    }
    checkArgument(value instanceof List, "'%s' must be a list in: %s", key, source);
    Set<String> values = new LinkedHashSet<>();
    for (Object v : (List<?>) value) {
      checkArgument(v != null, "'%s' must not contain empty values in: %s", key, source);
      values.add(String.valueOf(v));
    }
    return values;
  }

  private static ImmutableMap<String, String> stringMap(
      Map<?, ?> yaml, String key, String source) {
    Object value = yaml.get(key);
    if (value == null) {
      return ImmutableMap.of();
    }
    checkArgument(value instanceof Map, "'%s' must be a mapping in: %s", key, source);
    Map<String, String> values = new LinkedHashMap<>();
    ((Map<?, ?>) value)
        .forEach(
            (k, v) -> {
              checkArgument(
                  k != null && v != null, "'%s' has an empty key or value in: %s", key, source);
              values.put(String.valueOf(k), String.valueOf(v));
            });
    return ImmutableMap.copyOf(values);
  }

  @Nullable
  private static Integer intValue(Map<?, ?> yaml, String key, String source) {
    Object value = yaml.get(key);
    return value != null ? toInt(String.valueOf(value), key, source) : null;
  }

  private static int toInt(String value, String key, String source) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("'%s' has a non-numeric value '%s' in: %s", key, value, source), e);
    }
  }

  private ResolverConfigLoader() {}
}
