/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode.metadata;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableMap.toImmutableMap;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import net.goui.pcode.NameNormalizer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable gazetteer of registered p-codes for a single administrative level.
 *
 * <p>A registry maps each code to its display name and owning country, and each country (and
 * optionally each parent code) to an ordered mapping from normalized names to codes. When several
 * codes share a normalized name within a country or parent, the first registered code wins. When a
 * code is registered more than once, the last display name wins.
 *
 * <p>Lookups never throw for unknown keys, they just return empty results.
 */
public final class Registry {
  /** Returns a new builder for registering codes. */
  public static Builder builder() {
    return new Builder(null);
  }

  /**
   * Returns a new builder which silently skips rows for countries not in the given set. This is
   * useful when the source data covers more countries than are of interest. Countries are matched
   * ignoring case.
   */
  public static Builder builderForCountries(Set<String> countries) {
    return new Builder(countries.stream().map(Ascii::toUpperCase).collect(toImmutableSet()));
  }

  private final ImmutableSet<String> codes;
  private final ImmutableMap<String, String> codeToName;
  private final ImmutableMap<String, String> codeToCountry;
  private final ImmutableMap<String, String> codeToParent;
  private final ImmutableMap<String, ImmutableMap<String, String>> countryNames;
  private final ImmutableMap<String, ImmutableMap<String, String>> parentNames;
  private final ImmutableMap<String, Integer> codeLengths;

  private Registry(Builder builder) {
    this.codes = ImmutableSet.copyOf(builder.codes);
    this.codeToName = ImmutableMap.copyOf(builder.codeToName);
    this.codeToCountry = ImmutableMap.copyOf(builder.codeToCountry);
    this.codeToParent = ImmutableMap.copyOf(builder.codeToParent);
    this.countryNames = freeze(builder.countryNames);
    this.parentNames = freeze(builder.parentNames);
    this.codeLengths = ImmutableMap.copyOf(builder.codeLengths);
  }

  private static ImmutableMap<String, ImmutableMap<String, String>> freeze(
      Map<String, Map<String, String>> nameMaps) {
    return nameMaps.entrySet().stream()
        .collect(toImmutableMap(Map.Entry::getKey, e -> ImmutableMap.copyOf(e.getValue())));
  }

  /** Returns all registered codes in registration order. */
  public ImmutableSet<String> getCodes() {
    return codes;
  }

  /** Returns whether the given code is registered (case-sensitive). */
  public boolean contains(String code) {
    return codes.contains(code);
  }

  /** Returns the ISO 3166-1 alpha-3 codes of all countries with at least one registered code. */
  public ImmutableSet<String> getCountries() {
    return codeLengths.keySet();
  }

  /** Returns whether any codes were registered for the given country. */
  public boolean hasCountry(String countryIso3) {
    return codeLengths.containsKey(countryIso3);
  }

  /** Returns the display name of a registered code. */
  public Optional<String> lookupExact(String code) {
    return Optional.ofNullable(codeToName.get(code));
  }

  /** Returns the country which owns the given code. */
  public Optional<String> getCountry(String code) {
    return Optional.ofNullable(codeToCountry.get(code));
  }

  /** Returns the parent code of the given code, if one was registered. */
  public Optional<String> getParent(String code) {
    return Optional.ofNullable(codeToParent.get(code));
  }

  /** Returns whether any row in this registry was registered with a parent code. */
  public boolean usesParents() {
    return !codeToParent.isEmpty();
  }

  /**
   * Returns the length of the last code registered for the given country. This is used as the
   * "observed" code length when no grammar is available for the country.
   */
  public Optional<Integer> getCodeLength(String countryIso3) {
    return Optional.ofNullable(codeLengths.get(countryIso3));
  }

  /** Looks up a code via its normalized name within a country. */
  public Optional<String> lookupByCountryName(String countryIso3, String normalizedName) {
    return getCountryNames(countryIso3).map(m -> m.get(normalizedName));
  }

  /** Looks up a code via its normalized name within a parent code of a country. */
  public Optional<String> lookupByParentName(
      String countryIso3, String parent, String normalizedName) {
    return getParentNames(countryIso3, parent).map(m -> m.get(normalizedName));
  }

  /** Returns the ordered normalized name to code mapping for a country. */
  public Optional<ImmutableMap<String, String>> getCountryNames(String countryIso3) {
    return Optional.ofNullable(countryNames.get(countryIso3));
  }

  /** Returns the ordered normalized name to code mapping for a parent code within a country. */
  public Optional<ImmutableMap<String, String>> getParentNames(String countryIso3, String parent) {
    return Optional.ofNullable(parentNames.get(parentKey(countryIso3, parent)));
  }

  /**
   * Returns the character offsets at which any registered code of the given country holds a
   * {@code '0'}, in ascending order.
   */
  public ImmutableSet<Integer> getZeroPositions(String countryIso3) {
    Set<Integer> positions = new TreeSet<>();
    codeToCountry.forEach(
        (code, country) -> {
          if (country.equals(countryIso3)) {
            for (int i = 0; i < code.length(); i++) {
              if (code.charAt(i) == '0') {
                positions.add(i);
              }
            }
          }
        });
    return ImmutableSet.copyOf(positions);
  }

  private static String parentKey(String countryIso3, String parent) {
    return countryIso3 + "|" + parent;
  }

  @Override
  public String toString() {
    return String.format(
        "Registry{codes=%d, countries=%s, parents=%s}",
        codes.size(),
        getCountries(),
        usesParents());
  }

  /** Builder for {@link Registry} instances. */
  public static final class Builder {
    @Nullable private final ImmutableSet<String> countryFilter;

    private final Set<String> codes = new LinkedHashSet<>();
    private final Map<String, String> codeToName = new LinkedHashMap<>();
    private final Map<String, String> codeToCountry = new LinkedHashMap<>();
    private final Map<String, String> codeToParent = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> countryNames = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> parentNames = new LinkedHashMap<>();
    private final Map<String, Integer> codeLengths = new LinkedHashMap<>();

    private Builder(@Nullable ImmutableSet<String> countryFilter) {
      this.countryFilter = countryFilter;
    }

    /** Registers a code without a parent. */
    @CanIgnoreReturnValue
    public Builder register(String countryIso3, String code, String name) {
      return register(countryIso3, code, name, null);
    }

    /**
     * Registers a code with an optional parent code. Rows for countries outside any country filter
     * of this builder are skipped.
     */
    @CanIgnoreReturnValue
    public Builder register(
        String countryIso3, String code, String name, @Nullable String parent) {
      checkNotNull(name, "name must not be null: %s", code);
      checkArgument(!countryIso3.isEmpty(), "country must not be empty: %s", code);
      checkArgument(!code.isEmpty(), "code must not be empty for country: %s", countryIso3);
      if (countryFilter != null && !countryFilter.contains(Ascii.toUpperCase(countryIso3))) {
        return this;
      }
      codes.add(code);
      codeToName.put(code, name);
      codeToCountry.put(code, countryIso3);
      codeLengths.put(countryIso3, code.length());
      String normalizedName = NameNormalizer.normalize(name);
      countryNames
          .computeIfAbsent(countryIso3, k -> new LinkedHashMap<>())
          .putIfAbsent(normalizedName, code);
      if (parent != null && !parent.isEmpty()) {
        codeToParent.put(code, parent);
        parentNames
            .computeIfAbsent(parentKey(countryIso3, parent), k -> new LinkedHashMap<>())
            .putIfAbsent(normalizedName, code);
      }
      return this;
    }

    /** Builds the registry, failing if no codes were registered. */
    public Registry build() {
      checkState(!codes.isEmpty(), "no codes were registered");
      return new Registry(this);
    }
  }
}
