/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tuning of name resolution for a {@link PcodeResolver}.
 *
 * <p>Name mappings and replacements may be scoped by prefixing the key with a country or parent
 * code and a '|' (e.g. {@code "AFG|Kabul City"} or {@code "CD20| city"}). Unscoped keys apply
 * everywhere.
 */
@AutoValue
public abstract class ResolverConfig {
  /** Default minimum length of input for which fuzzy matching is attempted. */
  public static final int DEFAULT_MIN_FUZZY_LENGTH = 4;
  /** Default maximum phonetic distance accepted by fuzzy matching. */
  public static final int DEFAULT_MAX_PHONETIC_DISTANCE = 2;

  public static Builder builder() {
    return new AutoValue_ResolverConfig.Builder()
        .setNameMappings(ImmutableMap.of())
        .setNameReplacements(ImmutableMap.of())
        .setFuzzyDenyList(ImmutableSet.of())
        .setAdminLevelOverrides(ImmutableMap.of())
        .setMinFuzzyLength(DEFAULT_MIN_FUZZY_LENGTH)
        .setMaxPhoneticDistance(DEFAULT_MAX_PHONETIC_DISTANCE)
        .setNameTransforms(NameTransform.defaults());
  }

  /** Returns a configuration with default values and no mappings or replacements. */
  public static ResolverConfig defaults() {
    return builder().build();
  }

  /**
   * Countries for which fuzzy matching is attempted. If absent, fuzzy matching is attempted for
   * all countries.
   */
  public abstract Optional<ImmutableSet<String>> getFuzzyCountries();

  /** Literal input names mapped directly to codes, optionally scoped. */
  public abstract ImmutableMap<String, String> getNameMappings();

  /** Text replacements used to derive the secondary form of a normalized name. */
  public abstract ImmutableMap<String, String> getNameReplacements();

  /** Lower-cased input names for which fuzzy matching is never attempted. */
  public abstract ImmutableSet<String> getFuzzyDenyList();

  /** Per-country admin levels, overriding the resolver's admin level. */
  public abstract ImmutableMap<String, Integer> getAdminLevelOverrides();

  public abstract int getMinFuzzyLength();

  public abstract int getMaxPhoneticDistance();

  /** Alternative spellings of registered names tried during phonetic matching. */
  public abstract ImmutableList<NameTransform> getNameTransforms();

  public abstract Builder toBuilder();

  /** Returns whether fuzzy matching may be attempted for the given country. */
  public boolean isFuzzyCountry(String countryIso3) {
    return getFuzzyCountries().map(c -> c.contains(countryIso3)).orElse(true);
  }

  /** Returns whether the given input is on the fuzzy matching deny list. */
  public boolean isFuzzyDenied(String input) {
    return getFuzzyDenyList().contains(input.toLowerCase(Locale.ROOT));
  }

  /** Builder for {@link ResolverConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFuzzyCountries(ImmutableSet<String> countries);

    public Builder setFuzzyCountries(Set<String> countries) {
      return setFuzzyCountries(ImmutableSet.copyOf(countries));
    }

    public abstract Builder setNameMappings(Map<String, String> mappings);

    public abstract Builder setNameReplacements(Map<String, String> replacements);

    public abstract Builder setFuzzyDenyList(Set<String> names);

    abstract ImmutableSet<String> getFuzzyDenyList();

    public abstract Builder setAdminLevelOverrides(Map<String, Integer> overrides);

    public abstract Builder setMinFuzzyLength(int length);

    public abstract Builder setMaxPhoneticDistance(int distance);

    public abstract Builder setNameTransforms(Iterable<? extends NameTransform> transforms);

    abstract ResolverConfig autoBuild();

    public ResolverConfig build() {
      setFuzzyDenyList(
          getFuzzyDenyList().stream()
              .map(s -> s.toLowerCase(Locale.ROOT))
              .collect(toImmutableSet()));
      ResolverConfig config = autoBuild();
      checkArgument(
          config.getMinFuzzyLength() >= 0,
          "invalid minimum fuzzy length: %s",
          config.getMinFuzzyLength());
      checkArgument(
          config.getMaxPhoneticDistance() >= 0,
          "invalid maximum phonetic distance: %s",
          config.getMaxPhoneticDistance());
      config
          .getAdminLevelOverrides()
          .forEach((k, v) -> checkArgument(v > 0, "invalid admin level for %s: %s", k, v));
      return config;
    }
  }
}
