/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import net.goui.pcode.FuzzyNameMatcher.FuzzyMatch;
import net.goui.pcode.LengthConverter.Conversion;
import net.goui.pcode.metadata.CodeGrammar;
import net.goui.pcode.metadata.CountryCodes;
import net.goui.pcode.metadata.ParentCodes;
import net.goui.pcode.metadata.Registry;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves administrative area names and p-codes of one admin level to registered p-codes.
 *
 * <p>Resolution of an input for a country proceeds in stages, stopping at the first which
 * succeeds:
 *
 * <ol>
 *   <li>A configured name mapping, scoped by parent, country or unscoped (in that order), whose
 *       code belongs to the country (and to the parent, if given).
 *   <li>For p-code shaped input, the registered code itself or a length converted code (see {@link
 *       LengthConverter}).
 *   <li>The registered name, compared after normalization (see {@link NameNormalizer}).
 *   <li>Approximate matching by substring and then by phonetic distance, if permitted.
 * </ol>
 *
 * <p>Only the last stage yields inexact results. Resolution is thread safe, and diagnostic records
 * are collected in the resolver's {@link Diagnostics} when a context is given.
 */
public final class PcodeResolver {
  /** Returns a builder for a resolver over the given registry. */
  public static Builder builder(Registry registry) {
    return new Builder(registry);
  }

  private final Registry registry;
  private final ResolverConfig config;
  private final int adminLevel;
  private final LengthConverter lengthConverter;
  private final FuzzyNameMatcher fuzzyMatcher;
  private final Diagnostics diagnostics = new Diagnostics();

  private PcodeResolver(Builder builder) {
    this.registry = builder.registry;
    this.config = builder.config;
    this.adminLevel = builder.adminLevel;
    ImmutableMap.Builder<String, CodeGrammar> grammars = ImmutableMap.builder();
    builder.grammars.forEach(
        (country, grammar) ->
            grammars.put(country, grammar.withZeroPositions(registry.getZeroPositions(country))));
    this.lengthConverter =
        new LengthConverter(
            registry,
            grammars.buildOrThrow(),
            builder.parentCodes,
            builder.countryCodes,
            this::getAdminLevel);
    this.fuzzyMatcher =
        new FuzzyNameMatcher(config.getNameTransforms(), config.getMaxPhoneticDistance());
  }

  public Registry getRegistry() {
    return registry;
  }

  public ResolverConfig getConfig() {
    return config;
  }

  public Diagnostics getDiagnostics() {
    return diagnostics;
  }

  public LengthConverter getLengthConverter() {
    return lengthConverter;
  }

  /** Returns the admin level of codes for the given country, taking overrides into account. */
  public int getAdminLevel(String countryIso3) {
    return config.getAdminLevelOverrides().getOrDefault(countryIso3, adminLevel);
  }

  /**
   * Resolves an input name or p-code for a country.
   *
   * @param countryIso3 ISO 3166-1 alpha-3 code of the country.
   * @param input a name or p-code.
   * @param allowFuzzy whether approximate matching may be attempted.
   * @param context identifies the caller in diagnostic records, or null to record nothing.
   */
  public PcodeResult resolve(
      String countryIso3, String input, boolean allowFuzzy, @Nullable String context) {
    return resolve(countryIso3, input, null, allowFuzzy, context);
  }

  /**
   * Resolves an input name or p-code for a country, within an optional parent code. When a parent
   * is given and the registry has parent codes, names are only matched among the children of the
   * parent.
   */
  public PcodeResult resolve(
      String countryIso3,
      String input,
      @Nullable String parent,
      boolean allowFuzzy,
      @Nullable String context) {
    checkNotNull(countryIso3);
    checkNotNull(input);
    Optional<String> mapped = lookupNameMapping(countryIso3, input, parent);
    if (mapped.isPresent()) {
      return PcodeResult.exact(mapped.get());
    }
    if (LengthConverter.CODE_SHAPE.matcher(input).matches()) {
      return resolveCode(countryIso3, Ascii.toUpperCase(input), context);
    }
    String normalized = NameNormalizer.normalize(input);
    Optional<ImmutableMap<String, String>> names = getNames(countryIso3, parent);
    Optional<String> code = names.map(n -> n.get(normalized));
    if (code.isPresent()) {
      return PcodeResult.exact(code.get());
    }
    if (!allowFuzzy || input.codePointCount(0, input.length()) < config.getMinFuzzyLength()) {
      return PcodeResult.none(true);
    }
    return PcodeResult.of(resolveFuzzy(countryIso3, input, normalized, parent, context), false);
  }

  private Optional<String> lookupNameMapping(
      String countryIso3, String input, @Nullable String parent) {
    ImmutableMap<String, String> mappings = config.getNameMappings();
    if (mappings.isEmpty()) {
      return Optional.empty();
    }
    if (parent != null) {
      Optional<String> code =
          acceptMapping(mappings.get(parent + "|" + input), countryIso3, parent);
      if (code.isPresent()) {
        return code;
      }
    }
    Optional<String> code =
        acceptMapping(mappings.get(countryIso3 + "|" + input), countryIso3, parent);
    if (code.isPresent()) {
      return code;
    }
    return acceptMapping(mappings.get(input), countryIso3, parent);
  }

  private Optional<String> acceptMapping(
      @Nullable String code, String countryIso3, @Nullable String parent) {
    if (code == null || !registry.getCountry(code).filter(countryIso3::equals).isPresent()) {
      return Optional.empty();
    }
    if (parent != null
        && registry.usesParents()
        && !registry.getParent(code).filter(parent::equals).isPresent()) {
      return Optional.empty();
    }
    return Optional.of(code);
  }

  private PcodeResult resolveCode(String countryIso3, String code, @Nullable String context) {
    if (registry.contains(code)) {
      return PcodeResult.exact(code);
    }
    if (!registry.hasCountry(countryIso3) && context != null) {
      diagnostics.addError(ErrorRecord.of(context, countryIso3));
    }
    Optional<Conversion> conversion = lengthConverter.convert(countryIso3, code);
    if (conversion.isPresent() && context != null) {
      String converted = conversion.get().code();
      diagnostics.addMatch(
          MatchRecord.of(
              context,
              countryIso3,
              code,
              displayName(converted),
              converted,
              conversion.get().method()));
    }
    return PcodeResult.of(conversion.map(Conversion::code), true);
  }

  private Optional<String> resolveFuzzy(
      String countryIso3,
      String input,
      String normalized,
      @Nullable String parent,
      @Nullable String context) {
    if (!config.isFuzzyCountry(countryIso3)) {
      if (context != null) {
        diagnostics.addIgnored(IgnoredRecord.of(context, countryIso3));
      }
      return Optional.empty();
    }
    Optional<ImmutableMap<String, String>> maybeNames = getNames(countryIso3, parent);
    if (maybeNames.isEmpty()) {
      if (context != null) {
        diagnostics.addError(
            isParentScoped(parent) && registry.hasCountry(countryIso3)
                ? ErrorRecord.of(context, countryIso3, parent)
                : ErrorRecord.of(context, countryIso3));
      }
      return Optional.empty();
    }
    ImmutableMap<String, String> names = maybeNames.get();
    String secondary =
        NameNormalizer.applyReplacements(normalized, getReplacements(countryIso3, parent));
    String code = names.get(normalized);
    if (code == null) {
      code = names.get(secondary);
    }
    if (code != null) {
      return Optional.of(code);
    }
    if (config.isFuzzyDenied(input)) {
      if (context != null) {
        diagnostics.addIgnored(IgnoredRecord.of(context, countryIso3, input));
      }
      return Optional.empty();
    }
    Optional<FuzzyMatch> match = fuzzyMatcher.match(names, normalized, secondary);
    if (context != null) {
      if (match.isPresent()) {
        String matched = match.get().code();
        diagnostics.addMatch(
            MatchRecord.of(
                context, countryIso3, input, displayName(matched), matched, match.get().method()));
      } else {
        diagnostics.addError(ErrorRecord.of(context, countryIso3, input));
      }
    }
    return match.map(FuzzyMatch::code);
  }

  private boolean isParentScoped(@Nullable String parent) {
    return parent != null && registry.usesParents();
  }

  private Optional<ImmutableMap<String, String>> getNames(
      String countryIso3, @Nullable String parent) {
    return isParentScoped(parent)
        ? registry.getParentNames(countryIso3, parent)
        : registry.getCountryNames(countryIso3);
  }

  private ImmutableMap<String, String> getReplacements(
      String countryIso3, @Nullable String parent) {
    return selectReplacements(config.getNameReplacements(), countryIso3, parent);
  }

  /**
   * Returns the replacements which apply in the given scope, with scope prefixes removed.
   * Unscoped replacements always apply.
   */
  static ImmutableMap<String, String> selectReplacements(
      Map<String, String> replacements, String countryIso3, @Nullable String parent) {
    Map<String, String> selected = new LinkedHashMap<>();
    replacements.forEach(
        (key, value) -> {
          int split = key.indexOf('|');
          if (split < 0) {
            selected.put(key, value);
          } else {
            String scope = key.substring(0, split);
            if (scope.equals(countryIso3) || scope.equals(parent)) {
              selected.put(key.substring(split + 1), value);
            }
          }
        });
    return ImmutableMap.copyOf(selected);
  }

  private String displayName(String code) {
    return registry.lookupExact(code).orElse(code);
  }

  /** Builder for {@link PcodeResolver}. */
  public static final class Builder {
    private final Registry registry;
    private final Map<String, CodeGrammar> grammars = new LinkedHashMap<>();
    private ResolverConfig config = ResolverConfig.defaults();
    private int adminLevel = 1;
    private ParentCodes parentCodes = ParentCodes.none();
    private CountryCodes countryCodes = CountryCodes.icu();

    private Builder(Registry registry) {
      this.registry = checkNotNull(registry);
    }

    /** Sets the admin level of the registered codes (default 1). */
    @CanIgnoreReturnValue
    public Builder setAdminLevel(int adminLevel) {
      checkArgument(adminLevel > 0, "invalid admin level: %s", adminLevel);
      this.adminLevel = adminLevel;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setConfig(ResolverConfig config) {
      this.config = checkNotNull(config);
      return this;
    }

    /** Adds grammars for code length conversion, replacing any earlier grammar for a country. */
    @CanIgnoreReturnValue
    public Builder addGrammars(Collection<CodeGrammar> grammars) {
      grammars.forEach(g -> this.grammars.put(g.getCountry(), g));
      return this;
    }

    /** Sets the codes of the parent levels, used to validate length conversion. */
    @CanIgnoreReturnValue
    public Builder setParentCodes(ParentCodes parentCodes) {
      this.parentCodes = checkNotNull(parentCodes);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCountryCodes(CountryCodes countryCodes) {
      this.countryCodes = checkNotNull(countryCodes);
      return this;
    }

    public PcodeResolver build() {
      checkArgument(
          parentCodes.levels() < adminLevel,
          "too many parent levels (%s) for admin level %s",
          parentCodes.levels(),
          adminLevel);
      return new PcodeResolver(this);
    }
  }
}
