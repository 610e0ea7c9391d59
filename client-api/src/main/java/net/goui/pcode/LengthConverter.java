/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode;

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.ToIntFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.goui.pcode.metadata.CodeGrammar;
import net.goui.pcode.metadata.CountryCodes;
import net.goui.pcode.metadata.ParentCodes;
import net.goui.pcode.metadata.Registry;

/**
 * Repairs p-codes which differ from registered codes only in their segment lengths, such as
 * "NG15" for "NG015" or "YEM030001" for "YE3001".
 *
 * <p>When a {@link CodeGrammar} covering the admin level is available for a country, the code is
 * split segment by segment, padding or stripping at most one zero per level at positions where
 * registered codes hold zeros. Otherwise, for admin level 1 only, a simple heuristic based on the
 * observed length of registered codes is used.
 *
 * <p>A converted code is only ever returned if it is registered.
 */
public final class LengthConverter {
  /** Input which can be a p-code: 2 or 3 letters followed by digits. */
  public static final Pattern CODE_SHAPE = Pattern.compile("^([A-Za-z]{2,3})(\\d+)$");

  static final String SIMPLE = "pcode length conversion";
  static final String COUNTRY = "pcode length conversion-country";
  static final String ADMINS = "pcode length conversion-admins ";

  private static final Joiner COMMA = Joiner.on(',');

  /** A registered code produced by conversion, and the method by which it was produced. */
  @AutoValue
  public abstract static class Conversion {
    static Conversion of(String code, String method) {
      return new AutoValue_LengthConverter_Conversion(code, method);
    }

    /** The registered code. */
    public abstract String code();

    /** The conversion method, as reported in match diagnostics. */
    public abstract String method();
  }

  private final Registry registry;
  private final ImmutableMap<String, CodeGrammar> grammars;
  private final ParentCodes parentCodes;
  private final CountryCodes countryCodes;
  private final ToIntFunction<String> adminLevel;

  LengthConverter(
      Registry registry,
      ImmutableMap<String, CodeGrammar> grammars,
      ParentCodes parentCodes,
      CountryCodes countryCodes,
      ToIntFunction<String> adminLevel) {
    this.registry = registry;
    this.grammars = grammars;
    this.parentCodes = parentCodes;
    this.countryCodes = countryCodes;
    this.adminLevel = adminLevel;
  }

  /**
   * Attempts to convert the given code into a registered code of the country. Input which is not
   * code-shaped, or which cannot be unambiguously repaired, yields an empty result.
   */
  public Optional<Conversion> convert(String countryIso3, String code) {
    Matcher m = CODE_SHAPE.matcher(code);
    if (!m.matches()) {
      return Optional.empty();
    }
    int level = adminLevel.applyAsInt(countryIso3);
    CodeGrammar grammar = grammars.get(countryIso3);
    if (grammar == null || !grammar.covers(level)) {
      return level == 1 ? convertSimple(countryIso3, code) : Optional.empty();
    }
    return convertWithGrammar(countryIso3, m.group(1), m.group(2), grammar, level);
  }

  /**
   * Uses the observed code length of the country to guess the intended code. The country
   * prefix of the input (rather than the given country) is converted between ISO2 and ISO3.
   */
  private Optional<Conversion> convertSimple(String countryIso3, String code) {
    Optional<Integer> observed = registry.getCodeLength(countryIso3);
    int length = code.length();
    if (observed.isEmpty() || observed.get() == length || length < 4 || length > 6) {
      return Optional.empty();
    }
    Optional<String> converted;
    switch (observed.get()) {
      case 4:
        converted = countryCodes.toIso2(code.substring(0, 3)).map(c -> c + lastDigits(code, 2));
        break;
      case 5:
        converted =
            length == 4
                ? Optional.of(code.substring(0, 2) + "0" + lastDigits(code, 2))
                : countryCodes.toIso2(code.substring(0, 3)).map(c -> c + lastDigits(code, 3));
        break;
      case 6:
        converted =
            countryCodes
                .toIso3(code.substring(0, 2))
                .map(c -> c + (length == 4 ? "0" + lastDigits(code, 2) : lastDigits(code, 3)));
        break;
      default:
        converted = Optional.empty();
    }
    return converted.filter(registry::contains).map(c -> Conversion.of(c, SIMPLE));
  }

  private static String lastDigits(String code, int count) {
    return code.substring(code.length() - count);
  }

  private Optional<Conversion> convertWithGrammar(
      String countryIso3, String letters, String digits, CodeGrammar grammar, int level) {
    String countrySegment = letters;
    if (letters.length() > grammar.getCountryLength()) {
      Optional<String> iso2 = countryCodes.toIso2(countryIso3);
      if (iso2.isEmpty()) {
        return Optional.empty();
      }
      countrySegment = iso2.get();
    } else if (letters.length() < grammar.getCountryLength()) {
      countrySegment = countryIso3;
    }
    String candidate = countrySegment + digits;
    if (registry.contains(candidate)) {
      return Optional.of(Conversion.of(candidate, COUNTRY));
    }

    int totalLength = grammar.getTotalLength(level);
    List<String> parts = new ArrayList<>(List.of(countrySegment, digits));
    List<Integer> changedLevels = new ArrayList<>();
    for (int admin = 1; admin <= level; admin++) {
      if (candidate.length() == totalLength) {
        break;
      }
      int expected = grammar.getLength(admin);
      String part = parts.get(admin);
      if (part.length() == expected) {
        break;
      }
      int offset = grammar.getOffset(admin);
      if (part.length() < expected) {
        if (grammar.isZeroPosition(offset)) {
          String padded = "0" + part;
          if (admin < level && !isValidParent(parts, admin, padded, expected)) {
            break;
          }
          parts.set(admin, padded);
          changedLevels.add(admin);
          candidate = String.join("", parts);
        }
        break;
      }
      if (admin == level) {
        if (part.charAt(0) == '0') {
          parts.set(admin, part.substring(1));
          changedLevels.add(admin);
          candidate = String.join("", parts);
        }
        break;
      }
      // The part is too long and holds the digits of lower levels.
      String repaired = null;
      if (candidate.length() < totalLength && expected > 2 && grammar.isZeroPosition(offset)) {
        repaired = "0" + part;
      } else if (candidate.length() > totalLength && expected <= 2 && part.charAt(0) == '0') {
        repaired = part.substring(1);
      }
      if (repaired != null && isValidParent(parts, admin, repaired, expected)) {
        part = repaired;
        changedLevels.add(admin);
      }
      parts.set(admin, part.substring(0, expected));
      parts.add(part.substring(expected));
      candidate = String.join("", parts);
    }
    if (registry.contains(candidate)) {
      return Optional.of(Conversion.of(candidate, ADMINS + COMMA.join(changedLevels)));
    }
    return Optional.empty();
  }

  /** Checks the code prefix up to the given level, if parent codes are known. */
  private boolean isValidParent(List<String> parts, int admin, String part, int expected) {
    if (admin > parentCodes.levels()) {
      return true;
    }
    String prefix =
        String.join("", parts.subList(0, admin))
            + part.substring(0, Math.min(expected, part.length()));
    return parentCodes.contains(admin, prefix);
  }
}
