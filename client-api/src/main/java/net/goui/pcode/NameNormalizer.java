/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UCharacterCategory;
import com.ibm.icu.text.Normalizer2;
import java.util.Comparator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonical normalization of administrative area names for comparison.
 *
 * <p>Names are decomposed (NFD) and stripped of combining marks, so "Tillabéri" becomes
 * "tillaberi". Whitespace and '/' become spaces, everything else outside printable ASCII is
 * dropped, and the result is lower-cased with runs of spaces collapsed and trimmed. Normalization
 * is idempotent.
 */
public final class NameNormalizer {
  private static final Normalizer2 NFD = Normalizer2.getNFDInstance();
  private static final CharMatcher SEPARATORS = CharMatcher.anyOf("\t\n\u000B\f\r /");
  private static final CharMatcher PRINTABLE_ASCII = CharMatcher.inRange(' ', '~');
  private static final CharMatcher SPACE = CharMatcher.is(' ');

  /** Returns the normalized form of the given name. */
  public static String normalize(String name) {
    String decomposed = NFD.normalize(name);
    StringBuilder out = new StringBuilder(decomposed.length());
    decomposed
        .codePoints()
        .filter(cp -> UCharacter.getType(cp) != UCharacterCategory.NON_SPACING_MARK)
        .forEach(
            cp -> {
              if (cp < 0x80 && SEPARATORS.matches((char) cp)) {
                out.append(' ');
              } else if (cp < 0x80 && PRINTABLE_ASCII.matches((char) cp)) {
                out.append(Ascii.toLowerCase((char) cp));
              }
            });
    return SPACE.trimAndCollapseFrom(out, ' ');
  }

  /**
   * Applies all replacements to the text simultaneously. Where several keys match at the same
   * position, the longest key is used, and replaced text is never matched again. Keys are matched
   * literally.
   */
  public static String applyReplacements(String text, Map<String, String> replacements) {
    String alternation =
        replacements.keySet().stream()
            .filter(k -> !k.isEmpty())
            .sorted(Comparator.<String>comparingInt(String::length).reversed())
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
    if (alternation.isEmpty() || text.isEmpty()) {
      return text;
    }
    return Pattern.compile(alternation)
        .matcher(text)
        .replaceAll(m -> Matcher.quoteReplacement(replacements.get(m.group())));
  }

  private NameNormalizer() {}
}
