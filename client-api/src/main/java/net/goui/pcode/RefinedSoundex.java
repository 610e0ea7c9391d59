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
import org.apache.commons.text.similarity.LevenshteinDistance;

/**
 * Refined Soundex phonetic encoding, and the edit distance between encodings.
 *
 * <p>An encoding is the first letter of the word followed by the digit class of every letter
 * (including the first) with adjacent repeats squeezed. 'H' and 'W' carry no class and are
 * skipped entirely, so they do not separate repeats.
 */
final class RefinedSoundex {
  // Classes for 'A' to 'Z' ('-' is skipped).
  private static final String CLASSES = "0136024-04378801593602-505";

  private static final CharMatcher UPPER_CASE_LETTERS = CharMatcher.inRange('A', 'Z');
  private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

  /** Returns the encoding of a word, or the empty string if it has no ASCII letters. */
  static String encode(String word) {
    String letters = UPPER_CASE_LETTERS.retainFrom(Ascii.toUpperCase(word));
    if (letters.isEmpty()) {
      return "";
    }
    StringBuilder out = new StringBuilder(letters.length() + 1).append(letters.charAt(0));
    char last = 0;
    for (int i = 0; i < letters.length(); i++) {
      char c = CLASSES.charAt(letters.charAt(i) - 'A');
      if (c != '-' && c != last) {
        out.append(c);
        last = c;
      }
    }
    return out.toString();
  }

  /** Returns the Levenshtein distance between the encodings of two words. */
  static int distance(String first, String second) {
    return LEVENSHTEIN.apply(encode(first), encode(second));
  }

  private RefinedSoundex() {}
}
