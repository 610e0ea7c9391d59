/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode.metadata;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;

/**
 * The segment structure of p-codes for one country. Segment zero is the country prefix (2 or 3
 * letters) and segment {@code n} holds the digits of admin level {@code n}.
 *
 * <p>A grammar also carries the "zero positions" of the country, which are the character offsets
 * at which any registered code holds a {@code '0'}. These are only known once a registry is
 * available and are attached via {@link #withZeroPositions(Set)}.
 */
@AutoValue
public abstract class CodeGrammar {
  private static final CharMatcher ASCII_DIGITS = CharMatcher.inRange('0', '9');

  /** Creates a grammar from explicit segment lengths, with no zero positions. */
  public static CodeGrammar of(String countryIso3, List<Integer> segmentLengths) {
    checkArgument(!segmentLengths.isEmpty(), "missing country length: %s", countryIso3);
    for (int length : segmentLengths) {
      checkArgument(length > 0, "invalid segment lengths for %s: %s", countryIso3, segmentLengths);
    }
    return new AutoValue_CodeGrammar(
        countryIso3, ImmutableList.copyOf(segmentLengths), ImmutableSet.of());
  }

  /**
   * Parses a grammar from the textual columns of a code length table. Admin lengths are read in
   * level order and parsing stops at the first empty or ambiguous ({@code "2|3"}) value, so the
   * returned grammar covers only the levels before it.
   *
   * @throws IllegalArgumentException if the country length is missing or any length is not a
   *     positive number.
   */
  public static CodeGrammar parse(
      String countryIso3, String countryLength, List<String> adminLengths) {
    ImmutableList.Builder<Integer> lengths = ImmutableList.builder();
    lengths.add(parseLength(countryIso3, countryLength));
    for (String adminLength : adminLengths) {
      String length = adminLength.trim();
      if (length.isEmpty() || length.contains("|")) {
        break;
      }
      lengths.add(parseLength(countryIso3, length));
    }
    return of(countryIso3, lengths.build());
  }

  private static int parseLength(String countryIso3, String length) {
    String s = length.trim();
    checkArgument(
        !s.isEmpty() && ASCII_DIGITS.matchesAllOf(s),
        "invalid code length for %s: '%s'",
        countryIso3,
        length);
    return Integer.parseInt(s);
  }

  /** The ISO 3166-1 alpha-3 code of the country this grammar describes. */
  public abstract String getCountry();

  /** Segment lengths, starting with the country prefix length. */
  public abstract ImmutableList<Integer> getSegmentLengths();

  /** Offsets at which registered codes of this country have a zero digit. */
  public abstract ImmutableSet<Integer> getZeroPositions();

  /** Returns a copy of this grammar with the given zero positions. */
  public CodeGrammar withZeroPositions(Set<Integer> zeroPositions) {
    return new AutoValue_CodeGrammar(
        getCountry(), getSegmentLengths(), ImmutableSet.copyOf(zeroPositions));
  }

  /** Returns whether this grammar describes segments up to and including the given admin level. */
  public boolean covers(int adminLevel) {
    return getSegmentLengths().size() > adminLevel;
  }

  /** Returns the length of the country prefix. */
  public int getCountryLength() {
    return getSegmentLengths().get(0);
  }

  /** Returns the expected length of the given segment (0 being the country prefix). */
  public int getLength(int segment) {
    return getSegmentLengths().get(segment);
  }

  /** Returns the character offset at which the given segment starts. */
  public int getOffset(int segment) {
    int offset = 0;
    for (int i = 0; i < segment; i++) {
      offset += getSegmentLengths().get(i);
    }
    return offset;
  }

  /** Returns the total code length for codes of the given admin level. */
  public int getTotalLength(int adminLevel) {
    return getOffset(adminLevel + 1);
  }

  /** Returns whether registered codes of this country have a zero at the given offset. */
  public boolean isZeroPosition(int offset) {
    return getZeroPositions().contains(offset);
  }
}
