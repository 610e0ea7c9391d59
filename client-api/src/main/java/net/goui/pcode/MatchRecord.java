/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode;

import static java.util.Comparator.comparing;

import com.google.auto.value.AutoValue;
import java.util.Comparator;

/** A diagnostic record of an input resolved by length conversion or approximate matching. */
@AutoValue
public abstract class MatchRecord implements Comparable<MatchRecord> {
  private static final Comparator<MatchRecord> ORDER =
      comparing(MatchRecord::getContext)
          .thenComparing(MatchRecord::getCountry)
          .thenComparing(MatchRecord::getInput)
          .thenComparing(MatchRecord::getName)
          .thenComparing(MatchRecord::getMethod)
          .thenComparing(MatchRecord::getCode);

  public static MatchRecord of(
      String context, String country, String input, String name, String code, String method) {
    return new AutoValue_MatchRecord(context, country, input, name, code, method);
  }

  /** Identifies the caller, e.g. the data source being processed. */
  public abstract String getContext();

  public abstract String getCountry();

  /** The input which was matched (upper-cased for code input). */
  public abstract String getInput();

  /** The display name of the matched code. */
  public abstract String getName();

  public abstract String getCode();

  /** How the match was made, e.g. "fuzzy" or "pcode length conversion-country". */
  public abstract String getMethod();

  @Override
  public int compareTo(MatchRecord other) {
    return ORDER.compare(this, other);
  }
}
