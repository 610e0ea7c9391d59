/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode;

import static java.util.Comparator.comparing;
import static java.util.Comparator.naturalOrder;
import static java.util.Comparator.nullsFirst;

import com.google.auto.value.AutoValue;
import java.util.Comparator;
import org.checkerframework.checker.nullness.qual.Nullable;

/** An input (or a whole country) for which fuzzy matching was not attempted. */
@AutoValue
public abstract class IgnoredRecord implements Comparable<IgnoredRecord> {
  private static final Comparator<IgnoredRecord> ORDER =
      comparing(IgnoredRecord::getContext)
          .thenComparing(IgnoredRecord::getCountry)
          .thenComparing(IgnoredRecord::getInput, nullsFirst(naturalOrder()));

  public static IgnoredRecord of(String context, String country) {
    return new AutoValue_IgnoredRecord(context, country, null);
  }

  public static IgnoredRecord of(String context, String country, String input) {
    return new AutoValue_IgnoredRecord(context, country, input);
  }

  public abstract String getContext();

  public abstract String getCountry();

  /** The input (or parent code) concerned, or null if the record applies to the whole country. */
  @Nullable
  public abstract String getInput();

  @Override
  public int compareTo(IgnoredRecord other) {
    return ORDER.compare(this, other);
  }
}
