/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode;

import com.google.common.collect.ImmutableList;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Accumulates diagnostic records produced during resolution. Identical records are held once and
 * records are returned in sorted order. Instances are thread safe.
 */
public final class Diagnostics {
  private final NavigableSet<MatchRecord> matches = new TreeSet<>();
  private final NavigableSet<IgnoredRecord> ignored = new TreeSet<>();
  private final NavigableSet<ErrorRecord> errors = new TreeSet<>();

  synchronized void addMatch(MatchRecord record) {
    matches.add(record);
  }

  synchronized void addIgnored(IgnoredRecord record) {
    ignored.add(record);
  }

  synchronized void addError(ErrorRecord record) {
    errors.add(record);
  }

  /** Returns and removes all match records. */
  public synchronized ImmutableList<MatchRecord> drainMatches() {
    return drain(matches);
  }

  /** Returns and removes all ignored records. */
  public synchronized ImmutableList<IgnoredRecord> drainIgnored() {
    return drain(ignored);
  }

  /** Returns and removes all error records. */
  public synchronized ImmutableList<ErrorRecord> drainErrors() {
    return drain(errors);
  }

  /** Returns whether no records of any kind are held. */
  public synchronized boolean isEmpty() {
    return matches.isEmpty() && ignored.isEmpty() && errors.isEmpty();
  }

  /** Discards all records. */
  public synchronized void reset() {
    matches.clear();
    ignored.clear();
    errors.clear();
  }

  private static <T> ImmutableList<T> drain(NavigableSet<T> records) {
    ImmutableList<T> snapshot = ImmutableList.copyOf(records);
    records.clear();
    return snapshot;
  }
}
