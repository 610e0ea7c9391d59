/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Map;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Approximate matching of a normalized name against an ordered map of registered names. Matching
 * is attempted by substring containment and then by phonetic distance, stopping at the first
 * successful stage.
 *
 * <p>Candidates are always visited in map order, so earlier registered names win ties.
 */
final class FuzzyNameMatcher {
  static final String SUBSTRING = "substring";
  static final String FUZZY = "fuzzy";

  /** A code found by approximate matching, and the method by which it was found. */
  @AutoValue
  abstract static class FuzzyMatch {
    static FuzzyMatch of(String code, String method) {
      return new AutoValue_FuzzyNameMatcher_FuzzyMatch(code, method);
    }

    abstract String code();

    abstract String method();
  }

  private final ImmutableList<NameTransform> transforms;
  private final int maxDistance;

  FuzzyNameMatcher(ImmutableList<NameTransform> transforms, int maxDistance) {
    checkArgument(maxDistance >= 0, "invalid maximum distance: %s", maxDistance);
    this.transforms = transforms;
    this.maxDistance = maxDistance;
  }

  /**
   * Matches the primary normalized name (and if different, its secondary form) against the given
   * normalized name to code map.
   */
  Optional<FuzzyMatch> match(Map<String, String> names, String primary, String secondary) {
    Optional<String> code = findContaining(names, primary);
    if (code.isEmpty() && !secondary.equals(primary)) {
      code = findContaining(names, secondary);
    }
    if (code.isPresent()) {
      return code.map(c -> FuzzyMatch.of(c, SUBSTRING));
    }
    return findPhonetic(names, primary, secondary).map(c -> FuzzyMatch.of(c, FUZZY));
  }

  private static Optional<String> findContaining(Map<String, String> names, String name) {
    if (name.isEmpty()) {
      return Optional.empty();
    }
    return names.entrySet().stream()
        .filter(e -> e.getKey().contains(name))
        .map(Map.Entry::getValue)
        .findFirst();
  }

  Optional<String> findPhonetic(Map<String, String> names, String primary, String secondary) {
    String bestCode = null;
    int bestDistance = Integer.MAX_VALUE;
    for (Map.Entry<String, String> e : names.entrySet()) {
      int distance = distance(e.getKey(), primary, secondary);
      for (NameTransform transform : transforms) {
        @Nullable String transformed = transform.apply(e.getKey());
        if (transformed != null) {
          distance = Math.min(distance, distance(transformed, primary, secondary));
        }
      }
      // Strict comparison keeps the earliest candidate at the minimum distance.
      if (distance < bestDistance) {
        bestDistance = distance;
        bestCode = e.getValue();
      }
    }
    return bestDistance <= maxDistance ? Optional.ofNullable(bestCode) : Optional.empty();
  }

  private static int distance(String candidate, String primary, String secondary) {
    int distance = RefinedSoundex.distance(primary, candidate);
    if (!secondary.equals(primary)) {
      distance = Math.min(distance, RefinedSoundex.distance(secondary, candidate));
    }
    return distance;
  }
}
