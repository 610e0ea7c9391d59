/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An alternative spelling of a registered (normalized) name, tried during phonetic matching in
 * addition to the name itself.
 */
@FunctionalInterface
public interface NameTransform {
  /** Returns the transformed name, or null if this transform does not apply to the name. */
  @Nullable
  String apply(String normalizedName);

  /** Returns a transform which replaces a leading prefix, if present. */
  static NameTransform replacePrefix(String prefix, String replacement) {
    return name -> name.startsWith(prefix) ? replacement + name.substring(prefix.length()) : null;
  }

  /**
   * Transforms for Arabic article variants. Registered names such as "Al Dali" are also tried as
   * "Ad Dali" and "Dali".
   */
  ImmutableList<NameTransform> ARTICLE_VARIANTS =
      ImmutableList.of(replacePrefix("al ", "ad "), replacePrefix("al ", ""));

  /** The default transforms ({@link #ARTICLE_VARIANTS}). */
  static ImmutableList<NameTransform> defaults() {
    return ARTICLE_VARIANTS;
  }
}
