/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode.metadata;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.List;

/**
 * The sets of valid codes at each level above a resolver's admin level. For an admin level
 * {@code n} resolver, this holds the codes for levels {@code 1} to {@code n - 1}, and is used to
 * reject repairs which would produce a non-existent parent prefix.
 */
public final class ParentCodes {
  private static final ParentCodes NONE = new ParentCodes(ImmutableList.of());

  /** Returns an empty instance, for which no prefix checks are made. */
  public static ParentCodes none() {
    return NONE;
  }

  /** Creates parent codes from sets of codes in level order (index 0 is admin level 1). */
  public static ParentCodes of(List<? extends Collection<String>> codesByLevel) {
    if (codesByLevel.isEmpty()) {
      return NONE;
    }
    return new ParentCodes(
        codesByLevel.stream().map(ImmutableSet::copyOf).collect(toImmutableList()));
  }

  /** Creates parent codes from the registries of the parent levels, in level order. */
  public static ParentCodes fromRegistries(List<Registry> registries) {
    return of(registries.stream().map(Registry::getCodes).collect(toImmutableList()));
  }

  private final ImmutableList<ImmutableSet<String>> codesByLevel;

  private ParentCodes(ImmutableList<ImmutableSet<String>> codesByLevel) {
    this.codesByLevel = codesByLevel;
  }

  public boolean isEmpty() {
    return codesByLevel.isEmpty();
  }

  /** Returns the number of parent levels available. */
  public int levels() {
    return codesByLevel.size();
  }

  /** Returns whether the given code is a valid code of the given admin level (1-based). */
  public boolean contains(int adminLevel, String code) {
    checkElementIndex(adminLevel - 1, codesByLevel.size(), "admin level");
    return codesByLevel.get(adminLevel - 1).contains(code);
  }
}
