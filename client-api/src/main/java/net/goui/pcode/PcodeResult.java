/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/**
 * The result of resolving an input to a registered p-code. A result is "exact" if the input
 * identified the code without approximate name matching (even if the code was repaired from a
 * differently formatted p-code). An empty code with {@code isExact() == true} means no approximate
 * matching was attempted.
 */
@AutoValue
public abstract class PcodeResult {
  static PcodeResult of(Optional<String> code, boolean exact) {
    return new AutoValue_PcodeResult(code, exact);
  }

  static PcodeResult exact(String code) {
    return of(Optional.of(code), true);
  }

  static PcodeResult none(boolean exact) {
    return of(Optional.empty(), exact);
  }

  /** Returns the resolved code, if any. */
  public abstract Optional<String> getCode();

  /** Returns whether the result was found without approximate name matching. */
  public abstract boolean isExact();
}
