/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode.metadata;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;

/**
 * Conversion between ISO 3166-1 alpha-2 and alpha-3 country codes. Unknown codes yield empty
 * results. Lookups are case-insensitive.
 */
public interface CountryCodes {
  /** Returns the alpha-2 code for an alpha-3 code (e.g. "YEM" to "YE"). */
  Optional<String> toIso2(String iso3);

  /** Returns the alpha-3 code for an alpha-2 code (e.g. "YE" to "YEM"). */
  Optional<String> toIso3(String iso2);

  /** Returns the default implementation, backed by ICU locale data. */
  static CountryCodes icu() {
    return IcuCountryCodes.INSTANCE;
  }

  /** Returns an implementation over an explicit alpha-3 to alpha-2 mapping. */
  static CountryCodes fromMap(Map<String, String> iso3ToIso2) {
    return new MapCountryCodes(ImmutableMap.copyOf(iso3ToIso2));
  }
}
