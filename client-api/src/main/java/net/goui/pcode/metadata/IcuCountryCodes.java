/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode.metadata;

import com.google.common.collect.ImmutableMap;
import com.ibm.icu.util.ULocale;

/** Country code conversion using the ISO 3166 data bundled with ICU. */
final class IcuCountryCodes {
  static final CountryCodes INSTANCE = new MapCountryCodes(loadIso3ToIso2());

  private static ImmutableMap<String, String> loadIso3ToIso2() {
    ImmutableMap.Builder<String, String> map = ImmutableMap.builder();
    for (String iso2 : ULocale.getISOCountries()) {
      String iso3 = new ULocale("", iso2).getISO3Country();
      if (!iso3.isEmpty()) {
        map.put(iso3, iso2);
      }
    }
    return map.buildKeepingLast();
  }

  private IcuCountryCodes() {}
}
