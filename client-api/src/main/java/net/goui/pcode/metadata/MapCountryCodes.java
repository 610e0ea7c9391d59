/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode.metadata;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

final class MapCountryCodes implements CountryCodes {
  private final ImmutableMap<String, String> iso3ToIso2;
  private final ImmutableMap<String, String> iso2ToIso3;

  MapCountryCodes(ImmutableMap<String, String> iso3ToIso2) {
    Map<String, String> upper = new LinkedHashMap<>();
    Map<String, String> inverse = new LinkedHashMap<>();
    iso3ToIso2.forEach(
        (iso3, iso2) -> {
          String u3 = Ascii.toUpperCase(iso3);
          String u2 = Ascii.toUpperCase(iso2);
          upper.putIfAbsent(u3, u2);
          // Withdrawn codes can share an alpha-2 code, so keep the first (current) one.
          inverse.putIfAbsent(u2, u3);
        });
    this.iso3ToIso2 = ImmutableMap.copyOf(upper);
    this.iso2ToIso3 = ImmutableMap.copyOf(inverse);
  }

  @Override
  public Optional<String> toIso2(String iso3) {
    return Optional.ofNullable(iso3ToIso2.get(Ascii.toUpperCase(iso3)));
  }

  @Override
  public Optional<String> toIso3(String iso2) {
    return Optional.ofNullable(iso2ToIso3.get(Ascii.toUpperCase(iso2)));
  }
}
