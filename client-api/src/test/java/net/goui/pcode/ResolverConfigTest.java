/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ResolverConfigTest {
  @Test
  public void testDefaults() {
    ResolverConfig config = ResolverConfig.defaults();
    assertThat(config.getFuzzyCountries().isPresent()).isFalse();
    assertThat(config.isFuzzyCountry("ZWE")).isTrue();
    assertThat(config.getMinFuzzyLength()).isEqualTo(4);
    assertThat(config.getMaxPhoneticDistance()).isEqualTo(2);
    assertThat(config.getNameTransforms()).hasSize(2);
  }

  @Test
  public void testFuzzyLists() {
    ResolverConfig config =
        ResolverConfig.builder()
            .setFuzzyCountries(ImmutableSet.of("YEM"))
            .setFuzzyDenyList(ImmutableSet.of("Nord"))
            .build();
    assertThat(config.isFuzzyCountry("YEM")).isTrue();
    assertThat(config.isFuzzyCountry("ZWE")).isFalse();
    assertThat(config.getFuzzyDenyList()).containsExactly("nord");
    assertThat(config.isFuzzyDenied("NORD")).isTrue();
    assertThat(config.isFuzzyDenied("nord-ouest")).isFalse();
  }

  @Test
  public void testScopedReplacements() {
    ImmutableMap<String, String> replacements =
        ImmutableMap.of(" city", "", "COD|ville", "city", "CD20|-", " ");
    assertThat(PcodeResolver.selectReplacements(replacements, "COD", null))
        .containsExactly(" city", "", "ville", "city");
    assertThat(PcodeResolver.selectReplacements(replacements, "COD", "CD20"))
        .containsExactly(" city", "", "ville", "city", "-", " ");
    assertThat(PcodeResolver.selectReplacements(replacements, "MWI", "CD20"))
        .containsExactly(" city", "", "-", " ");
  }

  @Test
  public void testErrors() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ResolverConfig.builder().setMinFuzzyLength(-1).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> ResolverConfig.builder().setAdminLevelOverrides(ImmutableMap.of("YEM", 0)).build());
  }
}
