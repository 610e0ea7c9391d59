/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RefinedSoundexTest {
  @Test
  public void testEncode() {
    assertThat(RefinedSoundex.encode("Braz")).isEqualTo("B1905");
    assertThat(RefinedSoundex.encode("Tymczak")).isEqualTo("T6083503");
    assertThat(RefinedSoundex.encode("sanaa")).isEqualTo("S3080");
    // Punctuation and spaces are ignored.
    assertThat(RefinedSoundex.encode("sana'a")).isEqualTo("S3080");
    assertThat(RefinedSoundex.encode("ad dali")).isEqualTo("A06070");
  }

  @Test
  public void testEncode_silentLetters() {
    // 'H' is skipped without breaking the run of repeated classes.
    assertThat(RefinedSoundex.encode("Rhys")).isEqualTo("R903");
    assertThat(RefinedSoundex.encode("hello")).isEqualTo("H070");
  }

  @Test
  public void testEncode_noLetters() {
    assertThat(RefinedSoundex.encode("")).isEmpty();
    assertThat(RefinedSoundex.encode("123 '")).isEmpty();
  }

  @Test
  public void testDistance() {
    assertThat(RefinedSoundex.distance("blidda", "blida")).isEqualTo(0);
    assertThat(RefinedSoundex.distance("al dali", "ad dali")).isEqualTo(1);
    assertThat(RefinedSoundex.distance("abcdefgh", "ad dali")).isGreaterThan(2);
  }
}
