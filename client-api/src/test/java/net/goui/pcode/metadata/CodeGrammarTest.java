/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode.metadata;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CodeGrammarTest {
  @Test
  public void testParse() {
    CodeGrammar grammar = CodeGrammar.parse("NGA", "2", ImmutableList.of("3", "3", ""));
    assertThat(grammar.getCountry()).isEqualTo("NGA");
    assertThat(grammar.getSegmentLengths()).containsExactly(2, 3, 3).inOrder();
    assertThat(grammar.covers(2)).isTrue();
    assertThat(grammar.covers(3)).isFalse();
    assertThat(grammar.getZeroPositions()).isEmpty();
  }

  @Test
  public void testParse_stopsAtAmbiguousLength() {
    CodeGrammar grammar = CodeGrammar.parse("PHL", "2", ImmutableList.of("2|3", "3"));
    assertThat(grammar.getSegmentLengths()).containsExactly(2);
    assertThat(grammar.covers(1)).isFalse();
  }

  @Test
  public void testParse_errors() {
    assertThrows(
        IllegalArgumentException.class, () -> CodeGrammar.parse("NGA", "", ImmutableList.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> CodeGrammar.parse("NGA", "2", ImmutableList.of("x")));
    assertThrows(
        IllegalArgumentException.class,
        () -> CodeGrammar.parse("NGA", "0", ImmutableList.of("3")));
  }

  @Test
  public void testOffsets() {
    CodeGrammar grammar = CodeGrammar.of("NER", ImmutableList.of(3, 3, 3, 3));
    assertThat(grammar.getCountryLength()).isEqualTo(3);
    assertThat(grammar.getOffset(0)).isEqualTo(0);
    assertThat(grammar.getOffset(2)).isEqualTo(6);
    assertThat(grammar.getTotalLength(1)).isEqualTo(6);
    assertThat(grammar.getTotalLength(3)).isEqualTo(12);
  }

  @Test
  public void testZeroPositions() {
    CodeGrammar grammar =
        CodeGrammar.of("YEM", ImmutableList.of(2, 2, 2)).withZeroPositions(ImmutableSet.of(3, 4));
    assertThat(grammar.isZeroPosition(4)).isTrue();
    assertThat(grammar.isZeroPosition(2)).isFalse();
    assertThat(grammar.getSegmentLengths()).containsExactly(2, 2, 2).inOrder();
  }
}
