/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode;

import static com.google.common.truth.Truth8.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.goui.pcode.LengthConverter.Conversion;
import net.goui.pcode.metadata.CodeGrammar;
import net.goui.pcode.metadata.CountryCodes;
import net.goui.pcode.metadata.ParentCodes;
import net.goui.pcode.metadata.Registry;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LengthConverterTest {
  private static final CountryCodes COUNTRY_CODES =
      CountryCodes.fromMap(
          ImmutableMap.of(
              "YEM", "YE", "NGA", "NG", "NER", "NE", "DZA", "DZ", "COL", "CO", "MWI", "MW"));

  private static final ImmutableList<CodeGrammar> GRAMMARS =
      ImmutableList.of(
          CodeGrammar.of("YEM", ImmutableList.of(2, 2, 2, 2)),
          CodeGrammar.of("NGA", ImmutableList.of(2, 3, 3)),
          CodeGrammar.of("NER", ImmutableList.of(3, 3, 3, 3)),
          CodeGrammar.of("DZA", ImmutableList.of(2, 3, 3)),
          CodeGrammar.of("COL", ImmutableList.of(2, 2, 3)),
          CodeGrammar.of("MWI", ImmutableList.of(2, 1, 2)),
          CodeGrammar.of("PHL", ImmutableList.of(2)));

  private static final Registry ADMIN1 =
      Registry.builder()
          .register("YEM", "YE11", "Ibb")
          .register("YEM", "YE30", "Ad Dali")
          .register("NGA", "NG001", "Abia")
          .register("NGA", "NG015", "Federal Capital Territory")
          .register("NGA", "NG036", "Yobe")
          .register("NER", "NER001", "Agadez")
          .register("NER", "NER004", "Maradi")
          .register("NER", "NER008", "Niamey")
          .register("DZA", "DZ001", "Adrar")
          .register("DZA", "DZ009", "Blida")
          .register("COL", "CO05", "Antioquia")
          .register("COL", "CO08", "Atlántico")
          .register("COL", "CO11", "Bogotá, D.C.")
          .register("MWI", "MW3", "Southern")
          .build();

  private static final Registry ADMIN2 =
      Registry.builder()
          .register("YEM", "YE1101", "Al Qafr", "YE11")
          .register("YEM", "YE1102", "Yarim", "YE11")
          .register("YEM", "YE3001", "Damt", "YE30")
          .register("YEM", "YE3002", "Qatabah", "YE30")
          .register("YEM", "YE3003", "Ash Shuayb", "YE30")
          .register("NGA", "NG001001", "Aba North", "NG001")
          .register("NGA", "NG001002", "Aba South", "NG001")
          .register("NGA", "NG015001", "Abaji", "NG015")
          .register("NGA", "NG015002", "Abuja Municipal", "NG015")
          .register("NGA", "NG036014", "Nguru", "NG036")
          .register("NER", "NER001001", "Aderbissinat", "NER001")
          .register("NER", "NER004001", "Aguie", "NER004")
          .register("NER", "NER004009", "Tessaoua", "NER004")
          .register("NER", "NER008001", "Niamey 1", "NER008")
          .register("DZA", "DZ001001", "Adrar", "DZ001")
          .register("DZA", "DZ009009", "Bouinan", "DZ009")
          .register("COL", "CO05001", "Medellín", "CO05")
          .register("COL", "CO08849", "Usiacurí", "CO08")
          .register("COL", "CO11001", "Bogotá, D.C.", "CO11")
          .register("MWI", "MW305", "Blantyre", "MW3")
          .register("MWI", "MW306", "Chikwawa", "MW3")
          .build();

  @Test
  public void testSimpleHeuristic() {
    LengthConverter converter = admin1Converter(ImmutableList.of());

    assertConverted(converter, "YEM", "YEM30", "YE30", "pcode length conversion");
    assertConverted(converter, "YEM", "YEM030", "YE30", "pcode length conversion");
    assertConverted(converter, "NGA", "NG15", "NG015", "pcode length conversion");
    assertConverted(converter, "NGA", "NGA015", "NG015", "pcode length conversion");
    assertConverted(converter, "NER", "NE04", "NER004", "pcode length conversion");
    assertConverted(converter, "NER", "NE004", "NER004", "pcode length conversion");

    // Same length as registered codes, too short or no registered codes.
    assertThat(converter.convert("YEM", "YE99")).isEmpty();
    assertThat(converter.convert("NER", "NE4")).isEmpty();
    assertThat(converter.convert("ABC", "NE004")).isEmpty();
    // Not code shaped.
    assertThat(converter.convert("YEM", "YEME123")).isEmpty();
    assertThat(converter.convert("YEM", "Ad Dali")).isEmpty();
  }

  @Test
  public void testGrammar_admin1() {
    LengthConverter converter = admin1Converter(GRAMMARS);

    assertConverted(converter, "NER", "NE04", "NER004", "pcode length conversion-admins 1");
    assertConverted(converter, "NER", "NE004", "NER004", "pcode length conversion-country");
    assertConverted(converter, "NGA", "NG15", "NG015", "pcode length conversion-admins 1");
    assertConverted(converter, "NGA", "NGA015", "NG015", "pcode length conversion-country");
    assertConverted(converter, "YEM", "YEM30", "YE30", "pcode length conversion-country");
    assertConverted(converter, "YEM", "YEM030", "YE30", "pcode length conversion-admins 1");
    assertConverted(converter, "COL", "CO8", "CO08", "pcode length conversion-admins 1");
    assertConverted(converter, "MWI", "MWI3", "MW3", "pcode length conversion-country");
    assertConverted(converter, "MWI", "MW03", "MW3", "pcode length conversion-admins 1");
  }

  @Test
  public void testGrammar_notCoveringLevel() {
    // The PHL grammar has no admin 1 length, and there are no PHL codes for the heuristic.
    LengthConverter converter = admin1Converter(GRAMMARS);
    assertThat(converter.convert("PHL", "PH01")).isEmpty();
  }

  @Test
  public void testGrammar_admin2() {
    LengthConverter converter = admin2Converter(ParentCodes.none());

    assertConverted(converter, "YEM", "YEM3001", "YE3001", "pcode length conversion-country");
    assertConverted(converter, "YEM", "YEM03001", "YE3001", "pcode length conversion-admins 1");
    assertConverted(converter, "YEM", "YE301", "YE3001", "pcode length conversion-admins 2");
    assertConverted(converter, "YEM", "YEM30001", "YE3001", "pcode length conversion-admins 2");
    assertConverted(
        converter, "YEM", "YEM030001", "YE3001", "pcode length conversion-admins 1,2");
    assertConverted(converter, "NGA", "NG15001", "NG015001", "pcode length conversion-admins 1");
    assertConverted(converter, "NGA", "NGA015001", "NG015001", "pcode length conversion-country");
    assertConverted(converter, "NGA", "NG1501", "NG015001", "pcode length conversion-admins 1,2");
    assertConverted(converter, "NGA", "NG3614", "NG036014", "pcode length conversion-admins 1,2");
    assertConverted(converter, "NER", "NE04009", "NER004009", "pcode length conversion-admins 1");
    assertConverted(converter, "DZA", "DZ0090009", "DZ009009", "pcode length conversion-admins 2");
    assertConverted(converter, "MWI", "MW0305", "MW305", "pcode length conversion-admins 1");
    assertConverted(converter, "MWI", "MWI305", "MW305", "pcode length conversion-country");

    // At most one zero is repaired per level.
    assertThat(converter.convert("NGA", "NG01501")).isEmpty();
    assertThat(converter.convert("NGA", "NG0151")).isEmpty();
    assertThat(converter.convert("NGA", "NG151")).isEmpty();
    // Without parent codes, the wrong zero is repaired for these.
    assertThat(converter.convert("NER", "NE00409")).isEmpty();
    assertThat(converter.convert("COL", "CO080849")).isEmpty();
  }

  @Test
  public void testGrammar_admin2WithParentCodes() {
    LengthConverter converter =
        admin2Converter(ParentCodes.of(ImmutableList.of(ADMIN1.getCodes())));

    assertConverted(converter, "NER", "NE00409", "NER004009", "pcode length conversion-admins 2");
    assertConverted(converter, "COL", "CO080849", "CO08849", "pcode length conversion-admins 2");
    // Unaffected by parent codes.
    assertConverted(
        converter, "YEM", "YEM030001", "YE3001", "pcode length conversion-admins 1,2");
    assertConverted(converter, "NGA", "NG1501", "NG015001", "pcode length conversion-admins 1,2");
    assertConverted(converter, "MWI", "MW0305", "MW305", "pcode length conversion-admins 1");
    assertThat(converter.convert("NGA", "NG01501")).isEmpty();
  }

  @Test
  public void testNoGrammar_admin2() {
    LengthConverter converter =
        PcodeResolver.builder(ADMIN2)
            .setAdminLevel(2)
            .setCountryCodes(COUNTRY_CODES)
            .build()
            .getLengthConverter();
    assertThat(converter.convert("YEM", "YE03001")).isEmpty();
  }

  @Test
  public void testAdminLevelOverride() {
    // An admin 1 resolver, but Yemen is registered at admin 2.
    Registry mixed =
        Registry.builder()
            .register("NGA", "NG015", "Federal Capital Territory")
            .register("YEM", "YE3001", "Damt")
            .build();
    LengthConverter converter =
        PcodeResolver.builder(mixed)
            .setConfig(
                ResolverConfig.builder().setAdminLevelOverrides(ImmutableMap.of("YEM", 2)).build())
            .addGrammars(GRAMMARS)
            .setCountryCodes(COUNTRY_CODES)
            .build()
            .getLengthConverter();

    assertConverted(converter, "YEM", "YE301", "YE3001", "pcode length conversion-admins 2");
    assertConverted(converter, "NGA", "NG15", "NG015", "pcode length conversion-admins 1");
  }

  private static LengthConverter admin1Converter(ImmutableList<CodeGrammar> grammars) {
    return PcodeResolver.builder(ADMIN1)
        .addGrammars(grammars)
        .setCountryCodes(COUNTRY_CODES)
        .build()
        .getLengthConverter();
  }

  private static LengthConverter admin2Converter(ParentCodes parentCodes) {
    return PcodeResolver.builder(ADMIN2)
        .setAdminLevel(2)
        .addGrammars(GRAMMARS)
        .setParentCodes(parentCodes)
        .setCountryCodes(COUNTRY_CODES)
        .build()
        .getLengthConverter();
  }

  private static void assertConverted(
      LengthConverter converter, String country, String input, String code, String method) {
    assertThat(converter.convert(country, input)).hasValue(Conversion.of(code, method));
  }
}
