/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode.loader;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.io.StringReader;
import net.goui.pcode.metadata.ParentCodes;
import net.goui.pcode.metadata.Registry;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RegistryLoaderTest {
  private final RegistryLoader loader = new RegistryLoader(TableLoader.create());

  @Test
  public void testLoadAdminOne() throws IOException {
    Registry registry = loader.load("admin1.csv");
    assertThat(registry.getCountries())
        .containsAtLeast("YEM", "NGA", "NER", "UKR", "SOM", "DZA", "COL", "AFG", "COD", "MWI");
    assertThat(registry.lookupExact("CO11")).hasValue("Bogotá, D.C.");
    assertThat(registry.lookupByCountryName("NER", "tillaberi")).hasValue("NER006");
    assertThat(registry.getCodeLength("NER")).hasValue(6);
    assertThat(registry.usesParents()).isFalse();
  }

  @Test
  public void testLoadAdminTwo_withParents() throws IOException {
    Registry registry = loader.load("admin2.csv");
    assertThat(registry.usesParents()).isTrue();
    assertThat(registry.getParent("YE3001")).hasValue("YE30");
    assertThat(registry.lookupByParentName("AFG", "AF02", "kabul")).hasValue("AF0201");
    // The first code registered for a name wins at the country level.
    assertThat(registry.lookupByCountryName("AFG", "kabul")).hasValue("AF0101");
  }

  @Test
  public void testLoad_filteredCountries() throws IOException {
    Registry registry = loader.load("admin1.csv", ImmutableSet.of("YEM", "NGA"));
    assertThat(registry.getCountries()).containsExactly("YEM", "NGA").inOrder();
    assertThat(registry.contains("NER004")).isFalse();
  }

  @Test
  public void testLoad_lowerCaseCountries() throws IOException {
    Registry registry = loader.load("admin1.csv", ImmutableSet.of("yem"));
    assertThat(registry.getCountries()).containsExactly("YEM");
    assertThat(registry.getCodes()).hasSize(22);
  }

  @Test
  public void testLoadParentCodes() throws IOException {
    ParentCodes parents = loader.loadParentCodes(ImmutableList.of("admin1.csv"), null);
    assertThat(parents.levels()).isEqualTo(1);
    assertThat(parents.contains(1, "NG015")).isTrue();
    assertThat(parents.contains(1, "NG15")).isFalse();
  }

  @Test
  public void testFromTable_skipsRowsWithoutCode() throws IOException {
    CsvTable table =
        CsvTable.importCsv(new StringReader("iso3,pcode,name\nYEM,YE30,Ad Dali\nYEM,,Unknown\n"));
    Registry registry = RegistryLoader.fromTable(table, "test", null);
    assertThat(registry.getCodes()).containsExactly("YE30");
  }

  @Test
  public void testFromTable_badData() throws IOException {
    CsvTable noCodes = CsvTable.importCsv(new StringReader("iso3,name\nYEM,X\n"));
    assertThrows(
        IllegalArgumentException.class, () -> RegistryLoader.fromTable(noCodes, "test", null));

    CsvTable empty = CsvTable.importCsv(new StringReader("iso3,pcode,name\n"));
    assertThrows(IllegalStateException.class, () -> RegistryLoader.fromTable(empty, "test", null));
  }
}
