/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode.loader;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TableLoaderTest {
  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testResource() throws IOException {
    CsvTable table = TableLoader.create().load("pcode_lengths.csv");
    assertThat(table.getHeader())
        .containsExactly(
            "Location", "Country Length", "Admin1 Length", "Admin2 Length", "Admin3 Length")
        .inOrder();
    assertThat(table.getRows().get(0))
        .containsExactly(
            "Location", "YEM",
            "Country Length", "2",
            "Admin1 Length", "2",
            "Admin2 Length", "2",
            "Admin3 Length", "2");
    // A leading '/' is optional for resources.
    assertThat(TableLoader.create().load("/pcode_lengths.csv")).isEqualTo(table);
  }

  @Test
  public void testFile() throws IOException {
    File file = tmp.newFile("codes.tsv");
    Files.writeString(file.toPath(), "iso3\tpcode\tname\nYEM \t YE30\tAd Dali\n", UTF_8);

    CsvTable table = new TableLoader("", '\t').load(file.getPath());
    assertThat(table.getRows())
        .containsExactly(ImmutableMap.of("iso3", "YEM", "pcode", "YE30", "name", "Ad Dali"));
  }

  @Test
  public void testOverlayDirectory() throws IOException {
    File overlay = tmp.newFolder("overlay");
    Files.writeString(
        overlay.toPath().resolve("pcode_lengths.csv"), "Location,Country Length\nYEM,2\n", UTF_8);

    CsvTable table = new TableLoader(overlay.getPath(), ',').load("pcode_lengths.csv");
    assertThat(table.getHeader()).containsExactly("Location", "Country Length").inOrder();
    // Tables not in the overlay directory are still found.
    assertThat(new TableLoader(overlay.getPath(), ',').load("admin2.csv").getRows()).isNotEmpty();
  }

  @Test
  public void testMissing() {
    assertThrows(
        FileNotFoundException.class, () -> TableLoader.create().load("no_such_table.csv"));
  }
}
