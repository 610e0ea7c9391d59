/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode.loader;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import net.goui.pcode.metadata.CodeGrammar;

/**
 * Loads per-country p-code grammars from a code lengths table. The table has the columns {@code
 * Location} (ISO3 country code), {@code Country Length} and {@code Admin1 Length}, {@code Admin2
 * Length} and so on.
 */
public final class GrammarLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String LOCATION = "Location";
  static final String COUNTRY_LENGTH = "Country Length";

  private final TableLoader tableLoader;

  public GrammarLoader(TableLoader tableLoader) {
    this.tableLoader = tableLoader;
  }

  public ImmutableList<CodeGrammar> load(String path) throws IOException {
    ImmutableList<CodeGrammar> grammars = fromTable(tableLoader.load(path), path);
    logger.atInfo().log("Loaded %d code grammars from: %s", grammars.size(), path);
    return grammars;
  }

  /**
   * Parses grammars from a loaded table. Rows without a location are skipped.
   *
   * @throws IllegalArgumentException if a required column is missing or a row has a missing or
   *     invalid country length.
   */
  public static ImmutableList<CodeGrammar> fromTable(CsvTable table, String source) {
    table.checkColumns(source, LOCATION, COUNTRY_LENGTH);
    List<String> adminColumns = new ArrayList<>();
    for (int level = 1; table.hasColumn(adminColumn(level)); level++) {
      adminColumns.add(adminColumn(level));
    }
    ImmutableList.Builder<CodeGrammar> grammars = ImmutableList.builder();
    for (ImmutableMap<String, String> row : table.getRows()) {
      String country = row.get(LOCATION);
      if (country.isEmpty()) {
        continue;
      }
      List<String> adminLengths = new ArrayList<>();
      adminColumns.forEach(c -> adminLengths.add(row.get(c)));
      CodeGrammar grammar = CodeGrammar.parse(country, row.get(COUNTRY_LENGTH), adminLengths);
      logger.atFine().log("Grammar for %s: %s", country, grammar.getSegmentLengths());
      grammars.add(grammar);
    }
    return grammars.build();
  }

  private static String adminColumn(int level) {
    return "Admin" + level + " Length";
  }
}
