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
import java.util.Set;
import net.goui.pcode.metadata.ParentCodes;
import net.goui.pcode.metadata.Registry;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Loads a {@link Registry} from a table with the columns {@code iso3}, {@code pcode} and {@code
 * name}, and optionally {@code parent}. Rows with an empty code are skipped.
 */
public final class RegistryLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String COUNTRY = "iso3";
  static final String CODE = "pcode";
  static final String NAME = "name";
  static final String PARENT = "parent";

  private final TableLoader tableLoader;

  public RegistryLoader(TableLoader tableLoader) {
    this.tableLoader = tableLoader;
  }

  /** Loads all rows of the table at the given path. */
  public Registry load(String path) throws IOException {
    return load(path, null);
  }

  /** Loads the rows of the table at the given path for the given countries (or all if null). */
  public Registry load(String path, @Nullable Set<String> countries) throws IOException {
    Registry registry = fromTable(tableLoader.load(path), path, countries);
    logger.atInfo().log(
        "Loaded %d codes for %d countries from: %s",
        registry.getCodes().size(), registry.getCountries().size(), path);
    return registry;
  }

  /** Loads the registries of parent levels (in level order) and returns their codes. */
  public ParentCodes loadParentCodes(
      ImmutableList<String> paths, @Nullable Set<String> countries) throws IOException {
    ImmutableList.Builder<Registry> registries = ImmutableList.builder();
    for (String path : paths) {
      registries.add(load(path, countries));
    }
    return ParentCodes.fromRegistries(registries.build());
  }

  /**
   * Builds a registry from a loaded table.
   *
   * @throws IllegalArgumentException if a required column is missing.
   * @throws IllegalStateException if no rows were registered.
   */
  public static Registry fromTable(
      CsvTable table, String source, @Nullable Set<String> countries) {
    table.checkColumns(source, COUNTRY, CODE, NAME);
    boolean hasParents = table.hasColumn(PARENT);
    Registry.Builder registry =
        countries != null ? Registry.builderForCountries(countries) : Registry.builder();
    int skipped = 0;
    for (ImmutableMap<String, String> row : table.getRows()) {
      String code = row.get(CODE);
      if (code.isEmpty() || row.get(COUNTRY).isEmpty()) {
        skipped++;
        continue;
      }
      registry.register(
          row.get(COUNTRY), code, row.get(NAME), hasParents ? row.get(PARENT) : null);
    }
    if (skipped > 0) {
      logger.atWarning().log("Skipped %d rows without country or code in: %s", skipped, source);
    }
    return registry.build();
  }
}
