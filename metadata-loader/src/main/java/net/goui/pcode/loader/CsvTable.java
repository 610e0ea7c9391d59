/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode.loader;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;

/**
 * A parsed CSV table. Rows are mappings from column name to value, in column order, and every row
 * has a (possibly empty) value for every column.
 */
@AutoValue
public abstract class CsvTable {
  private static final CharMatcher BYTE_ORDER_MARK = CharMatcher.is('\uFEFF');
  private static final CSVFormat DEFAULT_FORMAT = csvFormat(',');

  /**
   * Returns the format for reading tables with the given separator. The first non-blank line is
   * the header, blank lines are skipped and whitespace around unquoted values is removed.
   *
   * @throws IllegalArgumentException if the separator is a quote or line break.
   */
  public static CSVFormat csvFormat(char separator) {
    return CSVFormat.DEFAULT
        .builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreSurroundingSpaces(true)
        .setDuplicateHeaderMode(DuplicateHeaderMode.DISALLOW)
        .setDelimiter(separator)
        .build();
  }

  /** Reads a comma separated table from the given reader, which is not closed. */
  public static CsvTable importCsv(Reader reader) throws IOException {
    return importCsv(reader, DEFAULT_FORMAT);
  }

  /**
   * Reads a table from the given reader, which is not closed. The format must read its header
   * from the data (see {@link #csvFormat(char)}).
   *
   * @throws IOException if the data cannot be read or is not valid CSV.
   * @throws IllegalArgumentException if the header has a duplicate or missing column name, or a
   *     row has more values than there are columns.
   */
  public static CsvTable importCsv(Reader reader, CSVFormat format) throws IOException {
    CSVParser parser = format.parse(reader);
    List<CSVRecord> records;
    try {
      records = parser.getRecords();
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
    List<String> header = new ArrayList<>(parser.getHeaderNames());
    if (!header.isEmpty()) {
      header.set(0, BYTE_ORDER_MARK.trimLeadingFrom(header.get(0)));
    }
    List<ImmutableMap<String, String>> rows = new ArrayList<>(records.size());
    for (CSVRecord record : records) {
      checkArgument(
          record.size() <= header.size(),
          "too many values in row %s (expected %s): %s",
          record.getRecordNumber(),
          header.size(),
          record.toList());
      Map<String, String> row = new LinkedHashMap<>();
      for (int i = 0; i < header.size(); i++) {
        row.put(header.get(i), i < record.size() ? record.get(i) : "");
      }
      rows.add(ImmutableMap.copyOf(row));
    }
    return of(header, rows);
  }

  static CsvTable of(List<String> header, List<ImmutableMap<String, String>> rows) {
    return new AutoValue_CsvTable(ImmutableList.copyOf(header), ImmutableList.copyOf(rows));
  }

  public abstract ImmutableList<String> getHeader();

  public abstract ImmutableList<ImmutableMap<String, String>> getRows();

  public boolean hasColumn(String name) {
    return getHeader().contains(name);
  }

  /**
   * Checks that all the named columns exist.
   *
   * @throws IllegalArgumentException if any column is missing.
   */
  public void checkColumns(String source, String... names) {
    for (String name : names) {
      checkArgument(
          hasColumn(name), "missing column '%s' in %s (columns: %s)", name, source, getHeader());
    }
  }
}
