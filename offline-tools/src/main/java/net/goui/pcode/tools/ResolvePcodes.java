/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode.tools;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.goui.pcode.Diagnostics;
import net.goui.pcode.DiagnosticsFormatter;
import net.goui.pcode.PcodeResolver;
import net.goui.pcode.PcodeResult;
import net.goui.pcode.ResolverConfig;
import net.goui.pcode.loader.CsvTable;
import net.goui.pcode.loader.GrammarLoader;
import net.goui.pcode.loader.RegistryLoader;
import net.goui.pcode.loader.ResolverConfigLoader;
import net.goui.pcode.loader.TableLoader;
import net.goui.pcode.metadata.Registry;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves a CSV file of administrative area names or p-codes against a p-code registry.
 *
 * <p>Input rows have the columns {@code country} (ISO 3166-1 alpha-3), {@code value} and
 * optionally {@code parent}. Output rows have the columns {@code country}, {@code value}, {@code
 * pcode} (empty if unresolved) and {@code exact}.
 */
public class ResolvePcodes {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String COUNTRY = "country";
  static final String VALUE = "value";
  static final String PARENT = "parent";

  private static final ImmutableList<String> OUTPUT_HEADER =
      ImmutableList.of(COUNTRY, VALUE, "pcode", "exact");
  private static final CSVFormat OUTPUT_FORMAT =
      CSVFormat.DEFAULT.builder().setRecordSeparator('\n').build();

  static final class Flags {
    @Parameter(
        names = "--registry",
        description = "Registry CSV (iso3, pcode, name[, parent]) path or resource",
        required = true)
    private String registryPath = "";

    @Parameter(
        names = "--parent_registry",
        description = "Registry CSV of a parent level, repeated in level order (optional)")
    private List<String> parentRegistryPaths = new ArrayList<>();

    @Parameter(names = "--formats", description = "Code lengths CSV path (optional)")
    private String formatsPath = "";

    @Parameter(names = "--config", description = "YAML config path (optional)")
    private String configPath = "";

    @Parameter(names = "--countries", description = "Comma separated countries to load (optional)")
    private String countries = "";

    @Parameter(names = "--admin_level", description = "Admin level of the registry codes")
    private int adminLevel = 1;

    @Parameter(names = "--dir", description = "Root overlay directory for CSV files (optional)")
    private String dirPath = "";

    @Parameter(
        names = "--csv_separator",
        description = "CSV separator for registry and input files (single char)")
    private String csvSeparator = ",";

    @Parameter(names = "--input", description = "Input CSV path", required = true)
    private String inputPath = "";

    @Parameter(names = "--out", description = "Output CSV path (default is standard out)")
    private String outPath = "";

    @Parameter(names = "--no_fuzzy", description = "Disable approximate name matching")
    private boolean noFuzzy = false;

    @Parameter(names = "--context", description = "Context name reported in diagnostics")
    private String context = "resolve";

    @Parameter(names = "--show_config", description = "Log name mappings and replacements")
    private boolean showConfig = false;

    @Parameter(names = "--log_level", description = "JDK log level name")
    private String logLevel = "INFO";
  }

  private static void setLogging(String levelName) {
    Level level = Level.parse(levelName);
    Arrays.stream(Logger.getLogger("").getHandlers()).forEach(h -> h.setLevel(level));
    Logger.getLogger("net.goui.pcode").setLevel(level);
  }

  public static void main(String[] args) throws IOException {
    Flags flags = new Flags();
    JCommander.newBuilder().addObject(flags).build().parse(args);
    setLogging(flags.logLevel);

    if (flags.outPath.isEmpty()) {
      Writer out = new OutputStreamWriter(System.out, UTF_8);
      run(flags, out);
      out.flush();
    } else {
      logger.atInfo().log("Writing: %s", flags.outPath);
      try (Writer out = Files.newBufferedWriter(Paths.get(flags.outPath), UTF_8)) {
        run(flags, out);
      }
    }
  }

  static void run(Flags flags, Writer out) throws IOException {
    checkArgument(
        flags.csvSeparator.length() == 1, "invalid CSV separator: '%s'", flags.csvSeparator);
    TableLoader tables = new TableLoader(flags.dirPath, flags.csvSeparator.charAt(0));
    PcodeResolver resolver = buildResolver(flags, tables);
    if (flags.showConfig) {
      logConfig(resolver);
    }
    resolveAll(resolver, tables.load(flags.inputPath), !flags.noFuzzy, flags.context, out);
    logDiagnostics(resolver.getDiagnostics());
  }

  private static PcodeResolver buildResolver(Flags flags, TableLoader tables) throws IOException {
    @Nullable ImmutableSet<String> countries =
        !flags.countries.isEmpty()
            ? ImmutableSet.copyOf(Splitter.on(',').trimResults().split(flags.countries))
            : null;
    RegistryLoader registryLoader = new RegistryLoader(tables);
    Registry registry = registryLoader.load(flags.registryPath, countries);
    ResolverConfig config =
        !flags.configPath.isEmpty()
            ? ResolverConfigLoader.load(Paths.get(flags.configPath))
            : ResolverConfig.defaults();
    PcodeResolver.Builder resolver =
        PcodeResolver.builder(registry).setAdminLevel(flags.adminLevel).setConfig(config);
    if (!flags.formatsPath.isEmpty()) {
      resolver.addGrammars(new GrammarLoader(tables).load(flags.formatsPath));
    }
    if (!flags.parentRegistryPaths.isEmpty()) {
      resolver.setParentCodes(
          registryLoader.loadParentCodes(
              ImmutableList.copyOf(flags.parentRegistryPaths), countries));
    }
    return resolver.build();
  }

  /**
   * Resolves each row of the input table and writes a CSV result row for it.
   *
   * @throws IllegalArgumentException if the input table has no country or value column.
   */
  static void resolveAll(
      PcodeResolver resolver, CsvTable input, boolean allowFuzzy, String context, Writer out)
      throws IOException {
    input.checkColumns("input", COUNTRY, VALUE);
    boolean hasParents = input.hasColumn(PARENT);
    CSVPrinter printer = new CSVPrinter(out, OUTPUT_FORMAT);
    printer.printRecord(OUTPUT_HEADER);
    int resolved = 0;
    for (ImmutableMap<String, String> row : input.getRows()) {
      String country = row.get(COUNTRY);
      String value = row.get(VALUE);
      @Nullable String parent = hasParents && !row.get(PARENT).isEmpty() ? row.get(PARENT) : null;
      PcodeResult result = resolver.resolve(country, value, parent, allowFuzzy, context);
      if (result.getCode().isPresent()) {
        resolved++;
      }
      printer.printRecord(
          country, value, result.getCode().orElse(""), Boolean.toString(result.isExact()));
    }
    printer.flush();
    logger.atInfo().log("Resolved %d of %d rows", resolved, input.getRows().size());
  }

  private static void logConfig(PcodeResolver resolver) {
    DiagnosticsFormatter.formatNameMappings(resolver.getConfig(), resolver.getRegistry())
        .forEach(m -> logger.atInfo().log("Name mapping: %s", m));
    DiagnosticsFormatter.formatNameReplacements(resolver.getConfig())
        .forEach(r -> logger.atInfo().log("Name replacement: %s", r));
  }

  private static void logDiagnostics(Diagnostics diagnostics) {
    DiagnosticsFormatter.formatMatches(diagnostics.drainMatches())
        .forEach(m -> logger.atInfo().log("%s", m));
    DiagnosticsFormatter.formatIgnored(diagnostics.drainIgnored())
        .forEach(m -> logger.atInfo().log("%s", m));
    DiagnosticsFormatter.formatErrors(diagnostics.drainErrors())
        .forEach(m -> logger.atWarning().log("%s", m));
  }
}
