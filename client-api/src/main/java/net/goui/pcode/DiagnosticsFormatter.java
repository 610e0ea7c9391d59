/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pcode;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.Optional;
import net.goui.pcode.metadata.Registry;

/** Renders diagnostic records and resolver configuration as human readable lines. */
public final class DiagnosticsFormatter {

  /**
   * Formats a match record. Length conversions are shown with the converted code rather than the
   * input, so that conversions of different inputs to the same code read the same.
   */
  public static String format(MatchRecord match) {
    String matched =
        match.getMethod().startsWith(LengthConverter.SIMPLE) ? match.getCode() : match.getInput();
    return String.format(
        "%s - %s: Matching (%s) %s to %s on map",
        match.getContext(),
        match.getCountry(),
        match.getMethod(),
        matched,
        match.getName());
  }

  public static String format(IgnoredRecord ignored) {
    return ignored.getInput() == null
        ? String.format("%s - Ignored %s!", ignored.getContext(), ignored.getCountry())
        : String.format(
            "%s - %s: Ignored %s!", ignored.getContext(), ignored.getCountry(), ignored.getInput());
  }

  public static String format(ErrorRecord error) {
    return error.getInput() == null
        ? String.format(
            "%s - Could not find %s in map names!", error.getContext(), error.getCountry())
        : String.format(
            "%s - %s: Could not find %s in map names!",
            error.getContext(),
            error.getCountry(),
            error.getInput());
  }

  /** Formats match records in order, omitting repeated lines. */
  public static ImmutableList<String> formatMatches(Collection<MatchRecord> matches) {
    return matches.stream()
        .map(DiagnosticsFormatter::format)
        .distinct()
        .collect(toImmutableList());
  }

  public static ImmutableList<String> formatIgnored(Collection<IgnoredRecord> ignored) {
    return ignored.stream().map(DiagnosticsFormatter::format).collect(toImmutableList());
  }

  public static ImmutableList<String> formatErrors(Collection<ErrorRecord> errors) {
    return errors.stream().map(DiagnosticsFormatter::format).collect(toImmutableList());
  }

  /**
   * Renders each name mapping as {@code "<key>: <display name> (<code>)"}. Mappings to codes which
   * are not in the registry are omitted.
   */
  public static ImmutableList<String> formatNameMappings(ResolverConfig config, Registry registry) {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    config
        .getNameMappings()
        .forEach(
            (key, code) -> {
              Optional<String> name = registry.lookupExact(code);
              name.ifPresent(n -> lines.add(String.format("%s: %s (%s)", key, n, code)));
            });
    return lines.build();
  }

  /** Renders each name replacement as {@code "<find>: <replace>"}. */
  public static ImmutableList<String> formatNameReplacements(ResolverConfig config) {
    return config.getNameReplacements().entrySet().stream()
        .map(e -> String.format("%s: %s", e.getKey(), e.getValue()))
        .collect(toImmutableList());
  }

  private DiagnosticsFormatter() {}
}
