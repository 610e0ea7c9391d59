package net.goui.pcode.loader;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.flogger.FluentLogger;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import org.apache.commons.csv.CSVFormat;

/**
 * Loads CSV tables by path. A path is resolved against the overlay directory (if given), then
 * the file system, and finally as a class path resource.
 */
public final class TableLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Optional<Path> overlayDir;
  private final CSVFormat csvFormat;

  /** Returns a loader for comma separated files with no overlay directory. */
  public static TableLoader create() {
    return new TableLoader("", ',');
  }

  public TableLoader(String overlayDirPath, char separator) {
    this.overlayDir =
        !overlayDirPath.isEmpty() ? Optional.of(Paths.get(overlayDirPath)) : Optional.empty();
    this.csvFormat = CsvTable.csvFormat(separator);
  }

  /**
   * Loads the table at the given path.
   *
   * @throws FileNotFoundException if the table cannot be found.
   * @throws IOException if the table cannot be read.
   */
  public CsvTable load(String path) throws IOException {
    if (overlayDir.isPresent()) {
      Path overlayPath = overlayDir.get().resolve(path);
      if (Files.isRegularFile(overlayPath)) {
        return loadTableFromFile(overlayPath);
      }
    }
    Path filePath = Paths.get(path);
    if (Files.isRegularFile(filePath)) {
      return loadTableFromFile(filePath);
    }
    String resourcePath = path.startsWith("/") ? path.substring(1) : path;
    try (InputStream is = TableLoader.class.getResourceAsStream("/" + resourcePath)) {
      if (is != null) {
        return loadFromResourceInputStream(is, resourcePath);
      }
    }
    throw new FileNotFoundException("cannot find table file or resource: " + path);
  }

  private CsvTable loadFromResourceInputStream(InputStream is, String path) throws IOException {
    logger.atInfo().log("Resource table: /%s", path);
    try (Reader reader = new InputStreamReader(is, UTF_8)) {
      return CsvTable.importCsv(reader, csvFormat);
    } catch (IOException e) {
      throw new IOException("error loading resource: " + path, e);
    }
  }

  private CsvTable loadTableFromFile(Path path) throws IOException {
    logger.atInfo().log("File table: %s", path);
    try (Reader reader = Files.newBufferedReader(path, UTF_8)) {
      return CsvTable.importCsv(reader, csvFormat);
    } catch (IOException e) {
      throw new IOException("error loading file: " + path, e);
    }
  }
}
