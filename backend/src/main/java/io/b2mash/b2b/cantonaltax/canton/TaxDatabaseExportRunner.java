package io.b2mash.b2b.cantonaltax.canton;

import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Compiles all configured tax years on startup and exports them when {@code tax.export.file} is
 * set. Failing to export is logged and does not stop the application.
 */
@Component
@ConditionalOnProperty(prefix = "tax.export", name = "file")
public class TaxDatabaseExportRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(TaxDatabaseExportRunner.class);

  private final TaxDatabaseService databaseService;
  private final TaxDatabaseExporter exporter;
  private final Path exportFile;

  public TaxDatabaseExportRunner(
      TaxDatabaseService databaseService,
      TaxDatabaseExporter exporter,
      @Value("${tax.export.file}") String exportFile) {
    this.databaseService = databaseService;
    this.exporter = exporter;
    this.exportFile = Path.of(exportFile);
  }

  @Override
  public void run(ApplicationArguments args) {
    var database = databaseService.buildDatabase();
    try {
      exporter.exportTo(database, exportFile);
    } catch (IOException e) {
      log.warn("Failed to export tax database to {}", exportFile, e);
    }
  }
}
