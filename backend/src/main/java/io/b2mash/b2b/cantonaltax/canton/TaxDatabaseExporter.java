package io.b2mash.b2b.cantonaltax.canton;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Serializes compiled tax databases for front ends that evaluate the tables themselves.
 *
 * <p>Formula trees and raw tables carry type ids; infinite bracket widths are written as the
 * string {@code "Infinity"}.
 */
@Service
public class TaxDatabaseExporter {

  private static final Logger log = LoggerFactory.getLogger(TaxDatabaseExporter.class);

  private final ObjectMapper objectMapper;

  public TaxDatabaseExporter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public void write(TaxDatabase database, OutputStream out) {
    objectMapper.writeValue(out, database);
  }

  public TaxDatabase read(InputStream in) {
    return objectMapper.readValue(in, TaxDatabase.class);
  }

  /** Writes the database to a new file; an existing file is never overwritten. */
  public void exportTo(TaxDatabase database, Path file) throws IOException {
    try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE_NEW)) {
      write(database, out);
    } catch (JacksonException e) {
      throw new IOException("Failed to serialize tax database to " + file, e);
    }
    log.info("Exported {} tax years to {}", database.years().size(), file);
  }
}
