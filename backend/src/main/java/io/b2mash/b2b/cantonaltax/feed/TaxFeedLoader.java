package io.b2mash.b2b.cantonaltax.feed;

import io.b2mash.b2b.cantonaltax.config.TaxDataProperties;
import io.b2mash.b2b.cantonaltax.exception.InvalidTaxDataException;
import io.b2mash.b2b.cantonaltax.exception.ResourceNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/** Reads the published scale and rate feeds of a year. */
@Service
public class TaxFeedLoader {

  private static final Logger log = LoggerFactory.getLogger(TaxFeedLoader.class);

  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper;
  private final TaxDataProperties properties;

  public TaxFeedLoader(
      ResourceLoader resourceLoader, ObjectMapper objectMapper, TaxDataProperties properties) {
    this.resourceLoader = resourceLoader;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  public ScaleFeed loadScales(int year) {
    return read("scales-" + year + ".json", ScaleFeed.class);
  }

  public RateFeed loadRates(int year) {
    return read("rates-" + year + ".json", RateFeed.class);
  }

  private <T> T read(String fileName, Class<T> type) {
    Resource resource = resourceLoader.getResource(properties.location() + "/" + fileName);
    if (!resource.exists()) {
      throw ResourceNotFoundException.withDetail(
          "Tax data not found", "No tax data file " + fileName + " at " + properties.location());
    }
    log.debug("Loading {} from {}", fileName, properties.location());
    try (InputStream in = resource.getInputStream()) {
      return objectMapper.readValue(in, type);
    } catch (JacksonException e) {
      log.warn("Failed to parse tax data file {}: {}", fileName, e.getMessage());
      throw new InvalidTaxDataException(
          "Malformed tax data", "Tax data file " + fileName + " could not be parsed");
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read tax data file " + fileName, e);
    }
  }
}
