package io.b2mash.b2b.cantonaltax.canton;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.cantonaltax.config.TaxDataProperties;
import io.b2mash.b2b.cantonaltax.exception.ResourceNotFoundException;
import io.b2mash.b2b.cantonaltax.feed.TaxFeedLoader;
import java.util.HashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/** Compiles tax years from the configured feeds on first use and keeps them in memory. */
@Service
@EnableConfigurationProperties(TaxDataProperties.class)
public class TaxDatabaseService {

  private static final Logger log = LoggerFactory.getLogger(TaxDatabaseService.class);

  private final TaxFeedLoader feedLoader;
  private final TaxYearCompiler compiler;
  private final TaxDataProperties properties;
  private final Cache<Integer, TaxYear> years;

  public TaxDatabaseService(
      TaxFeedLoader feedLoader, TaxYearCompiler compiler, TaxDataProperties properties) {
    this.feedLoader = feedLoader;
    this.compiler = compiler;
    this.properties = properties;
    this.years = Caffeine.newBuilder().maximumSize(properties.cacheSize()).build();
  }

  /**
   * Returns the compiled tax year.
   *
   * @throws ResourceNotFoundException if the year is outside the configured range or has no feeds
   */
  public TaxYear getYear(int year) {
    requireYearInRange(year);
    return years.get(year, this::compileYear);
  }

  /**
   * Checks that a year lies in the configured range without compiling it.
   *
   * @throws ResourceNotFoundException if the year is outside the configured range
   */
  public void requireYearInRange(int year) {
    if (year < properties.firstYear() || year > properties.lastYear()) {
      throw ResourceNotFoundException.taxYear(year, properties.firstYear(), properties.lastYear());
    }
  }

  /**
   * Returns the tax base of a canton in a year.
   *
   * @throws ResourceNotFoundException if the year or the canton is not available
   */
  public CantonalBase getCanton(int year, String canton) {
    return getYear(year)
        .canton(canton)
        .orElseThrow(() -> ResourceNotFoundException.canton(canton, year));
  }

  /** Compiles every configured year. */
  public TaxDatabase buildDatabase() {
    var compiled = new HashMap<Integer, TaxYear>();
    for (int year = properties.firstYear(); year <= properties.lastYear(); year++) {
      compiled.put(year, getYear(year));
    }
    return new TaxDatabase(compiled);
  }

  private TaxYear compileYear(int year) {
    log.info("Compiling income tax tables for {}", year);
    var scales = feedLoader.loadScales(year);
    var rates = feedLoader.loadRates(year);
    return compiler.compile(year, scales, rates);
  }
}
