package io.b2mash.b2b.cantonaltax.canton;

import io.b2mash.b2b.cantonaltax.exception.InvalidTaxDataException;
import io.b2mash.b2b.cantonaltax.feed.RateFeed;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Cantonal income tax multipliers, in percent of the simple tax. */
public final class CantonalRates {

  private static final Logger log = LoggerFactory.getLogger(CantonalRates.class);

  /** Multiplier of the federal pseudo-canton: the federal scale already yields the final tax. */
  public static final double FEDERAL_RATE = 100.0;

  private CantonalRates() {}

  /**
   * Extracts one multiplier per canton from a rate feed, including {@link
   * CantonPolicies#FEDERAL}.
   *
   * @throws InvalidTaxDataException if two locations of a canton disagree on the multiplier
   */
  public static Map<String, Double> fromFeed(int year, RateFeed feed) {
    var rates = new HashMap<String, Double>();
    for (var rate : feed.response()) {
      String canton = rate.location().canton();
      double incomeRate = adjust(canton, year, rate.incomeRateCanton());
      var previous = rates.putIfAbsent(canton, incomeRate);
      if (previous != null && previous != incomeRate) {
        throw new InvalidTaxDataException(
            "Inconsistent cantonal rate",
            "Inconsistent cantonal income rate in "
                + canton
                + " for "
                + year
                + ": "
                + previous
                + " != "
                + incomeRate);
      }
    }
    rates.put(CantonPolicies.FEDERAL, FEDERAL_RATE);
    log.debug("Cantonal rates for {}: {}", year, rates);
    return rates;
  }

  /**
   * Applies the corrections the published multipliers need: Geneva grants a 12% rebate and adds a
   * 1% surcharge, Vaud grants a 3.5% rebate from 2024 on.
   */
  static double adjust(String canton, int year, double incomeRate) {
    if ("GE".equals(canton)) {
      return incomeRate * 0.88 + 1.0;
    }
    if ("VD".equals(canton) && year >= 2024) {
      return incomeRate * 0.965;
    }
    return incomeRate;
  }
}
