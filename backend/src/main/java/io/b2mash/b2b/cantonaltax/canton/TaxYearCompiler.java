package io.b2mash.b2b.cantonaltax.canton;

import io.b2mash.b2b.cantonaltax.exception.InvalidTaxDataException;
import io.b2mash.b2b.cantonaltax.feed.Group;
import io.b2mash.b2b.cantonaltax.feed.RateFeed;
import io.b2mash.b2b.cantonaltax.feed.Scale;
import io.b2mash.b2b.cantonaltax.feed.ScaleFeed;
import io.b2mash.b2b.cantonaltax.feed.Target;
import io.b2mash.b2b.cantonaltax.formula.FormulaParseException;
import io.b2mash.b2b.cantonaltax.table.EvalPolicy;
import io.b2mash.b2b.cantonaltax.table.TableShapeException;
import io.b2mash.b2b.cantonaltax.table.TaxTable;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Compiles the published feeds of a year into single and married income tax tables per canton.
 *
 * <p>A scale whose rows cannot be compiled is logged and skipped; a canton is only kept when both
 * its single and married scales compiled. Unknown group or canton codes invalidate the whole feed.
 */
@Service
public class TaxYearCompiler {

  private static final Logger log = LoggerFactory.getLogger(TaxYearCompiler.class);

  /** {@code CantonID} of the location carrying the federal scale. */
  static final int FEDERAL_CANTON_ID = 1;

  public TaxYear compile(int year, ScaleFeed scales, RateFeed rates) {
    var cantonalRates = CantonalRates.fromFeed(year, rates);
    var cantonalScales = compileScales(scales);

    var cantons = new HashMap<String, CantonalBase>();
    cantonalScales.forEach(
        (canton, scale) -> {
          if (CantonPolicies.EXCLUDED.contains(canton)) {
            log.debug("Skipping excluded canton {} in {}", canton, year);
            return;
          }
          var rate = cantonalRates.get(canton);
          if (rate == null) {
            log.warn("No cantonal rate for {} in {}, skipping", canton, year);
            return;
          }
          cantons.put(canton, new CantonalBase(rate, scale));
        });
    log.info("Compiled {} cantonal income tax bases for {}", cantons.size(), year);
    return new TaxYear(year, cantons);
  }

  /** Single and married scales per canton; the federal one under {@link CantonPolicies#FEDERAL}. */
  public Map<String, CantonalScale> compileScales(ScaleFeed scales) {
    var singles = new HashMap<String, TaxTable>();
    var marrieds = new HashMap<String, MarriedTable>();

    for (var scale : scales.response()) {
      String canton;
      if (scale.isIncomeTaxOf(Target.KANTON)) {
        canton = scale.location().canton();
      } else if (isFederal(scale)) {
        canton = CantonPolicies.FEDERAL;
      } else {
        continue;
      }

      var groups = groupsOf(scale);
      boolean single = Group.isSingle(groups);
      boolean married = Group.isMarried(groups);
      if (!single && !married) {
        continue;
      }
      var table = tryCompile(scale, canton);
      if (table.isEmpty()) {
        continue;
      }
      if (single) {
        singles.put(canton, table.get());
      }
      if (married) {
        marrieds.put(canton, new MarriedTable(scale.splitting(), table.get()));
      }
    }

    var result = new HashMap<String, CantonalScale>();
    singles.forEach(
        (canton, single) -> {
          var married = marrieds.get(canton);
          if (married != null) {
            result.put(canton, new CantonalScale(married.splitting(), single, married.table()));
          } else {
            log.debug("No married scale for {}, skipping", canton);
          }
        });
    return result;
  }

  /** Federal income tax scale, published once under the location with canton id 1. */
  public static boolean isFederal(Scale scale) {
    return scale.isIncomeTaxOf(Target.BUND)
        && scale.location().cantonId() == FEDERAL_CANTON_ID;
  }

  /**
   * Compiles one scale with the policy of its canton.
   *
   * @throws InvalidTaxDataException if the canton code is unknown
   */
  public Optional<TaxTable> tryCompile(Scale scale, String canton) {
    var policy = policyOf(scale, canton);
    try {
      return Optional.of(TaxTable.of(scale.tableType(), scale.table(), policy));
    } catch (FormulaParseException | TableShapeException e) {
      log.warn(
          "Skipping {} scale of {} ({}): {}",
          scale.tableType(),
          canton,
          scale.group(),
          e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Group codes of a published scale.
   *
   * @throws InvalidTaxDataException if the feed lists an unknown group code
   */
  public static Set<Group> groupsOf(Scale scale) {
    try {
      return scale.groups();
    } catch (IllegalArgumentException e) {
      throw malformedScale(scale, e);
    }
  }

  /**
   * Policy of the canton a published scale is compiled for.
   *
   * @throws InvalidTaxDataException if the feed names an unknown canton
   */
  public static EvalPolicy policyOf(Scale scale, String canton) {
    try {
      return CantonPolicies.policyOf(canton);
    } catch (IllegalArgumentException e) {
      throw malformedScale(scale, e);
    }
  }

  private static InvalidTaxDataException malformedScale(Scale scale, IllegalArgumentException e) {
    log.warn(
        "Malformed {} scale of {}: {}",
        scale.tableType(),
        scale.location().bfsName(),
        e.getMessage());
    return new InvalidTaxDataException(
        "Malformed tax data",
        "Scale of " + scale.location().bfsName() + " (" + scale.group() + "): " + e.getMessage());
  }

  private record MarriedTable(double splitting, TaxTable table) {}
}
