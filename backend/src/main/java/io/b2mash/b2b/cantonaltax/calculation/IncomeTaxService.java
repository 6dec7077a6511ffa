package io.b2mash.b2b.cantonaltax.calculation;

import io.b2mash.b2b.cantonaltax.calculation.dto.IncomeTaxResponse;
import io.b2mash.b2b.cantonaltax.calculation.dto.ScaleReport;
import io.b2mash.b2b.cantonaltax.calculation.dto.ScaleReportEntry;
import io.b2mash.b2b.cantonaltax.canton.CantonPolicies;
import io.b2mash.b2b.cantonaltax.canton.CantonalRates;
import io.b2mash.b2b.cantonaltax.canton.TaxDatabaseService;
import io.b2mash.b2b.cantonaltax.canton.TaxYearCompiler;
import io.b2mash.b2b.cantonaltax.feed.Group;
import io.b2mash.b2b.cantonaltax.feed.Scale;
import io.b2mash.b2b.cantonaltax.feed.Target;
import io.b2mash.b2b.cantonaltax.feed.TaxFeedLoader;
import io.b2mash.b2b.cantonaltax.formula.FormulaParseException;
import io.b2mash.b2b.cantonaltax.table.TableShapeException;
import io.b2mash.b2b.cantonaltax.table.TaxTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/** Evaluates compiled income tax tables for API callers. */
@Service
public class IncomeTaxService {

  /** Incomes at which the scale report samples every scale. */
  static final List<Double> SAMPLE_INCOMES =
      List.of(10_000.0, 20_000.0, 50_000.0, 100_000.0, 200_000.0);

  private final TaxDatabaseService databaseService;
  private final TaxFeedLoader feedLoader;

  public IncomeTaxService(TaxDatabaseService databaseService, TaxFeedLoader feedLoader) {
    this.databaseService = databaseService;
    this.feedLoader = feedLoader;
  }

  public IncomeTaxResponse calculate(int year, String canton, double income, boolean married) {
    CantonPolicies.requireKnown(canton);
    var base = databaseService.getCanton(year, canton);
    var scale = base.scale();
    double simpleTax = married ? scale.marriedTax(income) : scale.singleTax(income);
    return new IncomeTaxResponse(
        year,
        canton,
        income,
        married,
        married ? scale.splitting() : 0.0,
        base.rate(),
        simpleTax,
        simpleTax * base.rate() / 100.0);
  }

  public List<String> cantons(int year) {
    return List.copyOf(databaseService.getYear(year).cantons().keySet());
  }

  /**
   * Samples every income tax scale of the given target: cantonal scales for {@link Target#KANTON},
   * the federal scales for {@link Target#BUND}. Sampled taxes are reported both as simple taxes and
   * multiplied by the canton's income tax rate.
   */
  public ScaleReport scaleReport(int year, Target target) {
    databaseService.requireYearInRange(year);
    var scales = feedLoader.loadScales(year);
    var rates = CantonalRates.fromFeed(year, feedLoader.loadRates(year));
    var entries = new ArrayList<ScaleReportEntry>();
    for (var scale : scales.response()) {
      if (target == Target.BUND && TaxYearCompiler.isFederal(scale)) {
        entries.add(reportEntry(scale, CantonPolicies.FEDERAL, rates));
      } else if (target == Target.KANTON && scale.isIncomeTaxOf(Target.KANTON)) {
        entries.add(reportEntry(scale, scale.location().canton(), rates));
      }
    }
    return new ScaleReport(year, target.name(), SAMPLE_INCOMES, entries);
  }

  private ScaleReportEntry reportEntry(Scale scale, String canton, Map<String, Double> rates) {
    var groups = TaxYearCompiler.groupsOf(scale);
    var policy = TaxYearCompiler.policyOf(scale, canton);
    Double rate = rates.get(canton);
    TaxTable table;
    try {
      table = TaxTable.of(scale.tableType(), scale.table(), policy);
    } catch (FormulaParseException | TableShapeException e) {
      return new ScaleReportEntry(
          canton,
          scale.group(),
          Group.isSingle(groups),
          Group.isMarried(groups),
          scale.splitting(),
          rate,
          List.of(),
          List.of(),
          List.of(),
          List.of(),
          e.getMessage());
    }
    var singleTaxes = SAMPLE_INCOMES.stream().map(table::eval).toList();
    var splitTaxes =
        SAMPLE_INCOMES.stream().map(x -> table.evalSplit(x, scale.splitting())).toList();
    return new ScaleReportEntry(
        canton,
        scale.group(),
        Group.isSingle(groups),
        Group.isMarried(groups),
        scale.splitting(),
        rate,
        singleTaxes,
        splitTaxes,
        applyRate(singleTaxes, rate),
        applyRate(splitTaxes, rate),
        null);
  }

  /** Multiplies simple taxes by a cantonal rate; empty when the canton publishes no rate. */
  private static List<Double> applyRate(List<Double> simpleTaxes, Double rate) {
    if (rate == null) {
      return List.of();
    }
    return simpleTaxes.stream().map(tax -> tax * rate / 100.0).toList();
  }
}
