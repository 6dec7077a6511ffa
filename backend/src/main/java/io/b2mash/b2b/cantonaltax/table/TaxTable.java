package io.b2mash.b2b.cantonaltax.table;

import io.b2mash.b2b.cantonaltax.formula.FormulaParseException;
import java.util.List;
import java.util.Objects;

/**
 * A compiled tax scale: a {@link RawTable} evaluated under an {@link EvalPolicy}.
 *
 * <p>Immutable and safe to evaluate from any number of threads.
 */
public record TaxTable(RawTable table, EvalPolicy policy) {

  public TaxTable {
    Objects.requireNonNull(table, "table must not be null");
    Objects.requireNonNull(policy, "policy must not be null");
  }

  /**
   * Compiles published rows of the given table type.
   *
   * @throws TableShapeException if a row does not fit the table type
   * @throws FormulaParseException if a formula cannot be parsed
   */
  public static TaxTable of(TableType type, List<BracketRow> rows, EvalPolicy policy)
      throws TableShapeException, FormulaParseException {
    return new TaxTable(RawTable.of(type, rows), policy);
  }

  /** Simple tax for a single taxpayer's income. */
  public double eval(double x) {
    return switch (policy) {
      case RAW, NO_SPLIT_RAW, VALAIS -> table.eval(x);
      case ROUND_100, DOUBLE_ROUND_100, NO_SPLIT_ROUND_100 -> evalRound100(x);
    };
  }

  /**
   * Simple tax for a combined income taxed with a splitting ratio. A ratio of 0 means the table is
   * consulted directly on the full amount.
   *
   * @throws IllegalStateException if a {@code NO_SPLIT} policy is evaluated with a non-zero ratio
   */
  public double evalSplit(double x, double split) {
    return switch (policy) {
      case RAW, VALAIS -> evalSplitRaw(x, split);
      case ROUND_100 -> evalSplitRound100(x, split);
      case DOUBLE_ROUND_100 -> evalSplitDoubleRound100(x, split);
      case NO_SPLIT_RAW -> {
        requireNoSplit(split);
        yield evalSplitRaw(x, split);
      }
      case NO_SPLIT_ROUND_100 -> {
        requireNoSplit(split);
        yield evalSplitRound100(x, split);
      }
    };
  }

  /** Rounds down to a multiple of 100 CHF. */
  public static double floor100(double x) {
    return Math.floor(x / 100.0) * 100.0;
  }

  private double evalRound100(double x) {
    return table.eval(floor100(x));
  }

  private double evalSplitRaw(double x, double split) {
    if (split == 0.0) {
      return table.eval(x);
    }
    return table.eval(x / split) * split;
  }

  private double evalSplitRound100(double x, double split) {
    if (split == 0.0) {
      return evalRound100(x);
    }
    double xx = floor100(x);
    return rateAt(xx / split) * xx;
  }

  private double evalSplitDoubleRound100(double x, double split) {
    if (split == 0.0) {
      return evalRound100(x);
    }
    double xx = floor100(x);
    return rateAt(floor100(xx / split)) * xx;
  }

  /** Average rate of the raw table at {@code yy}, 0 for an income of 0. */
  private double rateAt(double yy) {
    return yy == 0.0 ? 0.0 : table.eval(yy) / yy;
  }

  private void requireNoSplit(double split) {
    if (split != 0.0) {
      throw new IllegalStateException(
          "Policy " + policy + " does not support splitting, got ratio " + split);
    }
  }
}
