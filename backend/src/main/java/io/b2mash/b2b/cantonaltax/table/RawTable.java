package io.b2mash.b2b.cantonaltax.table;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.b2mash.b2b.cantonaltax.formula.Formula;
import io.b2mash.b2b.cantonaltax.formula.FormulaParseException;
import io.b2mash.b2b.cantonaltax.formula.FormulaParser;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A tax scale without rounding or splitting: maps an income to the simple tax owed.
 *
 * <p>Each variant keeps its entries in the order of the published rows, ascending by boundary.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(value = RawTable.Bund.class, name = "bund"),
  @JsonSubTypes.Type(value = RawTable.Flattax.class, name = "flattax"),
  @JsonSubTypes.Type(value = RawTable.Formel.class, name = "formel"),
  @JsonSubTypes.Type(value = RawTable.Freiburg.class, name = "freiburg"),
  @JsonSubTypes.Type(value = RawTable.Zuerich.class, name = "zuerich")
})
public sealed interface RawTable
    permits RawTable.Bund,
        RawTable.Flattax,
        RawTable.Formel,
        RawTable.Freiburg,
        RawTable.Zuerich {

  /** Widths at or above this value mark the open-ended top bracket of a Zurich-style scale. */
  double UNBOUNDED_BRACKET_WIDTH = 10_000_000.0;

  double eval(double x);

  /**
   * Builds the table for the given type from published rows.
   *
   * @throws TableShapeException if a row does not fit the table type
   * @throws FormulaParseException if a row of a formula-based table has malformed formula text
   */
  static RawTable of(TableType type, List<BracketRow> rows)
      throws TableShapeException, FormulaParseException {
    return switch (type) {
      case BUND -> Bund.of(rows);
      case FLATTAX -> Flattax.of(rows);
      case FORMEL -> Formel.of(rows);
      case FREIBURG -> Freiburg.of(rows);
      case ZUERICH -> Zuerich.of(rows);
      case UNKNOWN -> throw new TableShapeException(type, "type", 0, "unsupported table type");
    };
  }

  /** Marginal brackets with a base tax at each bracket start (federal style). */
  record Bund(List<Entry> entries) implements RawTable {

    private static final Logger log = LoggerFactory.getLogger(Bund.class);

    public record Entry(double bracketStart, double baseTax, double marginalRate) {}

    public Bund {
      entries = List.copyOf(entries);
    }

    static Bund of(List<BracketRow> rows) throws TableShapeException {
      var entries = new ArrayList<Entry>(rows.size());
      for (int i = 0; i < rows.size(); i++) {
        var row = rows.get(i);
        if (!row.formula().isEmpty()) {
          throw new TableShapeException(
              TableType.BUND, "formula", i, "non-empty formula \"" + row.formula() + "\"");
        }
        if (i == 0 && row.amount() != 0.0) {
          log.warn(
              "No entry found for 0 in table of type BUND, first bracket starts at {}",
              row.amount());
        }
        entries.add(new Entry(row.amount(), row.taxes(), row.percent()));
      }
      return new Bund(entries);
    }

    @Override
    public double eval(double x) {
      for (int i = entries.size() - 1; i >= 0; i--) {
        var entry = entries.get(i);
        if (x >= entry.bracketStart()) {
          return entry.baseTax() + (x - entry.bracketStart()) * entry.marginalRate() / 100.0;
        }
      }
      return 0.0;
    }
  }

  /** A single flat rate applied to the whole income. */
  record Flattax(double rate) implements RawTable {

    static Flattax of(List<BracketRow> rows) throws TableShapeException {
      if (rows.size() != 1) {
        throw new TableShapeException(
            TableType.FLATTAX, "size", 0, "expected exactly one row, found " + rows.size());
      }
      var row = rows.get(0);
      if (!row.formula().isEmpty()) {
        throw new TableShapeException(
            TableType.FLATTAX, "formula", 0, "non-empty formula \"" + row.formula() + "\"");
      }
      if (row.amount() != 0.0) {
        throw new TableShapeException(
            TableType.FLATTAX, "amount", 0, "non-zero amount " + row.amount());
      }
      return new Flattax(row.percent());
    }

    @Override
    public double eval(double x) {
      return x * rate / 100.0;
    }
  }

  /** One formula per bracket; the formula yields the total tax for incomes in its bracket. */
  record Formel(List<Entry> entries) implements RawTable {

    private static final Logger log = LoggerFactory.getLogger(Formel.class);

    public record Entry(double bracketStart, Formula formula) {}

    public Formel {
      entries = List.copyOf(entries);
    }

    static Formel of(List<BracketRow> rows) throws TableShapeException, FormulaParseException {
      var entries = new ArrayList<Entry>(rows.size());
      for (int i = 0; i < rows.size(); i++) {
        var row = rows.get(i);
        log.debug("Table formula row {}: {}", i, row);
        if (row.taxes() != 0.0) {
          throw new TableShapeException(
              TableType.FORMEL, "taxes", i, "non-zero taxes " + row.taxes());
        }
        if (row.percent() != 0.0) {
          throw new TableShapeException(
              TableType.FORMEL, "percent", i, "non-zero percent " + row.percent());
        }
        if (i == 0 && row.amount() != 0.0) {
          log.warn(
              "No entry found for 0 in table of type FORMEL, first bracket starts at {}",
              row.amount());
        }
        var formula = FormulaParser.parse(row.formula());
        log.debug("Parsed formula: {}", formula);
        entries.add(new Entry(row.amount(), formula));
      }
      return new Formel(entries);
    }

    @Override
    public double eval(double x) {
      for (int i = entries.size() - 1; i >= 0; i--) {
        var entry = entries.get(i);
        if (x >= entry.bracketStart()) {
          return entry.formula().evaluate(x);
        }
      }
      return 0.0;
    }
  }

  /**
   * Average rates at bracket starts, interpolated linearly in between and applied to the whole
   * income.
   */
  record Freiburg(List<Entry> entries) implements RawTable {

    private static final Logger log = LoggerFactory.getLogger(Freiburg.class);

    public record Entry(double bracketStart, double taxRate) {}

    public Freiburg {
      entries = List.copyOf(entries);
    }

    static Freiburg of(List<BracketRow> rows) throws TableShapeException {
      var entries = new ArrayList<Entry>(rows.size());
      for (int i = 0; i < rows.size(); i++) {
        var row = rows.get(i);
        requireRateOnly(TableType.FREIBURG, row, i);
        if (i == 0 && row.amount() != 0.0) {
          log.warn(
              "No entry found for 0 in table of type FREIBURG, first bracket starts at {}",
              row.amount());
        }
        entries.add(new Entry(row.amount(), row.percent()));
      }
      return new Freiburg(entries);
    }

    @Override
    public double eval(double x) {
      for (int i = entries.size() - 1; i >= 0; i--) {
        var entry = entries.get(i);
        if (x >= entry.bracketStart()) {
          double taxRate;
          if (i + 1 == entries.size()) {
            taxRate = entry.taxRate();
          } else {
            var next = entries.get(i + 1);
            double weight =
                (x - entry.bracketStart()) / (next.bracketStart() - entry.bracketStart());
            taxRate = entry.taxRate() + weight * (next.taxRate() - entry.taxRate());
          }
          return x * taxRate / 100.0;
        }
      }
      return 0.0;
    }
  }

  /** Marginal brackets given by their width; the income is consumed bracket by bracket. */
  record Zuerich(List<Entry> entries) implements RawTable {

    /** A bracket of {@code bracketLen} width, {@link Double#POSITIVE_INFINITY} for the top one. */
    public record Entry(double bracketLen, double marginalRate) {}

    public Zuerich {
      entries = List.copyOf(entries);
    }

    static Zuerich of(List<BracketRow> rows) throws TableShapeException {
      var entries = new ArrayList<Entry>(rows.size());
      for (int i = 0; i < rows.size(); i++) {
        var row = rows.get(i);
        requireRateOnly(TableType.ZUERICH, row, i);
        double bracketLen =
            row.amount() < UNBOUNDED_BRACKET_WIDTH ? row.amount() : Double.POSITIVE_INFINITY;
        entries.add(new Entry(bracketLen, row.percent()));
      }
      return new Zuerich(entries);
    }

    @Override
    public double eval(double x) {
      double tax = 0.0;
      double remaining = x;
      for (var entry : entries) {
        if (remaining <= entry.bracketLen()) {
          tax += remaining * entry.marginalRate() / 100.0;
          break;
        }
        tax += entry.bracketLen() * entry.marginalRate() / 100.0;
        remaining -= entry.bracketLen();
      }
      return tax;
    }
  }

  private static void requireRateOnly(TableType type, BracketRow row, int index)
      throws TableShapeException {
    if (!row.formula().isEmpty()) {
      throw new TableShapeException(
          type, "formula", index, "non-empty formula \"" + row.formula() + "\"");
    }
    if (row.taxes() != 0.0) {
      throw new TableShapeException(type, "taxes", index, "non-zero taxes " + row.taxes());
    }
  }
}
