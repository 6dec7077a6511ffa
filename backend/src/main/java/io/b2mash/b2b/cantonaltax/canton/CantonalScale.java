package io.b2mash.b2b.cantonaltax.canton;

import io.b2mash.b2b.cantonaltax.table.TaxTable;

/**
 * Income tax scales of one canton.
 *
 * @param splitting splitting ratio used with the married table, 0 for none
 */
public record CantonalScale(double splitting, TaxTable single, TaxTable married) {

  public double singleTax(double income) {
    return single.eval(income);
  }

  public double marriedTax(double income) {
    return married.evalSplit(income, splitting);
  }
}
