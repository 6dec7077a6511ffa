package io.b2mash.b2b.cantonaltax.canton;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Compiled tax years, keyed by year. */
public record TaxDatabase(Map<Integer, TaxYear> years) {

  public TaxDatabase {
    years = Collections.unmodifiableSortedMap(new TreeMap<>(years));
  }
}
