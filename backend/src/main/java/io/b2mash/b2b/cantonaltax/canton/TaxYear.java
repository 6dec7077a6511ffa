package io.b2mash.b2b.cantonaltax.canton;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Compiled income tax bases of every canton for one year, keyed by canton code. */
public record TaxYear(int year, Map<String, CantonalBase> cantons) {

  public TaxYear {
    cantons = Collections.unmodifiableSortedMap(new TreeMap<>(cantons));
  }

  public Optional<CantonalBase> canton(String code) {
    return Optional.ofNullable(cantons.get(code));
  }
}
