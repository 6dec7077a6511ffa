package io.b2mash.b2b.cantonaltax.table;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * One row of a published tax scale.
 *
 * @param formula formula text, empty unless the scale is formula-based
 * @param taxes base tax at the bracket start
 * @param percent marginal, flat or average rate in percent
 * @param amount bracket start, or bracket width for Zurich-style scales
 */
public record BracketRow(
    @JsonProperty("Formula") String formula,
    @JsonProperty("Taxes") double taxes,
    @JsonProperty("Percent") double percent,
    @JsonProperty("Amount") double amount) {

  public BracketRow {
    formula = Objects.requireNonNullElse(formula, "");
  }
}
