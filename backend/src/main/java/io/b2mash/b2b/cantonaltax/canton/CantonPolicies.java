package io.b2mash.b2b.cantonaltax.canton;

import io.b2mash.b2b.cantonaltax.table.EvalPolicy;
import java.util.Map;
import java.util.Set;

/** Rounding and splitting policy of each canton's income tax scale. */
public final class CantonPolicies {

  /** Pseudo-canton under which the federal scale is stored. */
  public static final String FEDERAL = "CH";

  /** Cantons left out of compiled tax years. */
  public static final Set<String> EXCLUDED = Set.of("VS");

  private static final Map<String, EvalPolicy> POLICIES =
      Map.ofEntries(
          Map.entry("BL", EvalPolicy.RAW),
          Map.entry("GE", EvalPolicy.RAW),
          Map.entry("GR", EvalPolicy.RAW),
          Map.entry("SO", EvalPolicy.RAW),
          Map.entry("UR", EvalPolicy.NO_SPLIT_RAW),
          Map.entry("AG", EvalPolicy.ROUND_100),
          Map.entry("AI", EvalPolicy.DOUBLE_ROUND_100),
          Map.entry("FR", EvalPolicy.DOUBLE_ROUND_100),
          Map.entry("GL", EvalPolicy.DOUBLE_ROUND_100),
          Map.entry("NE", EvalPolicy.DOUBLE_ROUND_100),
          Map.entry("NW", EvalPolicy.DOUBLE_ROUND_100),
          Map.entry("SG", EvalPolicy.DOUBLE_ROUND_100),
          Map.entry("SH", EvalPolicy.DOUBLE_ROUND_100),
          Map.entry("SZ", EvalPolicy.DOUBLE_ROUND_100),
          Map.entry("TG", EvalPolicy.DOUBLE_ROUND_100),
          Map.entry("VD", EvalPolicy.DOUBLE_ROUND_100),
          Map.entry("AR", EvalPolicy.NO_SPLIT_ROUND_100),
          Map.entry("BE", EvalPolicy.NO_SPLIT_ROUND_100),
          Map.entry("BS", EvalPolicy.NO_SPLIT_ROUND_100),
          Map.entry("JU", EvalPolicy.NO_SPLIT_ROUND_100),
          Map.entry("LU", EvalPolicy.NO_SPLIT_ROUND_100),
          Map.entry("OW", EvalPolicy.NO_SPLIT_ROUND_100),
          Map.entry("TI", EvalPolicy.NO_SPLIT_ROUND_100),
          Map.entry("ZG", EvalPolicy.NO_SPLIT_ROUND_100),
          Map.entry("ZH", EvalPolicy.NO_SPLIT_ROUND_100),
          Map.entry(FEDERAL, EvalPolicy.NO_SPLIT_ROUND_100),
          Map.entry("VS", EvalPolicy.VALAIS));

  private CantonPolicies() {}

  /**
   * Returns the policy of a canton code such as {@code "ZH"} or {@link #FEDERAL}.
   *
   * @throws IllegalArgumentException if the code is unknown
   */
  public static EvalPolicy policyOf(String canton) {
    var policy = POLICIES.get(canton);
    if (policy == null) {
      throw new IllegalArgumentException("Unknown canton: " + canton);
    }
    return policy;
  }

  /**
   * Checks that a canton code is known.
   *
   * @throws IllegalArgumentException if the code is unknown
   */
  public static void requireKnown(String canton) {
    policyOf(canton);
  }

  public static Set<String> cantons() {
    return POLICIES.keySet();
  }
}
