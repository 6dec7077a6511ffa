package io.b2mash.b2b.cantonaltax.table;

/**
 * Rounding and income-splitting rule applied around a {@link RawTable}.
 *
 * <p>The {@code NO_SPLIT} policies belong to scales that have no splitting ratio; they must only
 * be evaluated with a ratio of 0.
 */
public enum EvalPolicy {
  RAW,
  ROUND_100,
  DOUBLE_ROUND_100,
  NO_SPLIT_RAW,
  NO_SPLIT_ROUND_100,
  VALAIS
}
