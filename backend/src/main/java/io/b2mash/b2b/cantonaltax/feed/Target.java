package io.b2mash.b2b.cantonaltax.feed;

/** Authority levying a tax. */
public enum Target {
  BUND,
  GEMEINDE,
  KANTON,
  KIRCHE
}
