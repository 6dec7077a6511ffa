package io.b2mash.b2b.cantonaltax.feed;

public enum TaxType {
  EINKOMMENSSTEUER,
  ERBSCHAFT,
  GEWINNSTEUER,
  KAPITALSTEUER,
  VERMOEGENSSTEUER,
  VORSORGESTEUER
}
