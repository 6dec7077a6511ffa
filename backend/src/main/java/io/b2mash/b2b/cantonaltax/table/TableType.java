package io.b2mash.b2b.cantonaltax.table;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Shape of a published tax scale. */
public enum TableType {
  @JsonProperty("")
  UNKNOWN,
  BUND,
  FLATTAX,
  FORMEL,
  FREIBURG,
  ZUERICH
}
