package io.b2mash.b2b.cantonaltax.feed;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.b2b.cantonaltax.table.BracketRow;
import io.b2mash.b2b.cantonaltax.table.TableType;
import java.util.List;
import java.util.Set;

/**
 * A published tax scale for one location, authority and tax type.
 *
 * @param group comma-separated group codes, see {@link Group#parseList(String)}
 * @param splitting divisor applied to a married couple's income, 0 for none
 */
public record Scale(
    @JsonProperty("Location") Location location,
    @JsonProperty("Group") String group,
    @JsonProperty("Splitting") double splitting,
    @JsonProperty("TableType") TableType tableType,
    @JsonProperty("Target") Target target,
    @JsonProperty("TaxType") TaxType taxType,
    @JsonProperty("Table") List<BracketRow> table) {

  public Scale {
    table = table == null ? List.of() : List.copyOf(table);
  }

  public Set<Group> groups() {
    return Group.parseList(group == null ? "" : group);
  }

  public boolean isIncomeTaxOf(Target expected) {
    return taxType == TaxType.EINKOMMENSSTEUER && target == expected;
  }
}
