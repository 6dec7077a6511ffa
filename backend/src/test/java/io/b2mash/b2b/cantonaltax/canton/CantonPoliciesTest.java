package io.b2mash.b2b.cantonaltax.canton;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.cantonaltax.table.EvalPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CantonPoliciesTest {

  @ParameterizedTest
  @ValueSource(
      strings = {
        "AG", "AI", "AR", "BE", "BL", "BS", "FR", "GE", "GL", "GR", "JU", "LU", "NE", "NW", "OW",
        "SG", "SH", "SO", "SZ", "TG", "TI", "UR", "VD", "VS", "ZG", "ZH", "CH"
      })
  void everyCantonHasAPolicy(String canton) {
    assertThat(CantonPolicies.policyOf(canton)).isNotNull();
  }

  @Test
  void cantons_coversAllCantonsAndFederal() {
    assertThat(CantonPolicies.cantons()).hasSize(27).contains(CantonPolicies.FEDERAL);
  }

  @Test
  void policies_matchPublishedRoundingRules() {
    assertThat(CantonPolicies.policyOf("GE")).isEqualTo(EvalPolicy.RAW);
    assertThat(CantonPolicies.policyOf("UR")).isEqualTo(EvalPolicy.NO_SPLIT_RAW);
    assertThat(CantonPolicies.policyOf("AG")).isEqualTo(EvalPolicy.ROUND_100);
    assertThat(CantonPolicies.policyOf("FR")).isEqualTo(EvalPolicy.DOUBLE_ROUND_100);
    assertThat(CantonPolicies.policyOf("ZH")).isEqualTo(EvalPolicy.NO_SPLIT_ROUND_100);
    assertThat(CantonPolicies.policyOf("CH")).isEqualTo(EvalPolicy.NO_SPLIT_ROUND_100);
    assertThat(CantonPolicies.policyOf("VS")).isEqualTo(EvalPolicy.VALAIS);
  }

  @Test
  void valais_isExcluded() {
    assertThat(CantonPolicies.EXCLUDED).containsExactly("VS");
  }

  @Test
  void unknownCanton_isRejected() {
    assertThatThrownBy(() -> CantonPolicies.policyOf("XX"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown canton: XX");
    assertThatThrownBy(() -> CantonPolicies.policyOf("zh"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void requireKnown_acceptsCantonsAndFederal() {
    CantonPolicies.requireKnown("ZH");
    CantonPolicies.requireKnown(CantonPolicies.FEDERAL);
  }

  @Test
  void requireKnown_rejectsUnknownCode() {
    assertThatThrownBy(() -> CantonPolicies.requireKnown("XX"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown canton: XX");
  }
}
