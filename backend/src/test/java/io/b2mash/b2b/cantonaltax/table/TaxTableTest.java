package io.b2mash.b2b.cantonaltax.table;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

class TaxTableTest {

  // 5% up to 10'000, then 500 + 10% above
  private static final RawTable BRACKETS =
      new RawTable.Bund(
          List.of(new RawTable.Bund.Entry(0, 0, 5), new RawTable.Bund.Entry(10_000, 500, 10)));

  private static TaxTable table(EvalPolicy policy) {
    return new TaxTable(BRACKETS, policy);
  }

  @Test
  void of_compilesRowsWithPolicy() throws Exception {
    var table =
        TaxTable.of(
            TableType.BUND,
            List.of(new BracketRow("", 0, 5, 0), new BracketRow("", 500, 10, 10_000)),
            EvalPolicy.RAW);

    assertThat(table).isEqualTo(table(EvalPolicy.RAW));
    assertThat(table.eval(5_000)).isEqualTo(250.0);
    assertThat(table.eval(20_000)).isEqualTo(1_500.0);
  }

  @Test
  void floor100_roundsDownToHundreds() {
    assertThat(TaxTable.floor100(0)).isZero();
    assertThat(TaxTable.floor100(99.99)).isZero();
    assertThat(TaxTable.floor100(100)).isEqualTo(100.0);
    assertThat(TaxTable.floor100(12_345.67)).isEqualTo(12_300.0);
  }

  @ParameterizedTest
  @ValueSource(doubles = {0, 0.5, 99, 100, 1_234.5, 99_999.99, 1e9})
  void floor100_isIdempotent(double x) {
    assertThat(TaxTable.floor100(TaxTable.floor100(x))).isEqualTo(TaxTable.floor100(x));
  }

  @ParameterizedTest
  @EnumSource(EvalPolicy.class)
  void evalSplit_withZeroRatio_equalsEval(EvalPolicy policy) {
    var table = table(policy);
    for (double x : new double[] {0, 50, 5_049, 10_000, 23_456.78}) {
      assertThat(table.evalSplit(x, 0.0)).isEqualTo(table.eval(x));
    }
  }

  // --- RAW ---

  @Test
  void raw_evaluatesExactIncome() {
    assertThat(table(EvalPolicy.RAW).eval(5_050)).isEqualTo(252.5);
  }

  @Test
  void raw_split_taxesEachShareAndMultiplies() {
    // 2 x tax(10'000)
    assertThat(table(EvalPolicy.RAW).evalSplit(20_000, 2.0)).isEqualTo(1_000.0);
  }

  @Test
  void valais_behavesLikeRaw() {
    var raw = table(EvalPolicy.RAW);
    var valais = table(EvalPolicy.VALAIS);

    assertThat(valais.eval(12_345)).isEqualTo(raw.eval(12_345));
    assertThat(valais.evalSplit(30_000, 1.9)).isEqualTo(raw.evalSplit(30_000, 1.9));
  }

  // --- ROUND_100 ---

  @Test
  void round100_evaluatesFlooredIncome() {
    assertThat(table(EvalPolicy.ROUND_100).eval(5_099)).isEqualTo(250.0);
  }

  @Test
  void round100_split_appliesAverageRateOfShareToFlooredIncome() {
    // xx = 25'100, yy = 10'458.33.., rate = tax(yy) / yy
    double yy = 25_100 / 2.4;
    double expected = (500 + (yy - 10_000) * 0.10) / yy * 25_100;

    assertThat(table(EvalPolicy.ROUND_100).evalSplit(25_199, 2.4))
        .isCloseTo(expected, within(1e-9));
  }

  @Test
  void round100_split_flooredToZero_isZero() {
    assertThat(table(EvalPolicy.ROUND_100).evalSplit(99, 2.0)).isZero();
  }

  // --- DOUBLE_ROUND_100 ---

  @Test
  void doubleRound100_split_floorsShareAgain() {
    // xx = 25'100, yy = floor100(10'458.33..) = 10'400, rate = 540 / 10'400
    double expected = 540.0 / 10_400 * 25_100;

    var result = table(EvalPolicy.DOUBLE_ROUND_100).evalSplit(25_199, 2.4);

    assertThat(result).isCloseTo(expected, within(1e-9));
    assertThat(result).isLessThan(table(EvalPolicy.ROUND_100).evalSplit(25_199, 2.4));
  }

  @Test
  void doubleRound100_split_shareFlooredToZero_isZero() {
    // xx = 100, xx / 2 = 50, floored to 0
    assertThat(table(EvalPolicy.DOUBLE_ROUND_100).evalSplit(150, 2.0)).isZero();
  }

  @Test
  void doubleRound100_eval_floorsOnce() {
    assertThat(table(EvalPolicy.DOUBLE_ROUND_100).eval(20_099)).isEqualTo(1_500.0);
  }

  // --- NO_SPLIT ---

  @Test
  void noSplitRaw_evaluatesWithoutRounding() {
    assertThat(table(EvalPolicy.NO_SPLIT_RAW).evalSplit(5_050, 0.0)).isEqualTo(252.5);
  }

  @Test
  void noSplitRound100_evaluatesFlooredIncome() {
    assertThat(table(EvalPolicy.NO_SPLIT_ROUND_100).evalSplit(5_050, 0.0)).isEqualTo(250.0);
  }

  @ParameterizedTest
  @EnumSource(
      value = EvalPolicy.class,
      names = {"NO_SPLIT_RAW", "NO_SPLIT_ROUND_100"})
  void noSplit_withNonZeroRatio_violatesContract(EvalPolicy policy) {
    assertThatThrownBy(() -> table(policy).evalSplit(50_000, 2.0))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining(policy.name());
  }
}
