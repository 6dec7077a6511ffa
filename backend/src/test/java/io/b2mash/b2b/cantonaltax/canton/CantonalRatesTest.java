package io.b2mash.b2b.cantonaltax.canton;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.b2mash.b2b.cantonaltax.exception.InvalidTaxDataException;
import io.b2mash.b2b.cantonaltax.feed.Location;
import io.b2mash.b2b.cantonaltax.feed.Rate;
import io.b2mash.b2b.cantonaltax.feed.RateFeed;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CantonalRatesTest {

  private static Rate rate(String canton, String city, double incomeRate) {
    return new Rate(new Location(1, city, 2, canton, city, 1000, "1000"), incomeRate);
  }

  @Test
  void fromFeed_keepsOneRatePerCanton() {
    var feed =
        new RateFeed(
            List.of(
                rate("ZH", "Zuerich", 98), rate("ZH", "Winterthur", 98), rate("BE", "Bern", 302)));

    var rates = CantonalRates.fromFeed(2024, feed);

    assertThat(rates).containsEntry("ZH", 98.0).containsEntry("BE", 302.0).hasSize(3);
  }

  @Test
  void fromFeed_addsFederalRate() {
    var rates = CantonalRates.fromFeed(2024, new RateFeed(List.of()));

    assertThat(rates).containsExactly(Map.entry("CH", 100.0));
  }

  @Test
  void geneva_rebateAndSurcharge() {
    assertThat(CantonalRates.adjust("GE", 2024, 100)).isCloseTo(89.0, within(1e-9));
    assertThat(CantonalRates.adjust("GE", 2015, 50)).isCloseTo(45.0, within(1e-9));
  }

  @Test
  void vaud_rebateFrom2024() {
    assertThat(CantonalRates.adjust("VD", 2024, 155)).isCloseTo(149.575, within(1e-9));
    assertThat(CantonalRates.adjust("VD", 2025, 100)).isCloseTo(96.5, within(1e-9));
    assertThat(CantonalRates.adjust("VD", 2023, 155)).isEqualTo(155.0);
  }

  @Test
  void otherCantons_unchanged() {
    assertThat(CantonalRates.adjust("ZH", 2024, 98)).isEqualTo(98.0);
  }

  @Test
  void fromFeed_appliesAdjustmentsBeforeComparingLocations() {
    var feed = new RateFeed(List.of(rate("GE", "Geneve", 100), rate("GE", "Carouge", 100)));

    assertThat(CantonalRates.fromFeed(2024, feed).get("GE")).isCloseTo(89.0, within(1e-9));
  }

  @Test
  void fromFeed_rejectsInconsistentRates() {
    var feed = new RateFeed(List.of(rate("ZH", "Zuerich", 98), rate("ZH", "Winterthur", 100)));

    assertThatThrownBy(() -> CantonalRates.fromFeed(2024, feed))
        .isInstanceOf(InvalidTaxDataException.class)
        .satisfies(
            e ->
                assertThat(((InvalidTaxDataException) e).getBody().getDetail())
                    .contains("ZH")
                    .contains("2024"));
  }
}
