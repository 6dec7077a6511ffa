package io.b2mash.b2b.cantonaltax.feed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tax multipliers of one location. Only the cantonal income tax multiplier is read; the
 * municipal, church, wealth and profit multipliers are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Rate(
    @JsonProperty("Location") Location location,
    @JsonProperty("IncomeRateCanton") double incomeRateCanton) {}
