package io.b2mash.b2b.cantonaltax.calculation.dto;

import java.util.List;

/**
 * Sampled taxes of one published scale. All tax lists are empty and {@code error} is set when the
 * scale could not be compiled.
 *
 * @param rate income tax rate in percent of the scale's canton, 100 for the federal scale, null
 *     when the canton publishes no rate
 * @param singleTaxes {@code eval} at each sample income
 * @param splitTaxes {@code evalSplit} with the scale's splitting ratio at each sample income
 * @param cantonalSingleTaxes {@code singleTaxes} multiplied by {@code rate}
 * @param cantonalSplitTaxes {@code splitTaxes} multiplied by {@code rate}
 */
public record ScaleReportEntry(
    String canton,
    String group,
    boolean single,
    boolean married,
    double splitting,
    Double rate,
    List<Double> singleTaxes,
    List<Double> splitTaxes,
    List<Double> cantonalSingleTaxes,
    List<Double> cantonalSplitTaxes,
    String error) {}
