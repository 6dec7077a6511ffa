package io.b2mash.b2b.cantonaltax.canton;

/**
 * Scales of a canton together with its income tax multiplier.
 *
 * @param rate multiplier in percent applied to the simple tax
 */
public record CantonalBase(double rate, CantonalScale scale) {}
