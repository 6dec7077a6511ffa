package io.b2mash.b2b.cantonaltax.calculation.dto;

/**
 * Income tax of a canton for one income.
 *
 * @param rate cantonal multiplier in percent
 * @param simpleTax tax read from the scale
 * @param tax simple tax multiplied by the cantonal rate
 */
public record IncomeTaxResponse(
    int year,
    String canton,
    double income,
    boolean married,
    double splitting,
    double rate,
    double simpleTax,
    double tax) {}
