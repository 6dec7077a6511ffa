package io.b2mash.b2b.cantonaltax.calculation.dto;

import java.util.List;

public record ScaleReport(
    int year, String target, List<Double> incomes, List<ScaleReportEntry> scales) {}
