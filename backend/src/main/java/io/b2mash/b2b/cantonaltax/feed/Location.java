package io.b2mash.b2b.cantonaltax.feed;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Municipality a published scale or rate applies to. */
public record Location(
    @JsonProperty("BfsID") int bfsId,
    @JsonProperty("BfsName") String bfsName,
    @JsonProperty("CantonID") int cantonId,
    @JsonProperty("Canton") String canton,
    @JsonProperty("City") String city,
    @JsonProperty("TaxLocationID") int taxLocationId,
    @JsonProperty("ZipCode") String zipCode) {}
