package io.b2mash.b2b.cantonaltax.feed;

import java.util.List;

/** Content of a {@code rates-<year>.json} file. */
public record RateFeed(List<Rate> response) {

  public RateFeed {
    response = response == null ? List.of() : List.copyOf(response);
  }
}
