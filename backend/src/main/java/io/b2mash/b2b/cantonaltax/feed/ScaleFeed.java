package io.b2mash.b2b.cantonaltax.feed;

import java.util.List;

/** Content of a {@code scales-<year>.json} file. */
public record ScaleFeed(List<Scale> response) {

  public ScaleFeed {
    response = response == null ? List.of() : List.copyOf(response);
  }
}
