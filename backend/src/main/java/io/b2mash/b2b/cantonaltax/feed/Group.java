package io.b2mash.b2b.cantonaltax.feed;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Taxpayer group a scale applies to. Constants are named after their feed codes.
 *
 * <p>Only {@link #ALLE}, {@link #LEDIG_ALLEINE} and {@link #VERHEIRATET} matter for income tax;
 * the remaining groups are used by inheritance and gift tax scales.
 */
public enum Group {
  ALLE,
  LEDIG_ALLEINE,
  LEDIG_KONKUBINAT,
  LEDIG_MIT_KINDER,
  LEDIG_OHNE_KINDER,
  TYP_GESCHWISTER_GESCHWISTER,
  TYP_GESCHWISTER_STIEFGESCHWISTER,
  TYP_GROSSELTERN_GROSSELTERN,
  TYP_GROSSELTERN_PFLEGEGROSSELTERN,
  TYP_GROSSELTERN_STIEFGROSSELTERN,
  TYP_GROSSELTERN_URGROSSELTERN,
  TYP_EHEPARTNER_EHEPARTNER,
  TYP_ELTERN_ELTERN,
  TYP_ELTERN_PFLEGEELTERN,
  TYP_ELTERN_STIEFELTERN,
  TYP_KINDER_KINDER,
  TYP_KINDER_NACHKOMMENKINDER,
  TYP_KINDER_NACHKOMMENPFLEGEKINDER,
  TYP_KINDER_NACHKOMMENSTIEFKINDER,
  TYP_KINDER_PATENKINDER,
  TYP_KINDER_PFLEGEKINDER,
  TYP_KINDER_STIEFKINDER,
  TYP_KINDER_VOLLWAISEN,
  TYP_ONKELTANTEN_COUSIN,
  TYP_ONKELTANTEN_GROSSNEFFEN,
  TYP_ONKELTANTEN_GROSSONKEL,
  TYP_ONKELTANTEN_NACHKOMMENCOUSIN,
  TYP_ONKELTANTEN_NEFFEN,
  TYP_ONKELTANTEN_ONKEL,
  TYP_ONKELTANTEN_URGROSSNEFFEN,
  TYP_PARTNER_LEBENSPARTNER,
  TYP_PARTNER_LEBENSPARTNER_MIT_KIND,
  TYP_PARTNER_VERLOBTER,
  TYP_UEBRIGE_ANGESTELLTE,
  TYP_UEBRIGE_BESCHRAENKT,
  TYP_UEBRIGE_DAUERND_BEDUERFTIGT,
  TYP_UEBRIGE_PERSONENVEREINIGUNGEN,
  TYP_UEBRIGE_SCHWIEGERELTERN,
  TYP_UEBRIGE_SCHWIEGERSOHN,
  TYP_UEBRIGE_STIFTUNGEN,
  TYP_UEBRIGE_UEBRIGE,
  TYP_UEBRIGE_UNEHELICHEKINDER,
  TYP_UEBRIGE_VERSCHWAEGERTE,
  VERHEIRATET;

  /**
   * Parses a comma-separated list of group codes, skipping empty items.
   *
   * @throws IllegalArgumentException if a code is unknown
   */
  public static Set<Group> parseList(String codes) {
    var groups = EnumSet.noneOf(Group.class);
    Arrays.stream(codes.split(","))
        .filter(code -> !code.isEmpty())
        .map(Group::fromCode)
        .forEach(groups::add);
    return groups;
  }

  private static Group fromCode(String code) {
    try {
      return valueOf(code);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown group: " + code, e);
    }
  }

  /** Scale applies to unmarried taxpayers living alone. */
  public static boolean isSingle(Set<Group> groups) {
    return (groups.contains(ALLE) || groups.contains(LEDIG_ALLEINE))
        && !groups.contains(VERHEIRATET);
  }

  /** Scale applies to married couples. */
  public static boolean isMarried(Set<Group> groups) {
    return groups.contains(ALLE) || groups.contains(VERHEIRATET);
  }
}
