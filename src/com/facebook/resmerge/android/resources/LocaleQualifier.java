/*
 * Copyright 2019-present Facebook, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License. You may obtain
 * a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.facebook.resmerge.android.resources;

import com.facebook.resmerge.core.exceptions.HumanReadableException;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A locale, as used by resource directory qualifiers.
 *
 * <p>Two spellings interconvert: the platform's legacy qualifier ({@code fr}, {@code zh-rTW},
 * {@code iw}, {@code b+sr+Latn}) and a canonical language tag ({@code fr}, {@code zh-TW}, {@code
 * he}, {@code sr-Latn}). The language tag always uses modern ISO 639-1 codes, while the legacy
 * qualifier uses the codes older platform releases understand.
 *
 * <p>Parsing is partial: anything that is not a recognizable locale yields {@link
 * Optional#empty()} rather than a best-effort guess.
 */
public final class LocaleQualifier implements Comparable<LocaleQualifier> {

  private static final Pattern LEGACY_QUALIFIER =
      Pattern.compile("([a-z]{2,3})(?:-r([A-Z]{2}))?");

  private static final Pattern EXTENDED_QUALIFIER =
      Pattern.compile("b\\+([a-z]{2,3})((?:\\+\\w+)*)");

  private static final Pattern LANGUAGE_TAG =
      Pattern.compile("([a-z]{2,3})(?:[-_]([A-Z][a-z]{3}))?(?:[-_]([A-Z]{2}|[0-9]{3}))?");

  private static final Pattern SCRIPT = Pattern.compile("[A-Za-z]{4}");
  private static final Pattern REGION = Pattern.compile("[A-Za-z]{2}|[0-9]{3}");

  /**
   * Modern codes whose historical spelling is the only one older platform releases recognize,
   * plus Filipino, which only exists there under its Tagalog code.
   */
  private static final ImmutableBiMap<String, String> MODERN_TO_LEGACY_LANGUAGE =
      ImmutableBiMap.of(
          "he", "iw",
          "id", "in",
          "yi", "ji",
          "fil", "tl");

  /** Macrolanguages that resources must be filed under their principal language instead. */
  private static final ImmutableMap<String, String> MACROLANGUAGE_TO_PRINCIPAL =
      ImmutableMap.of("no", "nb");

  /** The legacy qualifier for Latin American Spanish, which has no numeric-region spelling. */
  private static final String LATIN_AMERICA = "419";

  private static final String LATIN_AMERICAN_SPANISH_LEGACY_REGION = "US";

  private static final ImmutableMap<String, String> THREE_LETTER_TO_TWO_LETTER_LANGUAGE =
      buildThreeLetterLanguageTable();

  private final String language;
  private final Optional<String> script;
  private final Optional<String> region;

  private LocaleQualifier(String language, Optional<String> script, Optional<String> region) {
    this.language = language;
    this.script = script;
    this.region = region;
  }

  public static LocaleQualifier of(String language) {
    return new LocaleQualifier(toModernLanguage(language), Optional.empty(), Optional.empty());
  }

  public static LocaleQualifier of(String language, String region) {
    return new LocaleQualifier(toModernLanguage(language), Optional.empty(), Optional.of(region));
  }

  /**
   * Parses a legacy or extended ({@code b+}) qualifier, the part of a directory name after {@code
   * values-}.
   */
  public static Optional<LocaleQualifier> fromAndroidQualifier(String qualifier) {
    Matcher legacy = LEGACY_QUALIFIER.matcher(qualifier);
    if (legacy.matches()) {
      String language = toModernLanguage(legacy.group(1));
      Optional<String> region = Optional.ofNullable(legacy.group(2));
      if (language.equals("es")
          && region.equals(Optional.of(LATIN_AMERICAN_SPANISH_LEGACY_REGION))) {
        region = Optional.of(LATIN_AMERICA);
      }
      return Optional.of(new LocaleQualifier(language, Optional.empty(), region));
    }

    Matcher extended = EXTENDED_QUALIFIER.matcher(qualifier);
    if (!extended.matches()) {
      return Optional.empty();
    }
    Optional<String> script = Optional.empty();
    Optional<String> region = Optional.empty();
    for (String subtag : Splitter.on('+').omitEmptyStrings().split(extended.group(2))) {
      if (!script.isPresent() && !region.isPresent() && SCRIPT.matcher(subtag).matches()) {
        script =
            Optional.of(subtag.substring(0, 1).toUpperCase() + subtag.substring(1).toLowerCase());
      } else if (!region.isPresent() && REGION.matcher(subtag).matches()) {
        region = Optional.of(subtag.toUpperCase());
      } else {
        // Variants and extensions have no place in a resource qualifier we know how to handle.
        return Optional.empty();
      }
    }
    return Optional.of(
        new LocaleQualifier(toModernLanguage(extended.group(1)), script, region));
  }

  /** Parses a language tag such as {@code en-US}, {@code es-419} or {@code sr-Latn}. */
  public static Optional<LocaleQualifier> fromLanguageTag(String tag) {
    Matcher matcher = LANGUAGE_TAG.matcher(tag);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return Optional.of(
        new LocaleQualifier(
            toModernLanguage(matcher.group(1)),
            Optional.ofNullable(matcher.group(2)),
            Optional.ofNullable(matcher.group(3))));
  }

  /**
   * Parses a language tag that must be expressible as a legacy qualifier, as required for locale
   * allow-lists.
   *
   * @throws HumanReadableException if the tag is malformed or needs the extended form.
   */
  public static LocaleQualifier parseLegacyExpressibleLanguageTag(String tag) {
    Optional<LocaleQualifier> locale = fromLanguageTag(tag);
    if (!locale.isPresent() || !locale.get().isLegacyExpressible()) {
      throw new HumanReadableException("Unsupported locale name: %s", tag);
    }
    return locale.get();
  }

  /**
   * Parses an allow-list entry, which is either a legacy qualifier such as {@code en-rGB} or a
   * language tag such as {@code en-GB}. Extended {@code b+} qualifiers are not accepted.
   *
   * @throws HumanReadableException if the name is neither, or needs the extended form.
   */
  public static LocaleQualifier parseAllowListLocale(String name) {
    if (LEGACY_QUALIFIER.matcher(name).matches()) {
      return fromAndroidQualifier(name).get();
    }
    return parseLegacyExpressibleLanguageTag(name);
  }

  private static String toModernLanguage(String language) {
    String modern = MODERN_TO_LEGACY_LANGUAGE.inverse().getOrDefault(language, language);
    modern = MACROLANGUAGE_TO_PRINCIPAL.getOrDefault(modern, modern);
    return THREE_LETTER_TO_TWO_LETTER_LANGUAGE.getOrDefault(modern, modern);
  }

  private static ImmutableMap<String, String> buildThreeLetterLanguageTable() {
    Map<String, String> table = new HashMap<>();
    for (String twoLetter : Locale.getISOLanguages()) {
      try {
        String threeLetter = new Locale(twoLetter).getISO3Language();
        String modern = MODERN_TO_LEGACY_LANGUAGE.inverse().getOrDefault(twoLetter, twoLetter);
        if (!threeLetter.isEmpty() && !threeLetter.equals(modern)) {
          table.putIfAbsent(threeLetter, MACROLANGUAGE_TO_PRINCIPAL.getOrDefault(modern, modern));
        }
      } catch (MissingResourceException e) {
        // No three-letter code is known for this language, so there is nothing to collapse.
        continue;
      }
    }
    return ImmutableMap.copyOf(table);
  }

  public String getLanguage() {
    return language;
  }

  public Optional<String> getScript() {
    return script;
  }

  public Optional<String> getRegion() {
    return region;
  }

  /** @return the same locale without script and region, e.g. {@code en} for {@code en-US}. */
  public LocaleQualifier getLanguageOnly() {
    return new LocaleQualifier(language, Optional.empty(), Optional.empty());
  }

  /** Whether {@link #toAndroidQualifier()} avoids the extended {@code b+} form. */
  public boolean isLegacyExpressible() {
    if (script.isPresent()) {
      return false;
    }
    if (!region.isPresent()) {
      return true;
    }
    return !Character.isDigit(region.get().charAt(0)) || isLatinAmericanSpanish();
  }

  private boolean isLatinAmericanSpanish() {
    return language.equals("es") && region.equals(Optional.of(LATIN_AMERICA));
  }

  /** @return the qualifier as platform directory names spell it, e.g. {@code iw-rIL}. */
  public String toAndroidQualifier() {
    String legacyLanguage = MODERN_TO_LEGACY_LANGUAGE.getOrDefault(language, language);
    if (isLatinAmericanSpanish()) {
      return legacyLanguage + "-r" + LATIN_AMERICAN_SPANISH_LEGACY_REGION;
    }
    if (!isLegacyExpressible()) {
      ImmutableList.Builder<String> parts = ImmutableList.builder();
      parts.add("b", legacyLanguage);
      script.ifPresent(parts::add);
      region.ifPresent(parts::add);
      return Joiner.on('+').join(parts.build());
    }
    return region.map(r -> legacyLanguage + "-r" + r).orElse(legacyLanguage);
  }

  /** @return the canonical language tag, e.g. {@code he-IL}. */
  public String toLanguageTag() {
    StringBuilder tag = new StringBuilder(language);
    script.ifPresent(s -> tag.append('-').append(s));
    region.ifPresent(r -> tag.append('-').append(r));
    return tag.toString();
  }

  @Override
  public int compareTo(LocaleQualifier other) {
    return toLanguageTag().compareTo(other.toLanguageTag());
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof LocaleQualifier)) {
      return false;
    }
    LocaleQualifier that = (LocaleQualifier) other;
    return language.equals(that.language)
        && script.equals(that.script)
        && region.equals(that.region);
  }

  @Override
  public int hashCode() {
    return Objects.hash(language, script, region);
  }

  @Override
  public String toString() {
    return toLanguageTag();
  }
}
