package com.trackit.tracking.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

class LocationNormalizerTest {

  private final LocationNormalizer normalizer = new LocationNormalizer();

  @Test
  void cosmeticVariantsShareOneKey() {
    assertThat(normalizer.normalize("LONDON, UK")).contains("london, uk");
    assertThat(normalizer.normalize("london, uk")).contains("london, uk");
    assertThat(normalizer.normalize("  London,  UK ")).contains("london, uk");
    assertThat(normalizer.normalize("London,\tUK\n")).contains("london, uk");
  }

  @ParameterizedTest
  @NullSource
  @ValueSource(strings = {"", " ", "\t\n "})
  void blankMeansNoLocation(String raw) {
    assertThat(normalizer.normalize(raw)).isEmpty();
  }

  @Test
  void keyKeepsFacilitySuffix() {
    // サフィックス除去は検索文字列だけに効く
    assertThat(normalizer.normalize("East Grinstead DO")).contains("east grinstead do");
  }

  @Test
  void searchTextStripsTrailingFacilitySuffix() {
    assertThat(normalizer.searchText("East Grinstead DO")).isEqualTo("East Grinstead");
    assertThat(normalizer.searchText("Chester  MC")).isEqualTo("Chester");
    assertThat(normalizer.searchText("Leeds dc")).isEqualTo("Leeds");
    assertThat(normalizer.searchText("LOS ANGELES CA INTERNATIONAL DISTRIBUTION CENTER"))
        .isEqualTo("LOS ANGELES CA");
    assertThat(normalizer.searchText("CHICAGO IL DISTRIBUTION CENTER")).isEqualTo("CHICAGO IL");
  }

  @Test
  void searchTextKeepsWordsThatOnlyEndLikeSuffix() {
    assertThat(normalizer.searchText("ORLANDO")).isEqualTo("ORLANDO");
    assertThat(normalizer.searchText("  New York,   NY  ")).isEqualTo("New York, NY");
  }
}
