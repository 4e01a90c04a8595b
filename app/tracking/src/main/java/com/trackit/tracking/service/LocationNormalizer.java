/*
 * どこで: Tracking サービス層
 * 何を: 生のロケーション文字列からキャッシュキーと検索文字列を作る
 * なぜ: 表記揺れを 1 エントリに集約し、ジオコーダ呼び出しを減らすため
 */
package com.trackit.tracking.service;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class LocationNormalizer {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  // 長いものから順に並べる。"INTERNATIONAL DISTRIBUTION CENTER" を先に判定するため。
  private static final Pattern FACILITY_SUFFIX =
      Pattern.compile(
          "\\s+(INTERNATIONAL DISTRIBUTION CENTER|DISTRIBUTION CENTER|DO|DC|MC)$",
          Pattern.CASE_INSENSITIVE);

  /** 空/空白のみは「ロケーションなし」として empty を返す。 */
  public Optional<String> normalize(String raw) {
    final String collapsed = collapse(raw);
    if (collapsed.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(collapsed.toLowerCase(Locale.ROOT));
  }

  /** 別名が無いときにジオコーダへ渡す文字列。キーには影響しない。 */
  public String searchText(String raw) {
    final String collapsed = collapse(raw);
    final String stripped = FACILITY_SUFFIX.matcher(collapsed).replaceFirst("");
    return stripped.isEmpty() ? collapsed : stripped;
  }

  private String collapse(String raw) {
    if (raw == null) {
      return "";
    }
    return WHITESPACE.matcher(raw.strip()).replaceAll(" ");
  }
}
