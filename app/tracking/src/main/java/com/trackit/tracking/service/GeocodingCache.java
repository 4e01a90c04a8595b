/*
 * どこで: Tracking サービス層
 * 何を: 正規化済みロケーション文字列ごとのジオコーディング結果を保持・再利用する
 * なぜ: レート制限の厳しいジオコーダ呼び出しを全パッケージ横断で最小化するため
 */
package com.trackit.tracking.service;

import com.trackit.common.concurrent.KeyedLocks;
import com.trackit.tracking.api.LocationNotFoundException;
import com.trackit.tracking.model.GeocodeResult;
import com.trackit.tracking.model.LocationEntry;
import com.trackit.tracking.repository.LocationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GeocodingCache {

  private static final Logger logger = LoggerFactory.getLogger(GeocodingCache.class);

  private final LocationRepository locationRepository;
  private final Geocoder geocoder;
  private final LocationNormalizer locationNormalizer;
  private final TrackingMetrics metrics;
  private final Clock clock;
  private final KeyedLocks keyLocks = new KeyedLocks();

  /**
   * ロケーション文字列を解決する。
   *
   * <p>未登録のときだけジオコーダを 1 回呼ぶ。失敗済みのエントリは再試行せずそのまま返す。
   *
   * @return 「ロケーションなし」の場合は empty
   */
  public Optional<LocationEntry> resolve(String rawLocation) {
    final Optional<String> normalized = locationNormalizer.normalize(rawLocation);
    if (normalized.isEmpty()) {
      return Optional.empty();
    }
    final String key = normalized.get();
    final Optional<LocationEntry> cached = locationRepository.findByKey(key);
    if (cached.isPresent()) {
      return cached;
    }
    return Optional.of(
        keyLocks.withLock(
            key,
            () -> {
              // 先行スレッドが同じキーを解決済みなら、その結果を使う
              final Optional<LocationEntry> stored = locationRepository.findByKey(key);
              if (stored.isPresent()) {
                return stored.get();
              }
              return createEntry(key, rawLocation);
            }));
  }

  /**
   * 別名を設定して即座にジオコーディングし直す。空白の別名は別名の解除として扱う。
   *
   * @return ジオコーディングに成功したら true
   */
  public boolean setAlias(String locationKey, String alias) {
    final String key = requireKey(locationKey);
    final String normalizedAlias = alias == null || alias.isBlank() ? null : alias.strip();
    return keyLocks.withLock(
        key,
        () -> {
          final LocationEntry entry =
              locationRepository.findByKey(key).orElseThrow(() -> new LocationNotFoundException(key));
          final Instant now = Instant.now(clock);
          locationRepository.updateAlias(key, normalizedAlias, now);
          final String text =
              normalizedAlias != null
                  ? normalizedAlias
                  : locationNormalizer.searchText(entry.locationString());
          final boolean succeeded = attemptAndStore(key, text);
          logger.info(
              "location alias updated key={} aliasCleared={} geocoded={}",
              key,
              normalizedAlias == null,
              succeeded);
          return succeeded;
        });
  }

  /** 失敗状態に関わらずジオコーディングを 1 回だけやり直す。 */
  public LocationEntry retry(String locationKey) {
    final String key = requireKey(locationKey);
    return keyLocks.withLock(
        key,
        () -> {
          final LocationEntry entry =
              locationRepository.findByKey(key).orElseThrow(() -> new LocationNotFoundException(key));
          final String text =
              entry.alias() != null && !entry.alias().isBlank()
                  ? entry.alias()
                  : locationNormalizer.searchText(entry.locationString());
          attemptAndStore(key, text);
          return locationRepository.findByKey(key).orElseThrow(() -> new LocationNotFoundException(key));
        });
  }

  /** 利用回数の更新は観測用。失敗しても同期を止めない。 */
  public void incrementUsage(String locationKey) {
    if (locationKey == null || locationKey.isBlank()) {
      return;
    }
    try {
      final int updated = locationRepository.incrementUsage(locationKey);
      if (updated == 0) {
        logger.warn("location usage not incremented because entry is missing key={}", locationKey);
      }
    } catch (DataAccessException ex) {
      logger.warn("location usage increment failed key={}", locationKey, ex);
    }
  }

  public Optional<LocationEntry> find(String locationKey) {
    return locationRepository.findByKey(requireKey(locationKey));
  }

  public List<LocationEntry> list(boolean failedOnly) {
    return locationRepository.findAll(failedOnly);
  }

  public Map<String, LocationEntry> findByKeys(Collection<String> locationKeys) {
    return locationRepository.findByKeys(locationKeys).stream()
        .collect(Collectors.toMap(LocationEntry::locationKey, Function.identity()));
  }

  private LocationEntry createEntry(String key, String rawLocation) {
    final String searchText = locationNormalizer.searchText(rawLocation);
    final Optional<GeocodeResult> result = attempt(key, searchText);
    final Instant now = Instant.now(clock);
    final LocationEntry entry =
        result
            .map(
                found ->
                    new LocationEntry(
                        key,
                        rawLocation.strip(),
                        null,
                        found.latitude(),
                        found.longitude(),
                        found.displayName(),
                        found.countryCode(),
                        now,
                        false,
                        0L))
            .orElseGet(
                () ->
                    new LocationEntry(
                        key, rawLocation.strip(), null, null, null, null, null, now, true, 0L));
    if (locationRepository.insertIfAbsent(entry, now) == 0) {
      // 別インスタンスが先に作成した行を正とする
      logger.info("location entry created concurrently key={}", key);
      return locationRepository.findByKey(key).orElse(entry);
    }
    return entry;
  }

  private boolean attemptAndStore(String key, String text) {
    final Instant now = Instant.now(clock);
    final Optional<GeocodeResult> result = attempt(key, text);
    if (result.isPresent()) {
      locationRepository.markGeocoded(key, result.get(), now);
      return true;
    }
    locationRepository.markFailed(key, now);
    return false;
  }

  private Optional<GeocodeResult> attempt(String key, String text) {
    try {
      final GeocodeResult result = geocoder.geocode(text);
      metrics.recordGeocode("success");
      return Optional.of(result);
    } catch (GeocodingException ex) {
      metrics.recordGeocode(ex.reason().name().toLowerCase(Locale.ROOT));
      logger.warn("geocoding failed key={} reason={} text={}", key, ex.reason(), text);
      return Optional.empty();
    } catch (RuntimeException ex) {
      // 想定外の失敗も失敗として記録し、同期や表示へは伝播させない
      metrics.recordGeocode("error");
      logger.warn("geocoding failed unexpectedly key={} text={}", key, text, ex);
      return Optional.empty();
    }
  }

  private String requireKey(String locationKey) {
    return locationNormalizer
        .normalize(locationKey)
        .orElseThrow(() -> new IllegalArgumentException("locationKey is required"));
  }
}
