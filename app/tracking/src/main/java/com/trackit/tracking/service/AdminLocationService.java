/*
 * どこで: Tracking サービス層 (運用者向け)
 * 何を: ロケーションキャッシュの一覧/別名設定/再試行を提供する
 * なぜ: ジオコーディングに失敗した地名を運用者が手動で補正できるようにするため
 */
package com.trackit.tracking.service;

import com.trackit.tracking.api.LocationNotFoundException;
import com.trackit.tracking.model.AliasUpdateResult;
import com.trackit.tracking.model.LocationEntry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AdminLocationService {

  private static final Logger logger = LoggerFactory.getLogger(AdminLocationService.class);

  private final GeocodingCache geocodingCache;

  public List<LocationEntry> listLocations(boolean failedOnly) {
    return geocodingCache.list(failedOnly);
  }

  public AliasUpdateResult updateAlias(String locationKey, String alias, String actorUserId) {
    validateKey(locationKey);
    logger.info("location alias requested key={} actor={}", locationKey, actorUserId);
    final boolean geocoded = geocodingCache.setAlias(locationKey, alias);
    final LocationEntry entry =
        geocodingCache
            .find(locationKey)
            .orElseThrow(() -> new LocationNotFoundException(locationKey));
    return new AliasUpdateResult(geocoded, entry);
  }

  public LocationEntry retryGeocoding(String locationKey, String actorUserId) {
    validateKey(locationKey);
    logger.info("location retry requested key={} actor={}", locationKey, actorUserId);
    return geocodingCache.retry(locationKey);
  }

  private void validateKey(String locationKey) {
    if (locationKey == null || locationKey.isBlank()) {
      throw new IllegalArgumentException("locationKey is required");
    }
  }
}
