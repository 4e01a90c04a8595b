/*
 * どこで: Tracking サービス層
 * 何を: パッケージのイベントを時系列順に座標付きで返す
 * なぜ: 地図表示が同期処理やジオコーダを意識せずに済むようにするため
 */
package com.trackit.tracking.service;

import com.google.common.annotations.VisibleForTesting;
import com.trackit.tracking.api.PackageNotFoundException;
import com.trackit.tracking.model.DeliveryLocationRecord;
import com.trackit.tracking.model.DeliveryTarget;
import com.trackit.tracking.model.LocatedEvent;
import com.trackit.tracking.model.LocationEntry;
import com.trackit.tracking.model.PackageLocations;
import com.trackit.tracking.model.PackageRecord;
import com.trackit.tracking.model.TrackingEventRecord;
import com.trackit.tracking.repository.DeliveryLocationRepository;
import com.trackit.tracking.repository.PackageRepository;
import com.trackit.tracking.repository.TrackingEventRepository;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PackageLocationService {

  private static final Logger logger = LoggerFactory.getLogger(PackageLocationService.class);
  private static final double EARTH_RADIUS_KM = 6371.0088d;

  private final PackageRepository packageRepository;
  private final TrackingEventRepository trackingEventRepository;
  private final DeliveryLocationRepository deliveryLocationRepository;
  private final GeocodingCache geocodingCache;

  public PackageLocations resolveLocationsForPackage(String packageId) {
    final PackageRecord trackedPackage =
        packageRepository
            .findById(packageId)
            .orElseThrow(() -> new PackageNotFoundException(packageId));
    final List<TrackingEventRecord> timeline = trackingEventRepository.findTimeline(packageId);

    final Set<String> keys = new LinkedHashSet<>();
    for (TrackingEventRecord event : timeline) {
      if (event.locationKey() != null) {
        keys.add(event.locationKey());
      }
    }
    final Map<String, LocationEntry> entries = new HashMap<>(geocodingCache.findByKeys(keys));
    for (TrackingEventRecord event : timeline) {
      // キャッシュ行が無いキーはここで遅延解決する
      if (event.locationKey() != null && !entries.containsKey(event.locationKey())) {
        resolveQuietly(packageId, event).ifPresent(entry -> entries.put(entry.locationKey(), entry));
      }
    }

    final List<LocatedEvent> events = new ArrayList<>(timeline.size());
    for (TrackingEventRecord event : timeline) {
      final LocationEntry entry =
          event.locationKey() == null ? null : entries.get(event.locationKey());
      final boolean located = entry != null && entry.hasCoordinates();
      events.add(
          new LocatedEvent(
              event.status(),
              event.location(),
              event.locationKey(),
              event.timestamp(),
              event.description(),
              located ? entry.latitude() : null,
              located ? entry.longitude() : null,
              located ? entry.displayName() : null));
    }

    return new PackageLocations(
        packageId,
        trackedPackage.originCountry(),
        trackedPackage.destinationCountry(),
        events,
        deliveryTarget(trackedPackage, events));
  }

  private Optional<LocationEntry> resolveQuietly(String packageId, TrackingEventRecord event) {
    try {
      return geocodingCache.resolve(event.location());
    } catch (RuntimeException ex) {
      // 未解決のまま表示する
      logger.warn(
          "lazy location resolve failed packageId={} key={}", packageId, event.locationKey(), ex);
      return Optional.empty();
    }
  }

  private DeliveryTarget deliveryTarget(PackageRecord trackedPackage, List<LocatedEvent> events) {
    if (trackedPackage.deliveryLocationId() == null) {
      return null;
    }
    final Optional<DeliveryLocationRecord> found =
        deliveryLocationRepository.findById(trackedPackage.deliveryLocationId());
    if (found.isEmpty()) {
      return null;
    }
    final DeliveryLocationRecord target = found.get();
    Double distanceKm = null;
    if (target.latitude() != null && target.longitude() != null) {
      // 最新の座標付きイベントからの距離
      for (int i = events.size() - 1; i >= 0; i--) {
        final LocatedEvent event = events.get(i);
        if (event.hasCoordinates()) {
          distanceKm =
              haversineKm(
                  event.latitude(), event.longitude(), target.latitude(), target.longitude());
          break;
        }
      }
    }
    return new DeliveryTarget(
        target.deliveryLocationId(),
        target.name(),
        target.address(),
        target.latitude(),
        target.longitude(),
        distanceKm);
  }

  @VisibleForTesting
  static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
    final double dLat = Math.toRadians(lat2 - lat1);
    final double dLon = Math.toRadians(lon2 - lon1);
    final double a =
        Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(Math.toRadians(lat1))
                * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2)
                * Math.sin(dLon / 2);
    return 2 * EARTH_RADIUS_KM * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
  }
}
