/*
 * どこで: Tracking API
 * 何を: パッケージ同期と位置タイムライン参照のエンドポイントを提供する
 * なぜ: 同期コアの公開インターフェースを明確にするため
 */
package com.trackit.tracking.api;

import com.trackit.tracking.service.PackageLocationService;
import com.trackit.tracking.service.TrackingSyncService;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/packages")
@RequiredArgsConstructor
@Validated
public class TrackingController {

  private final TrackingSyncService trackingSyncService;
  private final PackageLocationService packageLocationService;

  @PostMapping("/{packageId}:sync")
  public SyncResponse sync(
      @PathVariable("packageId") @NotBlank(message = "packageId is required") String packageId) {
    return SyncResponse.from(trackingSyncService.syncPackage(packageId));
  }

  @GetMapping("/{packageId}/locations")
  public PackageLocationsResponse locations(
      @PathVariable("packageId") @NotBlank(message = "packageId is required") String packageId) {
    return PackageLocationsResponse.from(
        packageLocationService.resolveLocationsForPackage(packageId));
  }
}
