/*
 * どこで: Tracking 運用 API
 * 何を: ロケーションキャッシュの一覧/別名設定/再試行のエンドポイントを提供する
 * なぜ: 運用者がジオコーディング失敗を補正できるようにするため
 */
package com.trackit.tracking.api;

import com.trackit.tracking.service.AdminLocationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/locations")
@RequiredArgsConstructor
@Validated
public class AdminLocationController {

  // 権限判定は前段で済んでいる前提。ここでは監査ログ用に受け取るだけ。
  private static final String HEADER_ACTOR_USER_ID = "X-Actor-User-Id";

  private final AdminLocationService adminLocationService;

  @GetMapping
  public LocationsResponse list(
      @RequestParam(value = "failed_only", defaultValue = "false") boolean failedOnly) {
    return new LocationsResponse(
        adminLocationService.listLocations(failedOnly).stream()
            .map(LocationEntryResponse::from)
            .toList());
  }

  @PutMapping("/{locationKey}/alias")
  public AliasUpdateResponse updateAlias(
      @PathVariable("locationKey") String locationKey,
      @RequestHeader(value = HEADER_ACTOR_USER_ID, required = false) String actorUserId,
      @Valid @RequestBody AliasUpdateRequest request) {
    return AliasUpdateResponse.from(
        adminLocationService.updateAlias(locationKey, request.alias(), actorUserId));
  }

  @PostMapping("/{locationKey}:retry")
  public LocationEntryResponse retry(
      @PathVariable("locationKey") String locationKey,
      @RequestHeader(value = HEADER_ACTOR_USER_ID, required = false) String actorUserId) {
    return LocationEntryResponse.from(
        adminLocationService.retryGeocoding(locationKey, actorUserId));
  }
}
