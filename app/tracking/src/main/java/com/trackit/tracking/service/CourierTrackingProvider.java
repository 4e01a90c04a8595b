package com.trackit.tracking.service;

import com.trackit.tracking.model.TrackingFetchResult;

/**
 * 複数キャリア対応の追跡プロバイダ。キャリア固有の解析はプロバイダ側で済んでいる前提。
 *
 * <p>失敗は {@link CourierTrackingException} で通知する。
 */
public interface CourierTrackingProvider {

  TrackingFetchResult fetch(String trackingNumber, String courierHint);

  TrackingFetchResult fetchByTrackerId(String trackerId);
}
