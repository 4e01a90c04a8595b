package com.trackit.tracking.service;

import com.trackit.tracking.model.GeocodeResult;

/** 住所文字列を座標へ変換する外部機能。失敗は {@link GeocodingException} で通知する。 */
public interface Geocoder {

  GeocodeResult geocode(String addressText);
}
