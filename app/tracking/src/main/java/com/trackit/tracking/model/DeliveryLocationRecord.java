/*
 * どこで: Tracking ドメインモデル
 * 何を: ユーザー定義の配達先 (読み取り専用入力) を表す
 * なぜ: 位置タイムラインに配達先ラベルと距離を添えるため
 */
package com.trackit.tracking.model;

public record DeliveryLocationRecord(
    String deliveryLocationId, String name, String address, Double latitude, Double longitude) {}
