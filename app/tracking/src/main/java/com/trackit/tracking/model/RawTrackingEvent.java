/*
 * どこで: Tracking ドメインモデル
 * 何を: プロバイダから取得した未検証のイベントを表す
 * なぜ: タイムスタンプ解釈とステータス変換をマージ処理の責務に寄せるため
 */
package com.trackit.tracking.model;

public record RawTrackingEvent(
    String status,
    String location,
    String timestamp,
    String description,
    String courierEventCode,
    String courierCode) {}
