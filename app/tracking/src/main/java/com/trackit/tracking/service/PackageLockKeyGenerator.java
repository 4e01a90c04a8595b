/*
 * どこで: Tracking サービス補助
 * 何を: パッケージ ID から 64-bit advisory lock のキーを生成する
 * なぜ: hashtext(32-bit) の衝突による無関係なパッケージ同士の直列化を避けるため
 */
package com.trackit.tracking.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class PackageLockKeyGenerator {

  // 64-bit advisory lock 用に SHA-256 の先頭 8byte を使う。
  static final int LOCK_KEY_BYTES = 8;

  // 他の advisory lock 利用箇所とキー空間を分ける
  private static final String NAMESPACE = "package-sync:";

  public long generate(String packageId) {
    if (packageId == null || packageId.isBlank()) {
      throw new IllegalArgumentException("packageId is required");
    }
    final byte[] hashed = hash(NAMESPACE + packageId);
    // ByteBuffer は Big Endian が既定。インスタンス間で同じ値になれば十分。
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] hash(String value) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
