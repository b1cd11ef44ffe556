/*
 * どこで: 共通ユーティリティ
 * 何を: リクエスト相関 ID の採用/採番を行う
 * なぜ: 上流から受け取った ID を優先し、無ければ新規採番してログを突き合わせられるようにするため
 */
package com.example.common;

import java.util.UUID;

public final class RequestIds {

  // ヘッダ経由の値をそのままログへ載せるため、長さと文字種を制限する
  static final int MAX_LENGTH = 128;

  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  public static String resolve(String candidate) {
    if (isUsable(candidate)) {
      return candidate.trim();
    }
    return newRequestId();
  }

  static boolean isUsable(String candidate) {
    if (candidate == null) {
      return false;
    }
    final String trimmed = candidate.trim();
    if (trimmed.isEmpty() || trimmed.length() > MAX_LENGTH) {
      return false;
    }
    for (int i = 0; i < trimmed.length(); i++) {
      final char c = trimmed.charAt(i);
      if (!(Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.' || c == ':')) {
        return false;
      }
    }
    return true;
  }
}
