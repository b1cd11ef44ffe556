/*
 * どこで: User Directory の設定値
 * 何を: カラム値が欠落/型不一致のときの扱いを定義する
 * なぜ: 既定値で補うか失敗として扱うかを運用で選べるようにするため
 */
package com.example.userdirectory.config;

public enum ColumnMappingMode {
  /** 欠落/型不一致を既定値 (id=0, 文字列="") で補う。 */
  LENIENT,
  /** 欠落/型不一致を結果処理の失敗として扱う。 */
  STRICT
}
