/*
 * どこで: User Directory アプリの設定バインド
 * 何を: 一覧対象テーブル名とカラム変換モードを保持する
 * なぜ: SQL に埋め込むテーブル名を起動時に検証し、変換方針を環境ごとに切り替えるため
 */
package com.example.userdirectory.config;

import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "user-directory.listing")
public record UserDirectoryListingProperties(
    @Pattern(
            regexp = "^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?$",
            message = "table must be a plain or schema-qualified identifier")
        String table,
    ColumnMappingMode columnMapping) {

  public UserDirectoryListingProperties {
    table = table == null || table.isBlank() ? "users" : table.trim();
    columnMapping = columnMapping == null ? ColumnMappingMode.LENIENT : columnMapping;
  }
}
