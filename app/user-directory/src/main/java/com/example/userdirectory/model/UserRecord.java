/*
 * どこで: app/user-directory/src/main/java/com/example/userdirectory/model/UserRecord.java
 * 何を: users テーブル 1 行分のドメインレコード
 * なぜ: Repository/Service/API 間でユーザー情報の受け渡しを明確にするため
 */
package com.example.userdirectory.model;

/**
 * users テーブルの 1 行。
 *
 * <p>createdAt / updatedAt は日時カラムを読まないため常に null。
 */
public record UserRecord(
    int id,
    String username,
    String email,
    String fullName,
    String createdAt,
    String updatedAt) {

  public static UserRecord withoutTimestamps(
      int id, String username, String email, String fullName) {
    return new UserRecord(id, username, email, fullName, null, null);
  }
}
