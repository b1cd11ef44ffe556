/*
 * どこで: app/user-directory/src/main/java/com/example/userdirectory/api/UserDirectoryController.java
 * 何を: ユーザー一覧 API を提供するコントローラー
 * なぜ: users テーブルの参照契約を HTTP から利用可能にするため
 */
package com.example.userdirectory.api;

import com.example.userdirectory.api.response.UserResponse;
import com.example.userdirectory.service.UserDirectoryService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class UserDirectoryController {

  private static final Logger logger = LoggerFactory.getLogger(UserDirectoryController.class);

  private final UserDirectoryService userDirectoryService;

  /**
   * 役割:
   * - users テーブルの全行を JSON 配列で返す。
   *
   * 期待動作:
   * - 0 件のときは空配列を 200 で返す。
   * - DB 起因の失敗は例外ハンドラで 500 と固定文言に変換し、DB のエラー文言は返さない。
   */
  @GetMapping(value = "/users", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<UserResponse>> listUsers() {
    logger.info("user listing called");
    return ResponseEntity.ok(userDirectoryService.listUsers());
  }
}
