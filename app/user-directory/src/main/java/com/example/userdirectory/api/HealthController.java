/*
 * どこで: User Directory API
 * 何を: 生存確認用の固定レスポンスを返す
 * なぜ: DB の状態に依存せずプロセスの稼働だけを確認できるようにするため
 */
package com.example.userdirectory.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

  private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

  static final String RUNNING_MESSAGE = "Server is running!";

  @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<JsonNode> health() {
    logger.info("health check called");
    return ResponseEntity.ok(TextNode.valueOf(RUNNING_MESSAGE));
  }
}
