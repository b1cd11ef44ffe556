/*
 * どこで: User Directory API
 * 何を: 例外を 500 と JSON 文字列のエラーメッセージへ変換する
 * なぜ: DB のエラー詳細をログだけに残し、クライアントへは固定文言だけを返すため
 */
package com.example.userdirectory.api;

import com.example.userdirectory.service.UserListingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class UserDirectoryApiExceptionHandler {

  private static final Logger logger =
      LoggerFactory.getLogger(UserDirectoryApiExceptionHandler.class);

  static final String MESSAGE_QUERY_FAILED = "Database query failed";
  static final String MESSAGE_RESULT_PROCESSING_FAILED = "Failed to process query results";
  static final String MESSAGE_INTERNAL_ERROR = "Internal server error";

  @ExceptionHandler(UserListingException.class)
  public ResponseEntity<JsonNode> handleUserListing(UserListingException ex) {
    final String message =
        switch (ex.reason()) {
          case QUERY_FAILED -> MESSAGE_QUERY_FAILED;
          case RESULT_PROCESSING_FAILED -> MESSAGE_RESULT_PROCESSING_FAILED;
        };
    return internalServerError(message);
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<JsonNode> handleUnexpected(RuntimeException ex) {
    logger.error("unexpected error while handling request", ex);
    return internalServerError(MESSAGE_INTERNAL_ERROR);
  }

  private ResponseEntity<JsonNode> internalServerError(String message) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .contentType(MediaType.APPLICATION_JSON)
        .body(TextNode.valueOf(message));
  }
}
