package com.example.userdirectory.repository;

import org.springframework.dao.NonTransientDataAccessException;

/** クエリ実行後、結果行の読み出し中に発生した失敗。 */
public class UserRowsReadException extends NonTransientDataAccessException {

  public UserRowsReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
