package com.example.userdirectory.service;

public class UserListingException extends RuntimeException {

  public enum Reason {
    QUERY_FAILED,
    RESULT_PROCESSING_FAILED
  }

  private final Reason reason;

  public UserListingException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
