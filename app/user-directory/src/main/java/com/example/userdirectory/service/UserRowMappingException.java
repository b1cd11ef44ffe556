package com.example.userdirectory.service;

/** STRICT モードでカラム値が欠落/型不一致だったことを表す。 */
public class UserRowMappingException extends RuntimeException {

  private final int rowIndex;
  private final String column;

  public UserRowMappingException(int rowIndex, String column, String message) {
    super(message);
    this.rowIndex = rowIndex;
    this.column = column;
  }

  public int rowIndex() {
    return rowIndex;
  }

  public String column() {
    return column;
  }
}
