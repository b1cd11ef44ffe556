/*
 * どこで: User Directory サービス層
 * 何を: クエリ結果の生の行を UserRecord へ変換する
 * なぜ: 欠落/型不一致のカラムを LENIENT では既定値で補い、STRICT では失敗として扱うため
 */
package com.example.userdirectory.service;

import com.example.userdirectory.config.ColumnMappingMode;
import com.example.userdirectory.config.UserDirectoryListingProperties;
import com.example.userdirectory.model.UserRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class UserRowConverter {

  private static final Logger logger = LoggerFactory.getLogger(UserRowConverter.class);

  static final String COLUMN_ID = "id";
  static final String COLUMN_USERNAME = "username";
  static final String COLUMN_EMAIL = "email";
  static final String COLUMN_FULL_NAME = "full_name";

  private static final int DEFAULT_ID = 0;
  private static final String DEFAULT_TEXT = "";

  private final UserDirectoryListingProperties properties;
  private final UserDirectoryMetrics metrics;

  public List<UserRecord> toRecords(List<Map<String, Object>> rows) {
    final List<UserRecord> records = new ArrayList<>(rows.size());
    for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
      records.add(toRecord(rows.get(rowIndex), rowIndex));
    }
    return records;
  }

  UserRecord toRecord(Map<String, Object> row, int rowIndex) {
    // 日時カラムは読まないため created_at / updated_at は常に null
    return UserRecord.withoutTimestamps(
        readId(row, rowIndex),
        readText(row, COLUMN_USERNAME, rowIndex),
        readText(row, COLUMN_EMAIL, rowIndex),
        readText(row, COLUMN_FULL_NAME, rowIndex));
  }

  private int readId(Map<String, Object> row, int rowIndex) {
    final Object value = row.get(COLUMN_ID);
    if (value instanceof Number number) {
      final long asLong = number.longValue();
      if (number.doubleValue() == asLong
          && asLong >= Integer.MIN_VALUE
          && asLong <= Integer.MAX_VALUE) {
        return (int) asLong;
      }
    }
    onInvalid(rowIndex, COLUMN_ID, describe(row, COLUMN_ID), "a 32-bit integer");
    return DEFAULT_ID;
  }

  private String readText(Map<String, Object> row, String column, int rowIndex) {
    final Object value = row.get(column);
    if (value instanceof String text) {
      return text;
    }
    onInvalid(rowIndex, column, describe(row, column), "a string");
    return DEFAULT_TEXT;
  }

  private String describe(Map<String, Object> row, String column) {
    if (!row.containsKey(column)) {
      return "missing";
    }
    final Object value = row.get(column);
    return value == null ? "null" : value.getClass().getSimpleName();
  }

  private void onInvalid(int rowIndex, String column, String actual, String expected) {
    if (properties.columnMapping() == ColumnMappingMode.STRICT) {
      throw new UserRowMappingException(
          rowIndex,
          column,
          "column " + column + " at row " + rowIndex + " is " + actual + ", expected " + expected);
    }
    logger.debug(
        "user row column defaulted row={} column={} actualType={}", rowIndex, column, actual);
    metrics.recordColumnDefaulted(column);
  }
}
