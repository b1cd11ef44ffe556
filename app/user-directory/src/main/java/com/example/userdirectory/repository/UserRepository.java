/*
 * どこで: User Directory データアクセス
 * 何を: users テーブルを全件読み出し、生の行データとして返す
 * なぜ: 接続の貸出はクエリ実行と行の読み出しの間だけに限定し、変換は接続返却後に行うため
 */
package com.example.userdirectory.repository;

import com.example.userdirectory.config.UserDirectoryListingProperties;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.stereotype.Repository;

@Repository
public class UserRepository {

  private static final Logger logger = LoggerFactory.getLogger(UserRepository.class);

  private final JdbcTemplate jdbcTemplate;
  private final String selectAllSql;

  public UserRepository(JdbcTemplate jdbcTemplate, UserDirectoryListingProperties properties) {
    this.jdbcTemplate = jdbcTemplate;
    // table は起動時に識別子パターンで検証済み
    this.selectAllSql = "SELECT id, username, email, full_name FROM " + properties.table();
  }

  /**
   * 全行をカラム名 (大文字小文字を区別しない) をキーとする Map のリストで返す。
   *
   * <p>接続の取得失敗やクエリ実行の失敗は Spring の {@link
   * org.springframework.dao.DataAccessException} へ変換される。実行後の行読み出しに失敗した場合は
   * {@link UserRowsReadException} を送出する。
   */
  public List<Map<String, Object>> findAllRows() {
    return jdbcTemplate.execute(
        (ConnectionCallback<List<Map<String, Object>>>)
            connection -> {
              logger.info("database connection acquired");
              try (Statement statement = connection.createStatement();
                  ResultSet resultSet = statement.executeQuery(selectAllSql)) {
                logger.info("query executed sql=\"{}\"", selectAllSql);
                return readRows(resultSet);
              }
            });
  }

  String selectAllSql() {
    return selectAllSql;
  }

  private List<Map<String, Object>> readRows(ResultSet resultSet) {
    try {
      return new RowMapperResultSetExtractor<>(new ColumnMapRowMapper()).extractData(resultSet);
    } catch (SQLException ex) {
      throw new UserRowsReadException("failed to read rows of users query", ex);
    }
  }
}
