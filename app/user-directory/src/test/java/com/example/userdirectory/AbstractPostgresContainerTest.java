/*
 * どこで: User Directory テスト基盤
 * 何を: Testcontainers(Postgres) と user-directory.database.* の共通設定を提供する
 * なぜ: テストごとの重複設定を削減し、実 DB と同じドライバ経路で検証するため
 */
package com.example.userdirectory;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

// プール上限はサブクラスの @TestPropertySource で上書きできるよう動的プロパティに含めない
@TestPropertySource(properties = "user-directory.database.pool.maximum-size=2")
public abstract class AbstractPostgresContainerTest {

  // JVM 内のテスト全体で共通の Postgres コンテナを使い回し、起動コストを抑える
  protected static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>("postgres:16-alpine").withInitScript("db/users-schema.sql");

  static {
    // @DynamicPropertySource が JUnit の Testcontainers 拡張より先に動く場合に備えて明示起動する
    POSTGRES.start();
  }

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("user-directory.database.host", POSTGRES::getHost);
    registry.add(
        "user-directory.database.port",
        () -> POSTGRES.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT));
    registry.add("user-directory.database.name", POSTGRES::getDatabaseName);
    registry.add("user-directory.database.username", POSTGRES::getUsername);
    registry.add("user-directory.database.password", POSTGRES::getPassword);
    // テスト用コンテナは TLS を提供しない
    registry.add("user-directory.database.ssl-enabled", () -> "false");
  }

  /** アプリのプール (読み取り専用) を経由せずにテストデータを投入するための JdbcTemplate。 */
  protected static JdbcTemplate fixtureJdbcTemplate() {
    return new JdbcTemplate(
        new DriverManagerDataSource(
            POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword()));
  }
}
