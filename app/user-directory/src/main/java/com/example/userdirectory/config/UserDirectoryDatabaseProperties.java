/*
 * どこで: User Directory アプリの設定バインド
 * 何を: 接続先 DB (host/port/name/認証情報/TLS/プール) の設定を保持する
 * なぜ: 必須項目の欠落や不正な port を起動時に検知し、サービス開始前に失敗させるため
 */
package com.example.userdirectory.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "user-directory.database")
public record UserDirectoryDatabaseProperties(
    @NotBlank String host,
    @NotNull @Min(0) @Max(65535) Integer port,
    // 空の DB 名・パスワードは有効 (ログインの既定 DB / パスワード無し認証)。未設定だけを弾く
    @NotNull @Pattern(regexp = UNRESOLVED_GUARD, message = "must be set") String name,
    @NotBlank String username,
    @NotNull @Pattern(regexp = UNRESOLVED_GUARD, message = "must be set") String password,
    Boolean sslEnabled,
    Boolean trustServerCertificate,
    @Valid Pool pool) {

  /** 環境変数が無いとき binder は {@code ${DB_...}} をそのまま残すため、その値を未設定とみなす. */
  static final String UNRESOLVED_GUARD = "(?s)(?!\\$\\{DB_[A-Z_]+}$).*";

  public UserDirectoryDatabaseProperties {
    // TLS は既定で有効、証明書の無検証受け入れは明示指定したときだけにする
    sslEnabled = sslEnabled == null ? Boolean.TRUE : sslEnabled;
    trustServerCertificate = trustServerCertificate == null ? Boolean.FALSE : trustServerCertificate;
    pool = pool == null ? new Pool(null, null) : pool;
  }

  public String jdbcUrl() {
    return "jdbc:postgresql://" + host + ":" + port + "/" + name;
  }

  @Override
  public String toString() {
    return "UserDirectoryDatabaseProperties[host="
        + host
        + ", port="
        + port
        + ", name="
        + name
        + ", username="
        + username
        + ", sslEnabled="
        + sslEnabled
        + ", trustServerCertificate="
        + trustServerCertificate
        + ", pool="
        + pool
        + "]";
  }

  public record Pool(@Min(1) Integer maximumSize, @NotNull Duration connectionTimeout) {

    public Pool {
      maximumSize = maximumSize == null ? 10 : maximumSize;
      connectionTimeout = connectionTimeout == null ? Duration.ofSeconds(30) : connectionTimeout;
    }
  }
}
