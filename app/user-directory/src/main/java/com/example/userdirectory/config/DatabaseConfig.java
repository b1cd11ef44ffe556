/*
 * どこで: User Directory の DB 接続設定
 * 何を: 上限付きコネクションプール (HikariCP) を構築し、起動時に最初の接続を確立する
 * なぜ: 接続/認証の失敗を起動失敗として扱い、リクエストごとの貸出/返却で DB を共有するため
 */
package com.example.userdirectory.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.metrics.micrometer.MicrometerMetricsTrackerFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  UserDirectoryDatabaseProperties.class,
  UserDirectoryListingProperties.class
})
public class DatabaseConfig {

  private static final Logger logger = LoggerFactory.getLogger(DatabaseConfig.class);

  static final String POOL_NAME = "user-directory-db";
  static final String NON_VALIDATING_SSL_FACTORY = "org.postgresql.ssl.NonValidatingFactory";

  @Bean(destroyMethod = "close")
  HikariDataSource dataSource(
      UserDirectoryDatabaseProperties properties, MeterRegistry meterRegistry) {
    logger.info(
        "connecting to database host={} port={} database={} sslEnabled={}",
        properties.host(),
        properties.port(),
        properties.name(),
        properties.sslEnabled());
    if (properties.sslEnabled() && properties.trustServerCertificate()) {
      logger.warn(
          "database server certificate is NOT validated host={} (trust-server-certificate=true)",
          properties.host());
    }
    final HikariConfig config = toHikariConfig(properties);
    // プール開始後は登録できないため、起動前に hikaricp_* メトリクスを結び付ける
    config.setMetricsTrackerFactory(new MicrometerMetricsTrackerFactory(meterRegistry));
    // initializationFailTimeout=1 のため、ここで最初の接続と認証が行われ失敗時は例外になる
    final HikariDataSource dataSource = new HikariDataSource(config);
    logger.info(
        "connected to database host={} port={} database={} maximumPoolSize={}",
        properties.host(),
        properties.port(),
        properties.name(),
        dataSource.getMaximumPoolSize());
    return dataSource;
  }

  static HikariConfig toHikariConfig(UserDirectoryDatabaseProperties properties) {
    final HikariConfig config = new HikariConfig();
    config.setPoolName(POOL_NAME);
    config.setJdbcUrl(properties.jdbcUrl());
    config.setUsername(properties.username());
    config.setPassword(properties.password());
    config.setMaximumPoolSize(properties.pool().maximumSize());
    config.setConnectionTimeout(properties.pool().connectionTimeout().toMillis());
    config.setInitializationFailTimeout(1);
    config.setReadOnly(true);
    config.addDataSourceProperty("tcpNoDelay", "true");
    config.addDataSourceProperty("ApplicationName", "user-directory");
    applySslSettings(config, properties);
    return config;
  }

  private static void applySslSettings(
      HikariConfig config, UserDirectoryDatabaseProperties properties) {
    if (!properties.sslEnabled()) {
      config.addDataSourceProperty("sslmode", "disable");
      return;
    }
    if (properties.trustServerCertificate()) {
      config.addDataSourceProperty("sslmode", "require");
      config.addDataSourceProperty("sslfactory", NON_VALIDATING_SSL_FACTORY);
      return;
    }
    config.addDataSourceProperty("sslmode", "verify-full");
  }
}
