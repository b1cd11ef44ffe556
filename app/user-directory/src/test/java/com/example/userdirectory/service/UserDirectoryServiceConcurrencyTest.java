/*
 * どこで: User Directory サービスの並行実行テスト
 * 何を: 同時に発行した一覧取得がそれぞれ完全な結果を受け取ることを確認する
 * なぜ: プール上限 (2) を超える同時リクエストでも結果が混ざらないことを保証するため
 */
package com.example.userdirectory.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.userdirectory.AbstractPostgresContainerTest;
import com.example.userdirectory.api.response.UserResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class UserDirectoryServiceConcurrencyTest extends AbstractPostgresContainerTest {

  private static final int CONCURRENT_REQUESTS = 16;
  private static final int ROWS = 50;

  @Autowired private UserDirectoryService userDirectoryService;

  private final JdbcTemplate fixtures = fixtureJdbcTemplate();

  @BeforeEach
  void seed() {
    fixtures.execute("TRUNCATE TABLE users RESTART IDENTITY");
    for (int i = 1; i <= ROWS; i++) {
      fixtures.update(
          "INSERT INTO users (username, email, full_name) VALUES (?, ?, ?)",
          "user_" + i,
          "user" + i + "@example.com",
          "User " + i);
    }
  }

  @Test
  void concurrentListingsEachReceiveCompleteResult() throws Exception {
    final ExecutorService executor = Executors.newFixedThreadPool(CONCURRENT_REQUESTS);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<List<UserResponse>>> futures = new ArrayList<>();
      for (int i = 0; i < CONCURRENT_REQUESTS; i++) {
        final Callable<List<UserResponse>> task =
            () -> {
              start.await();
              return userDirectoryService.listUsers();
            };
        futures.add(executor.submit(task));
      }
      start.countDown();

      for (Future<List<UserResponse>> future : futures) {
        final List<UserResponse> users = future.get(30, TimeUnit.SECONDS);
        assertThat(users).hasSize(ROWS);
        assertThat(users).extracting(UserResponse::id).doesNotHaveDuplicates();
        assertThat(users)
            .allSatisfy(
                user -> {
                  assertThat(user.username()).isEqualTo("user_" + user.id());
                  assertThat(user.email()).isEqualTo("user" + user.id() + "@example.com");
                  assertThat(user.fullName()).isEqualTo("User " + user.id());
                  assertThat(user.createdAt()).isNull();
                  assertThat(user.updatedAt()).isNull();
                });
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
