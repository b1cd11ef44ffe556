package com.example.userdirectory.service;

import com.example.userdirectory.api.response.UserResponse;
import com.example.userdirectory.model.UserRecord;
import com.example.userdirectory.repository.UserRepository;
import com.example.userdirectory.repository.UserRowsReadException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UserDirectoryService {

  private static final Logger logger = LoggerFactory.getLogger(UserDirectoryService.class);

  private final UserRepository userRepository;
  private final UserRowConverter userRowConverter;
  private final UserDirectoryMetrics metrics;

  public List<UserResponse> listUsers() {
    final long startedAt = System.nanoTime();
    final List<Map<String, Object>> rows;
    try {
      rows = userRepository.findAllRows();
    } catch (UserRowsReadException ex) {
      logger.error("user listing failed to read query results", ex);
      throw fail(
          UserListingException.Reason.RESULT_PROCESSING_FAILED,
          UserDirectoryMetrics.RESULT_MAPPING_ERROR,
          startedAt,
          ex);
    } catch (DataAccessException ex) {
      logger.error("user listing query failed", ex);
      throw fail(
          UserListingException.Reason.QUERY_FAILED,
          UserDirectoryMetrics.RESULT_QUERY_ERROR,
          startedAt,
          ex);
    }
    logger.info("user listing found rows={}", rows.size());

    final List<UserRecord> users;
    try {
      users = userRowConverter.toRecords(rows);
    } catch (UserRowMappingException ex) {
      logger.error(
          "user listing failed to map row row={} column={}", ex.rowIndex(), ex.column(), ex);
      throw fail(
          UserListingException.Reason.RESULT_PROCESSING_FAILED,
          UserDirectoryMetrics.RESULT_MAPPING_ERROR,
          startedAt,
          ex);
    }

    metrics.recordListing(UserDirectoryMetrics.RESULT_SUCCESS, elapsedSince(startedAt));
    metrics.recordRows(users.size());
    logger.info("user listing returning users={}", users.size());
    return users.stream().map(this::toResponse).toList();
  }

  private UserListingException fail(
      UserListingException.Reason reason, String result, long startedAt, RuntimeException cause) {
    metrics.recordListing(result, elapsedSince(startedAt));
    return new UserListingException(reason, "user listing failed: " + reason, cause);
  }

  private Duration elapsedSince(long startedAt) {
    return Duration.ofNanos(System.nanoTime() - startedAt);
  }

  private UserResponse toResponse(UserRecord user) {
    return new UserResponse(
        user.id(),
        user.username(),
        user.email(),
        user.fullName(),
        user.createdAt(),
        user.updatedAt());
  }
}
