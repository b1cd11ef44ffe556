/*
 * どこで: User Directory サービス層
 * 何を: ユーザー一覧 API の結果/所要時間/件数/既定値補完のメトリクスを記録する
 * なぜ: DB 起因の失敗率とカラム補完の発生を Prometheus から観測できるようにするため
 */
package com.example.userdirectory.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class UserDirectoryMetrics {

  static final String RESULT_SUCCESS = "success";
  static final String RESULT_QUERY_ERROR = "query_error";
  static final String RESULT_MAPPING_ERROR = "mapping_error";

  private static final String METRIC_LISTING_TOTAL = "user_directory.listing.total";
  private static final String METRIC_LISTING_DURATION = "user_directory.listing.duration";
  private static final String METRIC_LISTING_ROWS = "user_directory.listing.rows";
  private static final String METRIC_COLUMN_DEFAULTED_TOTAL =
      "user_directory.listing.column_defaulted.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> listingCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> listingTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> columnDefaultedCounters = new ConcurrentHashMap<>();
  private final DistributionSummary listingRows;

  public UserDirectoryMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.listingRows =
        DistributionSummary.builder(METRIC_LISTING_ROWS)
            .description("Rows returned by a successful user listing")
            .register(meterRegistry);
  }

  public void recordListing(String result, Duration duration) {
    listingCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_LISTING_TOTAL)
                    .description("User listing outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
    listingTimers
        .computeIfAbsent(
            result,
            ignored ->
                Timer.builder(METRIC_LISTING_DURATION)
                    .description("User listing duration including connection checkout")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .record(duration);
  }

  public void recordRows(int rows) {
    listingRows.record(Math.max(rows, 0));
  }

  public void recordColumnDefaulted(String column) {
    columnDefaultedCounters
        .computeIfAbsent(
            column,
            ignored ->
                Counter.builder(METRIC_COLUMN_DEFAULTED_TOTAL)
                    .description("Column values replaced by defaults in lenient mapping")
                    .tags(Tags.of("column", column))
                    .register(meterRegistry))
        .increment();
  }
}
