/*
 * どこで: identity-gateway サービス層
 * 何を: 本人解決の結果、キャッシュ命中、ストア作成、profile 取得時間を記録する
 * なぜ: fail-open で握りつぶした失敗の増加を Prometheus から観測できるようにするため
 */
package com.example.identity_gateway.service;

import com.example.identity_gateway.model.ResolutionOutcome;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class IdentityResolutionMetrics {

  private static final String METRIC_RESOLUTION_TOTAL = "identity.resolution.total";
  private static final String METRIC_CACHE_TOTAL = "identity.resolution.cache.total";
  private static final String METRIC_STORE_TOTAL = "identity.resolution.store.total";
  private static final String METRIC_CACHE_WRITE_ERROR_TOTAL =
      "identity.resolution.cache.write.error.total";
  private static final String METRIC_PROFILE_FETCH_DURATION =
      "identity.resolution.profile.fetch.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> cacheCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> storeCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> profileFetchTimers = new ConcurrentHashMap<>();

  public IdentityResolutionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordOutcome(ResolutionOutcome outcome) {
    final String status = outcome.status().name().toLowerCase(Locale.ROOT);
    final String reason =
        outcome.failure() == null ? "none" : outcome.failure().name().toLowerCase(Locale.ROOT);
    final String key = status + "|" + reason;
    outcomeCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_RESOLUTION_TOTAL)
                    .description("Identity resolution outcomes per request")
                    .tags(Tags.of("outcome", status, "reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordCacheLookup(boolean hit) {
    final String result = hit ? "hit" : "miss";
    cacheCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_CACHE_TOTAL)
                    .description("Identity cache lookups by result")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordStoreResult(boolean created) {
    final String result = created ? "inserted" : "found";
    storeCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_STORE_TOTAL)
                    .description("Identity store lookups by result")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordCacheWriteError() {
    Counter.builder(METRIC_CACHE_WRITE_ERROR_TOTAL)
        .description("Identity cache write failures")
        .register(meterRegistry)
        .increment();
  }

  public void recordProfileFetchDuration(String result, Duration duration) {
    profileFetchTimers
        .computeIfAbsent(
            result,
            ignored ->
                Timer.builder(METRIC_PROFILE_FETCH_DURATION)
                    .description("Profile service user details call duration")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .record(duration);
  }
}
