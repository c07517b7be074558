/*
 * Copyright © 2017 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.weathersync.sdk;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ConcurrentHashMultiset;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Multiset;
import java.util.List;
import java.util.NavigableSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.rules.TestRule;
import org.junit.runner.Description;
import org.junit.runners.model.Statement;

/**
 * Process-wide operation statistics, grouped by component.
 *
 * <pre>
 *   /:component/:operation          - registered count
 *   /:component/:event              - success and failure counts, latency histogram
 *   /:component/:operation/:result  - count per result
 * </pre>
 *
 * <p>The sync engine uses one component per concern, for example {@code "fetch"} with the
 * {@code page} event and {@code "emitter"} with the {@code commit} event.
 */
public class StatsManager {

  // upper bounds of the latency buckets, in milliseconds
  private static final NavigableSet<Long> LATENCY_RANGE =
      ImmutableSortedSet.of(
          10L, 50L, 100L, 250L, 500L, 1000L, 2000L, 5000L, 10000L, 30000L, 60000L);

  private final ConcurrentMap<String, OperationStats> stats = new ConcurrentHashMap<>();

  private static class InstanceHolder {
    private static final StatsManager instance = new StatsManager();
  }

  private StatsManager() {}

  public static StatsManager getInstance() {
    return InstanceHolder.instance;
  }

  public static List<String> getComponentNames() {
    return getInstance().stats.keySet().stream().sorted().collect(Collectors.toList());
  }

  /**
   * Retrieves the {@link OperationStats} of a component, creating it on first use.
   *
   * @param component name space of the statistics
   */
  public static OperationStats getComponent(String component) {
    return getInstance().stats.computeIfAbsent(component, key -> new OperationStats());
  }

  /** Builds a human-readable report for the logs. */
  public String printStats() {
    StringBuilder sb = new StringBuilder("Stats:\n");
    stats.keySet().stream().sorted().forEach(
        component -> {
          sb.append("  Component: ").append(component).append('\n');
          stats.get(component).printStats(sb);
        });
    return sb.toString();
  }

  /** Counters of one component. */
  public static class OperationStats {
    private final Multiset<String> opCounter = ConcurrentHashMultiset.create();
    private final Multiset<String> successCounter = ConcurrentHashMultiset.create();
    private final Multiset<String> failureCounter = ConcurrentHashMultiset.create();
    private final ConcurrentMap<String, Multiset<Long>> latency = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Multiset<String>> opWithResult =
        new ConcurrentHashMap<>();

    private OperationStats() {}

    /** Starts a timed event; finish it with {@link Event#success} or {@link Event#failure}. */
    public Event event(String operation) {
      return new Event(operation);
    }

    /** Counts an untimed operation. */
    public void register(String operation) {
      opCounter.add(operation);
    }

    /** Counts an untimed operation {@code count} times. */
    public void register(String operation, int count) {
      if (count > 0) {
        opCounter.add(operation, count);
      }
    }

    /** Counts one {@code result} of {@code operation}, for example an error kind. */
    public void logResult(String operation, String result) {
      opWithResult.computeIfAbsent(operation, op -> ConcurrentHashMultiset.create()).add(result);
    }

    public int getRegisteredCount(String operation) {
      return opCounter.count(operation);
    }

    public int getSuccessCount(String operation) {
      return successCounter.count(operation);
    }

    public int getFailureCount(String operation) {
      return failureCounter.count(operation);
    }

    public int getLogResultCount(String operation, String result) {
      Multiset<String> results = opWithResult.get(operation);
      return results == null ? 0 : results.count(result);
    }

    void clear() {
      opCounter.clear();
      successCounter.clear();
      failureCounter.clear();
      latency.clear();
      opWithResult.clear();
    }

    private void printStats(StringBuilder sb) {
      opCounter.elementSet().stream().sorted().forEach(
          op -> sb.append("\t").append(op).append(" : ").append(opCounter.count(op)).append('\n'));
      successCounter.elementSet().stream().sorted().forEach(
          op -> sb.append("\t").append(op).append(" ok : ")
              .append(successCounter.count(op)).append('\n'));
      failureCounter.elementSet().stream().sorted().forEach(
          op -> sb.append("\t").append(op).append(" failed : ")
              .append(failureCounter.count(op)).append('\n'));
      opWithResult.forEach(
          (op, results) -> results.elementSet().forEach(
              result -> sb.append("\t").append(op).append(" [").append(result).append("] : ")
                  .append(results.count(result)).append('\n')));
      latency.forEach(
          (op, buckets) -> {
            sb.append("\t").append(op).append(" latency ms:");
            buckets.elementSet().stream().sorted().forEach(
                bucket ->
                    sb.append(" <=").append(bucket).append('=').append(buckets.count(bucket)));
            sb.append('\n');
          });
    }

    /** A single timed operation. */
    public class Event {
      private final String op;
      private final Stopwatch watch = Stopwatch.createStarted();

      private Event(String op) {
        this.op = op;
      }

      public void success() {
        end(true);
      }

      public void failure() {
        end(false);
      }

      private void end(boolean success) {
        if (!watch.isRunning()) {
          return;
        }
        watch.stop();
        if (success) {
          successCounter.add(op);
          latency.computeIfAbsent(op, o -> ConcurrentHashMultiset.create())
              .add(bucketOf(watch.elapsed(TimeUnit.MILLISECONDS)));
        } else {
          failureCounter.add(op);
        }
      }
    }
  }

  @VisibleForTesting
  static Long bucketOf(long latencyMillis) {
    Long top = LATENCY_RANGE.ceiling(latencyMillis);
    return top != null ? top : Long.MAX_VALUE;
  }

  private static synchronized void resetStatsManager() {
    // Components may be held in static fields, so only their values are cleared.
    getInstance().stats.values().forEach(OperationStats::clear);
  }

  /** {@link TestRule} that clears all recorded statistics before each test. */
  public static class ResetStatsRule implements TestRule {
    @Override
    public Statement apply(Statement base, Description description) {
      resetStatsManager();
      return base;
    }
  }
}
