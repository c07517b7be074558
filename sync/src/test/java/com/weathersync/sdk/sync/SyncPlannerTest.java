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
package com.weathersync.sdk.sync;

import static com.weathersync.sdk.sync.SyncTestData.NOW;
import static com.weathersync.sdk.sync.SyncTestData.record;
import static com.weathersync.sdk.sync.SyncTestData.records;
import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.api.client.util.BackOff;
import com.google.api.client.util.Sleeper;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.weathersync.sdk.BatchPolicy;
import com.weathersync.sdk.RetryPolicy;
import com.weathersync.sdk.StatsManager;
import com.weathersync.sdk.StatsManager.ResetStatsRule;
import com.weathersync.sdk.sync.SyncSettings.EmptyWindowPolicy;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

/** Tests for {@link SyncPlanner}. */
@RunWith(MockitoJUnitRunner.class)
public class SyncPlannerTest {
  private static final String ENTITY_ID = "hourly_observations.berlin";
  private static final Instant START = Instant.parse("2024-03-09T00:00:00Z");

  @Rule public ExpectedException thrown = ExpectedException.none();
  @Rule public ResetStatsRule resetStats = new ResetStatsRule();

  @Mock private PageFetcher fetcher;
  @Mock private Sleeper sleeper;

  private EntityDescriptor entity;
  private InMemoryCursorStore cursorStore;
  private InMemoryTableSink sink;
  private SyncSettings.Builder settings;
  private BatchPolicy batchPolicy;

  @Before
  public void setUp() {
    entity = SyncTestData.observations(ENTITY_ID);
    cursorStore = new InMemoryCursorStore();
    sink = new InMemoryTableSink();
    settings =
        new SyncSettings.Builder()
            .setWindowSize(Duration.ofHours(48))
            .setInitialLookback(Duration.ofDays(1));
    batchPolicy = new BatchPolicy.Builder().build();
  }

  private SyncPlanner.Builder plannerBuilder() {
    return new SyncPlanner.Builder()
        .setEntity(entity)
        .setCursorStore(cursorStore)
        .setPageFetcher(fetcher)
        .setRowSink(sink)
        .setSettings(settings.build())
        .setBatchPolicy(batchPolicy)
        .setClock(SyncTestData.CLOCK)
        .setTicker(SyncTestData.FROZEN_TICKER);
  }

  private EntitySyncReport run() {
    return plannerBuilder().build().run();
  }

  private static FetchResult page(List<Map<String, Object>> records, String nextPageToken) {
    return FetchResult.of(new Page(records, nextPageToken, null));
  }

  private static FetchResult lastPage(List<Map<String, Object>> records) {
    return FetchResult.of(Page.last(records));
  }

  private static String minute(int minutes) {
    return START.plus(Duration.ofMinutes(minutes)).toString();
  }

  private String committedPosition() throws IOException {
    return cursorStore.load(ENTITY_ID).getPosition();
  }

  @Test
  public void testTwoPagesOneCommitAtMaxObserved() throws Exception {
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenReturn(
            page(records("berlin", START, 100), "p2"),
            lastPage(records("berlin", START.plus(Duration.ofMinutes(100)), 50)));

    EntitySyncReport report = run();

    assertTrue(report.toString(), report.isSuccess());
    assertEquals(2, report.getPagesFetched());
    assertEquals(150, report.getRowsEmitted());
    assertEquals(150, sink.getRows(ENTITY_ID).size());
    assertEquals(1, sink.getBatchesWritten());
    assertEquals(minute(149), committedPosition());
    assertEquals(minute(149), report.getLastGoodCursor().getPosition());

    ArgumentCaptor<FetchRequest> requests = ArgumentCaptor.forClass(FetchRequest.class);
    verify(fetcher, times(2)).fetch(requests.capture());
    FetchRequest first = requests.getAllValues().get(0);
    assertNull(first.getPageToken());
    assertEquals(1, first.getPageNumber());
    assertEquals(START, first.getWindowStart());
    assertEquals(NOW, first.getWindowEnd());
    assertTrue(first.getCursor().isInitial());
    FetchRequest second = requests.getAllValues().get(1);
    assertEquals("p2", second.getPageToken());
    assertEquals(2, second.getPageNumber());
  }

  @Test
  public void testTransientFailuresAreRetried() throws Exception {
    FetchResult unavailable = FetchResult.error(FetchError.transientError("HTTP 503", null));
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenReturn(unavailable, unavailable, lastPage(records("berlin", START, 5)));
    RetryPolicy retryPolicy =
        new RetryPolicy.Builder()
            .setBackOffFactory(() -> BackOff.ZERO_BACKOFF)
            .setSleeper(sleeper)
            .build();

    EntitySyncReport report =
        plannerBuilder()
            .setPageFetcher(new RetryingPageFetcher(fetcher, retryPolicy))
            .build()
            .run();

    assertTrue(report.toString(), report.isSuccess());
    assertEquals(5, sink.getRows(ENTITY_ID).size());
    assertEquals(minute(4), committedPosition());
    verify(sleeper, times(2)).sleep(0L);
  }

  @Test
  public void testFatalFetchLeavesCursorUnchanged() throws Exception {
    cursorStore.commit(ENTITY_ID, "2024-03-09T20:00:00Z", "previous");
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenReturn(FetchResult.error(FetchError.fatal("HTTP 401 Unauthorized", null)));

    SyncPlanner planner = plannerBuilder().build();
    EntitySyncReport report = planner.run();

    assertEquals(ErrorKind.FATAL_FETCH, report.getErrorKind());
    assertThat(report.getMessage(), containsString("HTTP 401 Unauthorized"));
    assertEquals(Cursor.of("2024-03-09T20:00:00Z", "previous"), report.getLastGoodCursor());
    assertEquals(Cursor.of("2024-03-09T20:00:00Z", "previous"), cursorStore.load(ENTITY_ID));
    assertEquals(0, sink.getBatchesWritten());
    assertEquals(SyncPlanner.State.FAILED, planner.getState());
    assertEquals(1,
        StatsManager.getComponent("planner").getLogResultCount("sync", "FATAL_FETCH"));
  }

  @Test
  public void testMappingErrorsBelowThresholdSkipRows() throws Exception {
    List<Map<String, Object>> page = records("berlin", START, 100);
    for (int i : new int[] {10, 50, 90}) {
      page.set(i, record("berlin", START.plus(Duration.ofMinutes(i)), "n/a"));
    }
    when(fetcher.fetch(any(FetchRequest.class))).thenReturn(lastPage(page));

    EntitySyncReport report = run();

    assertTrue(report.toString(), report.isSuccess());
    assertEquals(97, sink.getRows(ENTITY_ID).size());
    assertEquals(97, report.getRowsEmitted());
    assertEquals(3, report.getMappingErrors());
    assertEquals(minute(99), committedPosition());
    assertEquals(3, StatsManager.getComponent("planner").getRegisteredCount("mappingErrors"));
  }

  @Test
  public void testMappingErrorsAtThresholdAreTolerated() throws Exception {
    settings.setMaxMappingErrorsPerPage(2);
    List<Map<String, Object>> page = records("berlin", START, 10);
    page.set(3, record("berlin", START.plus(Duration.ofMinutes(3)), "n/a"));
    page.set(4, record("berlin", START.plus(Duration.ofMinutes(4)), "n/a"));
    when(fetcher.fetch(any(FetchRequest.class))).thenReturn(lastPage(page));

    assertTrue(run().isSuccess());
    assertEquals(8, sink.getRows(ENTITY_ID).size());
  }

  @Test
  public void testMappingErrorsAboveThresholdAbort() throws Exception {
    settings.setMaxMappingErrorsPerPage(2);
    List<Map<String, Object>> page = records("berlin", START, 10);
    for (int i = 0; i < 3; i++) {
      page.set(i, record("berlin", START.plus(Duration.ofMinutes(i)), "n/a"));
    }
    when(fetcher.fetch(any(FetchRequest.class))).thenReturn(lastPage(page));

    EntitySyncReport report = run();

    assertEquals(ErrorKind.MAPPING_THRESHOLD, report.getErrorKind());
    assertThat(report.getMessage(), containsString("3 of 10 records"));
    assertEquals(0, report.getRowsEmitted());
    assertEquals(0, sink.getBatchesWritten());
    assertTrue(cursorStore.load(ENTITY_ID).isInitial());
  }

  @Test
  public void testFailedSinkWriteIsRecoveredWithoutDuplicates() throws Exception {
    sink = spy(new InMemoryTableSink());
    doThrow(new IOException("disk full")).doCallRealMethod().when(sink).write(any());
    when(fetcher.fetch(any(FetchRequest.class))).thenReturn(lastPage(records("berlin", START, 10)));

    EntitySyncReport failed = run();

    assertEquals(ErrorKind.COMMIT, failed.getErrorKind());
    assertTrue(failed.getLastGoodCursor().isInitial());
    assertTrue(cursorStore.load(ENTITY_ID).isInitial());
    assertEquals(0, sink.getRows(ENTITY_ID).size());

    EntitySyncReport retried = run();

    assertTrue(retried.toString(), retried.isSuccess());
    assertEquals(10, sink.getRows(ENTITY_ID).size());
    assertEquals(minute(9), committedPosition());
  }

  @Test
  public void testRerunAfterCommitDoesNotDuplicateRows() throws Exception {
    when(fetcher.fetch(any(FetchRequest.class))).thenReturn(lastPage(records("berlin", START, 10)));
    assertTrue(run().isSuccess());
    assertTrue(run().isSuccess());
    assertEquals(10, sink.getRows(ENTITY_ID).size());
    assertEquals(minute(9), committedPosition());
  }

  @Test
  public void testNoRecordsHoldsCursor() throws Exception {
    when(fetcher.fetch(any(FetchRequest.class))).thenReturn(lastPage(ImmutableList.of()));

    SyncPlanner planner = plannerBuilder().build();
    EntitySyncReport report = planner.run();

    assertTrue(report.isSuccess());
    assertEquals(1, report.getPagesFetched());
    assertEquals(0, sink.getBatchesWritten());
    assertTrue(cursorStore.load(ENTITY_ID).isInitial());
    assertEquals(SyncPlanner.State.IDLE, planner.getState());
  }

  @Test
  public void testNoRecordsAdvancesToWindowEnd() throws Exception {
    settings.setEmptyWindowPolicy(EmptyWindowPolicy.ADVANCE_TO_WINDOW_END);
    when(fetcher.fetch(any(FetchRequest.class))).thenReturn(lastPage(ImmutableList.of()));

    assertTrue(run().isSuccess());
    assertEquals(NOW.toString(), committedPosition());
    assertEquals(1, sink.getBatchesWritten());
    assertEquals(0, sink.getRows(ENTITY_ID).size());
  }

  @Test
  public void testReplayIsDeterministic() throws Exception {
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenAnswer(
            invocation -> {
              FetchRequest request = invocation.getArgument(0);
              return request.getPageToken() == null
                  ? page(records("berlin", START, 7), "p2")
                  : lastPage(records("berlin", START.plus(Duration.ofMinutes(7)), 3));
            });
    run();
    InMemoryCursorStore firstStore = cursorStore;
    InMemoryTableSink firstSink = sink;

    cursorStore = new InMemoryCursorStore();
    sink = new InMemoryTableSink();
    run();

    assertEquals(firstSink.getRows(ENTITY_ID), sink.getRows(ENTITY_ID));
    assertEquals(firstSink.getCheckpoints(), sink.getCheckpoints());
    assertEquals(firstStore.load(ENTITY_ID), cursorStore.load(ENTITY_ID));
  }

  @Test
  public void testMidStreamCursorHeldAtLastEmittedRow() throws Exception {
    batchPolicy = new BatchPolicy.Builder().setMaxRows(2).build();
    List<Map<String, Object>> firstPage = new ArrayList<>();
    firstPage.add(record("berlin", START, 1.0));
    firstPage.add(record("berlin", START.plus(Duration.ofMinutes(1)), 2.0));
    firstPage.add(record("berlin", START.plus(Duration.ofMinutes(2)), 3.0));
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenReturn(
            page(firstPage, "p2"),
            FetchResult.error(FetchError.fatal("HTTP 500 on page 2", null)));

    EntitySyncReport failed = run();

    assertEquals(ErrorKind.FATAL_FETCH, failed.getErrorKind());
    assertEquals(minute(1), failed.getLastGoodCursor().getPosition());
    assertEquals(minute(1), committedPosition());
    // the third row was buffered and discarded
    assertEquals(2, sink.getRows(ENTITY_ID).size());

    // next run starts at the held cursor, inclusive, and re-fetches its rows
    fetcher = mock(PageFetcher.class);
    when(fetcher.fetch(any(FetchRequest.class))).thenReturn(lastPage(firstPage.subList(1, 3)));
    EntitySyncReport resumed = run();

    assertTrue(resumed.toString(), resumed.isSuccess());
    ArgumentCaptor<FetchRequest> request = ArgumentCaptor.forClass(FetchRequest.class);
    verify(fetcher).fetch(request.capture());
    assertEquals(START.plus(Duration.ofMinutes(1)), request.getValue().getWindowStart());
    assertEquals(minute(1), request.getValue().getCursor().getPosition());
    assertEquals(3, sink.getRows(ENTITY_ID).size());
    assertEquals(minute(2), committedPosition());
  }

  @Test
  public void testEqualOrderingValuesAcrossPagesAreNotDropped() throws Exception {
    batchPolicy = new BatchPolicy.Builder().setMaxRows(2).build();
    Instant shared = START.plus(Duration.ofMinutes(5));
    Map<String, Object> berlin = record("berlin", shared, 1.0);
    Map<String, Object> potsdam = record("potsdam", shared, 2.0);
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenReturn(
            page(ImmutableList.of(record("berlin", START, 0.5), berlin), "p2"),
            FetchResult.error(FetchError.fatal("HTTP 500 on page 2", null)));

    EntitySyncReport failed = run();

    assertEquals(ErrorKind.FATAL_FETCH, failed.getErrorKind());
    assertEquals(shared.toString(), failed.getLastGoodCursor().getPosition());
    assertEquals(shared.toString(), committedPosition());
    assertEquals(2, sink.getRows(ENTITY_ID).size());

    // the rerun window includes the cursor value, so the potsdam row still arrives
    fetcher = mock(PageFetcher.class);
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenReturn(lastPage(ImmutableList.of(berlin, potsdam)));
    EntitySyncReport resumed = run();

    assertTrue(resumed.toString(), resumed.isSuccess());
    ArgumentCaptor<FetchRequest> request = ArgumentCaptor.forClass(FetchRequest.class);
    verify(fetcher).fetch(request.capture());
    assertEquals(shared, request.getValue().getWindowStart());
    List<Object> locations =
        sink.getRows(ENTITY_ID).stream()
            .map(row -> row.getValues().get("location_id"))
            .collect(Collectors.toList());
    assertEquals(3, locations.size());
    assertTrue(locations.toString(), locations.contains("potsdam"));
    assertEquals(shared.toString(), committedPosition());
  }

  @Test
  public void testMaxDelayFlushesBetweenFetches() throws Exception {
    batchPolicy = new BatchPolicy.Builder().setMaxDelay(30, TimeUnit.SECONDS).build();
    AtomicLong nanos = new AtomicLong();
    Ticker ticker =
        new Ticker() {
          @Override
          public long read() {
            return nanos.get();
          }
        };
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenAnswer(
            invocation -> {
              FetchRequest request = invocation.getArgument(0);
              switch (request.getPageNumber()) {
                case 1:
                  return page(records("berlin", START, 1), "p2");
                case 2:
                  nanos.addAndGet(TimeUnit.SECONDS.toNanos(120));
                  return page(ImmutableList.of(), "p3");
                default:
                  nanos.addAndGet(TimeUnit.SECONDS.toNanos(120));
                  return FetchResult.error(FetchError.fatal("HTTP 401 Unauthorized", null));
              }
            });

    EntitySyncReport report = plannerBuilder().setTicker(ticker).build().run();

    assertEquals(ErrorKind.FATAL_FETCH, report.getErrorKind());
    assertEquals(1, sink.getBatchesWritten());
    assertEquals(1, sink.getRows(ENTITY_ID).size());
    assertEquals(minute(0), committedPosition());
    assertEquals(minute(0), report.getLastGoodCursor().getPosition());
  }

  @Test
  public void testOutOfOrderRowsSuspendMidStreamCommits() throws Exception {
    batchPolicy = new BatchPolicy.Builder().setMaxRows(2).build();
    List<Map<String, Object>> page = new ArrayList<>();
    page.add(record("berlin", START.plus(Duration.ofMinutes(3)), 1.0));
    page.add(record("berlin", START.plus(Duration.ofMinutes(1)), 2.0));
    page.add(record("berlin", START.plus(Duration.ofMinutes(2)), 3.0));
    when(fetcher.fetch(any(FetchRequest.class))).thenReturn(lastPage(page));

    assertTrue(run().isSuccess());

    List<String> checkpointCursors =
        sink.getCheckpoints().stream()
            .map(CheckpointRecord::getCursor)
            .collect(Collectors.toList());
    assertEquals(2, checkpointCursors.size());
    assertNull(checkpointCursors.get(0));
    assertEquals(minute(3), checkpointCursors.get(1));
    assertEquals(minute(3), committedPosition());
    assertEquals(3, sink.getRows(ENTITY_ID).size());
  }

  @Test
  public void testCursorNeverRegresses() throws Exception {
    cursorStore.commit(ENTITY_ID, "2024-03-09T22:00:00Z", "previous");
    when(fetcher.fetch(any(FetchRequest.class))).thenReturn(lastPage(records("berlin", START, 3)));

    assertTrue(run().isSuccess());
    assertEquals("2024-03-09T22:00:00Z", committedPosition());
    assertEquals(3, sink.getRows(ENTITY_ID).size());
  }

  @Test
  public void testResumesFromCommittedCursor() throws Exception {
    cursorStore.commit(ENTITY_ID, "2024-03-09T20:00:00Z", "previous");
    when(fetcher.fetch(any(FetchRequest.class))).thenReturn(lastPage(ImmutableList.of()));

    assertTrue(run().isSuccess());

    ArgumentCaptor<FetchRequest> request = ArgumentCaptor.forClass(FetchRequest.class);
    verify(fetcher).fetch(request.capture());
    assertEquals(Instant.parse("2024-03-09T20:00:00Z"), request.getValue().getWindowStart());
    assertEquals(NOW, request.getValue().getWindowEnd());
    assertEquals(Cursor.of("2024-03-09T20:00:00Z", "previous"), request.getValue().getCursor());
  }

  @Test
  public void testWatermarkBecomesCursor() throws Exception {
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenReturn(
            FetchResult.of(new Page(records("berlin", START, 5), null, "2024-03-09T12:00:00Z")));

    assertTrue(run().isSuccess());
    assertEquals("2024-03-09T12:00:00Z", committedPosition());
  }

  @Test
  public void testWatermarkCappedAtWindowEnd() throws Exception {
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenReturn(FetchResult.of(new Page(ImmutableList.of(), null, "2024-03-11T00:00:00Z")));

    assertTrue(run().isSuccess());
    assertEquals(NOW.toString(), committedPosition());
  }

  @Test
  public void testInvalidWatermarkIsFatal() throws Exception {
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenReturn(FetchResult.of(new Page(records("berlin", START, 5), null, "soon")));

    EntitySyncReport report = run();

    assertEquals(ErrorKind.FATAL_FETCH, report.getErrorKind());
    assertThat(report.getMessage(), containsString("invalid watermark [soon]"));
    assertEquals(0, sink.getBatchesWritten());
  }

  @Test
  public void testRepeatedPageTokenIsFatal() throws Exception {
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenReturn(
            page(records("berlin", START, 2), "same"),
            page(records("berlin", START.plus(Duration.ofMinutes(2)), 2), "same"));

    EntitySyncReport report = run();

    assertEquals(ErrorKind.FATAL_FETCH, report.getErrorKind());
    assertThat(report.getMessage(), containsString("pagination did not advance"));
    assertTrue(cursorStore.load(ENTITY_ID).isInitial());
  }

  @Test
  public void testEmptyPageWithTokenFetchesNextPage() throws Exception {
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenReturn(page(ImmutableList.of(), "p2"), lastPage(records("berlin", START, 2)));

    EntitySyncReport report = run();

    assertTrue(report.isSuccess());
    assertEquals(2, report.getPagesFetched());
    assertEquals(minute(1), committedPosition());
  }

  @Test
  public void testDeleteMarkerRemovesRow() throws Exception {
    Map<String, Object> deleted = record("berlin", START, 1.0);
    deleted.put("deleted", true);
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenReturn(
            page(ImmutableList.of(record("berlin", START, 1.0)), "p2"),
            lastPage(ImmutableList.of(deleted)));

    assertTrue(run().isSuccess());
    assertEquals(0, sink.getRows(ENTITY_ID).size());
    assertEquals(START.toString(), committedPosition());
  }

  @Test
  public void testWindowsUpToNow() throws Exception {
    settings.setWindowSize(Duration.ofHours(24)).setInitialLookback(Duration.ofDays(3));
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenAnswer(
            invocation -> {
              FetchRequest request = invocation.getArgument(0);
              Instant observed = request.getWindowStart().plus(Duration.ofHours(1));
              return lastPage(ImmutableList.of(record("berlin", observed, 1.0)));
            });

    EntitySyncReport report = run();

    assertTrue(report.toString(), report.isSuccess());
    ArgumentCaptor<FetchRequest> requests = ArgumentCaptor.forClass(FetchRequest.class);
    verify(fetcher, times(3)).fetch(requests.capture());
    List<Instant> starts =
        requests.getAllValues().stream()
            .map(FetchRequest::getWindowStart)
            .collect(Collectors.toList());
    assertEquals(
        ImmutableList.of(
            NOW.minus(Duration.ofDays(3)), NOW.minus(Duration.ofDays(2)),
            NOW.minus(Duration.ofDays(1))),
        starts);
    assertEquals(NOW, requests.getAllValues().get(2).getWindowEnd());
    assertEquals(3, sink.getRows(ENTITY_ID).size());
    assertEquals(3, sink.getBatchesWritten());
    assertEquals(NOW.minus(Duration.ofHours(23)).toString(), committedPosition());
  }

  @Test
  public void testInterruptDiscardsBufferedRows() throws Exception {
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenReturn(page(records("berlin", START, 5), "p2"))
        .thenThrow(new InterruptedException());

    EntitySyncReport report = run();

    assertTrue("interrupt flag restored", Thread.interrupted());
    assertEquals(ErrorKind.CANCELLED, report.getErrorKind());
    assertEquals(5, report.getRowsEmitted());
    assertEquals(0, sink.getBatchesWritten());
    assertTrue(cursorStore.load(ENTITY_ID).isInitial());
  }

  @Test
  public void testInterruptedBeforeFirstFetch() throws Exception {
    Thread.currentThread().interrupt();

    EntitySyncReport report = run();

    assertTrue(Thread.interrupted());
    assertEquals(ErrorKind.CANCELLED, report.getErrorKind());
    verify(fetcher, never()).fetch(any(FetchRequest.class));
  }

  @Test
  public void testCursorLoadFailure() throws Exception {
    CursorStore failingStore = mock(CursorStore.class);
    when(failingStore.load(ENTITY_ID)).thenThrow(new IOException("unreadable"));

    SyncPlanner planner = plannerBuilder().setCursorStore(failingStore).build();
    EntitySyncReport report = planner.run();

    assertEquals(ErrorKind.INTERNAL, report.getErrorKind());
    assertThat(report.getMessage(), containsString("unreadable"));
    assertNull(report.getLastGoodCursor());
    assertEquals(SyncPlanner.State.FAILED, planner.getState());
  }

  @Test
  public void testCursorCommitFailure() throws Exception {
    CursorStore failingStore = mock(CursorStore.class);
    when(failingStore.load(ENTITY_ID)).thenReturn(Cursor.initial());
    doThrow(new CommitException("read only"))
        .when(failingStore).commit(anyString(), anyString(), anyString());
    when(fetcher.fetch(any(FetchRequest.class))).thenReturn(lastPage(records("berlin", START, 2)));

    EntitySyncReport report = plannerBuilder().setCursorStore(failingStore).build().run();

    assertEquals(ErrorKind.COMMIT, report.getErrorKind());
    assertTrue(report.getLastGoodCursor().isInitial());
  }

  @Test
  public void testUnexpectedExceptionIsInternal() throws Exception {
    when(fetcher.fetch(any(FetchRequest.class))).thenThrow(new IllegalStateException("bug"));

    EntitySyncReport report = run();

    assertEquals(ErrorKind.INTERNAL, report.getErrorKind());
    assertThat(report.getMessage(), containsString("bug"));
  }

  @Test
  public void testSafeCursorCandidateBeforeRows() {
    SyncPlanner planner = plannerBuilder().build();
    assertNull(planner.safeCursorCandidate());
    assertEquals(SyncPlanner.State.IDLE, planner.getState());
  }

  @Test
  public void testRunsOnlyOnce() throws Exception {
    when(fetcher.fetch(any(FetchRequest.class))).thenReturn(lastPage(ImmutableList.of()));
    SyncPlanner planner = plannerBuilder().build();
    assertTrue(planner.run().isSuccess());
    thrown.expect(IllegalStateException.class);
    planner.run();
  }
}
