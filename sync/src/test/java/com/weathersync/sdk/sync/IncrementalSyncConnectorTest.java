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

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.weathersync.sdk.ConnectorContext;
import com.weathersync.sdk.InvalidConfigurationException;
import com.weathersync.sdk.config.Configuration.ResetConfigRule;
import com.weathersync.sdk.config.Configuration.SetupConfigRule;
import java.io.IOException;
import java.util.Properties;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.runner.RunWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

/** Tests for {@link IncrementalSyncConnector}. */
@RunWith(MockitoJUnitRunner.class)
public class IncrementalSyncConnectorTest {
  private static final String BERLIN = "hourly_observations.berlin";
  private static final String PARIS = "hourly_observations.paris";

  @Rule public ExpectedException thrown = ExpectedException.none();
  @Rule public ResetConfigRule resetConfig = new ResetConfigRule();
  @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized();

  @Mock private SyncRepository repository;
  @Mock private PageFetcher fetcher;
  @Mock private ConnectorContext context;

  private final InMemoryCursorStore cursorStore = new InMemoryCursorStore();
  private final InMemoryTableSink sink = new InMemoryTableSink();

  private IncrementalSyncConnector initConnector(Properties config) throws Exception {
    setupConfig.initConfig(config);
    when(repository.getEntities())
        .thenReturn(
            ImmutableList.of(SyncTestData.observations(BERLIN), SyncTestData.observations(PARIS)));
    when(repository.getPageFetcher()).thenReturn(fetcher);
    when(repository.getRowSink()).thenReturn(sink);
    IncrementalSyncConnector connector =
        new IncrementalSyncConnector(repository, cursorStore, SyncTestData.CLOCK);
    connector.init(context);
    return connector;
  }

  private static Properties shortLookback() {
    Properties config = new Properties();
    config.put(SyncSettings.CONFIG_INITIAL_LOOKBACK_DAYS, "1");
    return config;
  }

  @Test
  public void testInitNotConfigured() throws Exception {
    IncrementalSyncConnector connector =
        new IncrementalSyncConnector(repository, cursorStore, SyncTestData.CLOCK);
    thrown.expect(IllegalStateException.class);
    connector.init(context);
  }

  @Test
  public void testInitInvalidConfiguration() throws Exception {
    Properties config = new Properties();
    config.put(SyncSettings.CONFIG_WINDOW_HOURS, "0");
    setupConfig.initConfig(config);
    IncrementalSyncConnector connector =
        new IncrementalSyncConnector(repository, cursorStore, SyncTestData.CLOCK);
    thrown.expect(InvalidConfigurationException.class);
    connector.init(context);
  }

  @Test
  public void testTraverseSyncsAllEntities() throws Exception {
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenAnswer(
            invocation -> {
              FetchRequest request = invocation.getArgument(0);
              String location = request.getEntityId().endsWith("berlin") ? "berlin" : "paris";
              return FetchResult.of(Page.last(
                  SyncTestData.records(location, request.getWindowStart(), 4)));
            });
    IncrementalSyncConnector connector = initConnector(shortLookback());

    connector.traverse();

    verify(repository).init();
    assertEquals(4, sink.getRows(BERLIN).size());
    assertEquals(4, sink.getRows(PARIS).size());
    assertEquals("2024-03-09T00:03:00Z", cursorStore.load(BERLIN).getPosition());
    connector.destroy();
  }

  @Test
  public void testTraverseReportsFailedEntities() throws Exception {
    when(fetcher.fetch(any(FetchRequest.class)))
        .thenAnswer(
            invocation -> {
              FetchRequest request = invocation.getArgument(0);
              return BERLIN.equals(request.getEntityId())
                  ? FetchResult.error(FetchError.fatal("HTTP 403 Forbidden", null))
                  : FetchResult.of(Page.last(ImmutableList.of()));
            });
    IncrementalSyncConnector connector = initConnector(shortLookback());
    try {
      connector.traverse();
      fail("failed entity should fail the traversal");
    } catch (IOException e) {
      assertThat(e.getMessage(), containsString("Sync of 1 of 2 entities failed"));
      assertThat(e.getMessage(), containsString("HTTP 403 Forbidden"));
    } finally {
      connector.destroy();
    }
  }

  @Test
  public void testTraverseBeforeInit() throws Exception {
    IncrementalSyncConnector connector = new IncrementalSyncConnector(repository);
    thrown.expect(IllegalStateException.class);
    connector.traverse();
  }

  @Test
  public void testDestroyClosesRepository() throws Exception {
    IncrementalSyncConnector connector = initConnector(shortLookback());
    connector.destroy();
    InOrder inOrder = inOrder(repository);
    inOrder.verify(repository).init();
    inOrder.verify(repository).close();
  }

  @Test
  public void testDestroyWithoutInit() {
    new IncrementalSyncConnector(repository).destroy();
    verify(repository).close();
  }

  @Test
  public void testDefaultId() {
    assertEquals(repository.getClass().getName(),
        new IncrementalSyncConnector(repository).getDefaultId());
  }
}
