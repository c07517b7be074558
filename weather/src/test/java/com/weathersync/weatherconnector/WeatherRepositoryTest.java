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
package com.weathersync.weatherconnector;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;

import com.google.api.client.http.GenericUrl;
import com.google.api.client.testing.http.MockLowLevelHttpResponse;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.weathersync.sdk.ConnectorContext;
import com.weathersync.sdk.InvalidConfigurationException;
import com.weathersync.sdk.RetryPolicy;
import com.weathersync.sdk.config.Configuration.ResetConfigRule;
import com.weathersync.sdk.config.Configuration.SetupConfigRule;
import com.weathersync.sdk.sync.EntityDescriptor;
import com.weathersync.sdk.sync.IncrementalSyncConnector;
import com.weathersync.sdk.sync.LocalFileCursorStore;
import com.weathersync.sdk.sync.MappingException;
import com.weathersync.sdk.sync.RecordMapper;
import com.weathersync.sdk.sync.Row;
import com.weathersync.sdk.sync.SyncSettings;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

public class WeatherRepositoryTest {
  @Rule public ExpectedException thrown = ExpectedException.none();
  @Rule public ResetConfigRule resetConfig = new ResetConfigRule();
  @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized();
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private final TestingWeatherApi api = new TestingWeatherApi();

  private Properties requiredConfig() throws IOException {
    Properties config = new Properties();
    config.put(WeatherRepository.CONFIG_API_BASE_URL, "https://weather.example.com/v1");
    config.put(WeatherRepository.CONFIG_API_KEY, "secret");
    config.put(WeatherRepository.CONFIG_LOCATIONS, "london, paris");
    config.put(WeatherRepository.CONFIG_SINK_DIRECTORY,
        temporaryFolder.newFolder("tables").getAbsolutePath());
    return config;
  }

  private static Map<String, Object> observation(Instant observedAt, double temperature) {
    Map<String, Object> record = new HashMap<>();
    record.put("location", "london");
    record.put("observedAt", observedAt.toString());
    record.put("main", ImmutableMap.of("temp", temperature, "humidity", 72, "pressure", 1009.5));
    record.put("wind", ImmutableMap.of("speed", 4.1));
    record.put("conditions", "overcast");
    return record;
  }

  @Test
  public void init_createsEntityPerLocation() throws Exception {
    setupConfig.initConfig(requiredConfig());
    WeatherRepository repository = new WeatherRepository(api);

    repository.init();

    List<EntityDescriptor> entities = repository.getEntities();
    assertEquals(2, entities.size());
    assertEquals("hourly_observations.london", entities.get(0).getId());
    assertEquals("hourly_observations.paris", entities.get(1).getId());
    assertEquals(ImmutableList.of("location_id", "observed_at"), entities.get(0).getPrimaryKey());
    assertEquals("observed_at", entities.get(0).getOrderingColumn());
    assertEquals(
        ImmutableList.of("location_id", "observed_at", "temperature_c", "humidity_pct",
            "pressure_hpa", "wind_speed_ms", "precipitation_mm", "conditions"),
        entities.get(0).getSchema().getColumnNames());
  }

  @Test
  public void init_missingApiKey_fails() throws Exception {
    Properties config = requiredConfig();
    config.remove(WeatherRepository.CONFIG_API_KEY);
    setupConfig.initConfig(config);

    thrown.expect(InvalidConfigurationException.class);
    new WeatherRepository(api).init();
  }

  @Test
  public void init_emptyLocations_fails() throws Exception {
    Properties config = requiredConfig();
    config.put(WeatherRepository.CONFIG_LOCATIONS, " , ");
    setupConfig.initConfig(config);

    thrown.expect(InvalidConfigurationException.class);
    new WeatherRepository(api).init();
  }

  @Test
  public void init_invalidLocation_fails() throws Exception {
    Properties config = requiredConfig();
    config.put(WeatherRepository.CONFIG_LOCATIONS, "london,../etc");
    setupConfig.initConfig(config);

    thrown.expect(InvalidConfigurationException.class);
    thrown.expectMessage("../etc");
    new WeatherRepository(api).init();
  }

  @Test
  public void init_duplicateLocation_fails() throws Exception {
    Properties config = requiredConfig();
    config.put(WeatherRepository.CONFIG_LOCATIONS, "london,paris,london");
    setupConfig.initConfig(config);

    thrown.expect(InvalidConfigurationException.class);
    thrown.expectMessage("duplicate");
    new WeatherRepository(api).init();
  }

  @Test
  public void init_invalidPageSize_fails() throws Exception {
    Properties config = requiredConfig();
    config.put(WeatherRepository.CONFIG_PAGE_SIZE, "0");
    setupConfig.initConfig(config);

    thrown.expect(InvalidConfigurationException.class);
    new WeatherRepository(api).init();
  }

  @Test
  public void getEntities_beforeInit_fails() {
    thrown.expect(IllegalStateException.class);
    new WeatherRepository(api).getEntities();
  }

  @Test
  public void observationsEntity_mapsNestedRecord() throws MappingException {
    Instant observedAt = Instant.parse("2024-03-01T01:00:00Z");
    Map<String, Object> record = observation(observedAt, 6.5);

    Row row =
        new RecordMapper().map(record, WeatherRepository.observationsEntity("london"));

    assertEquals(Row.Operation.UPSERT, row.getOperation());
    assertEquals(ImmutableList.of("london", observedAt), row.getKey());
    assertEquals(6.5, row.getValues().get("temperature_c"));
    assertEquals(72L, row.getValues().get("humidity_pct"));
    assertEquals(4.1, row.getValues().get("wind_speed_ms"));
    assertNull(row.getValues().get("precipitation_mm"));
    assertEquals("overcast", row.getValues().get("conditions"));
  }

  @Test
  public void observationsEntity_deletedRecord() throws MappingException {
    Instant observedAt = Instant.parse("2024-03-01T01:00:00Z");
    Map<String, Object> record = new HashMap<>();
    record.put("location", "london");
    record.put("observedAt", observedAt.toString());
    record.put("deleted", true);

    Row row =
        new RecordMapper().map(record, WeatherRepository.observationsEntity("london"));

    assertEquals(Row.Operation.DELETE, row.getOperation());
  }

  @Test
  public void traverse_syncsObservationsIntoTable() throws Exception {
    Properties config = requiredConfig();
    config.put(WeatherRepository.CONFIG_LOCATIONS, "london");
    File cursors = temporaryFolder.newFolder("cursors");
    config.put(LocalFileCursorStore.CURSOR_DIRECTORY, cursors.getAbsolutePath());
    config.put(SyncSettings.CONFIG_INITIAL_LOOKBACK_DAYS, "1");
    config.put(SyncSettings.CONFIG_WINDOW_HOURS, "48");
    config.put(RetryPolicy.CONFIG_INITIAL_INTERVAL_MILLIS, "10");
    setupConfig.initConfig(config);
    Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    api.addResponse(
            new MockLowLevelHttpResponse()
                .setStatusCode(503)
                .addHeader(WeatherApiPageFetcher.RETRY_AFTER_HEADER, "0"))
        .addPage(ImmutableList.of(observation(now.minus(2, ChronoUnit.HOURS), 6.5)), "p2", null)
        .addPage(ImmutableList.of(observation(now.minus(1, ChronoUnit.HOURS), 7.0)), null, null);
    WeatherRepository repository = new WeatherRepository(api);
    IncrementalSyncConnector connector = new IncrementalSyncConnector(repository);

    connector.init(mock(ConnectorContext.class));
    try {
      connector.traverse();
    } finally {
      connector.destroy();
    }

    List<String> requests = api.getRequestUrls();
    assertEquals(3, requests.size());
    assertEquals("p2", new GenericUrl(requests.get(2)).getFirst("pageToken"));
    File table = new File(config.getProperty(WeatherRepository.CONFIG_SINK_DIRECTORY),
        "hourly_observations.london.csv");
    List<String> lines = Files.readAllLines(table.toPath(), UTF_8);
    assertEquals(3, lines.size());
    assertThat(lines.get(2), containsString(now.minus(1, ChronoUnit.HOURS).toString()));
    assertTrue(new File(cursors, "hourly_observations.london.cursor.json").isFile());
  }
}
