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

import static com.google.common.base.Preconditions.checkState;
import static com.weathersync.sdk.config.Configuration.checkConfiguration;

import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpTransport;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.weathersync.sdk.RetryPolicy;
import com.weathersync.sdk.TransportProxy;
import com.weathersync.sdk.config.Configuration;
import com.weathersync.sdk.sync.ColumnSpec;
import com.weathersync.sdk.sync.ColumnType;
import com.weathersync.sdk.sync.EntityDescriptor;
import com.weathersync.sdk.sync.PageFetcher;
import com.weathersync.sdk.sync.RowSink;
import com.weathersync.sdk.sync.SyncRepository;
import com.weathersync.sdk.sync.TableSchema;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link SyncRepository} of hourly weather observations, one entity per configured location.
 *
 * <p>Required configuration parameters:
 *
 * <ul>
 *   <li>{@value #CONFIG_API_BASE_URL} - base URL of the weather API.
 *   <li>{@value #CONFIG_API_KEY} - API key sent with every request.
 *   <li>{@value #CONFIG_LOCATIONS} - comma separated location ids.
 * </ul>
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@value #CONFIG_PAGE_SIZE} - observations per page. Default is 100.
 *   <li>{@value #CONFIG_CONNECT_TIMEOUT_SECONDS} - connect timeout. Default is 20 seconds.
 *   <li>{@value #CONFIG_READ_TIMEOUT_SECONDS} - read timeout. Default is 20 seconds.
 *   <li>{@value #CONFIG_SINK_DIRECTORY} - directory of the CSV tables. Default is
 *       {@code ./tables}.
 * </ul>
 *
 * <p>Requests go through the proxy configured with the {@code transport.proxy.*} keys, if any.
 */
public class WeatherRepository implements SyncRepository {
  private static final Logger logger = Logger.getLogger(WeatherRepository.class.getName());

  public static final String CONFIG_API_BASE_URL = "weather.apiBaseUrl";
  public static final String CONFIG_API_KEY = "weather.apiKey";
  public static final String CONFIG_LOCATIONS = "weather.locations";
  public static final String CONFIG_PAGE_SIZE = "weather.pageSize";
  public static final String CONFIG_CONNECT_TIMEOUT_SECONDS = "weather.connectTimeoutSeconds";
  public static final String CONFIG_READ_TIMEOUT_SECONDS = "weather.readTimeoutSeconds";
  public static final String CONFIG_SINK_DIRECTORY = "sink.directory";

  static final int DEFAULT_PAGE_SIZE = 100;
  @VisibleForTesting static final int DEFAULT_TIMEOUT_SECONDS = 20;
  @VisibleForTesting static final String DEFAULT_SINK_DIRECTORY = "./tables";

  /** Prefix of the entity ids, followed by the location id. */
  public static final String ENTITY_PREFIX = "hourly_observations.";

  private static final CharMatcher LOCATION_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("_-"));

  private static final TableSchema OBSERVATIONS_SCHEMA =
      new TableSchema(
          "hourly_observations",
          ImmutableList.of(
              new ColumnSpec.Builder("location_id", ColumnType.STRING)
                  .setSourcePath("location")
                  .build(),
              new ColumnSpec.Builder("observed_at", ColumnType.TIMESTAMP)
                  .setSourcePath("observedAt")
                  .build(),
              new ColumnSpec.Builder("temperature_c", ColumnType.DOUBLE)
                  .setSourcePath("main.temp")
                  .build(),
              new ColumnSpec.Builder("humidity_pct", ColumnType.LONG)
                  .setSourcePath("main.humidity")
                  .build(),
              new ColumnSpec.Builder("pressure_hpa", ColumnType.DOUBLE)
                  .setSourcePath("main.pressure")
                  .build(),
              new ColumnSpec.Builder("wind_speed_ms", ColumnType.DOUBLE)
                  .setSourcePath("wind.speed")
                  .build(),
              new ColumnSpec.Builder("precipitation_mm", ColumnType.DOUBLE)
                  .setSourcePath("precipitation.lastHour")
                  .setNullable(true)
                  .build(),
              new ColumnSpec.Builder("conditions", ColumnType.STRING)
                  .setNullable(true)
                  .build()));

  private final HttpTransport providedTransport;
  private HttpTransport transport;
  private ImmutableList<EntityDescriptor> entities;
  private WeatherApiPageFetcher pageFetcher;
  private CsvTableSink rowSink;

  public WeatherRepository() {
    this(null);
  }

  /** Uses {@code transport} for all requests instead of one built from proxy configuration. */
  @VisibleForTesting
  WeatherRepository(HttpTransport transport) {
    this.providedTransport = transport;
  }

  @Override
  public void init() throws IOException {
    checkState(Configuration.isInitialized(), "configuration not initialized");
    String baseUrl = Configuration.getString(CONFIG_API_BASE_URL, null).get();
    String apiKey = Configuration.getString(CONFIG_API_KEY, null).get();
    List<String> locations =
        Configuration.getMultiValue(CONFIG_LOCATIONS, null, Configuration.STRING_PARSER).get();
    int pageSize = Configuration.getInteger(CONFIG_PAGE_SIZE, DEFAULT_PAGE_SIZE).get();
    int connectTimeout =
        Configuration.getInteger(CONFIG_CONNECT_TIMEOUT_SECONDS, DEFAULT_TIMEOUT_SECONDS).get();
    int readTimeout =
        Configuration.getInteger(CONFIG_READ_TIMEOUT_SECONDS, DEFAULT_TIMEOUT_SECONDS).get();
    String sinkDirectory =
        Configuration.getString(CONFIG_SINK_DIRECTORY, DEFAULT_SINK_DIRECTORY).get();

    checkConfiguration(!baseUrl.isEmpty(), "%s can not be empty", CONFIG_API_BASE_URL);
    checkConfiguration(!apiKey.isEmpty(), "%s can not be empty", CONFIG_API_KEY);
    checkConfiguration(!locations.isEmpty(), "%s can not be empty", CONFIG_LOCATIONS);
    checkConfiguration(pageSize > 0, "%s must be positive: %d", CONFIG_PAGE_SIZE, pageSize);
    checkConfiguration(connectTimeout >= 0, "%s can not be negative: %d",
        CONFIG_CONNECT_TIMEOUT_SECONDS, connectTimeout);
    checkConfiguration(readTimeout >= 0, "%s can not be negative: %d",
        CONFIG_READ_TIMEOUT_SECONDS, readTimeout);

    Map<String, String> locationByEntity = new LinkedHashMap<>();
    ImmutableList.Builder<EntityDescriptor> descriptors = ImmutableList.builder();
    for (String location : locations) {
      checkConfiguration(!location.isEmpty() && LOCATION_CHARS.matchesAllOf(location),
          "invalid location id [%s] in %s", location, CONFIG_LOCATIONS);
      EntityDescriptor entity = observationsEntity(location);
      checkConfiguration(locationByEntity.put(entity.getId(), location) == null,
          "duplicate location id [%s] in %s", location, CONFIG_LOCATIONS);
      descriptors.add(entity);
    }
    entities = descriptors.build();

    HttpRequestInitializer requestInitializer = request -> {};
    if (providedTransport == null) {
      TransportProxy proxy = TransportProxy.fromConfiguration();
      transport = proxy.createHttpTransport();
      requestInitializer = proxy.getRequestInitializer();
    } else {
      transport = providedTransport;
    }
    pageFetcher =
        new WeatherApiPageFetcher.Builder()
            .setTransport(transport)
            .setRequestInitializer(requestInitializer)
            .setBaseUrl(baseUrl)
            .setApiKey(apiKey)
            .setPageSize(pageSize)
            .setLocations(ImmutableMap.copyOf(locationByEntity))
            .setConnectTimeout(Duration.ofSeconds(connectTimeout))
            .setReadTimeout(Duration.ofSeconds(readTimeout))
            .setRetryPolicy(RetryPolicy.fromConfiguration())
            .build();
    rowSink = new CsvTableSink(FileSystems.getDefault().getPath(sinkDirectory.trim()), entities);
    logger.log(Level.INFO, "Syncing observations of {0} locations from {1} into {2}",
        new Object[] {entities.size(), baseUrl, sinkDirectory});
  }

  /** Describes the hourly observations of one location. */
  @VisibleForTesting
  static EntityDescriptor observationsEntity(String location) {
    return new EntityDescriptor.Builder()
        .setId(ENTITY_PREFIX + location)
        .setSchema(OBSERVATIONS_SCHEMA)
        .setPrimaryKey(ImmutableList.of("location_id", "observed_at"))
        .setOrderingColumn("observed_at")
        .setDeleteMarkerField("deleted")
        .build();
  }

  @Override
  public List<EntityDescriptor> getEntities() {
    checkState(entities != null, "repository not initialized");
    return entities;
  }

  @Override
  public PageFetcher getPageFetcher() {
    checkState(pageFetcher != null, "repository not initialized");
    return pageFetcher;
  }

  @Override
  public RowSink getRowSink() {
    checkState(rowSink != null, "repository not initialized");
    return rowSink;
  }

  @Override
  public void close() {
    if (transport == null) {
      return;
    }
    try {
      transport.shutdown();
    } catch (IOException e) {
      logger.log(Level.WARNING, "Error shutting down the HTTP transport", e);
    }
    transport = null;
  }
}
