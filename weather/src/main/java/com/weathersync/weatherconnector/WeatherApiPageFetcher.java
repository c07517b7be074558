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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.GenericJson;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.api.client.util.Key;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.weathersync.sdk.RetryPolicy;
import com.weathersync.sdk.sync.FetchError;
import com.weathersync.sdk.sync.FetchRequest;
import com.weathersync.sdk.sync.FetchResult;
import com.weathersync.sdk.sync.Page;
import com.weathersync.sdk.sync.PageFetcher;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link PageFetcher} reading hourly observations from the weather API.
 *
 * <p>Each request is a GET on {@code <baseUrl>/observations} with the query parameters
 * {@code location}, {@code start}, {@code end}, {@code pageSize}, {@code pageToken} (after the
 * first page) and {@code key}. The response body is
 *
 * <pre>
 *   {"observations": [...], "nextPageToken": "...", "watermark": "..."}
 * </pre>
 *
 * <p>Connection failures and the statuses 408, 429 and 5xx are reported as transient errors,
 * honoring a {@code Retry-After} header when the server sends one. Any other unsuccessful status
 * or an unreadable body is fatal.
 */
public class WeatherApiPageFetcher implements PageFetcher {
  private static final Logger logger = Logger.getLogger(WeatherApiPageFetcher.class.getName());
  private static final JsonFactory JSON_FACTORY = JacksonFactory.getDefaultInstance();

  @VisibleForTesting static final String OBSERVATIONS_PATH = "/observations";
  @VisibleForTesting static final String RETRY_AFTER_HEADER = "Retry-After";

  private final HttpRequestFactory requestFactory;
  private final String observationsUrl;
  private final String apiKey;
  private final int pageSize;
  private final ImmutableMap<String, String> locations;
  private final int connectTimeoutMillis;
  private final int readTimeoutMillis;
  private final Clock clock;
  private final RetryPolicy retryPolicy;

  private WeatherApiPageFetcher(Builder builder) {
    this.requestFactory = builder.transport.createRequestFactory(builder.requestInitializer);
    this.observationsUrl =
        CharMatcher.is('/').trimTrailingFrom(builder.baseUrl) + OBSERVATIONS_PATH;
    this.apiKey = builder.apiKey;
    this.pageSize = builder.pageSize;
    this.locations = ImmutableMap.copyOf(builder.locations);
    this.connectTimeoutMillis = (int) builder.connectTimeout.toMillis();
    this.readTimeoutMillis = (int) builder.readTimeout.toMillis();
    this.clock = builder.clock;
    this.retryPolicy = builder.retryPolicy;
  }

  @Override
  public FetchResult fetch(FetchRequest request) throws InterruptedException {
    String location = locations.get(request.getEntityId());
    if (location == null) {
      return FetchResult.error(
          FetchError.fatal("no location configured for " + request.getEntityId(), null));
    }
    logger.log(
        Level.FINE,
        "Fetching page {0} of {1} for window [{2}, {3}]",
        new Object[] {
          request.getPageNumber(), location, request.getWindowStart(), request.getWindowEnd()
        });

    HttpResponse response;
    try {
      HttpRequest httpRequest = requestFactory.buildGetRequest(buildUrl(location, request));
      httpRequest.setThrowExceptionOnExecuteError(false);
      httpRequest.setConnectTimeout(connectTimeoutMillis);
      httpRequest.setReadTimeout(readTimeoutMillis);
      response = httpRequest.execute();
    } catch (IOException e) {
      return transientFailure(location, e);
    }
    try {
      if (!response.isSuccessStatusCode()) {
        return FetchResult.error(classify(response));
      }
      String content;
      try {
        content = response.parseAsString();
      } catch (IOException e) {
        return transientFailure(location, e);
      }
      return parse(content, request.getPageNumber());
    } finally {
      disconnect(response);
    }
  }

  private GenericUrl buildUrl(String location, FetchRequest request) {
    GenericUrl url = new GenericUrl(observationsUrl);
    url.set("location", location);
    url.set("start", request.getWindowStart().toString());
    url.set("end", request.getWindowEnd().toString());
    url.set("pageSize", pageSize);
    if (request.getPageToken() != null) {
      url.set("pageToken", request.getPageToken());
    }
    url.set("key", apiKey);
    return url;
  }

  private FetchError classify(HttpResponse response) {
    int status = response.getStatusCode();
    String message =
        String.format("HTTP %d %s", status, Strings.nullToEmpty(response.getStatusMessage()))
            .trim();
    if (retryPolicy.isRetryableStatusCode(status)) {
      Optional<Duration> retryAfter =
          parseRetryAfter(response.getHeaders().getFirstHeaderStringValue(RETRY_AFTER_HEADER));
      return retryAfter.isPresent()
          ? FetchError.transientError(message, retryAfter.get(), null)
          : FetchError.transientError(message, null);
    }
    return FetchError.fatal(message, null);
  }

  private static FetchResult parse(String content, int pageNumber) {
    ObservationsResponse parsed;
    try {
      parsed = JSON_FACTORY.fromString(content, ObservationsResponse.class);
    } catch (IOException | IllegalArgumentException e) {
      return FetchResult.error(
          FetchError.fatal("unparseable observations payload on page " + pageNumber, e));
    }
    if (parsed == null) {
      return FetchResult.error(
          FetchError.fatal("empty observations payload on page " + pageNumber, null));
    }
    List<Map<String, Object>> observations =
        parsed.getObservations() == null ? ImmutableList.of() : parsed.getObservations();
    if (observations.contains(null)) {
      return FetchResult.error(
          FetchError.fatal("null observation on page " + pageNumber, null));
    }
    return FetchResult.of(
        new Page(observations, parsed.getNextPageToken(), parsed.getWatermark()));
  }

  /**
   * Parses a {@code Retry-After} value, either delay seconds or an HTTP date.
   *
   * <p>Dates in the past yield a zero delay. Unreadable values are ignored.
   */
  @VisibleForTesting
  Optional<Duration> parseRetryAfter(String value) {
    if (Strings.isNullOrEmpty(value)) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    if (CharMatcher.inRange('0', '9').matchesAllOf(trimmed)) {
      try {
        return Optional.of(Duration.ofSeconds(Long.parseLong(trimmed)));
      } catch (NumberFormatException e) {
        logger.log(Level.FINE, "Ignoring out of range Retry-After [{0}]", trimmed);
        return Optional.empty();
      }
    }
    try {
      Instant retryAt = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME)
          .toInstant();
      Duration delay = Duration.between(clock.instant(), retryAt);
      return Optional.of(delay.isNegative() ? Duration.ZERO : delay);
    } catch (DateTimeParseException e) {
      logger.log(Level.FINE, "Ignoring unreadable Retry-After [{0}]", trimmed);
      return Optional.empty();
    }
  }

  private static void disconnect(HttpResponse response) {
    try {
      response.disconnect();
    } catch (IOException e) {
      logger.log(Level.FINE, "Error disconnecting response", e);
    }
  }

  /**
   * Reports an I/O failure without an HTTP status as transient, unless the calling thread was
   * interrupted.
   */
  private static FetchResult transientFailure(String location, IOException e)
      throws InterruptedException {
    if (Thread.interrupted()) {
      InterruptedException interrupted = new InterruptedException("fetch interrupted");
      interrupted.initCause(e);
      throw interrupted;
    }
    return FetchResult.error(
        FetchError.transientError(
            String.format("request for %s failed: %s", location, e.getMessage()), e));
  }

  /** Response body of the observations endpoint. */
  public static class ObservationsResponse extends GenericJson {
    @Key private List<Map<String, Object>> observations;
    @Key private String nextPageToken;
    @Key private String watermark;

    public List<Map<String, Object>> getObservations() {
      return observations;
    }

    public ObservationsResponse setObservations(List<Map<String, Object>> observations) {
      this.observations = observations;
      return this;
    }

    public String getNextPageToken() {
      return nextPageToken;
    }

    public ObservationsResponse setNextPageToken(String nextPageToken) {
      this.nextPageToken = nextPageToken;
      return this;
    }

    public String getWatermark() {
      return watermark;
    }

    public ObservationsResponse setWatermark(String watermark) {
      this.watermark = watermark;
      return this;
    }
  }

  /** Builder for {@link WeatherApiPageFetcher}. */
  public static class Builder {
    private HttpTransport transport;
    private HttpRequestInitializer requestInitializer = request -> {};
    private String baseUrl;
    private String apiKey;
    private int pageSize = WeatherRepository.DEFAULT_PAGE_SIZE;
    private Map<String, String> locations = ImmutableMap.of();
    private Duration connectTimeout = Duration.ofSeconds(20);
    private Duration readTimeout = Duration.ofSeconds(20);
    private Clock clock = Clock.systemUTC();
    private RetryPolicy retryPolicy = new RetryPolicy.Builder().build();

    public Builder setTransport(HttpTransport transport) {
      this.transport = transport;
      return this;
    }

    public Builder setRequestInitializer(HttpRequestInitializer requestInitializer) {
      this.requestInitializer = requestInitializer;
      return this;
    }

    public Builder setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder setApiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    public Builder setPageSize(int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    /** Sets the API location id for each entity id. */
    public Builder setLocations(Map<String, String> locations) {
      this.locations = locations;
      return this;
    }

    public Builder setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder setReadTimeout(Duration readTimeout) {
      this.readTimeout = readTimeout;
      return this;
    }

    public Builder setClock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Sets the policy that decides which HTTP statuses are transient. */
    public Builder setRetryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public WeatherApiPageFetcher build() {
      checkNotNull(transport, "transport can not be null");
      checkNotNull(requestInitializer, "request initializer can not be null");
      checkArgument(!Strings.isNullOrEmpty(baseUrl), "base url can not be null or empty");
      checkArgument(!Strings.isNullOrEmpty(apiKey), "api key can not be null or empty");
      checkArgument(pageSize > 0, "page size must be positive");
      checkNotNull(locations, "locations can not be null");
      checkArgument(!connectTimeout.isNegative(), "connect timeout can not be negative");
      checkArgument(!readTimeout.isNegative(), "read timeout can not be negative");
      checkNotNull(clock, "clock can not be null");
      checkNotNull(retryPolicy, "retry policy can not be null");
      return new WeatherApiPageFetcher(this);
    }
  }
}
