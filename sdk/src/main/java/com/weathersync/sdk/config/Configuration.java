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
package com.weathersync.sdk.config;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.MapDifference;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.weathersync.sdk.InvalidConfigurationException;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.rules.TestRule;
import org.junit.runner.Description;
import org.junit.runners.model.Statement;

/**
 * Static factory for connector configuration values.
 *
 * <p>Components declare the values they need through the typed factory methods and read them with
 * {@link ConfigValue#get} once {@link #initConfig} has run. A value declared before that is kept
 * pending and resolved when the configuration is loaded. Configured strings are trimmed before
 * parsing.
 *
 * <pre>{@code
 * ConfigValue<Integer> maxRows = Configuration.getInteger("batch.maxRows", 500);
 * ConfigValue<String> baseUrl = Configuration.getString("weather.apiBaseUrl", null);
 * }</pre>
 *
 * <p>Unit tests use {@link ResetConfigRule} and {@link SetupConfigRule}.
 */
public class Configuration {
  private static final Logger logger = Logger.getLogger(Configuration.class.getName());
  private static final String DEFAULT_CONFIG_FILE = "connector-config.properties";
  private static final String ARG_PREFIX = "-D";
  private static final String CONFIG_FILE_ARG = "config";

  @SuppressWarnings("rawtypes")
  private static final List<ConfigValue> pending = new ArrayList<>();

  private static volatile ImmutableSortedMap<String, String> loaded;

  private Configuration() {
    throw new AssertionError();
  }

  /**
   * Loads the properties file named by {@code -Dconfig=<file>}, {@value #DEFAULT_CONFIG_FILE} by
   * default, and lays the remaining {@code -Dkey=value} arguments over it.
   *
   * @param args command line arguments
   * @throws IOException if the configuration file exists but can't be read
   */
  public static void initConfig(String[] args) throws IOException {
    checkNotNull(args, "arguments can not be null");
    Properties fromArgs = new Properties();
    for (String arg : args) {
      if (!arg.startsWith(ARG_PREFIX)) {
        continue;
      }
      List<String> keyValue = Splitter.on('=').limit(2).splitToList(arg.substring(2));
      if (keyValue.size() == 2) {
        fromArgs.setProperty(keyValue.get(0).trim(), keyValue.get(1));
      }
    }
    File file = new File(fromArgs.getProperty(CONFIG_FILE_ARG, DEFAULT_CONFIG_FILE));
    Properties merged = new Properties();
    if (file.exists()) {
      try (InputStream in = new FileInputStream(file)) {
        merged.load(in);
      }
    } else {
      logger.log(Level.CONFIG, "No configuration file at {0}; using command line values", file);
    }
    merged.putAll(fromArgs);
    initConfig(merged);
  }

  /**
   * Loads the configuration and resolves every declared value.
   *
   * <p>Loading the same properties again is a no-op; loading different ones fails with {@link
   * IllegalStateException}. When a declared value can't be resolved, the configuration stays
   * uninitialized.
   *
   * @param config properties to load
   * @throws InvalidConfigurationException if a value is missing or malformed
   */
  @SuppressWarnings("rawtypes")
  public static synchronized void initConfig(Properties config) {
    checkNotNull(config, "config can not be null");
    ImmutableSortedMap<String, String> values = trimmed(config);
    if (loaded != null) {
      MapDifference<String, String> difference = Maps.difference(loaded, values);
      if (difference.areEqual()) {
        logger.log(Level.CONFIG, "Configuration reloaded with identical values");
        return;
      }
      throw new IllegalStateException(
          "Configuration already loaded with different values for "
              + Sets.union(
                  Sets.union(
                      difference.entriesOnlyOnLeft().keySet(),
                      difference.entriesOnlyOnRight().keySet()),
                  difference.entriesDiffering().keySet()));
    }
    boolean resolved = false;
    try {
      for (ConfigValue value : pending) {
        value.initialize(values.get(value.getConfigKey()));
      }
      resolved = true;
    } finally {
      for (ConfigValue value : pending) {
        if (resolved) {
          value.freeze();
        } else {
          value.reset();
        }
      }
    }
    loaded = values;
    pending.clear();
  }

  private static ImmutableSortedMap<String, String> trimmed(Properties config) {
    ImmutableSortedMap.Builder<String, String> values = ImmutableSortedMap.naturalOrder();
    for (String name : config.stringPropertyNames()) {
      values.put(name, config.getProperty(name).trim());
    }
    return values.build();
  }

  /** Returns {@code true} once {@link #initConfig} completed successfully. */
  public static boolean isInitialized() {
    return loaded != null;
  }

  /** Converts a configured string into a typed value. */
  public interface Parser<T> {
    /**
     * @param value configured string, never empty
     * @throws InvalidConfigurationException if {@code value} is malformed
     */
    T parse(String value) throws InvalidConfigurationException;
  }

  /** Accepts {@code true} and {@code false} in any case. */
  public static final Parser<Boolean> BOOLEAN_PARSER =
      value -> {
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
          return Boolean.valueOf(value);
        }
        throw new InvalidConfigurationException("[" + value + "] is not a boolean");
      };

  public static final Parser<Integer> INTEGER_PARSER = numberParser(Integer::valueOf);

  public static final Parser<Double> DOUBLE_PARSER = numberParser(Double::valueOf);

  public static final Parser<String> STRING_PARSER = value -> checkNotNull(value);

  private static <T> Parser<T> numberParser(Function<String, T> valueOf) {
    return value -> {
      checkArgument(!Strings.isNullOrEmpty(value), "value to parse can not be null or empty");
      try {
        return valueOf.apply(value);
      } catch (NumberFormatException e) {
        throw new InvalidConfigurationException(e);
      }
    };
  }

  /** Returns a parser for the constants of {@code enumClass}, ignoring case. */
  public static <E extends Enum<E>> Parser<E> enumParser(Class<E> enumClass) {
    checkNotNull(enumClass);
    return value -> {
      try {
        return Enum.valueOf(enumClass, value.toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new InvalidConfigurationException(
            String.format("Invalid value [%s] for %s", value, enumClass.getSimpleName()), e);
      }
    };
  }

  public static ConfigValue<Boolean> getBoolean(String configKey, Boolean defaultValue) {
    return getValue(configKey, defaultValue, BOOLEAN_PARSER);
  }

  public static ConfigValue<String> getString(String configKey, String defaultValue) {
    return getValue(configKey, defaultValue, STRING_PARSER);
  }

  public static ConfigValue<Integer> getInteger(String configKey, Integer defaultValue) {
    return getValue(configKey, defaultValue, INTEGER_PARSER);
  }

  public static ConfigValue<Double> getDouble(String configKey, Double defaultValue) {
    return getValue(configKey, defaultValue, DOUBLE_PARSER);
  }

  /** Returns a comma separated list value. Empty elements are skipped. */
  public static <T> ConfigValue<List<T>> getMultiValue(
      String configKey, List<T> defaultValues, Parser<T> parser) {
    return getMultiValue(configKey, defaultValues, parser, ",");
  }

  public static <T> ConfigValue<List<T>> getMultiValue(
      String configKey, List<T> defaultValues, Parser<T> parser, String delimiter) {
    Splitter splitter = Splitter.on(delimiter).trimResults().omitEmptyStrings();
    return getValue(
        configKey,
        defaultValues,
        value -> {
          ImmutableList.Builder<T> elements = ImmutableList.builder();
          for (String element : splitter.split(value)) {
            elements.add(parser.parse(element));
          }
          return elements.build();
        });
  }

  /**
   * Declares a value of any type.
   *
   * @param configKey configuration key
   * @param defaultValue value when the key isn't configured; {@code null} makes the key required
   * @param parser parser for the configured string
   */
  public static <T> ConfigValue<T> getValue(String configKey, T defaultValue, Parser<T> parser) {
    ConfigValue<T> value =
        new ConfigValue.Builder<T>()
            .setConfigKey(configKey)
            .setDefaultValue(defaultValue)
            .setParser(parser)
            .build();
    synchronized (Configuration.class) {
      if (loaded == null) {
        pending.add(value);
        return value;
      }
      value.initialize(loaded.get(configKey));
      value.freeze();
    }
    return value;
  }

  /**
   * Throws {@link InvalidConfigurationException} with the formatted message when {@code
   * condition} is false. Startup treats this as fatal rather than retrying initialization.
   */
  public static void checkConfiguration(
      boolean condition, String errorFormat, Object... errorArgs) {
    if (!condition) {
      throw new InvalidConfigurationException(String.format(errorFormat, errorArgs));
    }
  }

  private static synchronized void resetConfiguration() {
    pending.clear();
    loaded = null;
  }

  /** Clears the static {@link Configuration} before each test. */
  public static class ResetConfigRule implements TestRule {
    @Override
    public Statement apply(Statement base, Description description) {
      resetConfiguration();
      return base;
    }
  }

  /**
   * Initializes the static {@link Configuration} from inside a test, after the values under test
   * were declared.
   */
  public static class SetupConfigRule implements TestRule {
    private SetupConfigRule() {}

    public static SetupConfigRule uninitialized() {
      return new SetupConfigRule();
    }

    @Override
    public Statement apply(Statement base, Description description) {
      return base;
    }

    public void initConfig(Properties properties) {
      checkArgument(properties.size() == properties.stringPropertyNames().size(),
          "config holds non-string properties: %s", properties);
      Configuration.initConfig(properties);
    }
  }
}
