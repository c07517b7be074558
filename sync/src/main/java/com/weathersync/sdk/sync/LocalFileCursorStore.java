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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Strings.isNullOrEmpty;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.api.client.json.GenericJson;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.api.client.util.Key;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.ByteStreams;
import com.google.common.util.concurrent.Striped;
import com.weathersync.sdk.config.Configuration;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.concurrent.locks.Lock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link CursorStore} keeping one JSON file per entity on local disc.
 *
 * <p>A commit writes a temporary file next to the cursor file and moves it over the cursor file
 * atomically, so a crash leaves either the old or the new cursor, never a torn one.
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@value #CURSOR_DIRECTORY} - directory of the cursor files. Default is the current
 *       directory.
 * </ul>
 */
public class LocalFileCursorStore implements CursorStore {
  private static final Logger logger = Logger.getLogger(LocalFileCursorStore.class.getName());
  private static final JsonFactory JSON_FACTORY = JacksonFactory.getDefaultInstance();

  public static final String CURSOR_DIRECTORY = "cursor.directory";
  @VisibleForTesting static final String DEFAULT_CURSOR_DIRECTORY = ".";
  @VisibleForTesting static final String FILE_SUFFIX = ".cursor.json";

  private final Path basePath;
  private final FileHelper fileHelper;
  private final Clock clock;
  private final Striped<Lock> locks = Striped.lock(64);

  public LocalFileCursorStore(String directory) {
    this(directory, new FileHelper(), Clock.systemUTC());
  }

  @VisibleForTesting
  LocalFileCursorStore(String directory, FileHelper fileHelper, Clock clock) {
    String cursorDir = checkNotNull(directory, "cursor directory can not be null").trim();
    this.basePath = FileSystems.getDefault().getPath(cursorDir);
    this.fileHelper = checkNotNull(fileHelper);
    this.clock = checkNotNull(clock);
  }

  public static LocalFileCursorStore fromConfiguration() {
    checkState(Configuration.isInitialized(), "Configuration object not initialized");
    return new LocalFileCursorStore(
        Configuration.getString(CURSOR_DIRECTORY, DEFAULT_CURSOR_DIRECTORY).get());
  }

  @VisibleForTesting
  Path getCursorFilePath(String entityId) {
    checkArgument(!isNullOrEmpty(entityId), "entity id can't be null or empty");
    return basePath.resolve(entityId + FILE_SUFFIX);
  }

  @Override
  public Cursor load(String entityId) throws IOException {
    File cursorFile = fileHelper.getFile(getCursorFilePath(entityId));
    if (!cursorFile.exists()) {
      return Cursor.initial();
    }
    if (!cursorFile.isFile()) {
      throw new IOException("cursor path is not pointing to a file: " + cursorFile);
    }
    String content = new String(fileHelper.readFile(cursorFile), UTF_8);
    CursorFile parsed;
    try {
      parsed = JSON_FACTORY.fromString(content, CursorFile.class);
    } catch (IOException | IllegalArgumentException e) {
      throw new IOException("corrupt cursor file " + cursorFile, e);
    }
    if (parsed == null || isNullOrEmpty(parsed.getPosition())) {
      throw new IOException("cursor file " + cursorFile + " has no position");
    }
    return Cursor.of(parsed.getPosition(), parsed.getBatchToken());
  }

  @Override
  public void commit(String entityId, String newPosition, String batchToken)
      throws CommitException {
    checkArgument(!isNullOrEmpty(newPosition), "position can not be null or empty");
    Path cursorPath = getCursorFilePath(entityId);
    Lock lock = locks.get(entityId);
    lock.lock();
    try {
      Cursor current = load(entityId);
      if (batchToken != null && batchToken.equals(current.getBatchToken())) {
        logger.log(Level.FINE, "Cursor of {0} already committed by batch {1}",
            new Object[] {entityId, batchToken});
        return;
      }
      CursorFile file = new CursorFile();
      file.setEntityId(entityId);
      file.setPosition(newPosition);
      file.setBatchToken(batchToken);
      file.setCommittedAt(clock.instant().toString());
      fileHelper.writeFileAtomically(cursorPath, file.toPrettyString().getBytes(UTF_8));
      logger.log(Level.FINE, "Committed cursor {0} for {1}", new Object[] {newPosition, entityId});
    } catch (IOException e) {
      throw new CommitException("Failed to commit cursor of " + entityId + " to " + cursorPath, e);
    } finally {
      lock.unlock();
    }
  }

  /** Stored form of a cursor. Public with a public constructor for the JSON parser. */
  public static class CursorFile extends GenericJson {
    @Key private String entityId;
    @Key private String position;
    @Key private String batchToken;
    @Key private String committedAt;

    public CursorFile() {
      setFactory(JSON_FACTORY);
    }

    public String getEntityId() {
      return entityId;
    }

    public void setEntityId(String entityId) {
      this.entityId = entityId;
    }

    public String getPosition() {
      return position;
    }

    public void setPosition(String position) {
      this.position = position;
    }

    public String getBatchToken() {
      return batchToken;
    }

    public void setBatchToken(String batchToken) {
      this.batchToken = batchToken;
    }

    public String getCommittedAt() {
      return committedAt;
    }

    public void setCommittedAt(String committedAt) {
      this.committedAt = committedAt;
    }
  }

  /** Helper utility to wrap File operations and testing */
  static class FileHelper {

    File getFile(Path filePath) {
      return filePath.toFile();
    }

    byte[] readFile(File file) throws IOException {
      try (FileInputStream inputStream = new FileInputStream(file)) {
        return ByteStreams.toByteArray(inputStream);
      }
    }

    void writeFileAtomically(Path target, byte[] content) throws IOException {
      Path directory = target.toAbsolutePath().getParent();
      Files.createDirectories(directory);
      Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
      try {
        Files.write(temp, content);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE,
            StandardCopyOption.REPLACE_EXISTING);
      } finally {
        Files.deleteIfExists(temp);
      }
    }
  }
}
