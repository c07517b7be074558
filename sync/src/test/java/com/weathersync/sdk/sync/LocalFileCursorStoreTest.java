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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.weathersync.sdk.config.Configuration.ResetConfigRule;
import com.weathersync.sdk.config.Configuration.SetupConfigRule;
import com.weathersync.sdk.sync.LocalFileCursorStore.FileHelper;
import java.io.File;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

/** Tests for {@link LocalFileCursorStore}. */
public class LocalFileCursorStoreTest {
  private static final String ENTITY = "hourly_observations.berlin";

  @Rule public ExpectedException thrown = ExpectedException.none();
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();
  @Rule public ResetConfigRule resetConfig = new ResetConfigRule();
  @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized();

  private File cursorDir;
  private LocalFileCursorStore store;

  @Before
  public void setUp() throws IOException {
    cursorDir = temporaryFolder.newFolder("cursors");
    store = new LocalFileCursorStore(cursorDir.getPath(), new FileHelper(), SyncTestData.CLOCK);
  }

  @Test
  public void testFromConfigurationNotInitialized() {
    thrown.expect(IllegalStateException.class);
    LocalFileCursorStore.fromConfiguration();
  }

  @Test
  public void testFromConfigurationDefaultDirectory() {
    setupConfig.initConfig(new Properties());
    assertEquals(FileSystems.getDefault().getPath(".", ENTITY + ".cursor.json"),
        LocalFileCursorStore.fromConfiguration().getCursorFilePath(ENTITY));
  }

  @Test
  public void testFromConfigurationCustomDirectory() {
    Properties config = new Properties();
    config.put(LocalFileCursorStore.CURSOR_DIRECTORY, "./state");
    setupConfig.initConfig(config);
    assertEquals(FileSystems.getDefault().getPath("./state", ENTITY + ".cursor.json"),
        LocalFileCursorStore.fromConfiguration().getCursorFilePath(ENTITY));
  }

  @Test
  public void testConstructorNullDirectory() {
    thrown.expect(NullPointerException.class);
    new LocalFileCursorStore(null);
  }

  @Test
  public void testLoadMissingFileIsInitial() throws IOException {
    assertTrue(store.load(ENTITY).isInitial());
  }

  @Test
  public void testCommitThenLoad() throws IOException {
    store.commit(ENTITY, "2024-03-09T10:00:00Z", "token-1");
    assertEquals(Cursor.of("2024-03-09T10:00:00Z", "token-1"), store.load(ENTITY));
    store.commit(ENTITY, "2024-03-09T11:00:00Z", "token-2");
    assertEquals(Cursor.of("2024-03-09T11:00:00Z", "token-2"), store.load(ENTITY));
    // no temporary files left behind
    assertEquals(1, cursorDir.listFiles().length);
  }

  @Test
  public void testCommitWritesJson() throws IOException {
    store.commit(ENTITY, "2024-03-09T10:00:00Z", "token-1");
    String content =
        new String(Files.readAllBytes(store.getCursorFilePath(ENTITY)), UTF_8);
    assertThat(content, containsString("\"position\" : \"2024-03-09T10:00:00Z\""));
    assertThat(content, containsString("\"committedAt\" : \"2024-03-10T00:00:00Z\""));
    assertThat(content, containsString("\"entityId\" : \"" + ENTITY + "\""));
  }

  @Test
  public void testCommitSameBatchTokenIsNoOp() throws IOException {
    FileHelper fileHelper = spy(new FileHelper());
    LocalFileCursorStore spied =
        new LocalFileCursorStore(cursorDir.getPath(), fileHelper, SyncTestData.CLOCK);
    spied.commit(ENTITY, "2024-03-09T10:00:00Z", "token-1");
    spied.commit(ENTITY, "2024-03-09T10:00:00Z", "token-1");
    verify(fileHelper, times(1)).writeFileAtomically(any(Path.class), any(byte[].class));
    assertEquals(Cursor.of("2024-03-09T10:00:00Z", "token-1"), spied.load(ENTITY));
  }

  @Test
  public void testCommitWriteFailure() throws IOException {
    FileHelper fileHelper = spy(new FileHelper());
    doThrow(new IOException("disk full"))
        .when(fileHelper).writeFileAtomically(any(Path.class), any(byte[].class));
    LocalFileCursorStore failing =
        new LocalFileCursorStore(cursorDir.getPath(), fileHelper, SyncTestData.CLOCK);
    thrown.expect(CommitException.class);
    thrown.expectMessage("Failed to commit cursor of " + ENTITY);
    failing.commit(ENTITY, "2024-03-09T10:00:00Z", "token-1");
  }

  @Test
  public void testCommitEmptyPosition() throws IOException {
    thrown.expect(IllegalArgumentException.class);
    store.commit(ENTITY, "", "token-1");
  }

  @Test
  public void testLoadCorruptFile() throws IOException {
    Files.write(store.getCursorFilePath(ENTITY), "{not json".getBytes(UTF_8));
    thrown.expect(IOException.class);
    thrown.expectMessage("corrupt cursor file");
    store.load(ENTITY);
  }

  @Test
  public void testLoadFileWithoutPosition() throws IOException {
    Files.write(store.getCursorFilePath(ENTITY), "{\"entityId\": \"x\"}".getBytes(UTF_8));
    thrown.expect(IOException.class);
    thrown.expectMessage("has no position");
    store.load(ENTITY);
  }

  @Test
  public void testLoadDirectoryInsteadOfFile() throws IOException {
    Files.createDirectory(store.getCursorFilePath(ENTITY));
    thrown.expect(IOException.class);
    thrown.expectMessage("not pointing to a file");
    store.load(ENTITY);
  }

  @Test
  public void testEntitiesAreIndependent() throws IOException {
    store.commit(ENTITY, "2024-03-09T10:00:00Z", "token-1");
    assertTrue(store.load("hourly_observations.paris").isInitial());
    assertFalse(store.load(ENTITY).isInitial());
  }

  @Test
  public void testReadFailurePropagates() throws IOException {
    FileHelper fileHelper = mock(FileHelper.class);
    File file = mock(File.class);
    when(fileHelper.getFile(any(Path.class))).thenReturn(file);
    when(file.exists()).thenReturn(true);
    when(file.isFile()).thenReturn(true);
    when(fileHelper.readFile(file)).thenThrow(new IOException("io"));
    LocalFileCursorStore failing =
        new LocalFileCursorStore("cursors", fileHelper, SyncTestData.CLOCK);
    thrown.expect(IOException.class);
    thrown.expectMessage("io");
    failing.load(ENTITY);
  }

  @Test
  public void testConcurrentCommitsOfOneEntityAreSerialized() throws Exception {
    AtomicInteger writers = new AtomicInteger();
    AtomicInteger maxWriters = new AtomicInteger();
    FileHelper trackingHelper =
        new FileHelper() {
          @Override
          void writeFileAtomically(Path target, byte[] content) throws IOException {
            maxWriters.accumulateAndGet(writers.incrementAndGet(), Math::max);
            try {
              Thread.sleep(5);
              super.writeFileAtomically(target, content);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
              throw new IOException(e);
            } finally {
              writers.decrementAndGet();
            }
          }
        };
    LocalFileCursorStore tracked =
        new LocalFileCursorStore(cursorDir.getPath(), trackingHelper, SyncTestData.CLOCK);
    int threads = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    List<Future<?>> commits = new ArrayList<>();
    Set<String> positions = new HashSet<>();
    try {
      for (int i = 0; i < threads; i++) {
        String position = String.format("2024-03-09T%02d:00:00Z", i);
        String token = "token-" + i;
        positions.add(position);
        commits.add(
            executor.submit(
                () -> {
                  start.await();
                  tracked.commit(ENTITY, position, token);
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> commit : commits) {
        commit.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(1, maxWriters.get());
    Cursor committed = tracked.load(ENTITY);
    assertTrue(committed.getPosition(), positions.contains(committed.getPosition()));
    assertEquals(1, cursorDir.list().length);
  }
}
