package unionmount;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.io.File;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import unionmount.tasks.TaskFactory;
import unionmount.tasks.ThreadBasedTaskFactory;

/**
 * Tests {@link WatchServiceFileWatcher} against the real file system.
 *
 * Depending on the platform, creating a file sends one event (create) or two (create and
 * modify), so these tests just wait for the event they care about instead of asserting the
 * exact sequence.
 */
public class WatchServiceFileWatcherTest {

  static {
    LoggingConfig.init();
  }

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();
  private final TaskFactory taskFactory = new ThreadBasedTaskFactory();
  private final BlockingQueue<FileEvent> events = new LinkedBlockingQueue<>();
  private Path root;
  private WatchServiceFileWatcher watcher;

  @Before
  public void startWatcher() throws Exception {
    root = temp.newFolder("root").toPath().toRealPath();
    Files.createDirectories(root.resolve("existing"));
    watcher = new WatchServiceFileWatcher(FileSystems.getDefault().newWatchService(), root, events::put);
    watcher.startWatching();
    taskFactory.runTask(watcher);
  }

  @After
  public void stopWatcher() {
    taskFactory.stopTask(watcher);
  }

  @Test
  public void testFileCreatedInExistingDirectory() throws Exception {
    FileUtils.writeStringToFile(root.resolve("existing/foo.txt").toFile(), "abc", UTF_8);
    assertThat(waitFor(FileEvent.Kind.ADDED, root.resolve("existing/foo.txt")), is(true));
  }

  @Test
  public void testFileModified() throws Exception {
    File foo = root.resolve("foo.txt").toFile();
    FileUtils.writeStringToFile(foo, "abc", UTF_8);
    assertThat(waitFor(FileEvent.Kind.ADDED, foo.toPath()), is(true));
    FileUtils.writeStringToFile(foo, "abcd", UTF_8);
    assertThat(waitFor(FileEvent.Kind.MODIFIED, foo.toPath()), is(true));
  }

  @Test
  public void testFileRemoved() throws Exception {
    File foo = root.resolve("foo.txt").toFile();
    FileUtils.writeStringToFile(foo, "abc", UTF_8);
    assertThat(waitFor(FileEvent.Kind.ADDED, foo.toPath()), is(true));
    FileUtils.forceDelete(foo);
    assertThat(waitFor(FileEvent.Kind.REMOVED, foo.toPath()), is(true));
  }

  @Test
  public void testDirectoryMovedInWithNestedContents() throws Exception {
    // given a directory that is prepared outside of the root
    File outside = temp.newFolder("outside");
    FileUtils.writeStringToFile(new File(outside, "dir1/dir2/foo.txt"), "abc", UTF_8);
    // when it's moved into the root
    Files.move(outside.toPath().resolve("dir1"), root.resolve("dir1"));
    // then we see its nested files
    assertThat(waitFor(FileEvent.Kind.ADDED, root.resolve("dir1/dir2/foo.txt")), is(true));
    // and we watch its directories
    FileUtils.writeStringToFile(root.resolve("dir1/dir2/bar.txt").toFile(), "abc", UTF_8);
    assertThat(waitFor(FileEvent.Kind.ADDED, root.resolve("dir1/dir2/bar.txt")), is(true));
  }

  @Test
  public void testDirectoriesAreNotReported() throws Exception {
    Files.createDirectories(root.resolve("dir1"));
    FileUtils.writeStringToFile(root.resolve("marker.txt").toFile(), "abc", UTF_8);
    List<FileEvent> seen = new ArrayList<>();
    assertThat(waitFor(FileEvent.Kind.ADDED, root.resolve("marker.txt"), seen), is(true));
    for (FileEvent e : seen) {
      assertThat(e.getPath().equals(root.resolve("dir1")), is(false));
    }
  }

  private boolean waitFor(FileEvent.Kind kind, Path path) throws InterruptedException {
    return waitFor(kind, path, new ArrayList<>());
  }

  // drain events until we see the one we want
  private boolean waitFor(FileEvent.Kind kind, Path path, List<FileEvent> seen) throws InterruptedException {
    FileEvent expected = new FileEvent(kind, path);
    long deadline = System.currentTimeMillis() + 10_000;
    while (System.currentTimeMillis() < deadline) {
      FileEvent e = events.poll(100, TimeUnit.MILLISECONDS);
      if (e != null) {
        seen.add(e);
        if (e.equals(expected)) {
          return true;
        }
      }
    }
    return false;
  }

}
