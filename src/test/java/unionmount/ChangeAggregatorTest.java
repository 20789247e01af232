package unionmount;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;

import org.junit.Test;

import com.google.common.collect.ImmutableSet;

public class ChangeAggregatorTest {

  private static final Path pathA = Paths.get("/a/x.md");
  private final OverlayTable<String> overlay = new OverlayTable<>();

  @Test
  public void shouldKeepAPathAliveWhileAnotherSourceHasIt() {
    // given both A and B have a/x.md
    overlay.add("a/x.md", "A");
    overlay.add("a/x.md", "B");
    // when B removes it
    Change<String, String> batch = new Change<>();
    ChangeAggregator.apply(overlay, batch, "B", "Doc", "a/x.md", FileAction.delete());
    // then it's reported as still existing, via A
    assertThat(batch.get("Doc").get("a/x.md"), is(FileAction.refresh(RefreshAction.EXISTING, files("A"))));
  }

  @Test
  public void shouldDeleteAPathWhenTheLastSourceRemovesIt() {
    overlay.add("a/x.md", "A");
    Change<String, String> batch = new Change<>();
    ChangeAggregator.apply(overlay, batch, "A", "Doc", "a/x.md", FileAction.delete());
    assertThat(batch.get("Doc").get("a/x.md"), is(FileAction.delete()));
    assertThat(overlay.isEmpty(), is(true));
  }

  @Test
  public void shouldReportNewFiles() {
    Change<String, String> batch = new Change<>();
    ChangeAggregator.apply(overlay, batch, "A", "Doc", "c.md", FileAction.refresh(RefreshAction.NEW, pathA));
    assertThat(batch.get("Doc").get("c.md"), is(FileAction.refresh(RefreshAction.NEW, filesAt("c.md", "A"))));
  }

  @Test
  public void shouldReportAnUpdateWithEverySource() {
    overlay.add("a/x.md", "A");
    Change<String, String> batch = new Change<>();
    ChangeAggregator.apply(overlay, batch, "B", "Doc", "a/x.md", FileAction.refresh(RefreshAction.UPDATE, pathA));
    assertThat(batch.get("Doc").get("a/x.md"), is(FileAction.refresh(RefreshAction.UPDATE, files("A", "B"))));
  }

  @Test
  public void shouldOverwriteEarlierEntriesForTheSamePath() {
    Change<String, String> batch = new Change<>();
    ChangeAggregator.apply(overlay, batch, "A", "Doc", "a/x.md", FileAction.refresh(RefreshAction.EXISTING, pathA));
    ChangeAggregator.apply(overlay, batch, "B", "Doc", "a/x.md", FileAction.refresh(RefreshAction.EXISTING, pathA));
    ChangeAggregator.apply(overlay, batch, "A", "Doc", "b.md", FileAction.refresh(RefreshAction.EXISTING, pathA));
    assertThat(batch.size(), is(2));
    assertThat(batch.get("Doc").get("a/x.md"), is(FileAction.refresh(RefreshAction.EXISTING, files("A", "B"))));
  }

  @Test
  public void shouldKeepTagsSeparate() {
    Change<String, String> batch = new Change<>();
    ChangeAggregator.apply(overlay, batch, "A", "Doc", "a.md", FileAction.refresh(RefreshAction.EXISTING, pathA));
    ChangeAggregator.apply(overlay, batch, "A", "Code", "a.java", FileAction.refresh(RefreshAction.EXISTING, pathA));
    assertThat(batch.tags(), is(ImmutableSet.of("Doc", "Code")));
    assertThat(batch.get("Code").keySet(), is(ImmutableSet.of("a.java")));
    assertThat(batch.get("Other").isEmpty(), is(true));
  }

  private static Set<OverlayFile<String>> files(String... sources) {
    return filesAt("a/x.md", sources);
  }

  private static Set<OverlayFile<String>> filesAt(String path, String... sources) {
    ImmutableSet.Builder<OverlayFile<String>> b = ImmutableSet.builder();
    for (String s : sources) {
      b.add(new OverlayFile<>(s, path));
    }
    return b.build();
  }

}
