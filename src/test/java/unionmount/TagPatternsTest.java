package unionmount;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.Arrays;
import java.util.Optional;

import org.junit.Test;

public class TagPatternsTest {

  private enum Tag {
    T1, T2, Doc, Any
  }

  @Test
  public void shouldPickTheFirstMatchingPattern() {
    TagPatterns<Tag> p = TagPatterns.of(Tag.T1, "*.a").add(Tag.T2, "*.*");
    assertThat(p.resolveTag("x.a"), is(Optional.of(Tag.T1)));
    assertThat(p.resolveTag("x.b"), is(Optional.of(Tag.T2)));
  }

  @Test
  public void shouldUseListOrderOverSpecificity() {
    TagPatterns<Tag> p = TagPatterns.of(Tag.Any, "*").add(Tag.Doc, "*.md");
    assertThat(p.resolveTag("a.md"), is(Optional.of(Tag.Any)));
  }

  @Test
  public void shouldReturnEmptyWhenNothingMatches() {
    TagPatterns<Tag> p = TagPatterns.of(Tag.Doc, "*.md");
    assertThat(p.resolveTag("a.txt"), is(Optional.empty()));
    assertThat(p.matchesAny("a.txt"), is(false));
    assertThat(new TagPatterns<Tag>().resolveTag("a.md"), is(Optional.empty()));
  }

  @Test
  public void shouldMatchNestedPaths() {
    TagPatterns<Tag> p = TagPatterns.of(Tag.Doc, "*.md").add(Tag.T1, "src/*.a");
    assertThat(p.resolveTag("a/b/c.md"), is(Optional.of(Tag.Doc)));
    assertThat(p.resolveTag("src/x.a"), is(Optional.of(Tag.T1)));
    assertThat(p.resolveTag("lib/src/x.a"), is(Optional.empty()));
  }

  @Test
  public void shouldMatchAbsolutePathsLeniently() {
    TagPatterns<Tag> p = TagPatterns.of(Tag.T1, "src/*.a").add(Tag.Doc, "/docs/*.md");
    // anything matching as a relative path also matches when it escaped its root
    assertThat(p.resolveTag("src/x.a"), is(Optional.of(Tag.T1)));
    assertThat(p.resolveTag("/elsewhere/src/x.a"), is(Optional.of(Tag.T1)));
    assertThat(p.resolveTag("docs/a.md"), is(Optional.of(Tag.Doc)));
    assertThat(p.resolveTag("/home/docs/a.md"), is(Optional.of(Tag.Doc)));
    assertThat(p.resolveTag("/elsewhere/x.a"), is(Optional.empty()));
  }

  @Test
  public void shouldListTagsAndPatterns() {
    TagPatterns<Tag> p = TagPatterns.of(Tag.Doc, "*.md").add(Tag.Doc, "*.txt").add(Tag.Any, "*");
    assertThat(p.getTags(), is(Arrays.asList(Tag.Doc, Tag.Any)));
    assertThat(p.getPatterns(), is(Arrays.asList("*.md", "*.txt", "*")));
    assertThat(p.toString(), is("[Doc=*.md, Doc=*.txt, Any=*]"));
  }

}
