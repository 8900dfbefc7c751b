package dscript;

import java.util.Arrays;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * One level of indentation: the lines, comments and inner blocks written beneath the line that
 * precedes the block.
 */
@AutoValue
public abstract class Block {
  public abstract ImmutableList<Element> elements();

  public static Block of(Iterable<Element> elements) {
    return new AutoValue_Block(ImmutableList.copyOf(elements));
  }

  public static Block of(Element... elements) {
    return of(Arrays.asList(elements));
  }

  public boolean isEmpty() {
    return elements().isEmpty();
  }

  /** Formats this block as if it were nested directly beneath a top-level line. */
  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    Script.formatElements(ImmutableList.of(Element.of(this)), 0, "\n", sb);
    return sb.toString();
  }
}
