package dscript;

import com.google.auto.value.AutoValue;

/** A {@code //} comment. The body after the slashes is kept verbatim so it formats back exactly. */
@AutoValue
public abstract class Comment {
  public static final String PREFIX = "//";

  public abstract String body();

  public static Comment create(String body) {
    return new AutoValue_Comment(body);
  }

  public static Comment of(String text) {
    return create(" " + text);
  }

  public String text() {
    return body().trim();
  }

  @Override
  public final String toString() {
    return PREFIX + body();
  }
}
