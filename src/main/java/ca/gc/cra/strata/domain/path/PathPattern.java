package ca.gc.cra.strata.domain.path;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Compiled dotted path pattern.
 *
 * <p>Segments are separated by {@code .}. A segment is a literal name, {@code *} (exactly one segment), a glob
 * such as {@code lr_*} (one segment whose name matches the glob) or {@code **} (one or more segments). Matching is
 * performed segment by segment, so {@code *.lr} matches {@code data.lr} but neither {@code lr} nor
 * {@code a.nested.lr}.</p>
 *
 * @since 0.1.0
 */
public final class PathPattern {
  private static final String MULTI = "**";

  private final String text;
  private final List<Segment> segments;
  private final boolean literal;

  private PathPattern(String text, List<Segment> segments, boolean literal) {
    this.text = text;
    this.segments = segments;
    this.literal = literal;
  }

  /**
   * Compiles a dotted pattern.
   *
   * @param text pattern text
   * @return compiled pattern
   * @throws IllegalArgumentException when the pattern is blank or contains an empty segment
   */
  public static PathPattern compile(String text) {
    Objects.requireNonNull(text, "text");
    if (text.isBlank()) {
      throw new IllegalArgumentException("path pattern must not be blank");
    }
    List<Segment> compiled = new ArrayList<>();
    boolean literal = true;
    for (String part : text.split("\\.", -1)) {
      if (part.isEmpty()) {
        throw new IllegalArgumentException("path pattern contains an empty segment: '" + text + "'");
      }
      Segment segment = Segment.of(part);
      literal &= segment.kind == SegmentKind.LITERAL;
      compiled.add(segment);
    }
    return new PathPattern(text, List.copyOf(compiled), literal);
  }

  /**
   * Indicates whether {@code text} contains wildcard characters.
   *
   * @param text dotted path or pattern
   * @return {@code true} when {@code *} appears
   */
  public static boolean isWildcard(String text) {
    return text != null && text.indexOf('*') >= 0;
  }

  public String text() {
    return text;
  }

  /**
   * Indicates whether this pattern has no wildcard segment.
   *
   * @return {@code true} for plain dotted paths
   */
  public boolean isLiteral() {
    return literal;
  }

  /**
   * Tests a dotted path against the pattern.
   *
   * @param path dotted path
   * @return {@code true} on a full match
   */
  public boolean matches(String path) {
    if (path == null || path.isEmpty()) {
      return false;
    }
    return matches(path.split("\\.", -1), 0, 0);
  }

  private boolean matches(String[] parts, int partIndex, int segmentIndex) {
    if (segmentIndex == segments.size()) {
      return partIndex == parts.length;
    }
    if (partIndex == parts.length) {
      return false;
    }
    Segment segment = segments.get(segmentIndex);
    if (segment.kind == SegmentKind.MULTI) {
      for (int next = partIndex + 1; next <= parts.length; next++) {
        if (matches(parts, next, segmentIndex + 1)) {
          return true;
        }
      }
      return false;
    }
    return segment.matches(parts[partIndex]) && matches(parts, partIndex + 1, segmentIndex + 1);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PathPattern that && text.equals(that.text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return text;
  }

  private enum SegmentKind {
    LITERAL,
    ANY,
    GLOB,
    MULTI
  }

  private record Segment(SegmentKind kind, String literal, Pattern glob) {

    static Segment of(String part) {
      if (MULTI.equals(part)) {
        return new Segment(SegmentKind.MULTI, null, null);
      }
      if ("*".equals(part)) {
        return new Segment(SegmentKind.ANY, null, null);
      }
      if (part.indexOf('*') >= 0) {
        StringBuilder regex = new StringBuilder();
        for (String fragment : part.split("\\*", -1)) {
          if (regex.length() > 0) {
            regex.append(".*");
          }
          regex.append(Pattern.quote(fragment));
        }
        return new Segment(SegmentKind.GLOB, null, Pattern.compile(regex.toString()));
      }
      return new Segment(SegmentKind.LITERAL, part, null);
    }

    boolean matches(String name) {
      return switch (kind) {
        case LITERAL -> literal.equals(name);
        case ANY -> true;
        case GLOB -> glob.matcher(name).matches();
        case MULTI -> true;
      };
    }
  }
}
