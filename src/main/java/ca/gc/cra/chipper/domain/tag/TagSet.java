package ca.gc.cra.chipper.domain.tag;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Canonical, order-insensitive set of tags attached to an emission or a handler subscription.
 * <p><strong>Why:</strong> Routing is decided by tag overlap rather than severity, so every party must agree on a
 * single normalized form.</p>
 * <p><strong>Role:</strong> Domain value object shared by the routing, formatting and configuration layers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Lower-case and deduplicate tokens, keeping first-occurrence order for rendering.</li>
 *   <li>Reject malformed tokens with {@link InvalidTagException}.</li>
 *   <li>Answer overlap queries used for handler matching.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across emitting threads.</p>
 * <p><strong>Performance:</strong> Tag sets are small; matching is O(n*m) over at most a handful of tokens.</p>
 *
 * @since 0.1.0
 */
public final class TagSet {
  /** Tag synthesized for emissions that carry no tags. */
  public static final String DEFAULT_TAG = "default";
  /** Reserved tag that additionally requests call-site capture. */
  public static final String TRACE_TAG = "trace";
  /** Delimiter separating tokens in a tag name such as {@code general_info}. */
  public static final char NAME_DELIMITER = '_';

  private static final TagSet EMPTY = new TagSet(List.of());
  private static final TagSet DEFAULT = new TagSet(List.of(DEFAULT_TAG));

  private final List<String> tags;

  private TagSet(List<String> tags) {
    this.tags = tags;
  }

  /**
   * Builds a tag set from explicit tokens.
   *
   * @param tokens raw tokens in call order; {@code null} array is treated as empty
   * @return normalized tag set
   * @throws InvalidTagException if any token is null, empty, or contains whitespace/control characters
   */
  public static TagSet of(String... tokens) {
    if (tokens == null || tokens.length == 0) {
      return EMPTY;
    }
    return of(Arrays.asList(tokens));
  }

  /**
   * Builds a tag set from an ordered collection of tokens.
   *
   * @param tokens raw tokens in call order; must not be {@code null}
   * @return normalized tag set
   * @throws InvalidTagException if any token is malformed
   */
  public static TagSet of(Collection<String> tokens) {
    Objects.requireNonNull(tokens, "tokens");
    if (tokens.isEmpty()) {
      return EMPTY;
    }
    Set<String> normalized = new LinkedHashSet<>();
    for (String token : tokens) {
      normalized.add(normalize(token));
    }
    return new TagSet(List.copyOf(normalized));
  }

  /**
   * Derives a tag set from a name whose tokens are joined by {@value #NAME_DELIMITER}.
   * <p>Empty tokens produced by leading, trailing or doubled delimiters are dropped.</p>
   *
   * @param name tag name such as {@code blog_sql_warning}
   * @return normalized tag set, possibly empty
   * @throws InvalidTagException if a token contains whitespace or control characters
   */
  public static TagSet fromName(String name) {
    Objects.requireNonNull(name, "name");
    List<String> tokens = new ArrayList<>();
    int start = 0;
    for (int i = 0; i <= name.length(); i++) {
      if (i == name.length() || name.charAt(i) == NAME_DELIMITER) {
        if (i > start) {
          tokens.add(name.substring(start, i));
        }
        start = i + 1;
      }
    }
    return of(tokens);
  }

  /**
   * Returns the empty tag set.
   *
   * @return shared empty instance
   */
  public static TagSet empty() {
    return EMPTY;
  }

  /**
   * Returns the set holding only {@value #DEFAULT_TAG}.
   *
   * @return shared default instance
   */
  public static TagSet defaultTags() {
    return DEFAULT;
  }

  /**
   * Tests whether two tag sets overlap. Symmetric; never throws.
   *
   * @param emissionTags tags carried by an emission
   * @param subscriptionTags tags a handler listens for
   * @return {@code true} when at least one tag is shared
   */
  public static boolean matches(TagSet emissionTags, TagSet subscriptionTags) {
    if (emissionTags == null || subscriptionTags == null) {
      return false;
    }
    return emissionTags.intersects(subscriptionTags);
  }

  /**
   * Returns this set, or {@link #defaultTags()} when this set is empty.
   *
   * @return non-empty tag set
   */
  public TagSet orDefault() {
    return tags.isEmpty() ? DEFAULT : this;
  }

  /**
   * Tests whether this set shares at least one tag with {@code other}.
   *
   * @param other tag set to compare; must not be {@code null}
   * @return {@code true} when the sets overlap
   */
  public boolean intersects(TagSet other) {
    Objects.requireNonNull(other, "other");
    for (String tag : tags) {
      if (other.tags.contains(tag)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the tags shared with {@code other}, in this set's order.
   *
   * @param other tag set to intersect; must not be {@code null}
   * @return intersection, empty when the sets do not overlap
   */
  public TagSet intersection(TagSet other) {
    Objects.requireNonNull(other, "other");
    List<String> shared = new ArrayList<>(Math.min(tags.size(), other.tags.size()));
    for (String tag : tags) {
      if (other.tags.contains(tag)) {
        shared.add(tag);
      }
    }
    return shared.isEmpty() ? EMPTY : new TagSet(List.copyOf(shared));
  }

  /**
   * Returns the tags of this set that no subscription in {@code claimed} covers, in this set's order.
   *
   * @param claimed tag sets that already captured the emission
   * @return remaining tags, possibly empty
   */
  public TagSet without(Collection<TagSet> claimed) {
    Objects.requireNonNull(claimed, "claimed");
    List<String> remaining = new ArrayList<>(tags.size());
    for (String tag : tags) {
      boolean covered = false;
      for (TagSet set : claimed) {
        if (set.contains(tag)) {
          covered = true;
          break;
        }
      }
      if (!covered) {
        remaining.add(tag);
      }
    }
    return remaining.isEmpty() ? EMPTY : new TagSet(List.copyOf(remaining));
  }

  /**
   * Tests membership, ignoring case.
   *
   * @param tag candidate tag; {@code null} returns {@code false}
   * @return {@code true} when the tag is present
   */
  public boolean contains(String tag) {
    if (tag == null) {
      return false;
    }
    return tags.contains(tag.toLowerCase(Locale.ROOT));
  }

  /**
   * Indicates whether the reserved {@value #TRACE_TAG} tag is present.
   *
   * @return {@code true} when trace capture was requested
   */
  public boolean requestsTrace() {
    return tags.contains(TRACE_TAG);
  }

  public boolean isEmpty() {
    return tags.isEmpty();
  }

  public int size() {
    return tags.size();
  }

  /**
   * Returns the normalized tags in first-occurrence order.
   *
   * @return immutable list view
   */
  public List<String> asList() {
    return tags;
  }

  private static String normalize(String token) {
    if (token == null) {
      throw new InvalidTagException(null, "must not be null");
    }
    if (token.isEmpty()) {
      throw new InvalidTagException(token, "must not be empty");
    }
    for (int i = 0; i < token.length(); i++) {
      char c = token.charAt(i);
      if (Character.isWhitespace(c)) {
        throw new InvalidTagException(token, "must be a single word");
      }
      if (Character.isISOControl(c)) {
        throw new InvalidTagException(token, "must not contain control characters");
      }
    }
    return token.toLowerCase(Locale.ROOT);
  }

  // Equality ignores order.
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TagSet other)) {
      return false;
    }
    return tags.size() == other.tags.size() && tags.containsAll(other.tags);
  }

  @Override
  public int hashCode() {
    int hash = 0;
    for (String tag : tags) {
      hash += tag.hashCode();
    }
    return hash;
  }

  @Override
  public String toString() {
    return "{" + String.join(", ", tags) + "}";
  }
}
