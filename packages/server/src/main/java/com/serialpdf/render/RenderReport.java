package com.serialpdf.render;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unmatched placeholders left after rendering, keyed by file path relative to the snapshot root.
 * Files appear in sorted order, tokens within a file in source order.
 */
public record RenderReport(Map<String, List<UnmatchedPlaceholder>> unmatched) {

  public RenderReport {
    Map<String, List<UnmatchedPlaceholder>> copy = new LinkedHashMap<>();
    if (unmatched != null) {
      unmatched.forEach((file, tokens) -> copy.put(file, List.copyOf(tokens)));
    }
    unmatched = Collections.unmodifiableMap(copy);
  }

  public static RenderReport empty() {
    return new RenderReport(Map.of());
  }

  public boolean isEmpty() {
    return unmatched.isEmpty();
  }

  /** File -> token texts, the shape returned to pollers. */
  public Map<String, List<String>> tokensByFile() {
    Map<String, List<String>> result = new LinkedHashMap<>();
    unmatched.forEach(
        (file, tokens) -> {
          List<String> texts = new ArrayList<>(tokens.size());
          tokens.forEach(t -> texts.add(t.token()));
          result.put(file, texts);
        });
    return result;
  }

  /** Distinct unmatched keys across all files, in first-seen order. */
  public Set<String> keys() {
    Set<String> keys = new LinkedHashSet<>();
    unmatched.values().forEach(tokens -> tokens.forEach(t -> keys.add(t.key())));
    return keys;
  }
}
