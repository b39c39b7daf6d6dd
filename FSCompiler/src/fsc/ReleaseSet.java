package fsc;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

/**
 * Resources acquired and not yet released along one control-flow path, in acquisition order. Each
 * path owns its own copy; branches fork it.
 */
final class ReleaseSet {
  private final Map<String, ImmutableList<String>> pending;

  ReleaseSet() {
    this(new LinkedHashMap<>());
  }

  private ReleaseSet(Map<String, ImmutableList<String>> pending) {
    this.pending = pending;
  }

  ReleaseSet fork() {
    return new ReleaseSet(new LinkedHashMap<>(pending));
  }

  ImmutableSet<String> keys() {
    return ImmutableSet.copyOf(pending.keySet());
  }

  boolean contains(String resourceKey) {
    return pending.containsKey(resourceKey);
  }

  void acquire(String blockId, String resourceKey, ImmutableList<String> teardown)
      throws UnpairedResourceException {
    if (pending.putIfAbsent(resourceKey, teardown) != null)
      throw new UnpairedResourceException(
          blockId,
          resourceKey,
          String.format("resource '%s' is acquired again before being released", resourceKey));
  }

  /** Removes {@code resourceKey} and returns its teardown. */
  ImmutableList<String> release(String blockId, String resourceKey)
      throws UnpairedResourceException {
    ImmutableList<String> teardown = pending.remove(resourceKey);
    if (teardown == null)
      throw new UnpairedResourceException(
          blockId,
          resourceKey,
          String.format("resource '%s' is released but not held on this path", resourceKey));
    return teardown;
  }

  /** Removes every resource not in {@code keep} and returns their teardown, last acquired first. */
  ImmutableList<String> releaseAllExcept(Set<String> keep) {
    ImmutableList.Builder<String> teardown = ImmutableList.builder();
    for (String key : Lists.reverse(ImmutableList.copyOf(pending.keySet()))) {
      if (!keep.contains(key)) teardown.addAll(pending.remove(key));
    }
    return teardown.build();
  }

  ImmutableList<String> releaseAll() {
    return releaseAllExcept(ImmutableSet.of());
  }
}
