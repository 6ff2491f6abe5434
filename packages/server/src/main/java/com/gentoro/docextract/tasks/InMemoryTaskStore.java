package com.gentoro.docextract.tasks;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local {@link TaskStore}; tasks do not survive a restart. */
public final class InMemoryTaskStore implements TaskStore {
  private final Map<String, TaskState> map = new ConcurrentHashMap<>();

  @Override
  public void put(TaskState state) {
    map.put(state.id(), state);
  }

  @Override
  public Optional<TaskState> get(String id) {
    return Optional.ofNullable(map.get(id));
  }

  @Override
  public void remove(String id) {
    map.remove(id);
  }

  @Override
  public Collection<TaskState> all() {
    return List.copyOf(map.values());
  }
}
