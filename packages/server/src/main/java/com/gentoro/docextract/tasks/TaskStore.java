package com.gentoro.docextract.tasks;

import java.util.Collection;
import java.util.Optional;

/** Storage for task state. */
public interface TaskStore {
  void put(TaskState state);

  Optional<TaskState> get(String id);

  void remove(String id);

  Collection<TaskState> all();
}
