package com.gentoro.docextract.management;

import com.gentoro.docextract.management.endpoints.TaskControlServlet;
import com.gentoro.docextract.management.endpoints.TaskResultServlet;
import com.gentoro.docextract.management.endpoints.TaskStatusServlet;
import com.gentoro.docextract.management.endpoints.TaskSubmitServlet;
import com.gentoro.docextract.source.SourceFactory;
import com.gentoro.docextract.tasks.TaskRegistry;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** Registers the task endpoints under {@code /api/tasks}. */
public final class TaskServer {
  private final TaskRegistry tasks;
  private final SourceFactory sources;

  public TaskServer(TaskRegistry tasks, SourceFactory sources) {
    this.tasks = tasks;
    this.sources = sources;
  }

  private String contextPath() {
    return "/api/tasks";
  }

  public void register(ServletContextHandler ctx) {
    ctx.addServlet(new ServletHolder(new TaskSubmitServlet(tasks, sources)), contextPath());
    ctx.addServlet(
        new ServletHolder(new TaskStatusServlet(tasks)), "%s/status/*".formatted(contextPath()));
    ctx.addServlet(
        new ServletHolder(new TaskResultServlet(tasks)), "%s/result/*".formatted(contextPath()));
    ctx.addServlet(
        new ServletHolder(new TaskControlServlet(tasks)), "%s/*".formatted(contextPath()));
  }
}
