package com.gentoro.docextract.exception;

import org.apache.commons.lang3.StringUtils;

/** Turns exceptions into the short reasons recorded per item and per task. */
public final class ExceptionUtil {
  private static final String API_ERROR = "API error:";
  private static final String HTTP_PREFIX = API_ERROR + " HTTP ";

  private ExceptionUtil() {}

  /**
   * Extract a short, user-facing reason from a throwable.
   *
   * <p>An {@code "API error: HTTP <status>: <body>"} message anywhere in the cause chain wins, so
   * the reason shows what the extraction service answered. Otherwise the top-level exception's
   * simple class name and message are used.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    for (Throwable current = t; current != null; current = current.getCause()) {
      String message = current.getMessage();
      if (StringUtils.contains(message, API_ERROR)) {
        return apiReason(message.substring(message.indexOf(API_ERROR)));
      }
    }

    String className = t.getClass().getSimpleName();
    String message = t.getMessage();
    if (StringUtils.isBlank(message) || looksLikeStackTrace(message)) {
      return className;
    }
    return className + ": " + message;
  }

  private static String apiReason(String apiError) {
    if (apiError.startsWith(HTTP_PREFIX)) {
      int colon = apiError.indexOf(':', HTTP_PREFIX.length());
      if (colon > 0) {
        String status = apiError.substring(HTTP_PREFIX.length(), colon).trim();
        String body = apiError.substring(colon + 1).trim();
        return body.isEmpty() ? "HTTP " + status : "HTTP " + status + ": " + body;
      }
    }
    return apiError.substring(API_ERROR.length()).trim();
  }

  private static boolean looksLikeStackTrace(String message) {
    return message.contains(" > ") || message.contains(".java:");
  }
}
