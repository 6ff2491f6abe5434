package com.gentoro.docextract.management.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docextract.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** JSON response helpers shared by the task endpoints. */
final class ServletSupport {
  private ServletSupport() {}

  static void writeJson(HttpServletResponse resp, int status, JsonNode body) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(JacksonUtility.getJsonMapper().writeValueAsString(body));
  }

  static void writeError(HttpServletResponse resp, int status, String message) throws IOException {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("error", message);
    writeJson(resp, status, node);
  }

  /** Path info without the leading slash, or {@code null} when absent. */
  static String pathTail(String pathInfo) {
    if (pathInfo == null || pathInfo.length() <= 1) {
      return null;
    }
    return pathInfo.substring(1);
  }
}
