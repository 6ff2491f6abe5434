package com.gentoro.docextract.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/**
 * Logs every extraction call with its outcome and latency.
 *
 * <p>Request bodies carry base64 images, so only their size is logged. Network failures are logged
 * by category and rethrown unchanged; the retry decision belongs to the client.
 */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startTime = System.nanoTime();
    log.debug("{} {} with {} byte body", request.method(), request.url(), bodySize(request));

    Response response;
    try {
      response = chain.proceed(request);
    } catch (IOException e) {
      log.warn(
          "{} calling {} after {} ms: {}",
          failureKind(e),
          request.url(),
          elapsed(startTime),
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      throw e;
    }

    long took = elapsed(startTime);
    if (response.isSuccessful()) {
      log.debug("HTTP {} from {} in {} ms", response.code(), request.url(), took);
    } else {
      log.warn("HTTP {} from {} in {} ms", response.code(), request.url(), took);
    }
    return response;
  }

  private static String failureKind(IOException e) {
    if (e instanceof java.net.SocketTimeoutException) {
      return "Timeout";
    }
    if (e instanceof java.net.ConnectException) {
      return "Connection refused";
    }
    return "I/O error";
  }

  private static long elapsed(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static long bodySize(Request request) {
    try {
      return request.body() == null ? 0 : request.body().contentLength();
    } catch (IOException e) {
      return -1;
    }
  }
}
