package com.gentoro.docextract.http;

import java.net.Proxy;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * Builds the OkHttp client used for extraction calls.
 *
 * <ul>
 *   <li>{@code extraction.connectTimeoutSeconds} (default 10)
 *   <li>{@code extraction.timeoutSeconds} read timeout (default 180)
 *   <li>{@code extraction.useProxy} honour system proxies (default false; calls go direct)
 * </ul>
 */
public class OkHttpFactory {

  public static OkHttpClient create(Configuration configuration) {
    OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(
                configuration.getLong("extraction.connectTimeoutSeconds", 10), TimeUnit.SECONDS)
            .readTimeout(configuration.getLong("extraction.timeoutSeconds", 180), TimeUnit.SECONDS)
            .retryOnConnectionFailure(false)
            .addInterceptor(new LoggingInterceptor());
    if (!configuration.getBoolean("extraction.useProxy", false)) {
      builder.proxy(Proxy.NO_PROXY);
    }
    return builder.build();
  }
}
