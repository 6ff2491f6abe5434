package com.gentoro.docextract.model;

import com.gentoro.docextract.exception.ConfigException;
import com.gentoro.docextract.http.OkHttpFactory;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Creates the configured {@link ExtractionClient}.
 *
 * <p>Required: {@code extraction.baseUrl} and {@code extraction.apiKey}. Optional: {@code
 * extraction.model}, timeouts, proxy use and retry settings (see {@link RetryPolicy} and {@link
 * OkHttpFactory}).
 */
public final class ExtractionClientFactory {
  static final String DEFAULT_MODEL = "doubao-seed-1-6-vision-250815";

  private ExtractionClientFactory() {}

  public static ExtractionClient create(Configuration configuration) {
    String baseUrl = setting(configuration, "extraction.baseUrl");
    String apiKey = setting(configuration, "extraction.apiKey");
    if (StringUtils.isBlank(baseUrl) || StringUtils.isBlank(apiKey)) {
      throw new ConfigException(
          "Missing extraction service configuration: set extraction.baseUrl and"
              + " extraction.apiKey (EXTRACTION_BASE_URL / EXTRACTION_API_KEY)");
    }
    String model = setting(configuration, "extraction.model");
    return new ChatCompletionsExtractionClient(
        OkHttpFactory.create(configuration),
        baseUrl,
        apiKey,
        StringUtils.defaultIfBlank(model, DEFAULT_MODEL),
        RetryPolicy.fromConfiguration(configuration));
  }

  /** The configured value, or {@code null} when blank or an unresolved {@code ${env:...}}. */
  private static String setting(Configuration configuration, String key) {
    String value = configuration.getString(key, null);
    return StringUtils.isBlank(value) || value.startsWith("${") ? null : value.trim();
  }
}
