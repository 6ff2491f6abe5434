package com.gentoro.docextract.model;

import com.gentoro.docextract.exception.ExceptionUtil;
import com.gentoro.docextract.exception.ExtractionException;
import com.gentoro.docextract.pipeline.WorkItem;
import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.Random;

/**
 * Base {@link ExtractionClient} with the provider-independent plumbing: image encoding, prompt
 * selection and the retry loop.
 *
 * <p>Subclasses implement {@link #runExtraction(ExtractionRequest)} to perform exactly one call.
 * A transient {@link ExtractionException} (see {@link ExtractionException#isTransient()}) is
 * retried according to the {@link RetryPolicy}; anything else fails the item immediately.
 */
public abstract class AbstractExtractionClient implements ExtractionClient {
  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(AbstractExtractionClient.class);

  protected final RetryPolicy retryPolicy;
  private final Random random;

  protected AbstractExtractionClient(RetryPolicy retryPolicy) {
    this(retryPolicy, new Random());
  }

  protected AbstractExtractionClient(RetryPolicy retryPolicy, Random random) {
    this.retryPolicy = retryPolicy == null ? RetryPolicy.DEFAULT : retryPolicy;
    this.random = random;
  }

  @Override
  public ExtractionResponse extract(WorkItem item, ExtractionMode mode) {
    ExtractionRequest request =
        new ExtractionRequest(item.name(), toDataUri(item), ExtractionPrompts.forMode(mode));

    long start = System.currentTimeMillis();
    int attempt = 0;
    while (true) {
      try {
        ExtractionResponse response = runExtraction(request);
        log.debug(
            "Extracted {} in {} ms (attempt {}, {} tokens)",
            item.name(),
            System.currentTimeMillis() - start,
            attempt + 1,
            response.usage().total());
        return response;
      } catch (ExtractionException e) {
        if (!e.isTransient() || attempt >= retryPolicy.maxRetries()) {
          log.warn(
              "Extraction of {} failed after {} attempt(s): {}",
              item.name(),
              attempt + 1,
              ExceptionUtil.extractErrorMessage(e));
          throw e;
        }
        Duration delay = retryPolicy.delayFor(attempt, random);
        log.info(
            "Transient failure extracting {} (attempt {}/{}), retrying in {} ms: {}",
            item.name(),
            attempt + 1,
            retryPolicy.maxRetries() + 1,
            delay.toMillis(),
            e.getMessage());
        sleep(delay);
        attempt++;
      }
    }
  }

  /** Performs a single call to the service. Must not retry. */
  protected abstract ExtractionResponse runExtraction(ExtractionRequest request);

  protected void sleep(Duration delay) {
    if (delay.isZero()) {
      return;
    }
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExtractionException("Interrupted while waiting to retry", e);
    }
  }

  private static String toDataUri(WorkItem item) {
    byte[] bytes;
    try {
      bytes = item.source().bytes();
    } catch (IOException e) {
      throw new ExtractionException("Unable to read image " + item.name(), e);
    }
    return "data:%s;base64,%s"
        .formatted(item.source().mimeType(), Base64.getEncoder().encodeToString(bytes));
  }
}
