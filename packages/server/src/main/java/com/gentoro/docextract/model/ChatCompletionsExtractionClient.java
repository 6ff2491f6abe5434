package com.gentoro.docextract.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docextract.exception.ExtractionException;
import com.gentoro.docextract.utility.JacksonUtility;
import java.io.IOException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link ExtractionClient} for OpenAI-compatible vision chat-completions endpoints.
 *
 * <p>Each call posts one user message holding the image as a {@code data:} URI plus the mode's
 * instruction prompt, with model "thinking" disabled. I/O failures (timeouts, refused or reset
 * connections) are reported as transient; any non-2xx status is permanent.
 */
public class ChatCompletionsExtractionClient extends AbstractExtractionClient {
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final int MAX_ERROR_BODY = 500;

  private final OkHttpClient httpClient;
  private final String endpoint;
  private final String apiKey;
  private final String model;

  public ChatCompletionsExtractionClient(
      OkHttpClient httpClient, String baseUrl, String apiKey, String model, RetryPolicy policy) {
    super(policy);
    this.httpClient = httpClient;
    this.endpoint = StringUtils.removeEnd(baseUrl.trim(), "/") + "/chat/completions";
    this.apiKey = apiKey;
    this.model = model;
  }

  @Override
  protected ExtractionResponse runExtraction(ExtractionRequest request) {
    Request httpRequest =
        new Request.Builder()
            .url(endpoint)
            .header("Authorization", "Bearer " + apiKey)
            .post(RequestBody.create(JacksonUtility.toJson(requestBody(request)), JSON))
            .build();

    try (Response response = httpClient.newCall(httpRequest).execute()) {
      ResponseBody body = response.body();
      String payload = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw ExtractionException.httpFailure(
            response.code(), StringUtils.abbreviate(payload.trim(), MAX_ERROR_BODY));
      }
      return ResponseNormalizer.normalize(payload);
    } catch (IOException e) {
      throw ExtractionException.transientFailure(
          "Extraction call for %s failed: %s".formatted(request.itemName(), e.getMessage()), e);
    }
  }

  ObjectNode requestBody(ExtractionRequest request) {
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("model", model);

    ArrayNode content = JacksonUtility.getJsonMapper().createArrayNode();
    ObjectNode image = content.addObject();
    image.put("type", "image_url");
    image.putObject("image_url").put("url", request.imageDataUri());
    ObjectNode text = content.addObject();
    text.put("type", "text");
    text.put("text", request.prompt());

    ObjectNode message = body.putArray("messages").addObject();
    message.put("role", "user");
    message.set("content", content);

    body.putObject("thinking").put("type", "disabled");
    return body;
  }

  public String endpoint() {
    return endpoint;
  }
}
