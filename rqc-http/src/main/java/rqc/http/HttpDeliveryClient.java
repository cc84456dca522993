package rqc.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import rqc.codec.JacksonPayloadCodec;
import rqc.delivery.CredentialCheck;
import rqc.delivery.CredentialInvalidException;
import rqc.delivery.DeliveryClient;
import rqc.delivery.DeliveryOutcome;
import rqc.delivery.GradingRequest;
import rqc.delivery.GradingResponse;
import rqc.delivery.OutcomeClassifier;
import rqc.delivery.PermanentRejectException;
import rqc.delivery.TransientDeliveryException;
import rqc.model.DecisionEvent;
import rqc.model.JournalCredential;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DeliveryClient} speaking JSON over HTTP to the RQC service.
 *
 * <p>Each call is exactly one request: no retries, and redirects are never followed so a
 * {@code 303} from the grading endpoint can be handed to the editor's browser.
 *
 * <pre>{@code
 * HttpDeliveryClient client = HttpDeliveryClient.builder()
 *     .baseUrl("https://reviewqualitycollector.org/api")
 *     .requestTimeout(Duration.ofSeconds(20))
 *     .build();
 * }</pre>
 */
public final class HttpDeliveryClient implements DeliveryClient {
  private static final Logger logger = Logger.getLogger(HttpDeliveryClient.class.getName());

  static final String VALIDATE_PATH = "/credentials/validate";
  static final String GRADING_PATH = "/grading/trigger";
  static final String REPORT_PATH = "/decision/report";
  private static final int MAX_REASON_LENGTH = 500;

  private final String baseUrl;
  private final Duration requestTimeout;
  private final HttpClient httpClient;
  private final ObjectMapper mapper;
  private final WireFormat wireFormat;

  private HttpDeliveryClient(Builder builder) {
    String url = Objects.requireNonNull(builder.baseUrl, "baseUrl");
    this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    this.requestTimeout = builder.requestTimeout;
    this.mapper = builder.objectMapper != null ? builder.objectMapper : JacksonPayloadCodec.defaultMapper();
    this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
        .connectTimeout(builder.connectTimeout)
        .version(HttpClient.Version.HTTP_1_1)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
    this.wireFormat = new WireFormat(mapper);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public CredentialCheck validateCredentials(JournalCredential credential) {
    HttpResponse<String> response = postOrThrow(VALIDATE_PATH, wireFormat.credentialCheck(credential));
    int status = response.statusCode();
    if (OutcomeClassifier.isTransient(status)) {
      throw new TransientDeliveryException("RQC credential check failed with HTTP " + status);
    }
    JsonNode body = parse(response.body());
    if (status >= 200 && status < 300) {
      if (body.path("ok").asBoolean(true)) {
        return CredentialCheck.passed();
      }
      return CredentialCheck.failed(reason(body, response));
    }
    return CredentialCheck.failed("HTTP " + status + ": " + reason(body, response));
  }

  @Override
  public GradingResponse triggerGrading(JournalCredential credential, GradingRequest request) {
    HttpResponse<String> response = postOrThrow(GRADING_PATH, wireFormat.gradingRequest(credential, request));
    int status = response.statusCode();
    if (status == 303) {
      String location = response.headers().firstValue("Location").orElse(null);
      return new GradingResponse(location != null, location, status, location == null ? "303 without Location" : null);
    }
    JsonNode body = parse(response.body());
    String reason = reason(body, response);
    if (status >= 200 && status < 300) {
      boolean ok = body.path("ok").asBoolean(true);
      String redirect = body.hasNonNull("redirect_url") ? body.get("redirect_url").asText() : null;
      return new GradingResponse(ok, redirect, status, ok ? null : reason);
    }
    if (status == 401 || status == 403) {
      throw new CredentialInvalidException(credential.journalId(), "HTTP " + status + ": " + reason);
    }
    if (OutcomeClassifier.isTransient(status)) {
      throw new TransientDeliveryException("RQC grading request failed with HTTP " + status + ": " + reason);
    }
    throw new PermanentRejectException(status, "RQC refused grading request: " + reason);
  }

  @Override
  public DeliveryOutcome reportDecision(JournalCredential credential, DecisionEvent event) {
    HttpResponse<String> response;
    try {
      response = post(REPORT_PATH, wireFormat.decisionReport(credential, event));
    } catch (IOException e) {
      logger.log(Level.FINE, "No response from RQC for " + event.taskKey(), e);
      return OutcomeClassifier.noResponse(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return OutcomeClassifier.noResponse(e);
    }
    int status = response.statusCode();
    DeliveryOutcome outcome = OutcomeClassifier.classify(credential.journalId(), status,
        OutcomeClassifier.isSuccess(status) ? null : reason(parse(response.body()), response));
    logger.log(Level.FINE, "RQC answered {0} for {1}", new Object[]{status, event.taskKey()});
    return outcome;
  }

  private HttpResponse<String> postOrThrow(String path, ObjectNode body) {
    try {
      return post(path, body);
    } catch (IOException e) {
      throw new TransientDeliveryException("RQC unreachable at " + baseUrl + path, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientDeliveryException("Interrupted while calling RQC", e);
    }
  }

  private HttpResponse<String> post(String path, ObjectNode body) throws IOException, InterruptedException {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl + path))
        .timeout(requestTimeout)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
        .build();
    return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
  }

  private JsonNode parse(String body) {
    if (body == null || body.isBlank()) {
      return mapper.createObjectNode();
    }
    try {
      return mapper.readTree(body);
    } catch (JsonProcessingException e) {
      return mapper.createObjectNode();
    }
  }

  private static String reason(JsonNode body, HttpResponse<String> response) {
    for (String field : new String[]{"reason", "error", "message"}) {
      if (body.hasNonNull(field)) {
        return truncate(body.get(field).asText());
      }
    }
    String raw = response.body();
    return raw == null || raw.isBlank() ? "HTTP " + response.statusCode() : truncate(raw);
  }

  private static String truncate(String text) {
    return text.length() <= MAX_REASON_LENGTH ? text : text.substring(0, MAX_REASON_LENGTH - 3) + "...";
  }

  public static final class Builder {
    private String baseUrl;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(15);
    private ObjectMapper objectMapper;
    private HttpClient httpClient;

    private Builder() {
    }

    /**
     * Base URL of the RQC API, e.g. {@code https://reviewqualitycollector.org/api}.
     *
     * <p><b>Required.</b>
     */
    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    /**
     * <p>Optional. Defaults to 10 seconds. Ignored when {@link #httpClient} is set.
     */
    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
      return this;
    }

    /**
     * Per-request timeout; a timed-out report counts as a transient failure.
     *
     * <p>Optional. Defaults to 15 seconds.
     */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link JacksonPayloadCodec#defaultMapper()}.
     */
    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    /**
     * Supplies a preconfigured client (proxy, TLS). It should not follow redirects.
     *
     * <p>Optional.
     */
    public Builder httpClient(HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    public HttpDeliveryClient build() {
      return new HttpDeliveryClient(this);
    }
  }
}
