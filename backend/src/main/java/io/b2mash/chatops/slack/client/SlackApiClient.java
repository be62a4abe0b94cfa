package io.b2mash.chatops.slack.client;

import io.b2mash.chatops.config.SlackProperties;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Thin client over the Slack Web API. Responses are returned as parsed JSON maps; every failure
 * surfaces as {@link SlackApiException}. No retries happen here.
 */
@Component
public class SlackApiClient {

  private static final Logger log = LoggerFactory.getLogger(SlackApiClient.class);

  private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
      new ParameterizedTypeReference<>() {};

  private final RestClient restClient;
  private final Function<Duration, RestClient> timeoutClientFactory;
  private final Map<Duration, RestClient> timeoutClients = new ConcurrentHashMap<>();

  @Autowired
  public SlackApiClient(SlackProperties properties) {
    this(
        RestClient.builder().baseUrl(properties.baseUrl()).build(),
        timeout ->
            RestClient.builder()
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory(timeout))
                .build());
  }

  SlackApiClient(RestClient restClient, Function<Duration, RestClient> timeoutClientFactory) {
    this.restClient = restClient;
    this.timeoutClientFactory = timeoutClientFactory;
  }

  /** Issues a GET against {@code endpoint} (e.g. {@code /users.list}) with query parameters. */
  public Map<String, Object> get(
      String endpoint, Map<String, String> headers, Map<String, Object> params) {
    try {
      Map<String, Object> body =
          restClient
              .get()
              .uri(
                  uriBuilder -> {
                    uriBuilder.path(endpoint);
                    params.forEach((name, value) -> uriBuilder.queryParam(name, value));
                    return uriBuilder.build();
                  })
              .headers(httpHeaders -> headers.forEach(httpHeaders::set))
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .body(JSON_OBJECT);
      return checkOk(endpoint, body);
    } catch (RestClientException e) {
      throw translate(endpoint, e);
    }
  }

  /** Issues a form-encoded POST with a per-call read timeout. */
  public Map<String, Object> post(String endpoint, Map<String, String> data, Duration timeout) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    data.forEach(form::add);
    try {
      Map<String, Object> body =
          timeoutClients
              .computeIfAbsent(timeout, timeoutClientFactory)
              .post()
              .uri(endpoint)
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(form)
              .retrieve()
              .body(JSON_OBJECT);
      return checkOk(endpoint, body);
    } catch (RestClientException e) {
      throw translate(endpoint, e);
    }
  }

  private Map<String, Object> checkOk(String endpoint, Map<String, Object> body) {
    if (body == null) {
      throw new SlackApiException(200, "empty_response");
    }
    if (!Boolean.TRUE.equals(body.get("ok"))) {
      Object error = body.get("error");
      log.debug("Slack returned ok=false: endpoint={}, error={}", endpoint, error);
      throw new SlackApiException(200, error != null ? error.toString() : "unknown_error");
    }
    return body;
  }

  private SlackApiException translate(String endpoint, RestClientException e) {
    if (e instanceof RestClientResponseException responseException) {
      int status = responseException.getStatusCode().value();
      log.debug("Slack HTTP error: endpoint={}, status={}", endpoint, status);
      String error = status == 429 ? "ratelimited" : responseException.getStatusText();
      return new SlackApiException(status, error, e);
    }
    return new SlackApiException(0, e.getMessage(), e);
  }

  private static JdkClientHttpRequestFactory requestFactory(Duration readTimeout) {
    var factory = new JdkClientHttpRequestFactory();
    factory.setReadTimeout(readTimeout);
    return factory;
  }
}
