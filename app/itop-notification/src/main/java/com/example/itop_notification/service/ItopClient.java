/*
 * どこで: iTop 通知サービス層
 * 何を: iTop REST/JSON API (core/get など) の呼び出しを担当するクライアント
 * なぜ: HTTP の詳細を隠し、検出処理には JSON か構造化された失敗だけを返すため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.config.ItopClientProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class ItopClient {

  private static final Logger logger = LoggerFactory.getLogger(ItopClient.class);
  static final String AUTH_TOKEN_HEADER = "Auth-Token";
  static final String JSON_DATA_PARAM = "json_data";

  private final RestClient itopRestClient;
  private final ItopClientProperties properties;
  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public ItopClient(
      RestClient itopRestClient, ItopClientProperties properties, ObjectMapper objectMapper) {
    this.itopRestClient = itopRestClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  public boolean isConfigured() {
    return properties.hasApplicationToken();
  }

  /**
   * iTop へ 1 リクエストを送る。
   *
   * <p>iTop は SELECT を含む key を GET で受け付けないため、常に form POST の json_data で送る。
   *
   * @param params operation/class/key/output_fields などの API パラメータ
   * @return code=0 のレスポンス本文
   * @throws ItopIntegrationException HTTP 失敗、不正レスポンス、または iTop 側エラー
   */
  public JsonNode request(Map<String, Object> params) {
    if (!properties.hasApplicationToken()) {
      throw new ItopIntegrationException(
          ItopIntegrationException.Reason.UNAUTHORIZED, "itop application token is not configured");
    }
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add(JSON_DATA_PARAM, serialize(params));
    final String body;
    try {
      body =
          itopRestClient
              .post()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path(properties.restPath())
                          .queryParam("version", properties.apiVersion())
                          .build())
              .header(AUTH_TOKEN_HEADER, properties.applicationToken())
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(form)
              .retrieve()
              .body(String.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    }
    return requireSuccess(parse(body), params);
  }

  private String serialize(Map<String, Object> params) {
    try {
      return objectMapper.writeValueAsString(params);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("itop request serialization failure", ex);
    }
  }

  private JsonNode parse(String body) {
    if (body == null || body.isBlank()) {
      throw new ItopIntegrationException(
          ItopIntegrationException.Reason.INVALID_RESPONSE, "itop response body is empty");
    }
    try {
      final JsonNode node = objectMapper.readTree(body);
      if (node == null || !node.isObject()) {
        throw new ItopIntegrationException(
            ItopIntegrationException.Reason.INVALID_RESPONSE, "itop response is not a json object");
      }
      return node;
    } catch (JsonProcessingException ex) {
      logger.warn("itop response parse failed", ex);
      throw new ItopIntegrationException(
          ItopIntegrationException.Reason.INVALID_RESPONSE, "invalid json response from itop", ex);
    }
  }

  private JsonNode requireSuccess(JsonNode response, Map<String, Object> params) {
    final JsonNode code = response.get("code");
    if (code != null && code.isNumber() && code.asInt() != 0) {
      final String message = response.path("message").asText("");
      logger.warn(
          "itop api returned error code={} message={} operation={} class={}",
          code.asInt(),
          message,
          params.get("operation"),
          params.get("class"));
      throw new ItopIntegrationException(
          ItopIntegrationException.Reason.API_ERROR,
          "itop api error code=" + code.asInt() + " message=" + message);
    }
    return response;
  }

  private ItopIntegrationException mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "itop request failed with http status={} statusText={}", status, ex.getStatusText());
    if (status == 401) {
      return new ItopIntegrationException(
          ItopIntegrationException.Reason.UNAUTHORIZED, "itop rejected credentials", ex);
    }
    if (status == 403) {
      return new ItopIntegrationException(
          ItopIntegrationException.Reason.FORBIDDEN, "itop request forbidden", ex);
    }
    if (status == 404) {
      return new ItopIntegrationException(
          ItopIntegrationException.Reason.NOT_FOUND, "itop endpoint not found", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new ItopIntegrationException(
          ItopIntegrationException.Reason.BAD_GATEWAY, "itop server error", ex);
    }
    return new ItopIntegrationException(
        ItopIntegrationException.Reason.BAD_GATEWAY, "itop request failed", ex);
  }

  private ItopIntegrationException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("itop request timed out");
      return new ItopIntegrationException(
          ItopIntegrationException.Reason.TIMEOUT, "itop request timeout", ex);
    }
    logger.warn("itop connection failed", ex);
    return new ItopIntegrationException(
        ItopIntegrationException.Reason.BAD_GATEWAY, "itop connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
