/*
 * どこで: iTop 通知アプリの設定バインド
 * 何を: iTop REST API の接続先/アプリケーショントークン/タイムアウトを保持する
 * なぜ: 環境ごとに iTop インスタンスを切り替えるため
 */
package com.example.itop_notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "itop.client")
@Validated
public record ItopClientProperties(
    @NotBlank String baseUrl,
    String restPath,
    String apiVersion,
    String applicationToken,
    Duration connectTimeout,
    Duration readTimeout) {

  public ItopClientProperties {
    baseUrl = baseUrl == null ? "http://itop:80" : baseUrl;
    restPath = restPath == null || restPath.isBlank() ? "/webservices/rest.php" : restPath;
    apiVersion = apiVersion == null || apiVersion.isBlank() ? "1.3" : apiVersion;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
  }

  @AssertTrue(message = "itop.client timeouts must be positive")
  public boolean isTimeoutsPositive() {
    return isPositive(connectTimeout) && isPositive(readTimeout);
  }

  public boolean hasApplicationToken() {
    return applicationToken != null && !applicationToken.isBlank();
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
