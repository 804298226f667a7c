/*
 * どこで: Registration アプリの設定バインド
 * 何を: 起動時に登録するデモユーザーの値を保持する
 * なぜ: 成功/失敗シナリオをコマンドライン引数だけで切り替えるため
 */
package com.example.registration.config;

import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "registration.demo")
@Validated
public record RegistrationDemoProperties(
    @PositiveOrZero Long userId, String displayName, String email) {

  public RegistrationDemoProperties {
    // 未指定のみ既定値で埋める。空文字は失敗シナリオ用にそのまま残す
    userId = userId == null ? 1L : userId;
    displayName = displayName == null ? "Alice" : displayName;
    email = email == null ? "alice@example.com" : email;
  }
}
