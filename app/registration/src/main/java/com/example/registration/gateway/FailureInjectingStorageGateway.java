/*
 * どこで: Registration ゲートウェイ層
 * 何を: CI/Test 専用で保存失敗を注入する Gateway
 * なぜ: 本番経路を汚さずに STORAGE_FAILED の分岐を再現するため
 */
package com.example.registration.gateway;

import com.example.registration.model.UserRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "registration.storage.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingStorageGateway implements StorageGateway {

  private final ConsoleStorageGateway delegate;
  private final String emailPrefix;

  public FailureInjectingStorageGateway(
      ConsoleStorageGateway delegate,
      @Value("${registration.storage.failure-injection.email-prefix:}") String emailPrefix) {
    this.delegate = delegate;
    this.emailPrefix = emailPrefix;
  }

  @Override
  public void save(UserRecord record) {
    if (shouldInjectFailure(record.email())) {
      throw new StorageException(
          "user storage failure injection matched email=" + record.email());
    }
    delegate.save(record);
  }

  private boolean shouldInjectFailure(String email) {
    if (emailPrefix == null || emailPrefix.isBlank() || email == null) {
      return false;
    }
    return email.startsWith(emailPrefix);
  }
}
