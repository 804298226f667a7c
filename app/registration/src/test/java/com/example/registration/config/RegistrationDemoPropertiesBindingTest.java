/*
 * どこで: Registration 設定バインドのテスト
 * 何を: registration.demo.* の既定値と上書き、Bean Validation を検証する
 * なぜ: 空文字指定で失敗シナリオを起動できることを保証するため
 */
package com.example.registration.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class RegistrationDemoPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
          .withUserConfiguration(TestConfiguration.class);

  @Test
  void defaultsApplyWhenNothingIsSet() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final RegistrationDemoProperties properties =
              context.getBean(RegistrationDemoProperties.class);

          assertThat(properties.userId()).isEqualTo(1L);
          assertThat(properties.displayName()).isEqualTo("Alice");
          assertThat(properties.email()).isEqualTo("alice@example.com");
        });
  }

  @Test
  void explicitEmptyValuesAreKept() {
    contextRunner
        .withPropertyValues(
            "registration.demo.user-id=2",
            "registration.demo.display-name=",
            "registration.demo.email=bob@example.com")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final RegistrationDemoProperties properties =
                  context.getBean(RegistrationDemoProperties.class);

              assertThat(properties.userId()).isEqualTo(2L);
              assertThat(properties.displayName()).isEmpty();
              assertThat(properties.email()).isEqualTo("bob@example.com");
            });
  }

  @Test
  void negativeUserIdFailsStartup() {
    contextRunner
        .withPropertyValues("registration.demo.user-id=-1")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties(RegistrationDemoProperties.class)
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
