package com.example.registration.runner;

import com.example.common.TraceIds;
import com.example.registration.config.RegistrationDemoProperties;
import com.example.registration.model.UserRecord;
import com.example.registration.service.RegistrationService;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "registration.demo.enabled",
    havingValue = "true",
    matchIfMissing = true)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "コンソール出力先は Spring 管理の共有ストリームで防御的コピーが不可能なため")
public class RegistrationDemoRunner implements CommandLineRunner {

  static final String SUCCESS_MESSAGE = "User registered successfully!";
  static final String FAILURE_MESSAGE = "User registration failed.";

  private static final Logger logger = LoggerFactory.getLogger(RegistrationDemoRunner.class);

  private final RegistrationService registrationService;
  private final RegistrationDemoProperties properties;
  private final PrintStream console;

  public RegistrationDemoRunner(
      RegistrationService registrationService,
      RegistrationDemoProperties properties,
      PrintStream console) {
    this.registrationService = registrationService;
    this.properties = properties;
    this.console = console;
  }

  @Override
  public void run(String... args) {
    final UserRecord record =
        new UserRecord(properties.userId(), properties.displayName(), properties.email());
    try (MDC.MDCCloseable trace = TraceIds.openScope();
        MDC.MDCCloseable user = MDC.putCloseable("user_id", String.valueOf(record.userId()))) {
      logger.debug("demo registration started userId={}", record.userId());
      if (registrationService.register(record)) {
        console.println(SUCCESS_MESSAGE);
      } else {
        console.println(FAILURE_MESSAGE);
      }
    }
  }
}
