package com.example.registration.service;

import com.example.registration.gateway.StorageException;
import com.example.registration.gateway.StorageGateway;
import com.example.registration.model.RegistrationOutcome;
import com.example.registration.model.UserRecord;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class RegistrationService {

  private static final Logger logger = LoggerFactory.getLogger(RegistrationService.class);

  private final StorageGateway storageGateway;
  private final RegistrationMetrics metrics;

  /**
   * Validates the record and hands it to the storage gateway.
   *
   * <p>Returns {@code true} once {@link StorageGateway#save} has returned; a {@link
   * StorageException} from the gateway is rethrown as is. Returns {@code false} without touching
   * storage when the display name or the email is empty.
   */
  public boolean register(@NonNull UserRecord record) {
    final String rejectReason = rejectReason(record);
    if (rejectReason != null) {
      logger.info("registration rejected userId={} reason={}", record.userId(), rejectReason);
      metrics.recordOutcome(RegistrationOutcome.VALIDATION_FAILED);
      return false;
    }

    try {
      storageGateway.save(record);
    } catch (StorageException ex) {
      logger.warn("registration storage failed userId={}", record.userId(), ex);
      metrics.recordOutcome(RegistrationOutcome.STORAGE_FAILED);
      throw ex;
    }
    logger.info("registration completed userId={}", record.userId());
    metrics.recordOutcome(RegistrationOutcome.REGISTERED);
    return true;
  }

  /** Same as {@link #register} but reports a storage failure as an outcome instead of throwing. */
  public RegistrationOutcome attempt(@NonNull UserRecord record) {
    try {
      return register(record)
          ? RegistrationOutcome.REGISTERED
          : RegistrationOutcome.VALIDATION_FAILED;
    } catch (StorageException ex) {
      // register 側で WARN ログとメトリクスを記録済み
      return RegistrationOutcome.STORAGE_FAILED;
    }
  }

  // null は空文字と同じ扱い
  private String rejectReason(UserRecord record) {
    if (isEmpty(record.displayName())) {
      return "display_name_empty";
    }
    if (isEmpty(record.email())) {
      return "email_empty";
    }
    return null;
  }

  private boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }
}
