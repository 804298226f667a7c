/*
 * どこで: Registration ゲートウェイ層
 * 何を: ユーザー保存をコンソール出力で模擬する実装
 * なぜ: 実 DB を伴わずに登録フローを確認するため
 */
package com.example.registration.gateway;

import com.example.registration.model.UserRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "コンソール出力先は Spring 管理の共有ストリームで防御的コピーが不可能なため")
@RequiredArgsConstructor
public class ConsoleStorageGateway implements StorageGateway {

  private static final Logger logger = LoggerFactory.getLogger(ConsoleStorageGateway.class);

  private final PrintStream console;

  @Override
  public void save(UserRecord record) {
    // 実保存は行わず、コンソールに 1 行出力するだけとする
    console.println(
        "Saving user to database: " + record.displayName() + " (Email: " + record.email() + ")");
    logger.debug("user simulated save userId={}", record.userId());
  }
}
