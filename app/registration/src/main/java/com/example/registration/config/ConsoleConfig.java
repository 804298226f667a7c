/*
 * どこで: Registration 設定
 * 何を: コンソール出力先を DI 可能にする
 * なぜ: Gateway/Runner の出力をテストで差し替えられるようにするため
 */
package com.example.registration.config;

import java.io.PrintStream;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ConsoleConfig {

  @Bean
  public PrintStream console() {
    return System.out;
  }
}
