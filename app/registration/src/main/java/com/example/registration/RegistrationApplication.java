/*
 * どこで: Registration アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: Gateway/Service/Runner をコンストラクタ注入で組み立てるため
 */
package com.example.registration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RegistrationApplication {

	public static void main(String[] args) {
		SpringApplication.run(RegistrationApplication.class, args);
	}
}
