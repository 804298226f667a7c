/*
 * どこで: app/registration/src/main/java/com/example/registration/model/RegistrationOutcome.java
 * 何を: 登録処理の結果を表す列挙型
 * なぜ: 入力不備と保存失敗を呼び出し側で区別できるようにするため
 */
package com.example.registration.model;

public enum RegistrationOutcome {
    REGISTERED("registered"),
    VALIDATION_FAILED("validation_failed"),
    STORAGE_FAILED("storage_failed");

    private final String tag;

    RegistrationOutcome(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
