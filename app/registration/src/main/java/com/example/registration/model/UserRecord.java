/*
 * どこで: app/registration/src/main/java/com/example/registration/model/UserRecord.java
 * 何を: 登録対象ユーザーを表す不変のドメインレコード
 * なぜ: Runner/Service/Gateway 間でユーザー情報の受け渡しを明確にするため
 */
package com.example.registration.model;

public record UserRecord(
        long userId,
        String displayName,
        String email) {
}
