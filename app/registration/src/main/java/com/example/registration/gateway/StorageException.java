/*
 * どこで: Registration ゲートウェイ層
 * 何を: 保存処理の失敗を示す例外
 * なぜ: 入力不備(false 返却)と保存失敗を型で区別するため
 */
package com.example.registration.gateway;

public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }
}
