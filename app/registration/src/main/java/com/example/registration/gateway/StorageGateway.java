/*
 * どこで: Registration ゲートウェイ層
 * 何を: ユーザーレコード保存の抽象化インターフェース
 * なぜ: 保存先の実装差し替えをサービス層から切り離すため
 */
package com.example.registration.gateway;

import com.example.registration.model.UserRecord;

public interface StorageGateway {

    /**
     * Persists the given record.
     *
     * @throws StorageException if the record could not be persisted
     */
    void save(UserRecord record);
}
