/*
 * どこで: identity-gateway Repository 層
 * 何を: 解決済みユーザーのキャッシュ操作を抽象化する
 * なぜ: Redis 実装詳細を本人解決サービスから切り離すため
 */
package com.example.identity_gateway.repository;

import com.example.identity_gateway.model.CachedUserRecord;
import java.time.Duration;

public interface UserCacheRepository {

  /** 役割: userLogin のキャッシュが存在するか返す。 動作: 内容の鮮度は検証しない。 前提: userLogin は空でないこと。 */
  boolean exists(String userLogin);

  /**
   * 役割: 解決済みユーザーを保存する。 動作: 既存値は上書きし、ttl 経過後に失効させる。 前提: userLogin は空でないこと。
   */
  void save(String userLogin, CachedUserRecord user, Duration ttl);
}
