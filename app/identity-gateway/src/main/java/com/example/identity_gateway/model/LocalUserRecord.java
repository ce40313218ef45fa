/*
 * どこで: identity-gateway のドメインモデル
 * 何を: User テーブル相当のレコード
 * なぜ: Repository とサービス間で nullable 列を明示して受け渡すため
 */
package com.example.identity_gateway.model;

public record LocalUserRecord(
    Long id,
    String userLogin,
    Long custId,
    String avatarUrl,
    String extra,
    String encryptedPid) {

  /** 未採番の新規ユーザー。avatarUrl と extra は作成時には持たない。 */
  public static LocalUserRecord newUser(String userLogin, Long custId, String encryptedPid) {
    return new LocalUserRecord(null, userLogin, custId, null, null, encryptedPid);
  }
}
