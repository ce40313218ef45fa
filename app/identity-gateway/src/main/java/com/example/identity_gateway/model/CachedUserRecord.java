/*
 * どこで: identity-gateway のドメインモデル
 * 何を: Redis の SAPIUser:<login> に保存するユーザー情報
 * なぜ: 下流サービスが同じキャッシュを読むため、JSON のフィールド名を固定する
 */
package com.example.identity_gateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonRawValue;

public record CachedUserRecord(
    long id,
    String firstName,
    String lastName,
    String preferredEntryName,
    String email,
    String encryptedPid,
    long custId,
    int pseq,
    @JsonRawValue String extra,
    String userLogin,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean hasUsedCbsApp,
    String avatarUrl) {

  public static CachedUserRecord compose(
      String userLogin, ProfileRecord profile, LocalUserRecord user) {
    final String firstName = nullToEmpty(profile.firstName());
    final String lastName = nullToEmpty(profile.lastName());
    return new CachedUserRecord(
        user.id() == null ? 0L : user.id(),
        firstName,
        lastName,
        firstName + " " + lastName,
        nullToEmpty(profile.email()),
        nullToEmpty(profile.encryptedPid()),
        profile.custId(),
        0,
        user.extra(),
        isBlank(profile.userLogin()) ? userLogin : profile.userLogin(),
        false,
        nullToEmpty(user.avatarUrl()));
  }

  /** extra だけを差し替えたコピー。 */
  public CachedUserRecord withExtra(String newExtra) {
    return new CachedUserRecord(
        id,
        firstName,
        lastName,
        preferredEntryName,
        email,
        encryptedPid,
        custId,
        pseq,
        newExtra,
        userLogin,
        hasUsedCbsApp,
        avatarUrl);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
