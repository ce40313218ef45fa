/*
 * どこで: identity-gateway のドメインモデル
 * 何を: profile service から取得したユーザー情報
 * なぜ: 外部 API の JSON 形式をサービス層から切り離すため
 */
package com.example.identity_gateway.model;

public record ProfileRecord(
    long custId,
    String userLogin,
    String email,
    String firstName,
    String lastName,
    String encryptedPid) {}
