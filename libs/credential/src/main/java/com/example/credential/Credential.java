/*
 * どこで: libs/credential
 * 何を: リクエストから取り出した認証情報の閉じた直和型
 * なぜ: 認証情報の種類はコンパイル時に確定しており、種類ごとに userLogin 解決関数を持たせるため
 */
package com.example.credential;

public sealed interface Credential permits BearerToken, SessionCookie {}
