package com.example.credential;

public record BearerToken(String kind, String value) implements Credential {

  public static final String DEFAULT_KIND = "Bearer";

  public BearerToken {
    kind = kind == null || kind.isEmpty() ? DEFAULT_KIND : kind;
    value = value == null ? "" : value;
  }

  public boolean isValid() {
    return !value.isEmpty();
  }

  @Override
  public String toString() {
    // value は秘匿情報なのでログに出さない
    return "BearerToken[kind=" + kind + "]";
  }
}
