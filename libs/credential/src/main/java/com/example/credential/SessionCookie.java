package com.example.credential;

/**
 * pid Cookie の中身。
 *
 * <p>{@code status} は 1 文字のフラグで {@code "L"} がログイン済みを表す。{@code pid} は {@code encrypted}
 * に応じて平文または暗号文。
 */
public record SessionCookie(String status, String pid, boolean encrypted) implements Credential {

  public static final String LOGGED_IN_STATUS = "L";

  public SessionCookie {
    status = status == null ? "" : status;
    pid = pid == null ? "" : pid;
  }

  public boolean isValid() {
    return !status.isEmpty() && !pid.isEmpty();
  }

  public boolean isLoggedIn() {
    return LOGGED_IN_STATUS.equals(status);
  }

  @Override
  public String toString() {
    return "SessionCookie[status=" + status + ", encrypted=" + encrypted + "]";
  }
}
