package com.example.identity_gateway.repository;

public class UserCacheException extends RuntimeException {

  public UserCacheException(String message, Throwable cause) {
    super(message, cause);
  }
}
