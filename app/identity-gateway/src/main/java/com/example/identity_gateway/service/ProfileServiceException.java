package com.example.identity_gateway.service;

public class ProfileServiceException extends RuntimeException {

  public enum Reason {
    BAD_STATUS,
    TIMEOUT,
    CONNECTION_FAILURE,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public ProfileServiceException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ProfileServiceException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
