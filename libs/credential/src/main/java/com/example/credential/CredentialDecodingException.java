package com.example.credential;

public class CredentialDecodingException extends RuntimeException {

  public enum Reason {
    MALFORMED_CREDENTIAL,
    DECRYPTION_FAILURE,
    INVALID_CREDENTIAL,
    UNSUPPORTED_CREDENTIAL
  }

  private final Reason reason;

  public CredentialDecodingException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public CredentialDecodingException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
