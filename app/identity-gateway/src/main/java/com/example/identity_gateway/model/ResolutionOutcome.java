package com.example.identity_gateway.model;

/**
 * 1 リクエスト分の本人解決の結果。
 *
 * <p>どの結果でもリクエストは下流へ流れる。{@link Status#RESOLVED} のときだけ userLogin が付与される。
 */
public record ResolutionOutcome(
    Status status, String userLogin, boolean cacheHit, FailureKind failure) {

  public enum Status {
    UNAUTHENTICATED,
    RESOLVED,
    FAILED
  }

  public enum FailureKind {
    CREDENTIAL_MALFORMED,
    DECRYPTION_FAILURE,
    UPSTREAM_FETCH_FAILURE,
    STORE_FAILURE,
    CACHE_FAILURE
  }

  public static ResolutionOutcome unauthenticated() {
    return new ResolutionOutcome(Status.UNAUTHENTICATED, null, false, null);
  }

  public static ResolutionOutcome resolved(String userLogin, boolean cacheHit) {
    if (userLogin == null || userLogin.isEmpty()) {
      throw new IllegalArgumentException("userLogin is required");
    }
    return new ResolutionOutcome(Status.RESOLVED, userLogin, cacheHit, null);
  }

  public static ResolutionOutcome failed(FailureKind failure) {
    if (failure == null) {
      throw new IllegalArgumentException("failure is required");
    }
    return new ResolutionOutcome(Status.FAILED, null, false, failure);
  }

  public boolean isResolved() {
    return status == Status.RESOLVED;
  }
}
