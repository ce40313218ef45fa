/*
 * どこで: identity-gateway サービス層
 * 何を: 認証情報の抽出、userLogin の復号、キャッシュ/profile/ストアを使った本人解決を行う
 * なぜ: どの段階で失敗してもリクエストを止めず、解決できたときだけ userLogin を下流へ渡すため
 */
package com.example.identity_gateway.service;

import com.example.credential.Credential;
import com.example.credential.CredentialDecodingException;
import com.example.credential.CredentialLoginResolver;
import com.example.identity_gateway.model.CachedUserRecord;
import com.example.identity_gateway.model.LocalUserResolution;
import com.example.identity_gateway.model.ProfileRecord;
import com.example.identity_gateway.model.ResolutionOutcome;
import com.example.identity_gateway.model.ResolutionOutcome.FailureKind;
import com.example.identity_gateway.repository.UserCacheRepository;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Duration;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IdentityResolutionService {

  static final Duration CACHE_TTL = Duration.ofDays(7);

  private static final Logger logger = LoggerFactory.getLogger(IdentityResolutionService.class);

  private final CredentialExtractor credentialExtractor;
  private final CredentialLoginResolver credentialLoginResolver;
  private final UserCacheRepository userCacheRepository;
  private final ProfileServiceClient profileServiceClient;
  private final LocalUserService localUserService;
  private final IdentityResolutionMetrics metrics;

  public ResolutionOutcome resolve(HttpServletRequest request) {
    final ResolutionOutcome outcome = resolveRequest(request);
    metrics.recordOutcome(outcome);
    return outcome;
  }

  private ResolutionOutcome resolveRequest(HttpServletRequest request) {
    final Optional<Credential> credential;
    try {
      credential = credentialExtractor.extract(request);
    } catch (CredentialDecodingException ex) {
      logger.warn("error when trying to get request credential: {}", ex.getMessage());
      return ResolutionOutcome.failed(FailureKind.CREDENTIAL_MALFORMED);
    }
    if (credential.isEmpty()) {
      return ResolutionOutcome.unauthenticated();
    }

    final String userLogin;
    try {
      userLogin = credentialLoginResolver.resolveLogin(credential.get());
    } catch (CredentialDecodingException ex) {
      logger.warn(
          "error when decrypting request credential {}: {}", credential.get(), ex.getMessage());
      return ResolutionOutcome.failed(toFailureKind(ex.reason()));
    }
    if (userLogin == null || userLogin.isEmpty()) {
      logger.debug("credential is not logged in, passing through anonymously");
      return ResolutionOutcome.unauthenticated();
    }
    return resolveUserLogin(userLogin);
  }

  /** キャッシュにあればそのまま、無ければ profile とストアから組み立ててキャッシュへ書き戻す。 */
  public ResolutionOutcome resolveUserLogin(String userLogin) {
    final boolean cached;
    try {
      cached = userCacheRepository.exists(userLogin);
    } catch (RuntimeException ex) {
      logger.warn("error when checking cached user: {}", ex.getMessage());
      return ResolutionOutcome.failed(FailureKind.CACHE_FAILURE);
    }
    metrics.recordCacheLookup(cached);
    if (cached) {
      // キャッシュの存在を信頼し、ストアとの整合性は確認しない
      return ResolutionOutcome.resolved(userLogin, true);
    }

    final ProfileRecord profile;
    final long startedAt = System.nanoTime();
    try {
      profile = profileServiceClient.fetch(userLogin);
      metrics.recordProfileFetchDuration("success", elapsedSince(startedAt));
    } catch (RuntimeException ex) {
      metrics.recordProfileFetchDuration("error", elapsedSince(startedAt));
      logger.warn("error when requesting profile service user details: {}", ex.getMessage());
      return ResolutionOutcome.failed(FailureKind.UPSTREAM_FETCH_FAILURE);
    }

    final LocalUserResolution localUser;
    try {
      localUser = localUserService.findOrCreate(userLogin, profile);
    } catch (RuntimeException ex) {
      logger.warn("error while resolving db user: {}", ex.getMessage());
      return ResolutionOutcome.failed(FailureKind.STORE_FAILURE);
    }
    metrics.recordStoreResult(localUser.created());

    try {
      userCacheRepository.save(
          userLogin, CachedUserRecord.compose(userLogin, profile, localUser.user()), CACHE_TTL);
    } catch (RuntimeException ex) {
      // 書き込み失敗は次回のキャッシュミスで再計算されるだけなので、userLogin は下流へ渡す
      metrics.recordCacheWriteError();
      logger.warn("error while saving cached user: {}", ex.getMessage());
    }
    return ResolutionOutcome.resolved(userLogin, false);
  }

  private FailureKind toFailureKind(CredentialDecodingException.Reason reason) {
    if (reason == CredentialDecodingException.Reason.MALFORMED_CREDENTIAL
        || reason == CredentialDecodingException.Reason.INVALID_CREDENTIAL) {
      return FailureKind.CREDENTIAL_MALFORMED;
    }
    return FailureKind.DECRYPTION_FAILURE;
  }

  private Duration elapsedSince(long startedAt) {
    return Duration.ofNanos(System.nanoTime() - startedAt);
  }
}
