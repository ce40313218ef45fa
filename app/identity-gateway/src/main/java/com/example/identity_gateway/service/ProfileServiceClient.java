package com.example.identity_gateway.service;

import com.example.identity_gateway.config.ProfileServiceProperties;
import com.example.identity_gateway.model.ProfileRecord;
import com.example.identity_gateway.service.dto.ProfileServiceResponse;
import com.example.identity_gateway.service.dto.ProfileServiceUserDetails;
import java.net.SocketTimeoutException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@RequiredArgsConstructor
public class ProfileServiceClient {

  private static final Logger logger = LoggerFactory.getLogger(ProfileServiceClient.class);
  private static final String QUERY =
      "?edition=us&view=json&returnType=99&authKey={authKey}&userLogin={userLogin}";

  private final RestClient profileServiceRestClient;
  private final ProfileServiceProperties properties;

  public ProfileRecord fetch(String userLogin) {
    if (userLogin == null || userLogin.isBlank()) {
      throw new IllegalArgumentException("userLogin is required");
    }
    logger.debug("getting profile service user details");
    final ProfileServiceResponse response = callUserDetails(userLogin);
    return toProfileRecord(response);
  }

  private ProfileServiceResponse callUserDetails(String userLogin) {
    try {
      final ResponseEntity<ProfileServiceResponse> response =
          profileServiceRestClient
              .get()
              .uri(
                  properties.userDetailsPath() + QUERY,
                  Map.of("authKey", properties.authKey(), "userLogin", userLogin))
              .retrieve()
              .toEntity(ProfileServiceResponse.class);
      if (response.getStatusCode().value() != 200) {
        logger.warn(
            "profile service user details returned status={}", response.getStatusCode().value());
        throw new ProfileServiceException(
            ProfileServiceException.Reason.BAD_STATUS,
            "error status code received for user details: " + response.getStatusCode().value());
      }
      return response.getBody();
    } catch (RestClientResponseException ex) {
      logger.warn(
          "profile service user details failed with http status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      throw new ProfileServiceException(
          ProfileServiceException.Reason.BAD_STATUS,
          "error status code received for user details: " + ex.getStatusCode().value(),
          ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("profile service user details timed out");
        throw new ProfileServiceException(
            ProfileServiceException.Reason.TIMEOUT, "profile service request timeout", ex);
      }
      logger.warn("profile service user details connection failed", ex);
      throw new ProfileServiceException(
          ProfileServiceException.Reason.CONNECTION_FAILURE,
          "profile service connection failed",
          ex);
    } catch (ProfileServiceException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("profile service user details response parse failed", ex);
      throw new ProfileServiceException(
          ProfileServiceException.Reason.INVALID_RESPONSE,
          "profile service response parse failed",
          ex);
    }
  }

  private ProfileRecord toProfileRecord(ProfileServiceResponse response) {
    if (response == null || response.details() == null) {
      logger.warn("profile service user details response has no details");
      throw new ProfileServiceException(
          ProfileServiceException.Reason.INVALID_RESPONSE, "profile service response is empty");
    }
    final ProfileServiceUserDetails details = response.details();
    return new ProfileRecord(
        details.custId() == null ? 0L : details.custId(),
        details.userLogin(),
        details.email(),
        details.firstName(),
        details.lastName(),
        details.encryptedPid());
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
