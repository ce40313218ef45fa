package com.example.identity_gateway.model;

public record LocalUserResolution(LocalUserRecord user, boolean created) {

  public static LocalUserResolution found(LocalUserRecord user) {
    return new LocalUserResolution(user, false);
  }

  public static LocalUserResolution inserted(LocalUserRecord user) {
    return new LocalUserResolution(user, true);
  }
}
