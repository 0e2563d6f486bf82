package io.intellixity.pagekit.examples.service;

public final class UserNotFoundException extends RuntimeException {
  public static final String CODE = "NOT_FOUND";

  private final String userId;

  public UserNotFoundException(String userId) {
    super("User with id " + userId + " not found");
    this.userId = userId;
  }

  public String userId() { return userId; }
  public String code() { return CODE; }
}
