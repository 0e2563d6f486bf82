package io.intellixity.pagekit.examples.rpc;

public enum UserRole { ADMIN, USER, MODERATOR }
