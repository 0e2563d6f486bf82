package io.intellixity.pagekit.examples.rpc;

public enum UserStatus { ACTIVE, INACTIVE, PENDING }
