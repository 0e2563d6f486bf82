package io.intellixity.pagekit.query;

public enum Clause { AND, OR }
