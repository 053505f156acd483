package io.intellixity.reportql.query;

public enum Clause { AND, OR }
