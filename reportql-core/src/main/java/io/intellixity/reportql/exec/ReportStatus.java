package io.intellixity.reportql.exec;

public enum ReportStatus { SUCCEEDED, FAILED, TIMED_OUT }
