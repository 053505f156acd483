package io.intellixity.reportql.exec;

/** Non-terminal execution phases, in order. Terminal states are {@link ReportStatus}. */
public enum ReportPhase { VALIDATING, BUILDING, ROUTING, EXECUTING }
