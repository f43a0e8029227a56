package com.flamingo.inboundmail.domain.enums;

/** Final outcome of a closed batch run. */
public enum BatchOutcome {
  COMMITTED,
  PARTIALLY_COMMITTED,
  ABORTED
}
