package com.flamingo.inboundmail.domain.enums;

/** Lifecycle state of an extraction job. */
public enum JobState {
  PENDING,
  IN_PROGRESS,
  SUCCEEDED,
  FAILED
}
