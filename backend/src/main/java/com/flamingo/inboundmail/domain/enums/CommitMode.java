package com.flamingo.inboundmail.domain.enums;

/** How a batch persists its results. */
public enum CommitMode {
  /** All results of a batch are written in one transaction, or none are. */
  SINGLE_TRANSACTION,
  /** Each successful result is committed as soon as it is produced. */
  PER_ITEM
}
