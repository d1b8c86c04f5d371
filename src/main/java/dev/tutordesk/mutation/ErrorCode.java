package dev.tutordesk.mutation;

/** Error codes surfaced to tool callers. */
public enum ErrorCode {
  /** Caller precondition violated: empty query, missing identifier, malformed argument. */
  BAD_REQUEST,
  /** The referenced entity does not exist. */
  NOT_FOUND,
  /** The backing sheet has no data rows. */
  EMPTY,
  /** The confirm token is unknown or was already consumed. */
  CONFIRM_EXPIRED,
  /** The confirm token was issued for a different entity; the token is consumed regardless. */
  CONFIRM_MISMATCH,
  /** A lower-level failure, typically from the row store. */
  ERROR
}
