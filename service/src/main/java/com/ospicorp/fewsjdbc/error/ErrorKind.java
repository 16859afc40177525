package com.ospicorp.fewsjdbc.error;

/**
 * The closed set of failure variants a lookup can end in.
 */
public enum ErrorKind {
  REMOTE_UNAVAILABLE,
  REMOTE_QUERY_ERROR,
  SCHEMA_MISMATCH,
  NOT_FOUND,
  MALFORMED_TIMESTAMP
}
