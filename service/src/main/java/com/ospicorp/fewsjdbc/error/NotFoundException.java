package com.ospicorp.fewsjdbc.error;

public final class NotFoundException extends FewsJdbcException {

  public NotFoundException(String message) {
    super(ErrorKind.NOT_FOUND, message);
  }
}
