package com.flamingo.ai.knowledge.api.rest;

/** Request headers shared by the REST controllers. */
public final class ApiHeaders {

  /** Id of the calling user, set by the authenticating gateway. */
  public static final String USER_ID = "X-User-Id";

  private ApiHeaders() {}
}
