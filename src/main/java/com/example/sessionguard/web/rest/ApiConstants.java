package com.example.sessionguard.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String API_BASE = "/api";
    public static final String SESSION = "/session";

    // Session paths
    public static final String CHECK = "/check";
    public static final String SESSIONS = "/sessions";
    public static final String SESSION_BY_ID = "/sessions/{sessionId}";
    public static final String STATISTICS = "/statistics";

    private ApiPath() {}
  }

  public static final class Header {
    public static final String REAUTH_REQUIRED = "X-Reauth-Required";

    private Header() {}
  }

  private ApiConstants() {}
}
