package com.botcity.maestro.client;

import com.google.common.base.Strings;

import org.jetbrains.annotations.Nullable;

/**
 * Credentials and access token of one portal connection.
 *
 * <p>The token is the only state shared between calls. It is read by every authenticated request
 * and written only by login, logoff and {@link #setAccessToken(String)}; callers sharing a session
 * across threads synchronize externally.
 */
public class MaestroSession {
  static final String LOGIN_REQUIRED_MESSAGE = "Access token not available. Make sure to invoke login first.";

  private String server;
  private String login;
  private String key;

  private volatile String accessToken;

  public MaestroSession() {
    this(null, null, null);
  }

  public MaestroSession(@Nullable String server, @Nullable String login, @Nullable String key) {
    this.setServer(server);
    this.login = login;
    this.key = key;
  }

  /**
   * Strips exactly one trailing slash so that paths can be appended with a single separator.
   */
  public static String normalizeServer(@Nullable String server) {
    if (server != null && server.endsWith("/")) {
      return server.substring(0, server.length() - 1);
    }
    return server;
  }

  public String getServer() {
    return this.server;
  }

  public void setServer(@Nullable String server) {
    this.server = normalizeServer(server);
  }

  public String getLogin() {
    return this.login;
  }

  public void setLogin(@Nullable String login) {
    this.login = login;
  }

  public String getKey() {
    return this.key;
  }

  public void setKey(@Nullable String key) {
    this.key = key;
  }

  @Nullable
  public String getAccessToken() {
    return this.accessToken;
  }

  public void setAccessToken(@Nullable String accessToken) {
    this.accessToken = accessToken;
  }

  /**
   * Applies the non-empty overrides and checks that server, login and key are all present.
   *
   * @throws ConfigurationException naming the first missing value
   */
  void prepareLogin(@Nullable String server, @Nullable String login, @Nullable String key) {
    if (!Strings.isNullOrEmpty(server)) {
      this.setServer(server);
    }
    if (!Strings.isNullOrEmpty(login)) {
      this.login = login;
    }
    if (!Strings.isNullOrEmpty(key)) {
      this.key = key;
    }
    if (Strings.isNullOrEmpty(this.server)) {
      throw new ConfigurationException("Server is required.");
    }
    if (Strings.isNullOrEmpty(this.login)) {
      throw new ConfigurationException("Login is required.");
    }
    if (Strings.isNullOrEmpty(this.key)) {
      throw new ConfigurationException("Key is required.");
    }
  }

  public void logoff() {
    this.accessToken = null;
  }

  /**
   * @return the current token
   * @throws PreconditionException if login has not been called or logoff has cleared the token
   */
  public String requireToken() {
    String token = this.accessToken;
    if (token == null) {
      throw new PreconditionException(LOGIN_REQUIRED_MESSAGE);
    }
    return token;
  }

  public boolean isValid() {
    return this.accessToken != null;
  }

  @Override
  public String toString() {
    return String.format("MaestroSession[server=%s, login=%s, authenticated=%s]", server, login, isValid());
  }
}
