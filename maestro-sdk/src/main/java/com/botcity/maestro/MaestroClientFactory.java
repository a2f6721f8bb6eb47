package com.botcity.maestro;

import com.botcity.maestro.client.ConfigurationException;
import com.botcity.maestro.client.MaestroClient;
import com.botcity.maestro.client.MaestroSession;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import okhttp3.OkHttpClient;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link MaestroClient} instances from string parameters. The returned client is configured
 * but not logged in.
 */
public class MaestroClientFactory {
  private static final Logger LOG = LoggerFactory.getLogger(MaestroClientFactory.class);

  private MaestroClientFactory() {
  }

  /**
   * Creates a client from parameters keyed by the {@link MaestroConstants} names. Timeouts are in
   * seconds; absent timeouts keep the HTTP client defaults.
   *
   * @throws ConfigurationException if the server is missing or a timeout is not a non-negative number
   */
  @NotNull
  public static MaestroClient createClient(@NotNull Map<String, String> params) {
    String server = params.get(MaestroConstants.SERVER);
    if (Strings.isNullOrEmpty(server)) {
      throw new ConfigurationException("Server is required.");
    }

    OkHttpClient.Builder builder = MaestroClient.sharedHttpClient().newBuilder();
    Long connectTimeout = parseTimeout(params, MaestroConstants.CONNECT_TIMEOUT);
    if (connectTimeout != null) {
      builder.connectTimeout(connectTimeout, TimeUnit.SECONDS);
    }
    Long readTimeout = parseTimeout(params, MaestroConstants.READ_TIMEOUT);
    if (readTimeout != null) {
      builder.readTimeout(readTimeout, TimeUnit.SECONDS);
    }
    Long writeTimeout = parseTimeout(params, MaestroConstants.WRITE_TIMEOUT);
    if (writeTimeout != null) {
      builder.writeTimeout(writeTimeout, TimeUnit.SECONDS);
    }

    MaestroSession session = new MaestroSession(server, params.get(MaestroConstants.LOGIN),
        params.get(MaestroConstants.KEY));
    LOG.debug(String.format("Creating new MaestroClient for server: %s", session.getServer()));
    return new MaestroClient(session, builder.build());
  }

  /**
   * Creates a client from the {@code BOTCITY_SERVER}, {@code BOTCITY_LOGIN} and {@code BOTCITY_KEY}
   * environment variables.
   */
  @NotNull
  public static MaestroClient createClientFromEnvironment() {
    return createClient(fromEnvironment(System.getenv()));
  }

  @VisibleForTesting
  static Map<String, String> fromEnvironment(Map<String, String> environment) {
    Map<String, String> params = new HashMap<>();
    params.put(MaestroConstants.SERVER, environment.get(MaestroConstants.SERVER_ENV));
    params.put(MaestroConstants.LOGIN, environment.get(MaestroConstants.LOGIN_ENV));
    params.put(MaestroConstants.KEY, environment.get(MaestroConstants.KEY_ENV));
    return params;
  }

  @Nullable
  private static Long parseTimeout(Map<String, String> params, String name) {
    String value = params.get(name);
    if (Strings.isNullOrEmpty(value)) {
      return null;
    }
    try {
      long seconds = Long.parseLong(value.trim());
      if (seconds < 0) {
        throw new ConfigurationException(String.format("%s must not be negative: %s", name, value));
      }
      return seconds;
    } catch (NumberFormatException e) {
      throw new ConfigurationException(String.format("%s is not a number: %s", name, value), e);
    }
  }
}
