package com.botcity.maestro.client;

import com.botcity.maestro.MaestroConstants;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import okhttp3.FormBody;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the BotMaestro portal REST API.
 *
 * <p>Every call is a blocking round trip. Authenticated calls check for an access token before
 * building the request and attach it as the {@code access_token} form field or query parameter.
 * A call either returns a fully decoded result or throws: {@link RequestException} for a non-200
 * answer, {@link MaestroProtocolException} for a 200 answer with an unexpected body.
 */
public class MaestroClient {
  private static final Logger LOG = LoggerFactory.getLogger(MaestroClient.class);

  private static final OkHttpClient SHARED_CLIENT = new OkHttpClient();

  private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
  private static final String ARTIFACT_PART = "body";
  // TODO: send the real processed item count once the portal accepts it on task finish
  private static final String PROCESSED_ITEMS = "1";

  private final MaestroSession session;
  private final OkHttpClient client;

  public MaestroClient(@Nullable String server, @Nullable String login, @Nullable String key) {
    this(new MaestroSession(server, login, key));
  }

  public MaestroClient(@NotNull MaestroSession session) {
    this(session, SHARED_CLIENT);
  }

  public MaestroClient(@NotNull MaestroSession session, @NotNull OkHttpClient client) {
    this.session = session;
    this.client = client;
  }

  /**
   * Default HTTP client shared by all instances. Derive custom settings from it with
   * {@link OkHttpClient#newBuilder()} so the connection pool stays shared.
   */
  public static OkHttpClient sharedHttpClient() {
    return SHARED_CLIENT;
  }

  public MaestroSession getSession() {
    return this.session;
  }

  @VisibleForTesting
  public OkHttpClient getHttpClient() {
    return this.client;
  }

  public void login() throws IOException {
    this.login(null, null, null);
  }

  /**
   * Obtains an access token. Non-empty arguments replace the configured values first.
   *
   * @throws ConfigurationException if server, login or key is missing
   * @throws AuthenticationException if the portal rejects the credentials
   */
  public void login(@Nullable String server, @Nullable String login, @Nullable String key) throws IOException {
    this.session.prepareLogin(server, login, key);
    this.session.logoff();

    Map<String, String> data = new LinkedHashMap<>();
    data.put("userLogin", this.session.getLogin());
    data.put("key", this.session.getKey());

    LOG.debug(String.format("Logging in to %s as '%s'", this.session.getServer(), this.session.getLogin()));
    HttpResponse httpResponse = this.post(this.url(MaestroConstants.LOGIN_PATH), data, null);

    if (!httpResponse.isOk()) {
      LOG.warn(String.format("Login failed: HTTP %d - %s", httpResponse.getCode(), httpResponse.getBody()));
      throw new AuthenticationException(httpResponse.getCode(), httpResponse.getBody());
    }

    JsonObject body = JsonHelper.parseObject(httpResponse.getBody());
    String token = JsonHelper.getString(body, MaestroConstants.ACCESS_TOKEN_FIELD);
    if (token == null) {
      throw new MaestroProtocolException("Login response does not contain an access token");
    }
    this.session.setAccessToken(token);
    LOG.info(String.format("Logged in to %s as '%s'", this.session.getServer(), this.session.getLogin()));
  }

  public void logoff() {
    this.session.logoff();
  }

  public ServerMessage alert(String taskId, String title, String message, AlertType alertType)
      throws IOException {
    return this.alert(taskId, title, message, alertType != null ? alertType.getValue() : null);
  }

  /**
   * Registers an alert on the portal. {@code alertType} is passed through unchecked.
   */
  public ServerMessage alert(String taskId, String title, String message, String alertType) throws IOException {
    String token = this.session.requireToken();

    Map<String, String> data = new LinkedHashMap<>();
    data.put("taskId", taskId);
    data.put("title", title);
    data.put("message", message);
    data.put("type", alertType);

    HttpResponse httpResponse = this.post(this.url(MaestroConstants.ALERT_PATH), data, token);
    return this.toServerMessage("alert", httpResponse);
  }

  public ServerMessage message(List<String> emails, List<String> users, String subject, String body,
      MessageType messageType, String group) throws IOException {
    return this.message(emails, users, subject, body, messageType != null ? messageType.getValue() : null, group);
  }

  /**
   * Sends a message to the given e-mail addresses and portal users.
   */
  public ServerMessage message(List<String> emails, List<String> users, String subject, String body,
      String messageType, String group) throws IOException {
    String token = this.session.requireToken();

    Map<String, String> data = new LinkedHashMap<>();
    data.put("email", joinList(emails));
    data.put("users", joinList(users));
    data.put("subject", subject);
    data.put("body", body);
    data.put("type", messageType);
    data.put("group", group);

    HttpResponse httpResponse = this.post(this.url(MaestroConstants.MESSAGE_PATH), data, token);
    return this.toServerMessage("message", httpResponse);
  }

  public AutomationTask createTask(String activityLabel, Map<String, Object> parameters) throws IOException {
    return this.createTask(activityLabel, parameters, false);
  }

  /**
   * Creates a task for the given activity.
   *
   * @param parameters task parameters, sent JSON-encoded
   * @param test       whether the task is a test run
   */
  public AutomationTask createTask(String activityLabel, @Nullable Map<String, Object> parameters, boolean test)
      throws IOException {
    String token = this.session.requireToken();

    Map<String, String> data = new LinkedHashMap<>();
    data.put("activityLabel", activityLabel);
    data.put("jsonParams", JsonHelper.toJson(parameters != null ? parameters : Collections.emptyMap()));
    data.put("taskForTest", String.valueOf(test));

    HttpResponse httpResponse = this.post(this.url(MaestroConstants.TASK_CREATE_PATH), data, token);
    if (!httpResponse.isOk()) {
      throw this.requestFailed("task create", httpResponse);
    }

    JsonObject body = JsonHelper.parseObject(httpResponse.getBody());
    JsonElement payload = body.get("payload");
    if (payload == null || payload.isJsonNull()) {
      throw new MaestroProtocolException("Task create response does not contain a payload");
    }
    // Some portal versions send the task as a JSON-encoded string
    if (payload.isJsonPrimitive()) {
      payload = JsonHelper.parse(payload.getAsString());
    }
    AutomationTask task = JsonHelper.fromJson(payload, AutomationTask.class);
    LOG.debug(String.format("Created task %s for activity '%s'", task.getId(), activityLabel));
    return task;
  }

  public ServerMessage finishTask(String taskId, AutomationTaskFinishStatus status) throws IOException {
    return this.finishTask(taskId, status != null ? status.getValue() : null, "");
  }

  public ServerMessage finishTask(String taskId, AutomationTaskFinishStatus status, String message)
      throws IOException {
    return this.finishTask(taskId, status != null ? status.getValue() : null, message);
  }

  public ServerMessage finishTask(String taskId, String finishStatus, String message) throws IOException {
    String token = this.session.requireToken();

    Map<String, String> data = new LinkedHashMap<>();
    data.put("taskId", taskId);
    data.put("finishStatus", finishStatus);
    data.put("finishMessage", Strings.nullToEmpty(message));
    data.put("processedItems", PROCESSED_ITEMS);

    HttpResponse httpResponse = this.post(this.url(MaestroConstants.TASK_FINISH_PATH), data, token);
    return this.toServerMessage("task finish", httpResponse);
  }

  public ServerMessage restartTask(String taskId) throws IOException {
    String token = this.session.requireToken();

    Map<String, String> data = new LinkedHashMap<>();
    data.put("id", taskId);

    HttpResponse httpResponse = this.post(this.url(MaestroConstants.TASK_RESTART_PATH), data, token);
    return this.toServerMessage("task restart", httpResponse);
  }

  public AutomationTask getTask(String taskId) throws IOException {
    String token = this.session.requireToken();

    Map<String, String> params = new LinkedHashMap<>();
    params.put("id", taskId);

    HttpResponse httpResponse = this.get(this.url(MaestroConstants.TASK_GET_PATH), params, token);
    if (!httpResponse.isOk()) {
      throw this.requestFailed("task get", httpResponse);
    }
    return JsonHelper.fromJson(httpResponse.getBody(), AutomationTask.class);
  }

  /**
   * Creates a log for the activity with the given ordered columns.
   */
  public ServerMessage newLog(String activityLabel, List<Column> columns) throws IOException {
    String token = this.session.requireToken();

    Map<String, String> data = new LinkedHashMap<>();
    data.put("activityLabel", activityLabel);
    data.put("columns", JsonHelper.toJson(columns != null ? columns : Collections.emptyList()));

    HttpResponse httpResponse = this.post(this.url(MaestroConstants.LOG_CREATE_PATH), data, token);
    return this.toServerMessage("new log", httpResponse);
  }

  /**
   * Appends an entry to the activity's log.
   *
   * @param values column label to value
   */
  public ServerMessage newLogEntry(String activityLabel, Map<String, Object> values) throws IOException {
    String token = this.session.requireToken();

    Map<String, String> data = new LinkedHashMap<>();
    data.put("logName", activityLabel);
    data.put("columns", JsonHelper.toJson(values != null ? values : Collections.emptyMap()));

    HttpResponse httpResponse = this.post(this.url(MaestroConstants.LOG_ENTRY_PATH), data, token);
    return this.toServerMessage("new log entry", httpResponse);
  }

  public List<Map<String, Object>> getLog(String activityLabel) throws IOException {
    return this.getLog(activityLabel, "");
  }

  /**
   * Reads the activity's log entries.
   *
   * @param date first day to read, as DD/MM/YYYY; empty reads everything
   * @return one map per entry, keyed by column label
   */
  public List<Map<String, Object>> getLog(String activityLabel, @Nullable String date) throws IOException {
    String token = this.session.requireToken();

    Map<String, String> params = new LinkedHashMap<>();
    params.put("activityLabel", activityLabel);
    params.put("date", Strings.nullToEmpty(date));

    HttpResponse httpResponse = this.get(this.url(MaestroConstants.LOG_READ_PATH), params, token);
    if (!httpResponse.isOk()) {
      throw this.requestFailed("log read", httpResponse);
    }

    JsonObject body = JsonHelper.parseObject(httpResponse.getBody());
    JsonElement message = body.get("message");
    if (message == null || message.isJsonNull()) {
      throw new MaestroProtocolException("Log read response does not contain a message");
    }
    JsonElement entries = message.isJsonPrimitive() ? JsonHelper.parse(message.getAsString()) : message;
    if (!entries.isJsonArray()) {
      throw new MaestroProtocolException("Log read message is not a list of entries: " + message);
    }

    JsonArray array = entries.getAsJsonArray();
    List<Map<String, Object>> result = new ArrayList<>(array.size());
    for (JsonElement entry : array) {
      if (!entry.isJsonObject()) {
        throw new MaestroProtocolException("Unexpected log entry: " + entry);
      }
      result.add(JsonHelper.toMap(entry.getAsJsonObject().get("columns")));
    }
    LOG.debug(String.format("Read %d log entries for activity '%s'", result.size(), activityLabel));
    return result;
  }

  public ServerMessage deleteLog(String activityLabel) throws IOException {
    String token = this.session.requireToken();

    Map<String, String> data = new LinkedHashMap<>();
    data.put("activityLabel", activityLabel);

    HttpResponse httpResponse = this.post(this.url(MaestroConstants.LOG_DELETE_PATH), data, token);
    return this.toServerMessage("log delete", httpResponse);
  }

  /**
   * Uploads a file as an artifact of the given task.
   *
   * @param artifactName name displayed on the portal
   * @param file         file to upload; read completely before the request is sent
   */
  public ServerMessage postArtifact(String taskId, String artifactName, Path file) throws IOException {
    String token = this.session.requireToken();

    // Throws NoSuchFileException before any request is sent; the content is streamed during the call
    long size = Files.size(file);
    LOG.debug(String.format("Uploading artifact '%s' (%d bytes) for task %s", artifactName, size, taskId));

    Headers partHeaders = new Headers.Builder()
        .addUnsafeNonAscii("Content-Disposition", String.format("form-data; name=\"%s\"; filename=\"%s\"",
            ARTIFACT_PART, quote(artifactName)))
        .add("Expires", "0")
        .build();
    RequestBody requestBody = new MultipartBody.Builder()
        .setType(MultipartBody.FORM)
        .addFormDataPart("taskId", taskId)
        .addFormDataPart("name", artifactName)
        .addFormDataPart(MaestroConstants.ACCESS_TOKEN_FIELD, token)
        .addPart(partHeaders, RequestBody.create(OCTET_STREAM, file.toFile()))
        .build();

    Request request = new Request.Builder()
        .url(this.url(MaestroConstants.ARTIFACT_POST_PATH))
        .post(requestBody)
        .build();
    HttpResponse httpResponse = this.executeCall(request);
    return this.toServerMessage("artifact posting", httpResponse);
  }

  /**
   * Downloads an artifact. The name is recovered from the {@code Content-Disposition} header.
   */
  public Artifact getArtifact(int artifactId) throws IOException {
    String token = this.session.requireToken();

    Map<String, String> params = new LinkedHashMap<>();
    params.put("id", String.valueOf(artifactId));

    HttpResponse httpResponse = this.get(this.url(MaestroConstants.ARTIFACT_GET_PATH), params, token);
    if (!httpResponse.isOk()) {
      throw this.requestFailed("artifact get", httpResponse);
    }

    String name = parseArtifactName(httpResponse.getHeader(MaestroConstants.CONTENT_DISPOSITION_HEADER));
    return new Artifact(name, httpResponse.getContent());
  }

  /**
   * Recovers the artifact name from a {@code Content-Disposition} value. The portal stores files as
   * {@code base_suffix.ext}; the suffix between the last underscore and the extension is dropped.
   */
  @VisibleForTesting
  static String parseArtifactName(@Nullable String contentDisposition) throws MaestroProtocolException {
    if (Strings.isNullOrEmpty(contentDisposition) || contentDisposition.indexOf('=') < 0) {
      throw new MaestroProtocolException("Artifact response does not carry a file name: " + contentDisposition);
    }
    String filename = contentDisposition.substring(contentDisposition.lastIndexOf('=') + 1).trim();
    if (filename.length() >= 2 && filename.startsWith("\"") && filename.endsWith("\"")) {
      filename = filename.substring(1, filename.length() - 1);
    }

    int suffixStart = filename.lastIndexOf('_');
    if (suffixStart < 0) {
      return filename;
    }
    int extensionStart = filename.lastIndexOf('.');
    String extension = extensionStart > suffixStart ? filename.substring(extensionStart) : "";
    return filename.substring(0, suffixStart) + extension;
  }

  private ServerMessage toServerMessage(String operation, HttpResponse httpResponse) throws IOException {
    if (!httpResponse.isOk()) {
      throw this.requestFailed(operation, httpResponse);
    }
    return JsonHelper.fromJson(httpResponse.getBody(), ServerMessage.class);
  }

  private RequestException requestFailed(String operation, HttpResponse httpResponse) {
    String message = extractErrorMessage(httpResponse.getBody());
    LOG.warn(String.format("Failed %s: HTTP %d - %s", operation, httpResponse.getCode(), message));
    return new RequestException(operation, httpResponse.getCode(), message);
  }

  /**
   * Returns the {@code message} member of a JSON error body, or the body itself when it is not a
   * JSON object carrying one.
   */
  @VisibleForTesting
  static String extractErrorMessage(String body) {
    try {
      JsonElement element = JsonParser.parseString(body);
      if (element.isJsonObject()) {
        String message = JsonHelper.getString(element.getAsJsonObject(), "message");
        if (message != null) {
          return message;
        }
      }
    } catch (JsonParseException e) {
      LOG.debug(String.format("Error body is not JSON: %s", e.getMessage()));
    }
    return body;
  }

  private static String joinList(@Nullable List<String> values) {
    return values != null ? Joiner.on(',').skipNulls().join(values) : "";
  }

  private static String quote(String value) {
    return value.replace("\"", "%22").replace("\n", "%0A").replace("\r", "%0D");
  }

  private HttpUrl url(String path) {
    String server = this.session.getServer();
    if (Strings.isNullOrEmpty(server)) {
      throw new ConfigurationException("Server is required.");
    }
    HttpUrl url = HttpUrl.parse(String.format("%s/%s", server, path));
    if (url == null) {
      throw new ConfigurationException("Invalid server URL: " + server);
    }
    return url;
  }

  @VisibleForTesting
  HttpResponse post(HttpUrl url, Map<String, String> data, @Nullable String token) throws IOException {
    FormBody.Builder form = new FormBody.Builder();
    for (Map.Entry<String, String> field : data.entrySet()) {
      if (field.getValue() != null) {
        form.add(field.getKey(), field.getValue());
      }
    }
    if (token != null) {
      form.add(MaestroConstants.ACCESS_TOKEN_FIELD, token);
    }
    Request request = new Request.Builder().url(url).post(form.build()).build();
    return this.executeCall(request);
  }

  @VisibleForTesting
  HttpResponse get(HttpUrl url, Map<String, String> params, String token) throws IOException {
    HttpUrl.Builder builder = url.newBuilder();
    for (Map.Entry<String, String> param : params.entrySet()) {
      if (param.getValue() != null) {
        builder.addQueryParameter(param.getKey(), param.getValue());
      }
    }
    builder.addQueryParameter(MaestroConstants.ACCESS_TOKEN_FIELD, token);
    Request request = new Request.Builder().url(builder.build()).get().build();
    return this.executeCall(request);
  }

  private HttpResponse executeCall(Request request) throws IOException {
    // The query string carries the access token, log the path only
    LOG.debug("Executing request to BotMaestro API: " + request.method() + ' ' + request.url().encodedPath());
    try (Response response = this.client.newCall(request).execute()) {
      ResponseBody body = response.body();
      HttpResponse httpResponse = new HttpResponse(body != null ? body.bytes() : null,
          body != null ? body.contentType() : null, response.code(), response.headers());
      LOG.debug(String.format("BotMaestro API response: HTTP %d", httpResponse.getCode()));
      return httpResponse;
    }
  }
}
