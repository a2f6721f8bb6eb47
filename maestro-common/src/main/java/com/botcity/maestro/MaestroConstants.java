package com.botcity.maestro;

public class MaestroConstants {
  public static final String SERVER = "maestro.server";
  public static final String LOGIN = "maestro.login";
  public static final String KEY = "maestro.key";
  public static final String CONNECT_TIMEOUT = "maestro.timeout.connect";
  public static final String READ_TIMEOUT = "maestro.timeout.read";
  public static final String WRITE_TIMEOUT = "maestro.timeout.write";

  public static final String SERVER_ENV = "BOTCITY_SERVER";
  public static final String LOGIN_ENV = "BOTCITY_LOGIN";
  public static final String KEY_ENV = "BOTCITY_KEY";

  public static final String API_PATH = "app/api";
  public static final String LOGIN_PATH = API_PATH + "/login";
  public static final String ALERT_PATH = API_PATH + "/alert/send";
  public static final String MESSAGE_PATH = API_PATH + "/message/send";
  public static final String TASK_CREATE_PATH = API_PATH + "/task/create";
  public static final String TASK_FINISH_PATH = API_PATH + "/task/finish";
  public static final String TASK_RESTART_PATH = API_PATH + "/task/restart";
  public static final String TASK_GET_PATH = API_PATH + "/task/get";
  public static final String LOG_CREATE_PATH = API_PATH + "/log/create";
  public static final String LOG_ENTRY_PATH = API_PATH + "/newLogEntry";
  public static final String LOG_READ_PATH = API_PATH + "/log/read";
  public static final String LOG_DELETE_PATH = API_PATH + "/log/delete";
  public static final String ARTIFACT_POST_PATH = API_PATH + "/newArtifact";
  public static final String ARTIFACT_GET_PATH = API_PATH + "/artifact/get";

  public static final String ACCESS_TOKEN_FIELD = "access_token";
  public static final String CONTENT_DISPOSITION_HEADER = "Content-Disposition";

  private MaestroConstants() {
  }
}
