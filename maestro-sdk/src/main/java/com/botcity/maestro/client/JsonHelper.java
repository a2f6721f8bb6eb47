package com.botcity.maestro.client;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;

import java.lang.reflect.Type;
import java.util.Map;

public final class JsonHelper {
  private static final Gson GSON = new GsonBuilder()
      .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
      .disableHtmlEscaping()
      .create();

  private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {
  }.getType();

  private JsonHelper() {
  }

  public static <T> T fromJson(String json, Class<T> clazz) throws MaestroProtocolException {
    return fromJson(parse(json), clazz);
  }

  public static <T> T fromJson(JsonElement element, Class<T> clazz) throws MaestroProtocolException {
    if (element == null || element.isJsonNull()) {
      throw new MaestroProtocolException(String.format("Expected %s but response was empty", clazz.getSimpleName()));
    }
    try {
      return GSON.fromJson(element, clazz);
    } catch (JsonParseException | IllegalStateException e) {
      throw new MaestroProtocolException(String.format("Unable to read %s: %s", clazz.getSimpleName(), e.getMessage()), e);
    }
  }

  public static Map<String, Object> toMap(JsonElement element) throws MaestroProtocolException {
    if (element == null || !element.isJsonObject()) {
      throw new MaestroProtocolException("Expected a JSON object but got " + element);
    }
    return GSON.fromJson(element, MAP_TYPE);
  }

  public static JsonElement parse(String json) throws MaestroProtocolException {
    try {
      return JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new MaestroProtocolException("Response is not valid JSON: " + e.getMessage(), e);
    }
  }

  public static JsonObject parseObject(String json) throws MaestroProtocolException {
    JsonElement element = parse(json);
    if (!element.isJsonObject()) {
      throw new MaestroProtocolException("Expected a JSON object but got " + json);
    }
    return element.getAsJsonObject();
  }

  /**
   * Returns the string value of {@code member}, or null when the member is absent or not a primitive.
   */
  public static String getString(JsonObject object, String member) {
    JsonElement value = object.get(member);
    if (value == null || !value.isJsonPrimitive()) {
      return null;
    }
    return value.getAsString();
  }

  public static String toJson(Object value) {
    return GSON.toJson(value);
  }
}
