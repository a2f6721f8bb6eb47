package com.botcity.maestro.client;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import okhttp3.Headers;
import okhttp3.MediaType;

import org.jetbrains.annotations.Nullable;

/**
 * Fully read response of a single portal call. The body is buffered so the underlying
 * connection can be released before the response is interpreted.
 */
public class HttpResponse {
  private final byte[] content;
  private final MediaType contentType;
  private final int code;
  private final Headers headers;

  public HttpResponse(byte[] content, @Nullable MediaType contentType, int code, Headers headers) {
    this.content = content != null ? content : new byte[] {};
    this.contentType = contentType;
    this.code = code;
    this.headers = headers != null ? headers : Headers.of();
  }

  /**
   * The body decoded with the charset declared in {@code Content-Type}, UTF-8 when none is declared.
   */
  public String getBody() {
    Charset charset = this.contentType != null
        ? this.contentType.charset(StandardCharsets.UTF_8)
        : StandardCharsets.UTF_8;
    return new String(this.content, charset);
  }

  /**
   * The raw body bytes, undecoded.
   */
  public byte[] getContent() {
    return this.content.clone();
  }

  public int getCode() {
    return this.code;
  }

  /**
   * The portal signals success with 200 only; other 2xx codes are treated as failures.
   */
  public boolean isOk() {
    return this.code == 200;
  }

  public String getHeader(String name) {
    return this.headers.get(name);
  }
}
