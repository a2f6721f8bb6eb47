package com.botcity.maestro.client;

/**
 * A downloaded artifact: the display name recovered from the response headers and the raw content.
 */
public class Artifact {
  private final String name;
  private final byte[] content;

  public Artifact(String name, byte[] content) {
    this.name = name;
    this.content = content != null ? content.clone() : new byte[] {};
  }

  public String getName() {
    return this.name;
  }

  public byte[] getContent() {
    return this.content.clone();
  }

  @Override
  public String toString() {
    return String.format("Artifact{name='%s', size=%d}", name, content.length);
  }
}
