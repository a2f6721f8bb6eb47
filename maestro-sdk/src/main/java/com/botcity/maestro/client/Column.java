package com.botcity.maestro.client;

/**
 * One field of a log schema. {@code name} is what the portal displays, {@code label} is the key
 * used by log entries.
 */
public class Column {
  private String name;
  private String label;

  public Column(String name, String label) {
    this.name = name;
    this.label = label;
  }

  public String getName() {
    return this.name;
  }

  public String getLabel() {
    return this.label;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((name == null) ? 0 : name.hashCode());
    result = prime * result + ((label == null) ? 0 : label.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Column other = (Column) obj;
    if (name == null ? other.name != null : !name.equals(other.name)) {
      return false;
    }
    return label == null ? other.label == null : label.equals(other.label);
  }

  @Override
  public String toString() {
    return String.format("Column{name='%s', label='%s'}", name, label);
  }
}
