package org.hypertrace.core.panelquery.discovery;

/** Kinds of names {@code /api/suggest} can complete. */
public enum SuggestType {
  METRICS("metrics"),
  TAGK("tagk"),
  TAGV("tagv");

  private final String value;

  SuggestType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
