package io.hookline.model;

/** Outcome of the most recent delivery attempt to a subscription. */
public enum DeliveryStatus {
  SUCCESS("success"),
  FAILURE("failure");

  private final String code;

  DeliveryStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static DeliveryStatus fromCode(String code) {
    if (code == null) {
      return null;
    }
    for (DeliveryStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status: " + code);
  }
}
