package com.flamingo.ai.voicetutor.domain.enums;

/** Author of a prior conversation turn. */
public enum TurnRole {
  USER("user"),
  ASSISTANT("assistant");

  private final String wireName;

  TurnRole(String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }

  /** Returns the role for a wire name, or {@code null} if it is not one of ours. */
  public static TurnRole fromWireName(String name) {
    for (TurnRole role : values()) {
      if (role.wireName.equals(name)) {
        return role;
      }
    }
    return null;
  }
}
