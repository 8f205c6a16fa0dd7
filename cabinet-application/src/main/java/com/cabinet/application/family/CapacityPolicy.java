package com.cabinet.application.family;

/**
 * Slot arithmetic for a family group. The owner always occupies slot 1 and is never counted
 * among active members.
 */
public final class CapacityPolicy {

  private CapacityPolicy() {}

  /** A max of 1 or less leaves no room for anyone but the owner, whatever the flag says. */
  public static boolean familyAvailable(boolean familyEnabled, int maxMembersIncludingOwner) {
    return familyEnabled && maxMembersIncludingOwner > 1;
  }

  public static boolean hasRoom(long activeMembers, int maxMembersIncludingOwner) {
    return usedSlots(activeMembers) < maxMembersIncludingOwner;
  }

  public static int usedSlots(long activeMembers) {
    return (int) (1 + activeMembers);
  }

  public static int remainingSlots(long activeMembers, int maxMembersIncludingOwner) {
    return Math.max(0, maxMembersIncludingOwner - usedSlots(activeMembers));
  }
}
