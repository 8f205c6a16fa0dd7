package com.cabinet.api.family;

import com.cabinet.application.family.Handles;
import com.cabinet.saas.infrastructure.user.UserEntity;

final class DisplayNames {

  private DisplayNames() {}

  static String of(UserEntity user) {
    if (user == null) return Handles.displayName(null, null, null);
    return Handles.displayName(user.getId(), user.getUsername(), user.getTelegramId());
  }
}
