package com.cabinet.api.telegram;

import com.cabinet.api.family.FamilyService;
import com.cabinet.application.ports.MessengerPort;
import com.cabinet.saas.domain.error.DomainException;
import com.cabinet.saas.infrastructure.user.UserEntity;
import com.cabinet.saas.infrastructure.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Handles the Accept / Decline buttons attached to a family invite message.
 */
@Component
public class FamilyInviteCallbackHandler {

  private static final Logger log = LoggerFactory.getLogger(FamilyInviteCallbackHandler.class);

  private final FamilyService family;
  private final UserRepository users;
  private final MessengerPort messenger;

  public FamilyInviteCallbackHandler(FamilyService family, UserRepository users, MessengerPort messenger) {
    this.family = family;
    this.users = users;
    this.messenger = messenger;
  }

  /** One pressed button. Chat and message ids are null for inline-mode messages. */
  public record Callback(String id, long fromTelegramId, Long chatId, Long messageId, String data) {}

  public boolean supports(String data) {
    return data != null
        && (data.startsWith(FamilyService.CALLBACK_ACCEPT) || data.startsWith(FamilyService.CALLBACK_DECLINE));
  }

  public void handle(Callback cb) {
    boolean accept = cb.data().startsWith(FamilyService.CALLBACK_ACCEPT);
    String prefix = accept ? FamilyService.CALLBACK_ACCEPT : FamilyService.CALLBACK_DECLINE;

    Long inviteId = parseId(cb.data().substring(prefix.length()));
    if (inviteId == null) {
      messenger.answerCallback(cb.id(), "Invalid invite", true);
      return;
    }

    UserEntity user = users.findByTelegramId(cb.fromTelegramId()).orElse(null);
    if (user == null) {
      messenger.answerCallback(cb.id(), "User not found", true);
      return;
    }

    try {
      if (accept) {
        family.acceptInvite(user.getId(), inviteId);
      } else {
        family.declineInvite(user.getId(), inviteId);
      }
    } catch (DomainException e) {
      log.info("Family invite callback rejected: invite={} user={} code={}", inviteId, user.getId(), e.code());
      messenger.answerCallback(cb.id(), e.getMessage(), true);
      return;
    }

    if (cb.chatId() != null && cb.messageId() != null) {
      messenger.editMessage(cb.chatId(), cb.messageId(),
          accept ? "Family invitation accepted." : "Family invitation declined.");
    }
    messenger.answerCallback(cb.id(), accept ? "Accepted" : "Declined", false);
  }

  private static Long parseId(String raw) {
    try {
      return Long.valueOf(raw.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
