package com.cabinet.api.telegram;

import com.cabinet.api.family.FamilyService;
import com.cabinet.application.ports.MessengerPort;
import com.cabinet.saas.domain.error.DomainException;
import com.cabinet.saas.domain.error.ErrorCode;
import com.cabinet.saas.infrastructure.user.UserEntity;
import com.cabinet.saas.infrastructure.user.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class FamilyInviteCallbackHandlerTest {

  private FamilyService family;
  private UserRepository users;
  private MessengerPort messenger;
  private FamilyInviteCallbackHandler handler;

  @BeforeEach
  void setUp() {
    family = mock(FamilyService.class);
    users = mock(UserRepository.class);
    messenger = mock(MessengerPort.class);
    handler = new FamilyInviteCallbackHandler(family, users, messenger);

    UserEntity alice = new UserEntity("alice", 500L, null, Instant.EPOCH);
    ReflectionTestUtils.setField(alice, "id", 5L);
    when(users.findByTelegramId(500L)).thenReturn(Optional.of(alice));
  }

  @Test
  void supportsOnlyInviteButtons() {
    assertThat(handler.supports("family_invite:accept:12")).isTrue();
    assertThat(handler.supports("family_invite:decline:12")).isTrue();
    assertThat(handler.supports("menu:open")).isFalse();
    assertThat(handler.supports(null)).isFalse();
  }

  @Test
  void acceptEditsMessageAndAnswers() {
    handler.handle(new FamilyInviteCallbackHandler.Callback("cb-1", 500L, 900L, 77L, "family_invite:accept:12"));

    verify(family).acceptInvite(5L, 12L);
    verify(messenger).editMessage(900L, 77L, "Family invitation accepted.");
    verify(messenger).answerCallback("cb-1", "Accepted", false);
  }

  @Test
  void declineEditsMessageAndAnswers() {
    handler.handle(new FamilyInviteCallbackHandler.Callback("cb-2", 500L, 900L, 78L, "family_invite:decline:13"));

    verify(family).declineInvite(5L, 13L);
    verify(messenger).editMessage(900L, 78L, "Family invitation declined.");
    verify(messenger).answerCallback("cb-2", "Declined", false);
  }

  @Test
  void unparseableIdIsInvalidInvite() {
    handler.handle(new FamilyInviteCallbackHandler.Callback("cb-3", 500L, 900L, 79L, "family_invite:accept:abc"));

    verify(messenger).answerCallback("cb-3", "Invalid invite", true);
    verifyNoInteractions(family);
  }

  @Test
  void domainErrorIsShownAsAlert() {
    when(family.acceptInvite(5L, 14L)).thenThrow(new DomainException(ErrorCode.CAPACITY_REACHED));

    handler.handle(new FamilyInviteCallbackHandler.Callback("cb-4", 500L, 900L, 80L, "family_invite:accept:14"));

    verify(messenger).answerCallback("cb-4", "Family member limit reached", true);
    verify(messenger, never()).editMessage(anyLong(), anyLong(), anyString());
  }
}
