package com.quillvault.export.scheduler.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.quillvault.export.scheduler.config.AppProperties;
import com.quillvault.export.scheduler.exception.StoreUnavailableException;
import com.quillvault.export.scheduler.exception.UnauthorizedException;
import com.quillvault.export.scheduler.model.ApiCredential;
import com.quillvault.export.scheduler.repository.ApiCredentialRepository;
import com.quillvault.export.scheduler.service.DatabaseErrorHandlingService;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class CredentialServiceTest {

  private static final Instant NOW = Instant.parse("2026-04-01T08:00:00Z");

  @Mock private ApiCredentialRepository repository;

  private CredentialService service;

  @BeforeEach
  void setUp() {
    service =
        new CredentialService(
            repository,
            new DatabaseErrorHandlingService(),
            Clock.fixed(NOW, ZoneOffset.UTC),
            new AppProperties(
                new AppProperties.Security("pepper", null, null), null, null, null, null, null));
  }

  @Test
  void issuesKeyAndStoresOnlyItsHash() {
    when(repository.save(any(ApiCredential.class)))
        .thenAnswer(
            invocation -> {
              ApiCredential saved = invocation.getArgument(0);
              saved.setId(UUID.randomUUID());
              saved.setCreatedAt(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
              return saved;
            });

    IssuedCredential issued = service.issue();

    assertThat(issued.apiKey()).hasSize(64).matches("[0-9a-f]+");
    ArgumentCaptor<ApiCredential> captor = ArgumentCaptor.forClass(ApiCredential.class);
    verify(repository).save(captor.capture());
    assertThat(captor.getValue().getKeyHash())
        .isEqualTo(service.hash(issued.apiKey()))
        .isNotEqualTo(issued.apiKey());
  }

  @Test
  void hashIsSaltedAndStable() {
    assertThat(service.hash("abc")).isEqualTo(service.hash("abc")).hasSize(64);
    assertThat(service.hash("abc")).isNotEqualTo(service.hash("abd"));
  }

  @Test
  void verifyResolvesOwnerAndTouchesActivity() {
    ApiCredential credential = new ApiCredential(service.hash("key-1"));
    credential.setId(UUID.randomUUID());
    credential.setCreatedAt(LocalDateTime.of(2026, 1, 1, 0, 0));
    when(repository.findByKeyHash(service.hash("key-1"))).thenReturn(Optional.of(credential));

    CallerContext caller = service.verify(" key-1 ");

    assertThat(caller.ownerId()).isEqualTo(credential.getId());
    assertThat(caller.lastActive()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
    verify(repository).touchLastActive(eq(credential.getId()), any());
  }

  @Test
  void missingKeyIsRejectedWithoutLookup() {
    assertThatThrownBy(() -> service.verify(""))
        .isInstanceOf(UnauthorizedException.class)
        .hasMessage("API key required");
    verify(repository, never()).findByKeyHash(anyString());
  }

  @Test
  void unknownKeyIsRejected() {
    when(repository.findByKeyHash(anyString())).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.verify("guess"))
        .isInstanceOf(UnauthorizedException.class)
        .hasMessage("Invalid API key");
  }

  @Test
  void databaseOutageBecomesStoreUnavailable() {
    when(repository.findByKeyHash(anyString()))
        .thenThrow(new DataAccessResourceFailureException("Connection refused"));

    assertThatThrownBy(() -> service.verify("key"))
        .isInstanceOf(StoreUnavailableException.class);
  }
}
