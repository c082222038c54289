package com.quillvault.export.scheduler.repository;

import com.quillvault.export.scheduler.model.ApiCredential;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface ApiCredentialRepository extends JpaRepository<ApiCredential, UUID> {

  Optional<ApiCredential> findByKeyHash(String keyHash);

  @Modifying
  @Transactional
  @Query("UPDATE ApiCredential c SET c.lastActiveAt = :now WHERE c.id = :id")
  int touchLastActive(UUID id, LocalDateTime now);
}
