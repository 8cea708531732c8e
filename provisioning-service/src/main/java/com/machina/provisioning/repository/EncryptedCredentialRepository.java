package com.machina.provisioning.repository;

import com.machina.provisioning.entity.EncryptedCredential;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface EncryptedCredentialRepository extends JpaRepository<EncryptedCredential, UUID> {
}
