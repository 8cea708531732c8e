package com.machina.provisioning.repository;

import com.machina.provisioning.entity.ProviderAccount;
import com.machina.provisioning.entity.ProviderType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProviderAccountRepository extends JpaRepository<ProviderAccount, UUID> {

    List<ProviderAccount> findAllByOrderByCreatedAtDesc();

    List<ProviderAccount> findByProviderTypeOrderByCreatedAtDesc(ProviderType providerType);
}
