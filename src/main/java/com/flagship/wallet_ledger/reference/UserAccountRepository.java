package com.flagship.wallet_ledger.reference;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccountEntity, UUID> {

    /**
     * The treasury account. The schema allows at most one.
     */
    Optional<UserAccountEntity> findFirstBySystemTrue();

    List<UserAccountEntity> findAllBySystemFalseOrderByUsernameAsc();
}
