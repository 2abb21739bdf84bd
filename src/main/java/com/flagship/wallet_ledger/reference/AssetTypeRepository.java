package com.flagship.wallet_ledger.reference;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AssetTypeRepository extends JpaRepository<AssetTypeEntity, UUID> {

    Optional<AssetTypeEntity> findBySymbol(String symbol);

    List<AssetTypeEntity> findAllByOrderByNameAsc();
}
