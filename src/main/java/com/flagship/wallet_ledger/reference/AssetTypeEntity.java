package com.flagship.wallet_ledger.reference;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * A kind of value the ledger can hold (Gold Coins, Diamonds, ...).
 * Reference data: created by migration, never changed by the service.
 */
@Entity
@Immutable
@Table(name = "asset_types")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AssetTypeEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Column(nullable = false, unique = true, length = 16)
    private String symbol;

    @Column
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
