package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.reference.AssetTypeEntity;
import com.flagship.wallet_ledger.reference.ReferenceDataService;
import com.flagship.wallet_ledger.wallet.BalanceCalculator;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Read side of the ledger. Never creates wallets and never locks.
 */
@Service
public class LedgerQueryService {

    private final ReferenceDataService referenceDataService;
    private final WalletRegistry walletRegistry;
    private final BalanceCalculator balanceCalculator;
    private final LedgerRepository ledgerRepository;
    private final int historyLimit;

    public LedgerQueryService(ReferenceDataService referenceDataService,
                              WalletRegistry walletRegistry,
                              BalanceCalculator balanceCalculator,
                              LedgerRepository ledgerRepository,
                              @Value("${ledger.history.limit:50}") int historyLimit) {
        this.referenceDataService = referenceDataService;
        this.walletRegistry = walletRegistry;
        this.balanceCalculator = balanceCalculator;
        this.ledgerRepository = ledgerRepository;
        this.historyLimit = historyLimit;
    }

    /**
     * Derived balance of the user's wallet for the asset. A user without a
     * wallet for the asset reads as zero.
     *
     * @throws com.flagship.wallet_ledger.ledger.exception.NotFoundException if the asset type is unknown
     */
    @Transactional(readOnly = true)
    public BalanceView getBalance(UUID userId, UUID assetTypeId) {
        AssetTypeEntity assetType = referenceDataService.requireAssetType(assetTypeId);

        BigDecimal balance = walletRegistry.find(userId, assetTypeId)
            .map(wallet -> balanceCalculator.balanceOf(wallet.getId()))
            .orElse(BalanceCalculator.ZERO);

        return new BalanceView(userId, assetTypeId, assetType.getName(), assetType.getSymbol(), balance);
    }

    /**
     * Newest-first entries touching the user's wallets, optionally for one asset.
     */
    @Transactional(readOnly = true)
    public List<HistoryItem> getHistory(UUID userId, UUID assetTypeId) {
        List<UUID> walletIds = walletRegistry.findByUser(userId, assetTypeId).stream()
            .map(Wallet::getId)
            .toList();
        return ledgerRepository.findHistory(walletIds, historyLimit);
    }
}
