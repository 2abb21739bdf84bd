package com.flagship.wallet_ledger.reference;

import com.flagship.wallet_ledger.ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Read access to asset types and users.
 */
@Service
@RequiredArgsConstructor
public class ReferenceDataService {

    private final AssetTypeRepository assetTypeRepository;
    private final UserAccountRepository userAccountRepository;

    @Transactional(readOnly = true)
    public List<AssetTypeEntity> listAssetTypes() {
        return assetTypeRepository.findAllByOrderByNameAsc();
    }

    /**
     * Human users only; the treasury is not listed.
     */
    @Transactional(readOnly = true)
    public List<UserAccountEntity> listUsers() {
        return userAccountRepository.findAllBySystemFalseOrderByUsernameAsc();
    }

    @Transactional(readOnly = true)
    public AssetTypeEntity requireAssetType(UUID assetTypeId) {
        return assetTypeRepository.findById(assetTypeId)
                .orElseThrow(() -> new NotFoundException("Asset type not found: " + assetTypeId));
    }

    @Transactional(readOnly = true)
    public UserAccountEntity requireUser(UUID userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
    }
}
