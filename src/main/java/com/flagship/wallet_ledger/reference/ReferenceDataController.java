package com.flagship.wallet_ledger.reference;

import com.flagship.wallet_ledger.api.dto.AssetTypeResponse;
import com.flagship.wallet_ledger.api.dto.UserResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ReferenceDataController {

    private final ReferenceDataService referenceDataService;

    @GetMapping("/asset-types")
    public List<AssetTypeResponse> listAssetTypes() {
        return referenceDataService.listAssetTypes().stream()
                .map(AssetTypeResponse::from)
                .toList();
    }

    @GetMapping("/users")
    public List<UserResponse> listUsers() {
        return referenceDataService.listUsers().stream()
                .map(UserResponse::from)
                .toList();
    }
}
