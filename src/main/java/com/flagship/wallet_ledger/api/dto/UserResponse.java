package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.reference.UserAccountEntity;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class UserResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("username")
    String username;

    @JsonProperty("email")
    String email;

    public static UserResponse from(UserAccountEntity entity) {
        return UserResponse.builder()
            .id(entity.getId())
            .username(entity.getUsername())
            .email(entity.getEmail())
            .build();
    }
}
