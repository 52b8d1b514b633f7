package com.bit.vault.structure.dto;

import lombok.Data;

@Data
public class CreateVaultRequest {
    private String vault;
    private String admin;
    private String feeRecipient;
    private int feePercent;
    private boolean ownMevEscrow;
}
