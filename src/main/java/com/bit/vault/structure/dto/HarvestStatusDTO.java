package com.bit.vault.structure.dto;

import lombok.Data;

import java.math.BigInteger;

@Data
public class HarvestStatusDTO {
    private boolean collateralized;
    private boolean harvestRequired;
    private boolean canHarvest;
    private boolean stateUpdateRequired;
    private BigInteger rewardAssets;
    private long rewardNonce;
}
