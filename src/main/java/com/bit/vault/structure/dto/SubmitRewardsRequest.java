package com.bit.vault.structure.dto;

import lombok.Data;

@Data
public class SubmitRewardsRequest {
    private String caller;
    private String rewardsRoot;
    private String rewardsIpfsHash;
    private long updateTimestamp;
    // 65字节签名拼接后的十六进制
    private String signatures;
}
