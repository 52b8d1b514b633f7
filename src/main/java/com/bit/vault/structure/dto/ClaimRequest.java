package com.bit.vault.structure.dto;

import lombok.Data;

import java.math.BigInteger;

@Data
public class ClaimRequest {
    private String vault;
    private String receiver;
    private BigInteger positionTicket;
    // 入队时间（秒）
    private long timestamp;
    private int checkpointIndex;
}
