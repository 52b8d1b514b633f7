package com.bit.vault.structure.dto;

import lombok.Data;

import java.math.BigInteger;

@Data
public class EnterExitQueueRequest {
    private String vault;
    private String owner;
    private String receiver;
    private BigInteger shares;
}
