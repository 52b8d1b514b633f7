package com.bit.vault.structure.dto;

import lombok.Data;

import java.math.BigInteger;

@Data
public class DepositRequest {
    private String vault;
    private String caller;
    private String receiver;
    private BigInteger assets;
}
