package com.bit.vault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "vault")
public class VaultConfig {
    // 进入退出队列后至少等待多久才能领取（秒）
    private long exitedAssetsClaimDelay = 24 * 60 * 60;
    // 手续费比例上限（基点）
    private int maxFeePercent = 10_000;
}
