package com.bit.vault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 预言机共识配置
 */
@Data
@Component
@ConfigurationProperties(prefix = "keeper")
public class KeeperConfig {
    /**
     * 链ID，参与类型化签名域分隔
     */
    private long chainId = 1;

    /**
     * 验证合约地址，参与类型化签名域分隔
     */
    private String verifyingContract = "0x0000000000000000000000000000000000000000";

    /**
     * 两次奖励快照之间的最小间隔（秒）
     */
    private long rewardsDelay = 12 * 60 * 60;

    /**
     * 快照生效所需的最少预言机签名数
     */
    private int rewardsMinOracles = 1;

    /**
     * 初始预言机地址，首次启动时写入注册表
     */
    private List<String> oracles = new ArrayList<>();
}
