package com.bit.vault.structure.oracle;

import com.bit.vault.common.RewardsRoot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 预言机提交的快照更新
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RewardsUpdateParams {
    private RewardsRoot rewardsRoot;
    /**
     * 链下明细的内容寻址指针（如IPFS哈希），仅签名与记录，不在账本内校验
     */
    private String rewardsIpfsHash;
    private long updateTimestamp;
    /**
     * 按签名者地址严格递增拼接的 65 字节签名
     */
    private byte[] signatures;
}
