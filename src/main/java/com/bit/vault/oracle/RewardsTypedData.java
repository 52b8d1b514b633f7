package com.bit.vault.oracle;

import com.bit.vault.common.Address;
import com.bit.vault.common.RewardsRoot;
import com.bit.vault.config.KeeperConfig;
import com.bit.vault.util.ByteUtils;
import com.bit.vault.util.Sha;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 奖励快照的类型化结构摘要（EIP-712）
 * digest = keccak256(0x1901 || domainSeparator || structHash)
 * 摘要中包含当前 nonce，已被接受的快照签名无法在下一轮重放
 */
@Component
public class RewardsTypedData {

    public static final String DOMAIN_NAME = "KeeperOracles";
    public static final String DOMAIN_VERSION = "1";

    private static final byte[] DOMAIN_TYPE_HASH = Sha.keccak256(
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)");
    private static final byte[] REWARDS_TYPE_HASH = Sha.keccak256(
            "KeeperRewards(bytes32 rewardsRoot,string rewardsIpfsHash,uint64 updateTimestamp,uint64 nonce)");
    private static final byte[] PREFIX = new byte[]{0x19, 0x01};

    private final byte[] domainSeparator;

    @Autowired
    public RewardsTypedData(KeeperConfig keeperConfig) {
        this(keeperConfig.getChainId(), Address.fromHex(keeperConfig.getVerifyingContract()));
    }

    public RewardsTypedData(long chainId, Address verifyingContract) {
        this.domainSeparator = Sha.keccak256(
                DOMAIN_TYPE_HASH,
                Sha.keccak256(DOMAIN_NAME),
                Sha.keccak256(DOMAIN_VERSION),
                ByteUtils.toWord(chainId),
                ByteUtils.toWord(verifyingContract));
    }

    public byte[] hashRewards(RewardsRoot rewardsRoot, String rewardsIpfsHash, long updateTimestamp, long nonce) {
        byte[] structHash = Sha.keccak256(
                REWARDS_TYPE_HASH,
                rewardsRoot.getBytes(),
                Sha.keccak256(rewardsIpfsHash),
                ByteUtils.toWord(updateTimestamp),
                ByteUtils.toWord(nonce));
        return Sha.keccak256(PREFIX, domainSeparator, structHash);
    }
}
