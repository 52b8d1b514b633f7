package com.bit.vault.oracle;

import com.bit.vault.common.Address;
import com.bit.vault.database.StateTransaction;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.util.Secp256k1Signer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * 多预言机签名校验
 * 签名按签名者地址严格递增排列，递增约束同时排除了重复签名者
 */
@Slf4j
@Component
public class OracleSignatureVerifier {

    @Autowired
    private OracleRegistry oracleRegistry;

    /**
     * @param digest 32字节类型化摘要
     * @param signatures 若干个 65 字节签名的拼接
     * @return 通过校验的签名数
     */
    public int verify(StateTransaction tx, byte[] digest, byte[] signatures) {
        int required = oracleRegistry.getRewardsMinOracles(tx);
        int length = signatures == null ? 0 : signatures.length;
        if (length == 0 || length % Secp256k1Signer.SIGNATURE_LENGTH != 0) {
            throw new VaultException(ErrorType.NOT_ENOUGH_SIGNATURES, "签名长度非法: " + length);
        }
        int count = length / Secp256k1Signer.SIGNATURE_LENGTH;
        if (required <= 0 || count < required) {
            throw new VaultException(ErrorType.NOT_ENOUGH_SIGNATURES,
                    "签名数 " + count + " 少于所需 " + required);
        }

        Address lastSigner = null;
        for (int i = 0; i < count; i++) {
            int from = i * Secp256k1Signer.SIGNATURE_LENGTH;
            byte[] signature = Arrays.copyOfRange(signatures, from, from + Secp256k1Signer.SIGNATURE_LENGTH);
            Address signer = Secp256k1Signer.recoverAddress(digest, signature);
            if (signer == null) {
                throw new VaultException(ErrorType.INVALID_SIGNER, "第" + i + "个签名无法恢复签名者");
            }
            if (lastSigner != null && signer.compareTo(lastSigner) <= 0) {
                throw new VaultException(ErrorType.INVALID_SIGNER, "签名者未严格递增: " + signer);
            }
            if (!oracleRegistry.isOracle(tx, signer)) {
                throw new VaultException(ErrorType.INVALID_SIGNER, "签名者不是预言机: " + signer);
            }
            lastSigner = signer;
        }
        log.debug("签名校验通过，共{}个签名", count);
        return count;
    }
}
