package com.bit.vault.util;

import com.bit.vault.common.Address;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Secp256k1 可恢复签名（r || s || v，65字节）
 * 预言机对快照摘要签名，验证方从签名中恢复签名者地址，无需事先持有公钥
 */
@Slf4j
public class Secp256k1Signer {

    public static final int SIGNATURE_LENGTH = 65;
    public static final int PRIVATE_KEY_CORE_LENGTH = 32;
    // 以太坊风格的恢复标识偏移
    private static final int V_OFFSET = 27;

    private static final BigInteger CURVE_ORDER = ECKey.CURVE.getN();

    /**
     * 生成 Secp256k1 密钥
     */
    public static ECKey generateKey() {
        return new ECKey();
    }

    public static ECKey fromPrivate(byte[] privateKey) {
        if (privateKey.length != PRIVATE_KEY_CORE_LENGTH) {
            throw new IllegalArgumentException("私钥必须为32字节");
        }
        return ECKey.fromPrivate(privateKey, false);
    }

    /**
     * 由公钥推导地址：keccak256(非压缩公钥去掉0x04前缀) 的后20字节
     */
    public static Address toAddress(ECKey key) {
        byte[] uncompressed = key.getPubKeyPoint().getEncoded(false);
        byte[] hash = Sha.keccak256(Arrays.copyOfRange(uncompressed, 1, uncompressed.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, hash.length - Address.LENGTH, hash.length));
    }

    /**
     * 对32字节摘要签名，返回 r(32) || s(32) || v(1)
     * @param key 私钥
     * @param digest 已经过哈希的32字节摘要（不再二次哈希）
     */
    public static byte[] signDigest(ECKey key, byte[] digest) {
        Sha256Hash hash = Sha256Hash.wrap(digest);
        // bitcoinj 返回的签名已规范化为低S值
        ECKey.ECDSASignature signature = key.sign(hash);
        byte[] expected = key.getPubKeyPoint().getEncoded(false);
        int recId = -1;
        for (int i = 0; i < 4; i++) {
            ECKey recovered = ECKey.recoverFromSignature(i, signature, hash, false);
            if (recovered != null && Arrays.equals(recovered.getPubKeyPoint().getEncoded(false), expected)) {
                recId = i;
                break;
            }
        }
        if (recId < 0 || recId > 1) {
            throw new IllegalStateException("无法确定签名恢复标识");
        }
        byte[] result = new byte[SIGNATURE_LENGTH];
        System.arraycopy(toFixed32(signature.r), 0, result, 0, 32);
        System.arraycopy(toFixed32(signature.s), 0, result, 32, 32);
        result[64] = (byte) (V_OFFSET + recId);
        return result;
    }

    /**
     * 从签名中恢复签名者地址
     * @return 签名者地址；签名格式错误、高S值（可延展）或无法恢复时返回 null
     */
    public static Address recoverAddress(byte[] digest, byte[] signature) {
        if (digest == null || digest.length != 32 || signature == null || signature.length != SIGNATURE_LENGTH) {
            return null;
        }
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, 32));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        int v = signature[64] & 0xFF;
        int recId = v - V_OFFSET;
        if (recId != 0 && recId != 1) {
            log.debug("签名v值非法: {}", v);
            return null;
        }
        if (r.signum() == 0 || s.signum() == 0 || r.compareTo(CURVE_ORDER) >= 0 || s.compareTo(CURVE_ORDER) >= 0) {
            return null;
        }
        ECKey.ECDSASignature ecdsa = new ECKey.ECDSASignature(r, s);
        if (!ecdsa.isCanonical()) {
            log.debug("拒绝高S值签名");
            return null;
        }
        try {
            ECKey recovered = ECKey.recoverFromSignature(recId, ecdsa, Sha256Hash.wrap(digest), false);
            return recovered == null ? null : toAddress(recovered);
        } catch (IllegalArgumentException e) {
            log.debug("签名恢复失败: {}", e.getMessage());
            return null;
        }
    }

    private static byte[] toFixed32(BigInteger value) {
        byte[] raw = value.toByteArray();
        byte[] fixed = new byte[32];
        int copy = Math.min(raw.length, 32);
        System.arraycopy(raw, raw.length - copy, fixed, 32 - copy, copy);
        return fixed;
    }
}
