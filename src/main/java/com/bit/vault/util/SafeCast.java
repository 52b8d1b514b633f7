package com.bit.vault.util;

import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;

import java.math.BigInteger;

/**
 * 定宽整数校验：与链上合约一致，越界即整体失败，不做截断
 */
public final class SafeCast {

    private SafeCast() {
    }

    public static BigInteger toUint128(BigInteger value) {
        return toUint(value, 128);
    }

    public static BigInteger toUint160(BigInteger value) {
        return toUint(value, 160);
    }

    public static BigInteger toUint256(BigInteger value) {
        return toUint(value, 256);
    }

    public static BigInteger toInt160(BigInteger value) {
        return toInt(value, 160);
    }

    public static BigInteger toUint(BigInteger value, int bits) {
        if (value.signum() < 0 || value.bitLength() > bits) {
            throw new VaultException(ErrorType.OVERFLOW, "uint" + bits + " 越界: " + value);
        }
        return value;
    }

    public static BigInteger toInt(BigInteger value, int bits) {
        // bitLength 不含符号位，int160 的取值范围为 [-2^159, 2^159)
        if (value.bitLength() > bits - 1) {
            throw new VaultException(ErrorType.OVERFLOW, "int" + bits + " 越界: " + value);
        }
        return value;
    }
}
