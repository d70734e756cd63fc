package com.bit.attest.util;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.NoSuchProviderException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Security;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;


@Slf4j
public class Ed25519Signer {
    // 静态代码块：注册BouncyCastle Provider（JDK原生不可用时降级）
    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    // Ed25519核心密钥长度（公钥/私钥均为32字节）
    public static final int CORE_KEY_LENGTH = 32;
    // Ed25519签名长度
    public static final int SIGNATURE_LENGTH = 64;
    // X.509公钥编码头部长度（固定12字节）
    private static final int X509_HEADER_LENGTH = 12;
    // X.509公钥固定头部（用于补全32字节核心公钥）
    private static final byte[] X509_PUBLIC_HEADER = new byte[]{
            0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70, 0x03, 0x21, 0x00
    };

    private Ed25519Signer() {
    }

    /**
     * 生成 Ed25519 密钥对
     */
    public static KeyPair generateKeyPair() {
        try {
            KeyPairGenerator keyPairGenerator;
            try {
                keyPairGenerator = KeyPairGenerator.getInstance("Ed25519");
            } catch (NoSuchAlgorithmException e) {
                keyPairGenerator = KeyPairGenerator.getInstance("Ed25519", BouncyCastleProvider.PROVIDER_NAME);
            }
            return keyPairGenerator.generateKeyPair();
        } catch (NoSuchAlgorithmException | NoSuchProviderException e) {
            throw new RuntimeException("Ed25519 密钥对生成失败", e);
        }
    }

    /**
     * Ed25519 签名：用私钥对原始数据签名（返回 64 字节签名）
     * @param privateKey Ed25519 私钥
     * @param data 待签名原始数据
     */
    public static byte[] applySignature(PrivateKey privateKey, byte[] data) {
        try {
            Signature signer = getSignature();
            signer.initSign(privateKey);
            signer.update(data); // Ed25519 内部自动处理哈希（SHA-512），无需手动哈希
            return signer.sign();
        } catch (Exception e) {
            throw new RuntimeException("Ed25519 签名失败", e);
        }
    }

    /**
     * Ed25519 验签：用公钥验证签名有效性
     * @return true=验签成功，false=验签失败（含签名格式非法）
     */
    public static boolean verifySignature(PublicKey publicKey, byte[] data, byte[] signature) {
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            return false;
        }
        try {
            Signature verifier = getSignature();
            verifier.initVerify(publicKey);
            verifier.update(data);
            return verifier.verify(signature);
        } catch (Exception e) {
            log.warn("Ed25519 验签异常: {}", e.getMessage());
            return false;
        }
    }

    /**
     * 用32字节核心公钥验签
     */
    public static boolean verifySignature(byte[] corePublicKey, byte[] data, byte[] signature) {
        PublicKey publicKey;
        try {
            publicKey = recoverPublicKeyFromCore(corePublicKey);
        } catch (RuntimeException e) {
            log.warn("无效的Ed25519公钥: {}", e.getMessage());
            return false;
        }
        return verifySignature(publicKey, data, signature);
    }

    // ------------------------------ 公钥核心字节处理 ------------------------------

    /**
     * 从公钥对象中提取32字节核心字节（剔除X.509头部）
     */
    public static byte[] extractPublicKeyCore(PublicKey publicKey) {
        byte[] encoded = publicKey.getEncoded();
        if (encoded.length != X509_HEADER_LENGTH + CORE_KEY_LENGTH) {
            throw new IllegalArgumentException("无效的Ed25519公钥编码，长度应为44字节");
        }
        byte[] core = new byte[CORE_KEY_LENGTH];
        System.arraycopy(encoded, X509_HEADER_LENGTH, core, 0, CORE_KEY_LENGTH);
        return core;
    }

    /**
     * 从32字节核心公钥恢复公钥对象（自动补全X.509头部）
     */
    public static PublicKey recoverPublicKeyFromCore(byte[] corePublicKey) {
        if (corePublicKey == null || corePublicKey.length != CORE_KEY_LENGTH) {
            throw new IllegalArgumentException("核心公钥必须为32字节");
        }
        try {
            byte[] x509Encoded = new byte[X509_HEADER_LENGTH + CORE_KEY_LENGTH];
            System.arraycopy(X509_PUBLIC_HEADER, 0, x509Encoded, 0, X509_HEADER_LENGTH);
            System.arraycopy(corePublicKey, 0, x509Encoded, X509_HEADER_LENGTH, CORE_KEY_LENGTH);
            return getKeyFactory().generatePublic(new X509EncodedKeySpec(x509Encoded));
        } catch (Exception e) {
            throw new RuntimeException("从核心公钥恢复公钥失败", e);
        }
    }

    // ------------------------------ 工具方法 ------------------------------

    /**
     * 获取Ed25519签名器（优先JDK原生，降级BouncyCastle）
     */
    private static Signature getSignature() throws NoSuchAlgorithmException, NoSuchProviderException {
        try {
            return Signature.getInstance("Ed25519");
        } catch (NoSuchAlgorithmException e) {
            return Signature.getInstance("Ed25519", BouncyCastleProvider.PROVIDER_NAME);
        }
    }

    /**
     * 获取Ed25519密钥工厂（优先JDK原生，降级BouncyCastle）
     */
    private static KeyFactory getKeyFactory() throws NoSuchAlgorithmException, NoSuchProviderException {
        try {
            return KeyFactory.getInstance("Ed25519");
        } catch (NoSuchAlgorithmException e) {
            return KeyFactory.getInstance("Ed25519", BouncyCastleProvider.PROVIDER_NAME);
        }
    }
}
