package com.bit.attest.util;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.PublicKey;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class Ed25519SignerTest {

    @Test
    void signAndVerifyWithCoreKeys() {
        KeyPair keyPair = Ed25519Signer.generateKeyPair();
        byte[] data = "现场工作证明".getBytes(StandardCharsets.UTF_8);

        byte[] signature = Ed25519Signer.applySignature(keyPair.getPrivate(), data);
        assertEquals(Ed25519Signer.SIGNATURE_LENGTH, signature.length);

        byte[] corePublic = Ed25519Signer.extractPublicKeyCore(keyPair.getPublic());
        assertEquals(Ed25519Signer.CORE_KEY_LENGTH, corePublic.length);
        assertTrue(Ed25519Signer.verifySignature(corePublic, data, signature));
        assertTrue(Ed25519Signer.verifySignature(keyPair.getPublic(), data, signature));
    }

    @Test
    void tamperedDataOrSignatureFails() {
        KeyPair keyPair = Ed25519Signer.generateKeyPair();
        byte[] data = "amount=1000".getBytes(StandardCharsets.UTF_8);
        byte[] signature = Ed25519Signer.applySignature(keyPair.getPrivate(), data);
        byte[] corePublic = Ed25519Signer.extractPublicKeyCore(keyPair.getPublic());

        assertFalse(Ed25519Signer.verifySignature(corePublic, "amount=1001".getBytes(StandardCharsets.UTF_8), signature));
        byte[] tampered = signature.clone();
        tampered[0] ^= 0x01;
        assertFalse(Ed25519Signer.verifySignature(corePublic, data, tampered));
        assertFalse(Ed25519Signer.verifySignature(corePublic, data, new byte[63]));
        assertFalse(Ed25519Signer.verifySignature(new byte[5], data, signature));
    }

    @Test
    void corePublicKeyRecoversEquivalentKey() {
        KeyPair keyPair = Ed25519Signer.generateKeyPair();
        byte[] corePublic = Ed25519Signer.extractPublicKeyCore(keyPair.getPublic());

        PublicKey recoveredPublic = Ed25519Signer.recoverPublicKeyFromCore(corePublic);
        assertArrayEquals(corePublic, Ed25519Signer.extractPublicKeyCore(recoveredPublic));
        byte[] data = "recover".getBytes(StandardCharsets.UTF_8);
        byte[] signature = Ed25519Signer.applySignature(keyPair.getPrivate(), data);
        assertTrue(Ed25519Signer.verifySignature(recoveredPublic, data, signature));
        assertThrows(IllegalArgumentException.class, () -> Ed25519Signer.recoverPublicKeyFromCore(new byte[31]));
        log.info("公钥核心: {}", ByteUtils.bytesToHex(corePublic));
    }
}
