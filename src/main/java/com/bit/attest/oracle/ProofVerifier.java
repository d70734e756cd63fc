package com.bit.attest.oracle;

import com.bit.attest.config.ProtocolConfig;
import com.bit.attest.structure.contribution.ContributionProof;
import com.bit.attest.structure.contribution.ProofDomain;
import com.bit.attest.util.Ed25519Signer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 校验工人对证明的 Ed25519 签名（绑定签名域）
 */
@Slf4j
@Component
public class ProofVerifier {

    @Getter
    private final ProofDomain domain;

    @Autowired
    public ProofVerifier(ProtocolConfig protocolConfig) {
        this.domain = new ProofDomain(
                protocolConfig.getDomainName(),
                protocolConfig.getDomainVersion(),
                protocolConfig.getChainId(),
                protocolConfig.getOracleAddress());
        log.info("签名域初始化完成: {} v{} chainId={}", domain.getName(), domain.getVersion(), domain.getChainId());
    }

    public boolean verify(ContributionProof proof, byte[] signature) {
        if (signature == null || signature.length != Ed25519Signer.SIGNATURE_LENGTH) {
            return false;
        }
        byte[] signData = proof.buildSignData(domain);
        return Ed25519Signer.verifySignature(proof.getWorkerId().toBytes(), signData, signature);
    }

    public byte[] signData(ContributionProof proof) {
        return proof.buildSignData(domain);
    }
}
