package com.bit.attest.oracle;

import com.bit.attest.ProtocolTestSupport;
import com.bit.attest.common.Address;
import com.bit.attest.common.ContributionKey;
import com.bit.attest.exception.ErrorType;
import com.bit.attest.structure.contribution.ContributionProof;
import com.bit.attest.structure.contribution.ContributionRecord;
import com.bit.attest.structure.contribution.ContributionStatus;
import com.bit.attest.structure.contribution.PayoutSplit;
import com.bit.attest.util.Ed25519Signer;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class ContributionOracleTest extends ProtocolTestSupport {

    private Address validatorA;
    private Address validatorB;
    private KeyPair worker;
    private Address workerAddress;
    private Address wallet;
    private String buildingId;

    @BeforeEach
    void setUp() {
        validatorA = newValidator(1000);
        validatorB = newValidator(1000);
        worker = newWorker();
        workerAddress = addressOf(worker);
        wallet = randomAddress();
        buildingId = newBuilding(wallet);
    }

    private ContributionRecord attest(Address validator, long amount) {
        ContributionProof proof = proof(worker, buildingId, amount);
        return contributionOracle.attest(validator, buildingId, workerAddress, amount, proof, sign(worker, proof));
    }

    @Test
    void attestCreatesRecordAndCountsDistinctValidators() {
        ContributionRecord first = attest(validatorA, 1000);
        assertEquals(1, first.getConfirmationCount());
        assertEquals(wallet, first.getBuildingWallet());
        assertEquals(clock.millis(), first.getProposedAt());
        assertEquals(ContributionStatus.PROPOSED, first.getStatus());

        ContributionRecord second = attest(validatorB, 1000);
        assertEquals(first.getKey(), second.getKey());
        assertEquals(2, second.getConfirmationCount());
        assertEquals(contributionOracle.computeKey(buildingId, workerAddress, 1000), second.getKey());
    }

    @Test
    void attestChecksCallerAndClaim() {
        ContributionProof proof = proof(worker, buildingId, 1000);
        byte[] signature = sign(worker, proof);

        assertError(ErrorType.AUTHORIZATION, () -> contributionOracle.attest(randomAddress(), buildingId,
                workerAddress, 1000, proof, signature));
        assertError(ErrorType.VALIDATION, () -> contributionOracle.attest(validatorA, buildingId,
                workerAddress, 0, proof, signature));
        assertError(ErrorType.NOT_FOUND, () -> contributionOracle.attest(validatorA, "missing-building",
                workerAddress, 1000, proof, signature));

        KeyPair inactive = Ed25519Signer.generateKeyPair();
        assertError(ErrorType.VALIDATION, () -> contributionOracle.attest(validatorA, buildingId,
                addressOf(inactive), 1000, proof, signature));

        // 证明金额与声明不一致
        assertError(ErrorType.VALIDATION, () -> contributionOracle.attest(validatorA, buildingId,
                workerAddress, 999, proof, signature));
        assertFalse(contributionOracle.isProofConsumed(proof, signature));
    }

    @Test
    void attestRejectsFutureCaptureAndBadSignatures() {
        ContributionProof future = proof(worker, buildingId, 1000);
        future.setCapturedAt(clock.millis() + 1);
        assertError(ErrorType.VALIDATION, () -> contributionOracle.attest(validatorA, buildingId,
                workerAddress, 1000, future, sign(worker, future)));

        ContributionProof proof = proof(worker, buildingId, 1000);
        KeyPair other = Ed25519Signer.generateKeyPair();
        byte[] foreign = Ed25519Signer.applySignature(other.getPrivate(), proofVerifier.signData(proof));
        assertError(ErrorType.VALIDATION, () -> contributionOracle.attest(validatorA, buildingId,
                workerAddress, 1000, proof, foreign));

        // 不带签名域的签名无效
        byte[] undomained = Ed25519Signer.applySignature(worker.getPrivate(), proof.encode());
        assertError(ErrorType.VALIDATION, () -> contributionOracle.attest(validatorA, buildingId,
                workerAddress, 1000, proof, undomained));

        assertError(ErrorType.VALIDATION, () -> contributionOracle.attest(validatorA, buildingId,
                workerAddress, 1000, proof, new byte[10]));
    }

    @Test
    void consumedProofCannotBeReplayed() {
        ContributionProof proof = proof(worker, buildingId, 1000);
        byte[] signature = sign(worker, proof);
        contributionOracle.attest(validatorA, buildingId, workerAddress, 1000, proof, signature);
        assertTrue(contributionOracle.isProofConsumed(proof, signature));

        assertError(ErrorType.REPLAY, () -> contributionOracle.attest(validatorB, buildingId,
                workerAddress, 1000, proof, signature));
        assertEquals(1, contributionOracle.getContribution(
                contributionOracle.computeKey(buildingId, workerAddress, 1000)).getConfirmationCount());
    }

    @Test
    void consumedProofIsReplayForAnyClaim() {
        ContributionProof proof = proof(worker, buildingId, 1000);
        byte[] signature = sign(worker, proof);
        contributionOracle.attest(validatorA, buildingId, workerAddress, 1000, proof, signature);

        // 换金额
        assertError(ErrorType.REPLAY, () -> contributionOracle.attest(validatorB, buildingId,
                workerAddress, 2000, proof, signature));
        // 换建筑
        String otherBuilding = newBuilding(randomAddress());
        assertError(ErrorType.REPLAY, () -> contributionOracle.attest(validatorB, otherBuilding,
                workerAddress, 1000, proof, signature));
        // 换工人
        Address otherWorker = addressOf(newWorker());
        assertError(ErrorType.REPLAY, () -> contributionOracle.attest(validatorB, buildingId,
                otherWorker, 1000, proof, signature));

        assertError(ErrorType.NOT_FOUND, () -> contributionOracle.getContribution(
                contributionOracle.computeKey(buildingId, workerAddress, 2000)));
        assertError(ErrorType.NOT_FOUND, () -> contributionOracle.getContribution(
                contributionOracle.computeKey(otherBuilding, workerAddress, 1000)));
    }

    @Test
    void malformedProofIsRejectedBeforeConsumptionLookup() {
        ContributionProof proof = proof(worker, buildingId, 1000);
        byte[] signature = sign(worker, proof);
        proof.setEvidenceRoot(null);

        assertError(ErrorType.VALIDATION, () -> contributionOracle.attest(validatorA, buildingId,
                workerAddress, 1000, proof, signature));
        assertError(ErrorType.VALIDATION, () -> contributionOracle.isProofConsumed(proof, signature));
        assertError(ErrorType.VALIDATION, () -> contributionOracle.attest(validatorA, buildingId,
                workerAddress, 1000, null, signature));
    }

    @Test
    void sameValidatorCannotConfirmTwice() {
        attest(validatorA, 1000);
        ContributionProof proof = proof(worker, buildingId, 1000);
        byte[] signature = sign(worker, proof);

        assertError(ErrorType.DUPLICATE, () -> contributionOracle.attest(validatorA, buildingId,
                workerAddress, 1000, proof, signature));
        // 失败的确认不会消费证明
        assertFalse(contributionOracle.isProofConsumed(proof, signature));
    }

    @Test
    void finalizeRequiresDelayAndQuorum() {
        ContributionKey key = attest(validatorA, 1000).getKey();
        assertError(ErrorType.NOT_FOUND, () -> contributionOracle.finalizeContribution(
                contributionOracle.computeKey(buildingId, workerAddress, 1)));

        assertError(ErrorType.TIMING, () -> contributionOracle.finalizeContribution(key));
        clock.advance(Duration.ofHours(24));
        assertError(ErrorType.CONSENSUS, () -> contributionOracle.finalizeContribution(key));
        assertFalse(contributionOracle.isFinalizable(key));

        attest(validatorB, 1000);
        assertTrue(contributionOracle.isFinalizable(key));
        ContributionRecord record = contributionOracle.finalizeContribution(key);
        assertEquals(ContributionStatus.FINALIZED, record.getStatus());
        assertEquals(700, valueLedger.balanceOf(workerAddress));
        assertEquals(100, valueLedger.balanceOf(wallet));

        assertError(ErrorType.STATE, () -> contributionOracle.finalizeContribution(key));
    }

    @Test
    void delayIsMeasuredFromFirstProof() {
        ContributionKey key = attest(validatorA, 1000).getKey();
        clock.advance(Duration.ofHours(23));
        attest(validatorB, 1000);
        assertError(ErrorType.TIMING, () -> contributionOracle.finalizeContribution(key));
        clock.advance(Duration.ofHours(1));
        contributionOracle.finalizeContribution(key);
    }

    @Test
    void finalizedRecordRejectsFurtherConfirmations() {
        ContributionKey key = attest(validatorA, 1000).getKey();
        attest(validatorB, 1000);
        clock.advance(Duration.ofHours(24));
        contributionOracle.finalizeContribution(key);

        Address validatorC = newValidator(1000);
        ContributionProof proof = proof(worker, buildingId, 1000);
        assertError(ErrorType.STATE, () -> contributionOracle.attest(validatorC, buildingId,
                workerAddress, 1000, proof, sign(worker, proof)));
        assertError(ErrorType.STATE, () -> contributionOracle.raiseFlag(validatorC, key, "晚了"));
    }

    @Test
    void advisoryFlagBlocksFinalizeUntilCleared() {
        ContributionKey key = attest(validatorA, 1000).getKey();
        attest(validatorB, 1000);

        assertError(ErrorType.AUTHORIZATION, () -> contributionOracle.raiseFlag(randomAddress(), key, "可疑"));
        assertError(ErrorType.VALIDATION, () -> contributionOracle.raiseFlag(validatorA, key, " "));
        assertError(ErrorType.STATE, () -> contributionOracle.clearFlag(admin, key));

        ContributionRecord flagged = contributionOracle.raiseFlag(validatorB, key, "照片重复");
        assertEquals(ContributionStatus.DISPUTED, flagged.getStatus());
        assertEquals(validatorB, flagged.getFlaggedBy());
        assertError(ErrorType.DUPLICATE, () -> contributionOracle.raiseFlag(validatorA, key, "再次"));

        clock.advance(Duration.ofHours(24));
        assertError(ErrorType.DISPUTED, () -> contributionOracle.finalizeContribution(key));
        assertFalse(contributionOracle.isFinalizable(key));

        assertError(ErrorType.AUTHORIZATION, () -> contributionOracle.clearFlag(validatorA, key));
        contributionOracle.clearFlag(admin, key);
        contributionOracle.finalizeContribution(key);
    }

    @Test
    void payoutUsesWalletSnapshot() {
        ContributionKey key = attest(validatorA, 1000).getKey();
        Address newWallet = randomAddress();
        identityRegistry.setBuildingWallet(buildingId, newWallet);
        attest(validatorB, 1000);
        clock.advance(Duration.ofHours(24));

        contributionOracle.finalizeContribution(key);

        assertEquals(100, valueLedger.balanceOf(wallet));
        assertEquals(0, valueLedger.balanceOf(newWallet));
    }

    @Test
    void previewSplitGivesRemainderToTreasury() {
        PayoutSplit split = contributionOracle.previewSplit(999);
        assertEquals(699, split.getWorker());
        assertEquals(99, split.getBuilding());
        assertEquals(99, split.getMaintainer());
        assertEquals(102, split.getTreasury());
        assertError(ErrorType.VALIDATION, () -> contributionOracle.previewSplit(0));
    }
}
