package com.bit.attest;

import com.bit.attest.common.Address;
import com.bit.attest.common.ContributionKey;
import com.bit.attest.structure.contribution.ContributionProof;
import com.bit.attest.structure.contribution.ContributionRecord;
import com.bit.attest.structure.contribution.ContributionStatus;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 完整流程：两名质押1000的验证者确认一笔1000的贡献，24小时后终结分账 700/100/100/100
 */
@Slf4j
public class AttestScenarioTest extends ProtocolTestSupport {

    @Test
    void twoValidatorsFinalizeContribution() {
        Address maintainerPool = protocolConfig.getMaintainerPoolAddress();
        Address treasury = protocolConfig.getTreasuryAddress();
        long maintainerBefore = valueLedger.balanceOf(maintainerPool);
        long treasuryBefore = valueLedger.balanceOf(treasury);

        Address validatorA = newValidator(1000);
        Address validatorB = newValidator(1000);
        KeyPair worker = newWorker();
        Address workerAddress = addressOf(worker);
        Address wallet = randomAddress();
        String buildingId = newBuilding(wallet);

        ContributionProof proofA = proof(worker, buildingId, 1000);
        ContributionRecord record = contributionOracle.attest(validatorA, buildingId, workerAddress, 1000,
                proofA, sign(worker, proofA));
        ContributionKey key = record.getKey();
        log.info("贡献记录键: {}", key);

        ContributionProof proofB = proof(worker, buildingId, 1000);
        contributionOracle.attest(validatorB, buildingId, workerAddress, 1000, proofB, sign(worker, proofB));

        clock.advance(Duration.ofHours(24));
        ContributionRecord finalized = contributionOracle.finalizeContribution(key);

        assertEquals(ContributionStatus.FINALIZED, finalized.getStatus());
        assertEquals(clock.millis(), finalized.getFinalizedAt());
        assertEquals(700, valueLedger.balanceOf(workerAddress));
        assertEquals(100, valueLedger.balanceOf(wallet));
        assertEquals(maintainerBefore + 100, valueLedger.balanceOf(maintainerPool));
        assertEquals(treasuryBefore + 100, valueLedger.balanceOf(treasury));

        ContributionRecord stored = contributionOracle.getContribution(key);
        assertTrue(stored.isFinalized());
        assertFalse(stored.isCancelled());
        assertTrue(stored.hasConfirmed(validatorA));
        assertTrue(stored.hasConfirmed(validatorB));
        assertTrue(contributionOracle.listContributions(Integer.MAX_VALUE).stream()
                .anyMatch(r -> r.getKey().equals(key)));
    }
}
