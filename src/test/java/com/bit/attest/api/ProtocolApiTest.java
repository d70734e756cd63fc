package com.bit.attest.api;

import com.bit.attest.ProtocolTestSupport;
import com.bit.attest.common.Address;
import com.bit.attest.structure.contribution.ContributionProof;
import com.bit.attest.structure.dto.AmountRequest;
import com.bit.attest.structure.dto.AttestRequest;
import com.bit.attest.structure.dto.BuildingRequest;
import com.bit.attest.structure.dto.ProofDTO;
import com.bit.attest.util.ByteUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.security.KeyPair;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Slf4j
@AutoConfigureMockMvc
public class ProtocolApiTest extends ProtocolTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void registryWritesRequireAdmin() throws Exception {
        BuildingRequest request = new BuildingRequest();
        request.setBuildingId("api-building-" + randomAddress().toBase58());
        request.setWallet(randomAddress().toBase58());

        mockMvc.perform(post("/registry/building")
                        .header("X-Caller", randomAddress().toBase58())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorType").value("AUTHORIZATION"));

        mockMvc.perform(post("/registry/building")
                        .header("X-Caller", admin.toBase58())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        mockMvc.perform(get("/registry/building").param("buildingId", request.getBuildingId()))
                .andExpect(jsonPath("$.data").value(request.getWallet()));
    }

    @Test
    void depositAndQueryStake() throws Exception {
        Address validator = randomAddress();
        valueLedger.mint(validator, 1000);
        AmountRequest request = new AmountRequest();
        request.setAmount(1000);

        mockMvc.perform(post("/stake/deposit")
                        .header("X-Caller", validator.toBase58())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.activeStake").value(1000))
                .andExpect(jsonPath("$.data.validator").value(validator.toBase58()));

        mockMvc.perform(get("/stake/qualified").param("validator", validator.toBase58()))
                .andExpect(jsonPath("$.data").value(true));

        mockMvc.perform(post("/stake/completeWithdrawal").header("X-Caller", validator.toBase58()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorType").value("STATE"));
    }

    @Test
    void attestThroughHttp() throws Exception {
        Address validator = newValidator(1000);
        KeyPair worker = newWorker();
        String buildingId = newBuilding(randomAddress());
        ContributionProof proof = proof(worker, buildingId, 500);

        AttestRequest request = new AttestRequest();
        request.setBuildingId(buildingId);
        request.setWorkerId(addressOf(worker).toBase58());
        request.setAmount(500);
        request.setProof(ProofDTO.from(proof));
        request.setSignature(ByteUtils.bytesToHex(sign(worker, proof)));
        String key = contributionOracle.computeKey(buildingId, addressOf(worker), 500).toHex();

        mockMvc.perform(post("/contribution/attest")
                        .header("X-Caller", validator.toBase58())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.key").value(key))
                .andExpect(jsonPath("$.data.confirmationCount").value(1))
                .andExpect(jsonPath("$.data.status").value("PROPOSED"));

        // 同一证明再次提交
        mockMvc.perform(post("/contribution/attest")
                        .header("X-Caller", validator.toBase58())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorType").value("REPLAY"));

        mockMvc.perform(get("/contribution/detail").param("key", key))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.amount").value(500));

        mockMvc.perform(post("/contribution/finalize").param("key", key))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorType").value("TIMING"));
    }

    @Test
    void malformedInputIsValidationError() throws Exception {
        mockMvc.perform(get("/contribution/detail").param("key", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorType").value("VALIDATION"));

        mockMvc.perform(get("/stake/account").param("validator", "0OIl"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/stake/completeWithdrawal"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/contribution/split").param("amount", "1000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.worker").value(700))
                .andExpect(jsonPath("$.data.treasury").value(100));
    }

    @Test
    void consumedQueryRejectsIncompleteProof() throws Exception {
        KeyPair worker = newWorker();
        String buildingId = newBuilding(randomAddress());
        ContributionProof proof = proof(worker, buildingId, 500);
        AttestRequest request = new AttestRequest();
        request.setProof(ProofDTO.from(proof));
        request.setSignature(ByteUtils.bytesToHex(sign(worker, proof)));

        mockMvc.perform(post("/contribution/consumed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(false));

        request.getProof().setBuildingId(null);
        mockMvc.perform(post("/contribution/consumed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorType").value("VALIDATION"));

        request.getProof().setBuildingId(buildingId);
        request.getProof().setEvidenceRoot(null);
        mockMvc.perform(post("/contribution/consumed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorType").value("VALIDATION"));
    }

    @Test
    void unknownDisputeIsNotFound() throws Exception {
        String key = contributionOracle.computeKey("nowhere", randomAddress(), 1).toHex();
        mockMvc.perform(get("/dispute/detail").param("key", key))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorType").value("NOT_FOUND"));
        mockMvc.perform(get("/dispute/unresolved").param("key", key))
                .andExpect(jsonPath("$.data").value(false));
    }
}
