package com.meritmarket.controller;

import com.meritmarket.mapper.ResolutionResponseMapper;
import com.meritmarket.model.Resolution;
import com.meritmarket.model.ResolutionStake;
import com.meritmarket.model.ResolutionStatus;
import com.meritmarket.model.StakeRole;
import com.meritmarket.service.LedgerInsolvencyException;
import com.meritmarket.service.LegislatorVotingService;
import com.meritmarket.service.ResolutionError;
import com.meritmarket.service.ResolutionProtocol;
import com.meritmarket.service.ResolutionValidationException;
import com.meritmarket.service.RewardClaimService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ResolutionController.class)
@Import(ResolutionResponseMapper.class)
class ResolutionControllerTest {

    private static final String HASH = "0x" + "ab".repeat(32);
    private static final OffsetDateTime PROPOSED_AT = OffsetDateTime.parse("2026-03-01T00:10:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ResolutionProtocol resolutionProtocol;

    @Test
    void proposeReturnsCreatedResolutionWithWindows() throws Exception {
        when(resolutionProtocol.proposeResolution(
                eq("market-1"), eq("alice"), eq(1), eq("ipfs://report"), eq(HASH), eq(HASH), eq(2_000_000_000L)))
                .thenReturn(sampleResolution());

        mockMvc.perform(post("/api/markets/{marketId}/resolution", "market-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "proposer": "alice",
                                  "outcome": 1,
                                  "evidenceUri": "ipfs://report",
                                  "evidenceHash": "%s",
                                  "salt": "%s",
                                  "stake": 2000000000
                                }
                                """.formatted(HASH, HASH)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.marketId").value("market-1"))
                .andExpect(jsonPath("$.cycle").value(1))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.supportStake").value(2_000_000_000L))
                .andExpect(jsonPath("$.windows.supportCloses").exists())
                .andExpect(jsonPath("$.windows.finalizableAt").exists());
    }

    @Test
    void commitWithMalformedHashReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/markets/{marketId}/resolution/commits", "market-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "committer": "alice",
                                  "commitHash": "0x1234",
                                  "bond": 0
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_request"))
                .andExpect(jsonPath("$.fieldErrors.commitHash").exists())
                .andExpect(jsonPath("$.fieldErrors.bond").exists());

        verify(resolutionProtocol, never()).commitResolution(anyString(), anyString(), anyString(), anyLong());
    }

    @Test
    void malformedBodyReturnsInvalidRequest() throws Exception {
        mockMvc.perform(post("/api/markets/{marketId}/resolution/support", "market-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"participant\": \"bob\", \"amount\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_request"))
                .andExpect(jsonPath("$.fieldErrors").isEmpty());

        verify(resolutionProtocol, never()).supportResolution(anyString(), anyString(), anyLong());
    }

    @Test
    void slashLegislatorTargetsRequestedCycle() throws Exception {
        when(resolutionProtocol.slashNonRevealingLegislator("market-1", 1, "keeper", "leg-3"))
                .thenReturn(new LegislatorVotingService.LegislatorSlashResult("leg-3", 100L, true));

        mockMvc.perform(post("/api/markets/{marketId}/resolution/votes/slash", "market-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"caller": "keeper", "legislator": "leg-3", "cycle": 1}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.penalty").value(100))
                .andExpect(jsonPath("$.applied").value(true));
    }

    @Test
    void supportAfterWindowReturnsConflictCode() throws Exception {
        when(resolutionProtocol.supportResolution("market-1", "bob", 5_000_000_000L))
                .thenThrow(new ResolutionValidationException(ResolutionError.WINDOW_CLOSED, "Support window closed"));

        mockMvc.perform(post("/api/markets/{marketId}/resolution/support", "market-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"participant": "bob", "amount": 5000000000}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("window_closed"))
                .andExpect(jsonPath("$.message").value("Support window closed"));
    }

    @Test
    void supportReturnsStakeSummary() throws Exception {
        ResolutionStake stake = new ResolutionStake();
        stake.setParticipant("bob");
        stake.setRole(StakeRole.SUPPORT);
        stake.setAmount(5_000_000_000L);
        stake.setWeightedAmount(6_000_000_000L);
        stake.setTimingBonusBps(2_000);
        stake.setLastContributionAt(PROPOSED_AT.plusMinutes(30));
        when(resolutionProtocol.supportResolution("market-1", "bob", 5_000_000_000L)).thenReturn(stake);

        mockMvc.perform(post("/api/markets/{marketId}/resolution/support", "market-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"participant": "bob", "amount": 5000000000}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("SUPPORT"))
                .andExpect(jsonPath("$.weightedAmount").value(6_000_000_000L))
                .andExpect(jsonPath("$.timingBonusBps").value(2_000));
    }

    @Test
    void missingResolutionReturnsNotFound() throws Exception {
        when(resolutionProtocol.resolution("market-9", null))
                .thenThrow(ResolutionValidationException.resolutionNotFound("market-9"));

        mockMvc.perform(get("/api/markets/{marketId}/resolution", "market-9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("resolution_not_found"));
    }

    @Test
    void challengerClaimPassesDisputeIndexAndCycle() throws Exception {
        when(resolutionProtocol.claimDisputeReward("market-1", 2, "dave", 3))
                .thenReturn(new RewardClaimService.ClaimReceipt("market-1", 2, "dave", "DISPUTE_CHALLENGER", 42L));

        mockMvc.perform(post("/api/markets/{marketId}/resolution/disputes/{disputeIndex}/claims/challenger", "market-1", 3)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"participant": "dave", "cycle": 2}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cycle").value(2))
                .andExpect(jsonPath("$.payout").value(42));
    }

    @Test
    void claimWithInvalidCycleIsRejected() throws Exception {
        mockMvc.perform(post("/api/markets/{marketId}/resolution/claims/support", "market-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"participant": "alice", "cycle": 0}
                                """))
                .andExpect(status().isBadRequest());

        verify(resolutionProtocol, never()).claimResolutionReward(anyString(), any(), anyString());
    }

    @Test
    void insolventClaimReturnsUnprocessableEntity() throws Exception {
        when(resolutionProtocol.claimResolutionReward("market-1", null, "alice"))
                .thenThrow(new LedgerInsolvencyException("Market market-1 cannot cover claim of 10"));

        mockMvc.perform(post("/api/markets/{marketId}/resolution/claims/support", "market-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"participant": "alice"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("ledger_insolvent"));
    }

    @Test
    void disputeBondQuoteReturnsRequiredBond() throws Exception {
        when(resolutionProtocol.requiredDisputeBond("market-1")).thenReturn(20_276_000_000L);

        mockMvc.perform(get("/api/markets/{marketId}/resolution/dispute-bond", "market-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requiredBond").value(20_276_000_000L));
    }

    @Test
    void endorsementRequiresLegislator() throws Exception {
        mockMvc.perform(post("/api/markets/{marketId}/resolution/disputes/{disputeIndex}/endorsements", "market-1", 0)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"legislator": ""}
                                """))
                .andExpect(status().isBadRequest());

        verify(resolutionProtocol, never()).endorseDispute(anyString(), anyString(), anyInt());
    }

    private static Resolution sampleResolution() {
        Resolution resolution = new Resolution();
        resolution.setMarketId("market-1");
        resolution.setCycle(1);
        resolution.setProposer("alice");
        resolution.setProposedOutcome(1);
        resolution.setProposedAt(PROPOSED_AT);
        resolution.setEvidenceUri("ipfs://report");
        resolution.setEvidenceHash(HASH);
        resolution.setSupportStake(2_000_000_000L);
        resolution.setSupportWeighted(2_300_000_000L);
        resolution.setSupporterCount(1);
        resolution.setStatus(ResolutionStatus.PENDING);
        return resolution;
    }
}
