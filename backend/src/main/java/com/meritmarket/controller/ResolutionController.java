package com.meritmarket.controller;

import com.meritmarket.dto.ResolutionRequests;
import com.meritmarket.dto.ResolutionResponses;
import com.meritmarket.gateway.PriceOracle;
import com.meritmarket.mapper.ResolutionResponseMapper;
import com.meritmarket.service.LegislatorVotingService;
import com.meritmarket.service.ResolutionFinalizationService;
import com.meritmarket.service.ResolutionProposalService;
import com.meritmarket.service.ResolutionProtocol;
import com.meritmarket.service.RewardClaimService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for the resolution lifecycle of one market. Callers identify themselves in the request body.
 */
@RestController
@RequestMapping("/api/markets/{marketId}/resolution")
public class ResolutionController {

    private final ResolutionProtocol resolutionProtocol;
    private final ResolutionResponseMapper mapper;

    public ResolutionController(ResolutionProtocol resolutionProtocol, ResolutionResponseMapper mapper) {
        this.resolutionProtocol = resolutionProtocol;
        this.mapper = mapper;
    }

    @GetMapping
    public ResponseEntity<ResolutionResponses.ResolutionDetail> getResolution(
            @PathVariable String marketId,
            @RequestParam(required = false) Integer cycle
    ) {
        return ResponseEntity.ok(mapper.toResolutionDetail(resolutionProtocol.resolution(marketId, cycle)));
    }

    @GetMapping("/history")
    public ResponseEntity<List<ResolutionResponses.ResolutionDetail>> getHistory(@PathVariable String marketId) {
        return ResponseEntity.ok(mapper.toResolutionDetails(resolutionProtocol.history(marketId)));
    }

    @PostMapping("/commits")
    public ResponseEntity<ResolutionResponses.CommitSummary> commit(
            @PathVariable String marketId,
            @Valid @RequestBody ResolutionRequests.CommitRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toCommitSummary(
                resolutionProtocol.commitResolution(marketId, request.committer(), request.commitHash(), request.bond())));
    }

    @PostMapping("/commits/slash")
    public ResponseEntity<ResolutionProposalService.CommitSlashResult> slashCommit(
            @PathVariable String marketId,
            @Valid @RequestBody ResolutionRequests.SlashCommitRequest request
    ) {
        return ResponseEntity.ok(resolutionProtocol.slashUnrevealedCommit(marketId, request.caller(), request.committer()));
    }

    @PostMapping
    public ResponseEntity<ResolutionResponses.ResolutionDetail> propose(
            @PathVariable String marketId,
            @Valid @RequestBody ResolutionRequests.ProposeRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResolutionDetail(
                resolutionProtocol.proposeResolution(marketId, request.proposer(), request.outcome(),
                        request.evidenceUri(), request.evidenceHash(), request.salt(), request.stake())));
    }

    @PostMapping("/support")
    public ResponseEntity<ResolutionResponses.StakeSummary> support(
            @PathVariable String marketId,
            @Valid @RequestBody ResolutionRequests.StakeRequest request
    ) {
        return ResponseEntity.ok(mapper.toStakeSummary(
                resolutionProtocol.supportResolution(marketId, request.participant(), request.amount())));
    }

    @PostMapping("/opposition")
    public ResponseEntity<ResolutionResponses.StakeSummary> oppose(
            @PathVariable String marketId,
            @Valid @RequestBody ResolutionRequests.StakeRequest request
    ) {
        return ResponseEntity.ok(mapper.toStakeSummary(
                resolutionProtocol.opposeResolution(marketId, request.participant(), request.amount())));
    }

    @GetMapping("/stakes")
    public ResponseEntity<List<ResolutionResponses.StakeSummary>> getStakes(
            @PathVariable String marketId,
            @RequestParam(required = false) Integer cycle,
            @RequestParam(required = false) String participant
    ) {
        return ResponseEntity.ok(mapper.toStakeSummaries(resolutionProtocol.stakes(marketId, cycle, participant)));
    }

    @PostMapping("/challenges")
    public ResponseEntity<ResolutionResponses.ChallengeSummary> challengeEvidence(
            @PathVariable String marketId,
            @Valid @RequestBody ResolutionRequests.ChallengeEvidenceRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toChallengeSummary(
                resolutionProtocol.challengeEvidence(marketId, request.challenger(), request.reason(), request.stake())));
    }

    @PostMapping("/challenges/{challengeIndex}/resolution")
    public ResponseEntity<ResolutionResponses.ChallengeSummary> resolveChallenge(
            @PathVariable String marketId,
            @PathVariable int challengeIndex,
            @Valid @RequestBody ResolutionRequests.ResolveChallengeRequest request
    ) {
        return ResponseEntity.ok(mapper.toChallengeSummary(resolutionProtocol.resolveEvidenceChallenge(
                marketId, request.resolver(), challengeIndex, request.upheld())));
    }

    @GetMapping("/challenges")
    public ResponseEntity<List<ResolutionResponses.ChallengeSummary>> getChallenges(
            @PathVariable String marketId,
            @RequestParam(required = false) Integer cycle
    ) {
        return ResponseEntity.ok(mapper.toChallengeSummaries(resolutionProtocol.challenges(marketId, cycle)));
    }

    @PostMapping("/votes/commit")
    public ResponseEntity<ResolutionResponses.VoteCommitSummary> commitVote(
            @PathVariable String marketId,
            @Valid @RequestBody ResolutionRequests.VoteCommitRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toVoteCommitSummary(
                resolutionProtocol.commitLegislatorVote(marketId, request.legislator(), request.commitHash())));
    }

    @PostMapping("/votes/reveal")
    public ResponseEntity<ResolutionResponses.ResolutionDetail> revealVote(
            @PathVariable String marketId,
            @Valid @RequestBody ResolutionRequests.VoteRevealRequest request
    ) {
        return ResponseEntity.ok(mapper.toResolutionDetail(resolutionProtocol.revealLegislatorVote(
                marketId, request.legislator(), request.support(), request.salt())));
    }

    @PostMapping("/votes/slash")
    public ResponseEntity<LegislatorVotingService.LegislatorSlashResult> slashLegislator(
            @PathVariable String marketId,
            @Valid @RequestBody ResolutionRequests.SlashLegislatorRequest request
    ) {
        return ResponseEntity.ok(resolutionProtocol.slashNonRevealingLegislator(
                marketId, request.cycle(), request.caller(), request.legislator()));
    }

    @GetMapping("/dispute-bond")
    public ResponseEntity<ResolutionResponses.DisputeBondQuote> getRequiredDisputeBond(@PathVariable String marketId) {
        return ResponseEntity.ok(new ResolutionResponses.DisputeBondQuote(
                marketId, resolutionProtocol.requiredDisputeBond(marketId)));
    }

    @PostMapping("/disputes")
    public ResponseEntity<ResolutionResponses.DisputeSummary> dispute(
            @PathVariable String marketId,
            @Valid @RequestBody ResolutionRequests.DisputeRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toDisputeSummary(
                resolutionProtocol.disputeResolution(marketId, request.challenger(), request.alternativeOutcome(),
                        request.evidenceUri(), request.evidenceHash(), request.bond())));
    }

    @GetMapping("/disputes")
    public ResponseEntity<List<ResolutionResponses.DisputeSummary>> getDisputes(
            @PathVariable String marketId,
            @RequestParam(required = false) Integer cycle
    ) {
        return ResponseEntity.ok(mapper.toDisputeSummaries(resolutionProtocol.disputes(marketId, cycle)));
    }

    @PostMapping("/disputes/{disputeIndex}/support")
    public ResponseEntity<ResolutionResponses.StakeSummary> supportDispute(
            @PathVariable String marketId,
            @PathVariable int disputeIndex,
            @Valid @RequestBody ResolutionRequests.StakeRequest request
    ) {
        return ResponseEntity.ok(mapper.toStakeSummary(resolutionProtocol.supportDispute(
                marketId, request.participant(), disputeIndex, request.amount())));
    }

    @PostMapping("/disputes/{disputeIndex}/endorsements")
    public ResponseEntity<ResolutionResponses.DisputeSummary> endorseDispute(
            @PathVariable String marketId,
            @PathVariable int disputeIndex,
            @Valid @RequestBody ResolutionRequests.EndorseRequest request
    ) {
        return ResponseEntity.ok(mapper.toDisputeSummary(
                resolutionProtocol.endorseDispute(marketId, request.legislator(), disputeIndex)));
    }

    @PostMapping("/finalize")
    public ResponseEntity<ResolutionFinalizationService.FinalizationResult> finalizeResolution(
            @PathVariable String marketId
    ) {
        return ResponseEntity.ok(resolutionProtocol.finalizeResolution(marketId));
    }

    @PostMapping("/claims/support")
    public ResponseEntity<RewardClaimService.ClaimReceipt> claimSupport(
            @PathVariable String marketId,
            @Valid @RequestBody ResolutionRequests.ClaimRequest request
    ) {
        return ResponseEntity.ok(resolutionProtocol.claimResolutionReward(marketId, request.cycle(), request.participant()));
    }

    @PostMapping("/claims/opposition")
    public ResponseEntity<RewardClaimService.ClaimReceipt> claimOpposition(
            @PathVariable String marketId,
            @Valid @RequestBody ResolutionRequests.ClaimRequest request
    ) {
        return ResponseEntity.ok(resolutionProtocol.claimOppositionReward(marketId, request.cycle(), request.participant()));
    }

    @PostMapping("/disputes/{disputeIndex}/claims/challenger")
    public ResponseEntity<RewardClaimService.ClaimReceipt> claimDisputeReward(
            @PathVariable String marketId,
            @PathVariable int disputeIndex,
            @Valid @RequestBody ResolutionRequests.ClaimRequest request
    ) {
        return ResponseEntity.ok(resolutionProtocol.claimDisputeReward(
                marketId, request.cycle(), request.participant(), disputeIndex));
    }

    @PostMapping("/disputes/{disputeIndex}/claims/backer")
    public ResponseEntity<RewardClaimService.ClaimReceipt> reclaimDisputeStake(
            @PathVariable String marketId,
            @PathVariable int disputeIndex,
            @Valid @RequestBody ResolutionRequests.ClaimRequest request
    ) {
        return ResponseEntity.ok(resolutionProtocol.reclaimDisputeStake(
                marketId, request.cycle(), request.participant(), disputeIndex));
    }

    @GetMapping("/price")
    public ResponseEntity<PriceOracle.RecordedPrice> getRecordedPrice(@PathVariable String marketId) {
        return ResponseEntity.ok(resolutionProtocol.recordedPrice(marketId));
    }
}
