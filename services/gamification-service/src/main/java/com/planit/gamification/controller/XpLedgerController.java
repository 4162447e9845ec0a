package com.planit.gamification.controller;

import com.planit.gamification.domain.RankedEntry;
import com.planit.gamification.dto.ApiResponse;
import com.planit.gamification.dto.AwardAcceptedResponse;
import com.planit.gamification.dto.AwardXpRequest;
import com.planit.gamification.dto.FriendsLeaderboardRequest;
import com.planit.gamification.dto.RankResponse;
import com.planit.gamification.dto.XpStateResponse;
import com.planit.gamification.service.AwardCommand;
import com.planit.gamification.service.PendingAward;
import com.planit.gamification.service.XpLedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/gamification")
@RequiredArgsConstructor
@Slf4j
@Validated
@Tag(name = "XP Ledger", description = "XP awards, levels and leaderboards")
public class XpLedgerController {

    private final XpLedgerService xpLedgerService;

    // Ledger
    @PostMapping("/users/{userId}/xp")
    @Operation(summary = "Award XP to a user", description = "Queues the award; it is applied asynchronously")
    public ResponseEntity<ApiResponse<AwardAcceptedResponse>> awardXp(
            @PathVariable String userId,
            @Valid @RequestBody AwardXpRequest request) {
        log.info("Awarding XP: userId={}, amount={}, eventKind={}", userId, request.getAmount(), request.getEventKind());

        PendingAward pending = xpLedgerService.awardXp(AwardCommand.builder()
                .userId(userId)
                .amount(request.getAmount())
                .eventKind(request.getEventKind())
                .subjectRef(request.getSubjectRef())
                .details(request.getDetails())
                .eventId(request.getEventId())
                .build());
        AwardAcceptedResponse response = AwardAcceptedResponse.builder()
                .userId(userId)
                .eventId(pending.getEventId())
                .status(pending.getPhase().name())
                .build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(response));
    }

    @GetMapping("/users/{userId}/xp")
    @Operation(summary = "Get XP, level and recent activity of a user")
    public ResponseEntity<ApiResponse<XpStateResponse>> getXpState(@PathVariable String userId) {
        XpStateResponse response = XpStateResponse.from(
                xpLedgerService.currentState(userId), xpLedgerService.recentEvents(userId));
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @GetMapping("/users/{userId}/rank")
    @Operation(summary = "Get a user's rank on the current monthly leaderboard")
    public ResponseEntity<ApiResponse<RankResponse>> getRank(@PathVariable String userId) {
        RankResponse response = new RankResponse(userId, xpLedgerService.currentPeriodKey(),
                xpLedgerService.findRank(userId).orElse(null));
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    // Leaderboards
    @GetMapping("/leaderboards/current")
    @Operation(summary = "Get the current month's global leaderboard")
    public ResponseEntity<ApiResponse<List<RankedEntry>>> getCurrentLeaderboard(
            @RequestParam(required = false) @Min(1) @Max(500) Integer limit) {
        return ResponseEntity.ok(ApiResponse.success(
                xpLedgerService.globalLeaderboard(xpLedgerService.currentPeriodKey(), limit)));
    }

    @GetMapping("/leaderboards/{periodKey}")
    @Operation(summary = "Get the global leaderboard of a month (yyyy-MM)")
    public ResponseEntity<ApiResponse<List<RankedEntry>>> getLeaderboard(
            @PathVariable String periodKey,
            @RequestParam(required = false) @Min(1) @Max(500) Integer limit) {
        return ResponseEntity.ok(ApiResponse.success(xpLedgerService.globalLeaderboard(periodKey, limit)));
    }

    @PostMapping("/leaderboards/{periodKey}/friends")
    @Operation(summary = "Rank a set of users for a month")
    public ResponseEntity<ApiResponse<List<RankedEntry>>> getFriendsLeaderboard(
            @PathVariable String periodKey,
            @Valid @RequestBody FriendsLeaderboardRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                xpLedgerService.friendsLeaderboard(periodKey, request.getUserIds())));
    }
}
