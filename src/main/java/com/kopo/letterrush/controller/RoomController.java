package com.kopo.letterrush.controller;

import com.kopo.letterrush.dto.*;
import com.kopo.letterrush.exception.ValidationException;
import com.kopo.letterrush.service.GameStateService;
import com.kopo.letterrush.service.RoomService;
import com.kopo.letterrush.service.RoundService;
import com.kopo.letterrush.service.SubmissionService;
import com.kopo.letterrush.service.VotingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@RequestMapping("/api/rooms")
@CrossOrigin(origins = "*")
@Tag(name = "Room", description = "Rooms, rounds, answers and votes")
public class RoomController {

    private static final Logger logger = LoggerFactory.getLogger(RoomController.class);
    private static final String BEARER = "Bearer";

    @Autowired
    private RoomService roomService;

    @Autowired
    private RoundService roundService;

    @Autowired
    private SubmissionService submissionService;

    @Autowired
    private VotingService votingService;

    @Autowired
    private GameStateService gameStateService;

    @PostMapping
    @Operation(summary = "Create a room", description = "Creates a room and its host player. The returned token authorizes the host.")
    @ApiResponse(responseCode = "201", description = "Room created")
    @ApiResponse(responseCode = "400", description = "Invalid settings")
    public ResponseEntity<SessionResponse> createRoom(@RequestBody CreateRoomRequest request) {
        logger.info("Create room request from {}", request.getPlayerName());
        SessionResponse session = roomService.createRoom(
                request.getPlayerName(), request.getTotalRounds(), request.getCategories(), request.getTimerDuration());
        return ResponseEntity.status(HttpStatus.CREATED).body(session);
    }

    @PostMapping("/join")
    @Operation(summary = "Join a room", description = "Adds a player to the room with the given invite code.")
    @ApiResponse(responseCode = "200", description = "Joined")
    @ApiResponse(responseCode = "404", description = "No room with this code")
    @ApiResponse(responseCode = "409", description = "Name taken or game finished")
    public ResponseEntity<SessionResponse> joinRoom(@RequestBody JoinRoomRequest request) {
        logger.info("Join request for room {} from {}", request.getCode(), request.getPlayerName());
        return ResponseEntity.ok(roomService.joinRoom(request.getCode(), request.getPlayerName()));
    }

    @GetMapping("/{code}")
    @Operation(summary = "Room state", description = "Room, players, current round and, once the round is completed, all answers with vote tallies.")
    @ApiResponse(responseCode = "200", description = "Current state")
    @ApiResponse(responseCode = "404", description = "No room with this code")
    public ResponseEntity<RoomStateResponse> getState(
            @Parameter(description = "Room invite code", required = true, example = "AB12CD") @PathVariable String code,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return ResponseEntity.ok(gameStateService.getState(code, bearerToken(authorization)));
    }

    @PostMapping("/{code}/start")
    @Operation(summary = "Start the game", description = "Host only. Opens round 1.")
    public ResponseEntity<ActionResponse> startGame(
            @PathVariable String code,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        roomService.startGame(code, bearerToken(authorization));
        return ResponseEntity.ok(ActionResponse.ok());
    }

    @PostMapping("/{code}/submit")
    @Operation(summary = "Submit answers", description = "Replaces the caller's answers for the active round.")
    public ResponseEntity<ActionResponse> submitAnswers(
            @PathVariable String code,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody SubmitAnswersRequest request) {
        submissionService.submit(code, bearerToken(authorization), request.getAnswers());
        return ResponseEntity.ok(ActionResponse.ok());
    }

    @PostMapping("/{code}/round/finish")
    @Operation(summary = "Finish the round", description = "Host only. Completes the active round, if any.")
    public ResponseEntity<ActionResponse> finishRound(
            @PathVariable String code,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        roundService.finishRound(code, bearerToken(authorization));
        return ResponseEntity.ok(ActionResponse.ok());
    }

    @PostMapping("/{code}/round/next")
    @Operation(summary = "Next round", description = "Opens the next round with a fresh letter.")
    public ResponseEntity<ActionResponse> nextRound(@PathVariable String code) {
        roundService.nextRound(code);
        return ResponseEntity.ok(ActionResponse.ok());
    }

    @PostMapping("/{code}/answers/{answerId}/vote")
    @Operation(summary = "Vote on an answer", description = "Accept or reject a peer answer of a completed round.")
    public ResponseEntity<ActionResponse> vote(
            @PathVariable String code,
            @PathVariable Long answerId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody VoteRequest request) {
        if (request.getAccepted() == null) {
            throw new ValidationException("accepted is required");
        }
        boolean rejected = votingService.vote(code, answerId, bearerToken(authorization), request.getAccepted());
        return ResponseEntity.ok(ActionResponse.voted(rejected));
    }

    @PostMapping("/{code}/answers/{answerId}/moderate")
    @Operation(summary = "Moderate an answer", description = "Host only. Sets or clears the rejection marker of an answer.")
    public ResponseEntity<ActionResponse> moderate(
            @PathVariable String code,
            @PathVariable Long answerId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody ModerateRequest request) {
        if (request.getRejected() == null) {
            throw new ValidationException("rejected is required");
        }
        boolean rejected = votingService.moderate(code, answerId, bearerToken(authorization), request.getRejected());
        return ResponseEntity.ok(ActionResponse.voted(rejected));
    }

    @PostMapping("/{code}/categories")
    @Operation(summary = "Update categories", description = "Only before the game starts.")
    public ResponseEntity<ActionResponse> updateCategories(
            @PathVariable String code, @RequestBody UpdateCategoriesRequest request) {
        roomService.updateCategories(code, request.getCategories());
        return ResponseEntity.ok(ActionResponse.ok());
    }

    @PostMapping("/{code}/settings")
    @Operation(summary = "Update settings", description = "Round count and timer, only before the game starts.")
    public ResponseEntity<ActionResponse> updateSettings(
            @PathVariable String code, @RequestBody UpdateSettingsRequest request) {
        roomService.updateSettings(code, request.getTotalRounds(), request.getTimerDuration());
        return ResponseEntity.ok(ActionResponse.ok());
    }

    // "Bearer <token>" or the bare token
    static String bearerToken(String authorization) {
        if (authorization == null) {
            return null;
        }
        String value = authorization.trim();
        if (value.regionMatches(true, 0, BEARER, 0, BEARER.length())
                && (value.length() == BEARER.length() || Character.isWhitespace(value.charAt(BEARER.length())))) {
            value = value.substring(BEARER.length()).trim();
        }
        return value.isEmpty() ? null : value;
    }
}
