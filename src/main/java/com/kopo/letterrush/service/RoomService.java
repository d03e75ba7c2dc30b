package com.kopo.letterrush.service;

import com.kopo.letterrush.dto.SessionResponse;
import com.kopo.letterrush.entity.Player;
import com.kopo.letterrush.entity.Room;
import com.kopo.letterrush.exception.ConflictException;
import com.kopo.letterrush.exception.ValidationException;
import com.kopo.letterrush.repository.PlayerRepository;
import com.kopo.letterrush.repository.RoomRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Room configuration and high-level status: creation, joining, game start and pre-game settings.
 */
@Service
@Transactional
@RequiredArgsConstructor
public class RoomService {

    private static final Logger logger = LoggerFactory.getLogger(RoomService.class);

    public static final List<String> DEFAULT_CATEGORIES =
            List.of("panstwo", "miasto", "imie", "zwierze", "rzecz", "roslina");
    public static final int DEFAULT_TOTAL_ROUNDS = 5;
    public static final int DEFAULT_TIMER_SECONDS = 10;
    static final int MIN_ROUNDS = 1;
    static final int MAX_ROUNDS = 20;
    static final int MAX_TIMER_SECONDS = 60;
    static final int MAX_NAME_LENGTH = 40;

    private static final String CODE_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int CODE_LENGTH = 6;

    private final RoomRepository roomRepository;
    private final PlayerRepository playerRepository;
    private final RoomAccessService roomAccess;
    private final RoundService roundService;
    private final Clock clock;
    private final Random random = new SecureRandom();

    public String generateInviteCode() {
        String code;
        do {
            StringBuilder result = new StringBuilder();
            for (int i = 0; i < CODE_LENGTH; i++) {
                result.append(CODE_CHARS.charAt(random.nextInt(CODE_CHARS.length())));
            }
            code = result.toString();
        } while (roomRepository.existsByCode(code));
        return code;
    }

    public SessionResponse createRoom(String hostName, Integer totalRounds, List<String> categories, Integer timerDuration) {
        String name = requireName(hostName);
        int rounds = totalRounds == null ? DEFAULT_TOTAL_ROUNDS : checkTotalRounds(totalRounds);
        int timer = timerDuration == null ? DEFAULT_TIMER_SECONDS : checkTimer(timerDuration);
        List<String> roomCategories = categories == null ? DEFAULT_CATEGORIES : normalizeCategories(categories);

        Room room = new Room();
        room.setCode(generateInviteCode());
        room.setTotalRounds(rounds);
        room.setTimerDuration(timer);
        room.setCategories(new ArrayList<>(roomCategories));
        room.setCreatedAt(LocalDateTime.now(clock));
        roomRepository.save(room);

        Player host = newPlayer(room, name, true);
        logger.info("Room {} created by {} (rounds: {}, timer: {}s, categories: {})",
                room.getCode(), name, rounds, timer, roomCategories);
        return new SessionResponse(room.getCode(), host.getId(), host.getToken());
    }

    public SessionResponse joinRoom(String code, String playerName) {
        String name = requireName(playerName);
        // lock so two joins with the same name cannot both pass the uniqueness check
        Room room = roomAccess.requireRoomForUpdate(code);
        if (room.getStatus() == Room.RoomStatus.FINISHED) {
            throw new ConflictException("Game in room " + room.getCode() + " is already finished");
        }
        if (playerRepository.existsByRoomIdAndNameIgnoreCase(room.getId(), name)) {
            throw new ConflictException("Name '" + name + "' is already taken in room " + room.getCode());
        }
        Player player = newPlayer(room, name, false);
        logger.info("Player {} joined room {} (players: {})",
                name, room.getCode(), playerRepository.countByRoomId(room.getId()));
        return new SessionResponse(room.getCode(), player.getId(), player.getToken());
    }

    public void startGame(String code, String token) {
        Room room = roomAccess.requireRoomForUpdate(code);
        roomAccess.requireHost(room, token);
        if (room.getStatus() != Room.RoomStatus.WAITING) {
            throw new ValidationException("Game in room " + room.getCode() + " has already started");
        }
        room.moveTo(Room.RoomStatus.PLAYING);
        room.setRoundNumber(0);
        room.getUsedLetters().clear();
        roomRepository.saveAndFlush(room);
        logger.info("Game started in room {}", room.getCode());

        roundService.startNextRound(room.getId());
    }

    public void updateCategories(String code, List<String> categories) {
        Room room = requireWaitingRoom(code);
        if (categories == null) {
            throw new ValidationException("categories are required");
        }
        room.setCategories(new ArrayList<>(normalizeCategories(categories)));
        roomRepository.save(room);
        logger.info("Room {} categories updated: {}", room.getCode(), room.getCategories());
    }

    public void updateSettings(String code, Integer totalRounds, Integer timerDuration) {
        Room room = requireWaitingRoom(code);
        if (totalRounds != null) {
            room.setTotalRounds(checkTotalRounds(totalRounds));
        }
        if (timerDuration != null) {
            room.setTimerDuration(checkTimer(timerDuration));
        }
        roomRepository.save(room);
        logger.info("Room {} settings updated: rounds {}, timer {}s",
                room.getCode(), room.getTotalRounds(), room.getTimerDuration());
    }

    private Room requireWaitingRoom(String code) {
        Room room = roomAccess.requireRoom(code);
        if (room.getStatus() != Room.RoomStatus.WAITING) {
            throw new ValidationException("Settings can only be changed before the game starts");
        }
        return room;
    }

    private Player newPlayer(Room room, String name, boolean host) {
        Player player = new Player();
        player.setRoomId(room.getId());
        player.setName(name);
        player.setHost(host);
        player.setScore(0);
        player.setToken(UUID.randomUUID().toString());
        player.setJoinedAt(LocalDateTime.now(clock));
        return playerRepository.save(player);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("playerName is required");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("playerName is longer than " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    static int checkTotalRounds(int totalRounds) {
        if (totalRounds < MIN_ROUNDS || totalRounds > MAX_ROUNDS) {
            throw new ValidationException("totalRounds must be between " + MIN_ROUNDS + " and " + MAX_ROUNDS);
        }
        return totalRounds;
    }

    static int checkTimer(int timerDuration) {
        if (timerDuration < 0 || timerDuration > MAX_TIMER_SECONDS) {
            throw new ValidationException("timerDuration must be between 0 and " + MAX_TIMER_SECONDS);
        }
        return timerDuration;
    }

    static List<String> normalizeCategories(List<String> categories) {
        Set<String> result = new LinkedHashSet<>();
        for (String category : categories) {
            if (category == null || category.isBlank()) {
                throw new ValidationException("Category names must not be blank");
            }
            result.add(category.trim());
        }
        if (result.isEmpty()) {
            throw new ValidationException("At least one category is required");
        }
        return new ArrayList<>(result);
    }
}
