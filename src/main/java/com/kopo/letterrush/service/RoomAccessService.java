package com.kopo.letterrush.service;

import com.kopo.letterrush.entity.Player;
import com.kopo.letterrush.entity.Room;
import com.kopo.letterrush.exception.ForbiddenException;
import com.kopo.letterrush.exception.NotFoundException;
import com.kopo.letterrush.exception.UnauthorizedException;
import com.kopo.letterrush.repository.PlayerRepository;
import com.kopo.letterrush.repository.RoomRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves room codes and player tokens. Tokens are opaque values checked against the store.
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class RoomAccessService {

    private final RoomRepository roomRepository;
    private final PlayerRepository playerRepository;

    public Room requireRoom(String code) {
        if (code == null || code.isBlank()) {
            throw new NotFoundException("Room not found");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return roomRepository.findByCode(normalized)
                .orElseThrow(() -> new NotFoundException("Room not found: " + normalized));
    }

    @Transactional
    public Room requireRoomForUpdate(String code) {
        if (code == null || code.isBlank()) {
            throw new NotFoundException("Room not found");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return roomRepository.findByCodeForUpdate(normalized)
                .orElseThrow(() -> new NotFoundException("Room not found: " + normalized));
    }

    public Room requireRoom(Long roomId) {
        return roomRepository.findById(roomId)
                .orElseThrow(() -> new NotFoundException("Room not found: " + roomId));
    }

    /**
     * @throws UnauthorizedException when the token is missing or unknown
     * @throws ForbiddenException when the token belongs to a player of another room
     */
    public Player requirePlayer(Room room, String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException("Missing player token");
        }
        Player player = playerRepository.findByToken(token.trim())
                .orElseThrow(() -> new UnauthorizedException("Unknown player token"));
        if (!player.getRoomId().equals(room.getId())) {
            throw new ForbiddenException("Player does not belong to room " + room.getCode());
        }
        return player;
    }

    public Player requireHost(Room room, String token) {
        Player player = requirePlayer(room, token);
        if (!player.isHost()) {
            throw new ForbiddenException("Only the host can do this");
        }
        return player;
    }

    // lenient: an absent or foreign token yields no player
    public Optional<Player> findPlayer(Room room, String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return playerRepository.findByToken(token.trim())
                .filter(p -> p.getRoomId().equals(room.getId()));
    }
}
