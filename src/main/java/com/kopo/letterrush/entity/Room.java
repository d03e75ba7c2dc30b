package com.kopo.letterrush.entity;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "rooms")
@Data
public class Room {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(unique = true, nullable = false)
    private String code;
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RoomStatus status = RoomStatus.WAITING;
    private int roundNumber = 0;
    private int totalRounds = 5;
    private Integer timerDuration; // seconds after the first submission, null or 0 = no timer
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "room_categories", joinColumns = @JoinColumn(name = "room_id"))
    @OrderColumn(name = "item_index")
    @Column(name = "category", nullable = false)
    private List<String> categories = new ArrayList<>();
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "room_used_letters", joinColumns = @JoinColumn(name = "room_id"))
    @OrderColumn(name = "item_index")
    @Column(name = "letter", nullable = false)
    private List<String> usedLetters = new ArrayList<>();
    private LocalDateTime createdAt;

    public boolean hasTimer() {
        return timerDuration != null && timerDuration > 0;
    }

    public int timerSeconds() {
        return hasTimer() ? timerDuration : 0;
    }

    /**
     * Moves the room forward in its lifecycle. A finished room never goes back to an earlier status.
     */
    public void moveTo(RoomStatus next) {
        if (next.ordinal() < status.ordinal()) {
            throw new IllegalStateException("Room " + code + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    public enum RoomStatus {
        WAITING, PLAYING, FINISHED
    }
}
