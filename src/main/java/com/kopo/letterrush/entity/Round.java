package com.kopo.letterrush.entity;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

@Entity
@Table(name = "rounds")
@Data
public class Round {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "room_id", nullable = false)
    private Long roomId;
    @Column(name = "round_number", nullable = false)
    private int roundNumber;
    @Column(nullable = false, length = 1)
    private String letter;
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RoundStatus status = RoundStatus.ACTIVE;
    private LocalDateTime firstSubmissionAt;
    private LocalDateTime startedAt;
    private LocalDateTime endedAt;
    private LocalDateTime validatedAt;

    public enum RoundStatus {
        ACTIVE, COMPLETED
    }
}
