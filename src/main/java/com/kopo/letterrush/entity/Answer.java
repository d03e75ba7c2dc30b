package com.kopo.letterrush.entity;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "answers", uniqueConstraints = @UniqueConstraint(columnNames = {"round_id", "player_id", "category"}))
@Data
public class Answer {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "round_id", nullable = false)
    private Long roundId;
    @Column(name = "player_id", nullable = false)
    private Long playerId;
    @Column(name = "category", nullable = false)
    private String category;
    @Column(nullable = false)
    private String word;
    @Column(name = "is_valid")
    private Boolean valid; // null while pending validation
    private int points = 0;
    @Column(columnDefinition = "TEXT")
    private String validationReason;
    private boolean communityRejected = false;
}
