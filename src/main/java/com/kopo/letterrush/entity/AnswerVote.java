package com.kopo.letterrush.entity;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

@Entity
@Table(name = "answer_votes", uniqueConstraints = @UniqueConstraint(columnNames = {"answer_id", "player_id"}))
@Data
public class AnswerVote {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "answer_id", nullable = false)
    private Long answerId;
    @Column(name = "player_id", nullable = false)
    private Long playerId;
    private boolean accepted;
    private LocalDateTime createdAt;
}
