package com.kopo.letterrush.entity;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

@Entity
@Table(name = "players", uniqueConstraints = @UniqueConstraint(columnNames = {"room_id", "name"}))
@Data
public class Player {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "room_id", nullable = false)
    private Long roomId;
    @Column(name = "name", nullable = false)
    private String name;
    private int score = 0;
    private boolean host = false;
    @Column(unique = true, nullable = false)
    private String token; // opaque bearer credential, only handed to the player itself
    private LocalDateTime joinedAt;
}
