package com.kopo.letterrush.repository;

import com.kopo.letterrush.entity.Player;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.util.List;
import java.util.Optional;

@Repository
public interface PlayerRepository extends JpaRepository<Player, Long> {
    List<Player> findByRoomIdOrderByIdAsc(Long roomId);

    long countByRoomId(Long roomId);

    Optional<Player> findByToken(String token);

    boolean existsByRoomIdAndNameIgnoreCase(Long roomId, String name);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Player p SET p.score = p.score + :delta WHERE p.id = :id")
    int addToScore(@Param("id") Long id, @Param("delta") int delta);
}
