package com.kopo.letterrush.repository;

import com.kopo.letterrush.entity.Room;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.util.Optional;

@Repository
public interface RoomRepository extends JpaRepository<Room, Long> {
    Optional<Room> findByCode(String code);

    boolean existsByCode(String code);

    /**
     * Loads the room holding a row lock until the surrounding transaction ends.
     * Serializes round creation and joins for one room.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Room r WHERE r.id = :id")
    Optional<Room> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Room r WHERE r.code = :code")
    Optional<Room> findByCodeForUpdate(@Param("code") String code);

    /**
     * Finishes the room once its round counter has reached the round budget.
     *
     * @return number of rows changed, 0 when the budget is not spent or the room is already finished
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Room r SET r.status = :finished " +
           "WHERE r.id = :id AND r.roundNumber >= r.totalRounds AND r.status <> :finished")
    int finishIfRoundBudgetSpent(@Param("id") Long id, @Param("finished") Room.RoomStatus finished);
}
