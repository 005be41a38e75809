package com.flagship.topup_gateway.topup;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface TopupRepository extends JpaRepository<TopupEntity, Long> {

    Optional<TopupEntity> findByIdempotencyKey(String idempotencyKey);

    /**
     * Clears the trash marker on every trashed topup.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TopupEntity t SET t.deletedAt = NULL, t.updatedAt = :now WHERE t.deletedAt IS NOT NULL")
    int restoreAllTrashed(@Param("now") Instant now);

    /**
     * Permanently removes every trashed topup. Live rows are untouched.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TopupEntity t WHERE t.deletedAt IS NOT NULL")
    int deleteAllTrashed();
}
