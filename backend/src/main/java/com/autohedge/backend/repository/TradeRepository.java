package com.autohedge.backend.repository;

import com.autohedge.backend.model.Trade;
import com.autohedge.backend.model.TradeStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Status changes are compare-and-set on (id, expected status) and bump the version column.
 * Each returns the number of rows written: 0 means the trade was deleted or had already moved on.
 */
public interface TradeRepository extends JpaRepository<Trade, String> {

    Optional<Trade> findByIdAndUserId(String id, String userId);

    List<Trade> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);

    List<Trade> findByUserIdAndStatusOrderByCreatedAtDesc(String userId, TradeStatus status, Pageable pageable);

    List<Trade> findByUserIdAndCreatedAtGreaterThanEqual(String userId, Instant since);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Trade t set t.status = :next, t.startedAt = :startedAt, t.version = t.version + 1 "
            + "where t.id = :id and t.status = :expected")
    int markRunning(@Param("id") String id,
                    @Param("expected") TradeStatus expected,
                    @Param("next") TradeStatus next,
                    @Param("startedAt") Instant startedAt);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Trade t set t.status = :next, t.completedAt = :completedAt, t.resultJson = :resultJson, "
            + "t.errorMessage = :errorMessage, t.version = t.version + 1 "
            + "where t.id = :id and t.status = :expected")
    int finish(@Param("id") String id,
               @Param("expected") TradeStatus expected,
               @Param("next") TradeStatus next,
               @Param("completedAt") Instant completedAt,
               @Param("resultJson") String resultJson,
               @Param("errorMessage") String errorMessage);

    /** Fails a trade that was never handed to the executor. Callable from after-commit callbacks. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Trade t set t.status = com.autohedge.backend.model.TradeStatus.FAILED, t.completedAt = :completedAt, "
            + "t.errorMessage = :errorMessage, t.version = t.version + 1 "
            + "where t.id = :id and t.status = com.autohedge.backend.model.TradeStatus.PENDING")
    int failPending(@Param("id") String id,
                    @Param("completedAt") Instant completedAt,
                    @Param("errorMessage") String errorMessage);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Trade t where t.id = :id and t.userId = :userId")
    int deleteOwned(@Param("id") String id, @Param("userId") String userId);
}
