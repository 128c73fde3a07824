package com.glengine.period;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public interface PeriodLockRepository extends JpaRepository<PeriodLock, String> {

    List<PeriodLock> findByFiscalPeriodIdAndActiveTrue(String fiscalPeriodId);

    List<PeriodLock> findByFiscalPeriodIdOrderByCreatedAt(String fiscalPeriodId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update PeriodLock l set l.active = false, l.releasedAt = :now " +
           "where l.fiscalPeriodId = :fiscalPeriodId and l.active = true")
    int deactivateAll(@Param("fiscalPeriodId") String fiscalPeriodId, @Param("now") Instant now);

    /**
     * Active locks of the given types on any period of the company that contains the date.
     */
    @Query("select count(l) from PeriodLock l, FiscalPeriod p " +
           "where l.fiscalPeriodId = p.id and l.active = true and l.lockType in :lockTypes " +
           "and p.tenantId = :tenantId and p.companyId = :companyId " +
           "and p.startDate <= :date and p.endDate >= :date")
    long countActiveLocksCovering(@Param("tenantId") String tenantId,
                                  @Param("companyId") String companyId,
                                  @Param("date") LocalDate date,
                                  @Param("lockTypes") Collection<PeriodLockType> lockTypes);
}
