package com.glengine.period;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Fiscal period access. Status changes are compare-and-swap updates that
 * return the number of rows changed: 0 means another caller won the race.
 */
@Repository
public interface FiscalPeriodRepository extends JpaRepository<FiscalPeriod, String> {

    Optional<FiscalPeriod> findByTenantIdAndCompanyIdAndFiscalCalendarIdAndPeriodNumber(
        String tenantId, String companyId, String fiscalCalendarId, int periodNumber);

    default Optional<FiscalPeriod> findNext(FiscalPeriod period) {
        if (period.getFiscalCalendarId() == null) {
            return Optional.empty();
        }
        return findByTenantIdAndCompanyIdAndFiscalCalendarIdAndPeriodNumber(period.getTenantId(),
            period.getCompanyId(), period.getFiscalCalendarId(), period.getPeriodNumber() + 1);
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update FiscalPeriod p set p.status = com.glengine.period.FiscalPeriodStatus.CLOSED, " +
           "p.closedAt = :closedAt, p.closedBy = :closedBy, p.closeReason = :closeReason, p.updatedAt = :now " +
           "where p.id = :id and p.status = com.glengine.period.FiscalPeriodStatus.OPEN")
    int closeIfOpen(@Param("id") String id,
                    @Param("closedAt") Instant closedAt,
                    @Param("closedBy") String closedBy,
                    @Param("closeReason") String closeReason,
                    @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update FiscalPeriod p set p.status = com.glengine.period.FiscalPeriodStatus.OPEN, " +
           "p.closedAt = null, p.closedBy = null, p.closeReason = null, " +
           "p.reopenedAt = :now, p.reopenedBy = :openedBy, p.reopenReason = :openReason, p.updatedAt = :now " +
           "where p.id = :id and p.status = :expected")
    int reopenIfStatus(@Param("id") String id,
                       @Param("expected") FiscalPeriodStatus expected,
                       @Param("openedBy") String openedBy,
                       @Param("openReason") String openReason,
                       @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update FiscalPeriod p set p.status = com.glengine.period.FiscalPeriodStatus.LOCKED, p.updatedAt = :now " +
           "where p.id = :id and p.status = com.glengine.period.FiscalPeriodStatus.CLOSED")
    int lockIfClosed(@Param("id") String id, @Param("now") Instant now);
}
