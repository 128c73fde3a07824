package com.glengine.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Read access to persisted journals.
 */
@Repository
public interface JournalRepository extends JpaRepository<Journal, String> {

    long countByTenantIdAndCompanyIdAndStatusNotAndJournalDateBetween(
        String tenantId, String companyId, JournalStatus status, LocalDate start, LocalDate end);

    @Query("select sum(l.debit) as totalDebits, sum(l.credit) as totalCredits " +
           "from JournalEntryLine l " +
           "where l.journal.tenantId = :tenantId and l.journal.companyId = :companyId " +
           "and l.journal.status = :status and l.journal.journalDate <= :asOf")
    TrialBalanceTotals sumLines(@Param("tenantId") String tenantId,
                                @Param("companyId") String companyId,
                                @Param("status") JournalStatus status,
                                @Param("asOf") LocalDate asOf);

    /**
     * Posted accrual journals in the range that have no reversing entry yet.
     */
    @Query("select j from Journal j " +
           "where j.tenantId = :tenantId and j.companyId = :companyId " +
           "and j.status = com.glengine.ledger.JournalStatus.POSTED " +
           "and j.journalDate between :start and :end " +
           "and upper(j.reference) like '%ACCRUAL%' " +
           "and not exists (select r.id from ReversingEntry r where r.originalJournalId = j.id) " +
           "order by j.journalDate, j.journalNumber")
    List<Journal> findUnreversedAccruals(@Param("tenantId") String tenantId,
                                         @Param("companyId") String companyId,
                                         @Param("start") LocalDate start,
                                         @Param("end") LocalDate end);

    default long countUnposted(String tenantId, String companyId, LocalDate start, LocalDate end) {
        return countByTenantIdAndCompanyIdAndStatusNotAndJournalDateBetween(
            tenantId, companyId, JournalStatus.POSTED, start, end);
    }

    default TrialBalanceTotals trialBalance(String tenantId, String companyId, LocalDate asOf) {
        return sumLines(tenantId, companyId, JournalStatus.POSTED, asOf);
    }
}
