package com.glengine.period;

import com.glengine.ledger.Journal;
import com.glengine.ledger.JournalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Schedules reversals of a closing period's accrual journals on the first day
 * of the next period. Journals that already have a reversing entry are skipped,
 * so running it twice creates nothing new.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReversingEntryGenerator {

    private final JournalRepository journalRepository;
    private final ReversingEntryRepository reversingEntryRepository;

    @Transactional
    public int generate(FiscalPeriod period, FiscalPeriod nextPeriod, String createdBy) {
        if (nextPeriod == null) {
            log.info("No next period after {}; no reversing entries scheduled", period.getId());
            return 0;
        }

        List<Journal> accruals = journalRepository.findUnreversedAccruals(
            period.getTenantId(), period.getCompanyId(), period.getStartDate(), period.getEndDate());

        int created = 0;
        for (Journal journal : accruals) {
            if (reversingEntryRepository.existsByOriginalJournalId(journal.getId())) {
                continue;
            }
            reversingEntryRepository.save(new ReversingEntry(
                period.getTenantId(),
                period.getCompanyId(),
                journal.getId(),
                period.getId(),
                nextPeriod.getStartDate(),
                "Auto-reversal for period close: " + journal.getDescription(),
                createdBy));
            created++;
        }

        log.info("Scheduled {} reversing entries for period {} on {}",
            created, period.getId(), nextPeriod.getStartDate());
        return created;
    }
}
