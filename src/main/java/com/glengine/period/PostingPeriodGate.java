package com.glengine.period;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Answers whether a posting date falls in a period that is locked for posting.
 */
@Component
@RequiredArgsConstructor
public class PostingPeriodGate {

    private static final Set<PeriodLockType> POSTING_LOCKS = Arrays.stream(PeriodLockType.values())
        .filter(PeriodLockType::blocksPosting)
        .collect(Collectors.toCollection(() -> EnumSet.noneOf(PeriodLockType.class)));

    private final PeriodLockRepository periodLockRepository;

    @Transactional(readOnly = true)
    public boolean isPostingLocked(String tenantId, String companyId, LocalDate journalDate) {
        return periodLockRepository.countActiveLocksCovering(tenantId, companyId, journalDate, POSTING_LOCKS) > 0;
    }
}
