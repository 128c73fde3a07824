package com.glengine.period;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReversingEntryRepository extends JpaRepository<ReversingEntry, String> {

    boolean existsByOriginalJournalId(String originalJournalId);

    List<ReversingEntry> findByFiscalPeriodId(String fiscalPeriodId);
}
