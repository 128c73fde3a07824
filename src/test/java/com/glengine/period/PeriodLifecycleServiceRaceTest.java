package com.glengine.period;

import com.glengine.common.exception.PeriodLockException;
import com.glengine.sod.SoDAuthorizer;
import com.glengine.sod.SoDDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for losing a concurrent status transition.
 *
 * The repository reports 0 rows changed, as it would when another transaction
 * moved the period first; the service must then write nothing else.
 */
@ExtendWith(MockitoExtension.class)
class PeriodLifecycleServiceRaceTest {

    @Mock
    private FiscalPeriodRepository fiscalPeriodRepository;

    @Mock
    private PeriodLockRepository periodLockRepository;

    @Mock
    private PeriodCloseValidator periodCloseValidator;

    @Mock
    private ReversingEntryGenerator reversingEntryGenerator;

    @Mock
    private SoDAuthorizer sodAuthorizer;

    private PeriodLifecycleService service;

    private FiscalPeriod period;

    @BeforeEach
    void setUp() {
        service = new PeriodLifecycleService(fiscalPeriodRepository, periodLockRepository,
            periodCloseValidator, reversingEntryGenerator, sodAuthorizer);
        period = new FiscalPeriod("tenant-1", "company-1", "FY2026", 3,
            LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 31));
    }

    @Test
    void testLosingCloseWritesNothing() {
        PeriodCloseValidation clean = new PeriodCloseValidation(true, List.of(), List.of(),
            new PeriodCloseChecks(true, true, true, true, false, true), BigDecimal.ZERO);

        when(fiscalPeriodRepository.findById(period.getId())).thenReturn(Optional.of(period));
        when(sodAuthorizer.check(any())).thenReturn(SoDDecision.allow());
        when(periodCloseValidator.validate(period)).thenReturn(clean);
        when(fiscalPeriodRepository.closeIfOpen(eq(period.getId()), any(), any(), any(), any())).thenReturn(0);

        PeriodOperationResult result = service.closeFiscalPeriod(PeriodCloseRequest.builder()
            .tenantId("tenant-1")
            .companyId("company-1")
            .fiscalPeriodId(period.getId())
            .closeDate(Instant.now().minusSeconds(5))
            .closedBy("controller-2")
            .userRole("manager")
            .generateReversingEntries(true)
            .build());

        assertFalse(result.isSuccess());
        assertEquals(PeriodErrorCode.PERIOD_ALREADY_CLOSED, result.getCode());

        verify(fiscalPeriodRepository, never()).findNext(any());
        verify(reversingEntryGenerator, never()).generate(any(), any(), any());
        verify(periodLockRepository, never()).save(any());
    }

    @Test
    void testLosingReopenReleasesNothing() {
        period.setStatus(FiscalPeriodStatus.CLOSED);

        when(fiscalPeriodRepository.findById(period.getId())).thenReturn(Optional.of(period));
        when(sodAuthorizer.check(any())).thenReturn(SoDDecision.allow());
        when(fiscalPeriodRepository.reopenIfStatus(eq(period.getId()), eq(FiscalPeriodStatus.CLOSED),
            any(), any(), any())).thenReturn(0);

        PeriodOperationResult result = service.openFiscalPeriod(PeriodOpenRequest.builder()
            .tenantId("tenant-1")
            .companyId("company-1")
            .fiscalPeriodId(period.getId())
            .openedBy("cfo-2")
            .userRole("admin")
            .openReason("Correction")
            .build());

        assertFalse(result.isSuccess());
        assertEquals(PeriodErrorCode.PERIOD_ALREADY_OPEN, result.getCode());
        verify(periodLockRepository, never()).deactivateAll(any(), any());
    }

    @Test
    void testLockInsertFailureDuringCloseIsInfrastructureError() {
        PeriodCloseValidation clean = new PeriodCloseValidation(true, List.of(), List.of(),
            new PeriodCloseChecks(true, true, true, true, false, true), BigDecimal.ZERO);

        when(fiscalPeriodRepository.findById(period.getId())).thenReturn(Optional.of(period));
        when(sodAuthorizer.check(any())).thenReturn(SoDDecision.allow());
        when(periodCloseValidator.validate(period)).thenReturn(clean);
        when(fiscalPeriodRepository.closeIfOpen(eq(period.getId()), any(), any(), any(), any())).thenReturn(1);
        when(fiscalPeriodRepository.findNext(period)).thenReturn(Optional.empty());
        when(periodLockRepository.save(any())).thenThrow(new DataIntegrityViolationException("duplicate lock"));

        PeriodLockException thrown = assertThrows(PeriodLockException.class,
            () -> service.closeFiscalPeriod(PeriodCloseRequest.builder()
                .tenantId("tenant-1")
                .companyId("company-1")
                .fiscalPeriodId(period.getId())
                .closeDate(Instant.now().minusSeconds(5))
                .closedBy("controller-2")
                .userRole("manager")
                .build()));

        assertInstanceOf(DataIntegrityViolationException.class, thrown.getCause());
        // only period:close is checked; the close's own lock needs no separate grant
        verify(sodAuthorizer, times(1)).check(any());
    }
}
