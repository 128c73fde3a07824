package com.glengine.period;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Period operations under narrowly configured roles.
 *
 * {@code closer} may close but not lock, and every close it does is routed
 * through approval. {@code locker} may lock, with approval.
 */
@SpringBootTest(properties = {
    "gl-engine.sod.roles.closer.allow[0]=period:close",
    "gl-engine.sod.roles.closer.approval-actions[0]=period:close",
    "gl-engine.sod.roles.locker.allow[0]=period:lock",
    "gl-engine.sod.roles.locker.approval-actions[0]=period:lock"
})
@ActiveProfiles("test")
@Transactional
class PeriodRolePolicyTest {

    private static final String TENANT = "tenant-1";
    private static final String COMPANY = "company-1";

    @Autowired
    private PeriodLifecycleService service;

    @Autowired
    private FiscalPeriodRepository fiscalPeriodRepository;

    @Autowired
    private PeriodLockRepository periodLockRepository;

    private FiscalPeriod march;

    @BeforeEach
    void setUp() {
        march = fiscalPeriodRepository.save(new FiscalPeriod(TENANT, COMPANY, "FY2026", 3,
            LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 31)));
    }

    @Test
    void testCloseWithoutLockPermissionStillPlacesPostingLock() {
        PeriodOperationResult result = service.closeFiscalPeriod(PeriodCloseRequest.builder()
            .tenantId(TENANT)
            .companyId(COMPANY)
            .fiscalPeriodId(march.getId())
            .closeDate(Instant.now().minusSeconds(60))
            .closedBy("closer-1")
            .userRole("closer")
            .build());

        assertTrue(result.isSuccess(), result.getError());
        assertEquals(FiscalPeriodStatus.CLOSED,
            fiscalPeriodRepository.findById(march.getId()).orElseThrow().getStatus());

        List<PeriodLock> locks = periodLockRepository.findByFiscalPeriodIdAndActiveTrue(march.getId());
        assertEquals(1, locks.size());
        assertEquals(PeriodLockType.POSTING, locks.get(0).getLockType());
        assertEquals("closer-1", locks.get(0).getLockedBy());
        assertEquals("Period closed", locks.get(0).getReason());
    }

    @Test
    void testCloseFlaggedForApprovalReportsApprovers() {
        PeriodOperationResult result = service.closeFiscalPeriod(PeriodCloseRequest.builder()
            .tenantId(TENANT)
            .companyId(COMPANY)
            .fiscalPeriodId(march.getId())
            .closeDate(Instant.now().minusSeconds(60))
            .closedBy("closer-1")
            .userRole("closer")
            .build());

        assertTrue(result.isSuccess(), result.getError());
        assertTrue(result.isRequiresApproval());
        assertEquals(List.of("manager", "admin"), result.getApproverRoles());
    }

    @Test
    void testDirectLockStillNeedsLockPermission() {
        PeriodLockResult result = service.createPeriodLock(lockRequest("closer"));

        assertFalse(result.isSuccess());
        assertEquals(PeriodErrorCode.SOD_VIOLATION, result.getCode());
        assertTrue(periodLockRepository.findByFiscalPeriodIdOrderByCreatedAt(march.getId()).isEmpty());
    }

    @Test
    void testLockFlaggedForApprovalReportsApprovers() {
        PeriodLockResult result = service.createPeriodLock(lockRequest("locker"));

        assertTrue(result.isSuccess(), result.getError());
        assertTrue(result.isRequiresApproval());
        assertEquals(List.of("manager", "admin"), result.getApproverRoles());
    }

    private PeriodLockRequest lockRequest(String role) {
        return PeriodLockRequest.builder()
            .tenantId(TENANT)
            .companyId(COMPANY)
            .fiscalPeriodId(march.getId())
            .lockType(PeriodLockType.REPORTING)
            .lockedBy("user-9")
            .userRole(role)
            .reason("Audit")
            .build();
    }
}
