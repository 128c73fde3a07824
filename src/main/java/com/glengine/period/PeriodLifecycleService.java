package com.glengine.period;

import com.glengine.common.exception.PeriodLockException;
import com.glengine.sod.SoDAction;
import com.glengine.sod.SoDAuthorizer;
import com.glengine.sod.SoDDecision;
import com.glengine.sod.SoDRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fiscal period state machine.
 *
 * <pre>
 * OPEN   --close--> CLOSED   (plus an active POSTING lock)
 * CLOSED --lock FULL--> LOCKED
 * CLOSED/LOCKED --open--> OPEN (all locks deactivated)
 * </pre>
 *
 * Every transition is a compare-and-swap on the status read at the start of
 * the operation, so of two concurrent closes (or opens) of one period only one
 * succeeds; the other gets PERIOD_ALREADY_CLOSED (or PERIOD_ALREADY_OPEN).
 * Each operation runs in one transaction. A period belonging to another
 * tenant or company is reported as not found.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PeriodLifecycleService {

    private final FiscalPeriodRepository fiscalPeriodRepository;
    private final PeriodLockRepository periodLockRepository;
    private final PeriodCloseValidator periodCloseValidator;
    private final ReversingEntryGenerator reversingEntryGenerator;
    private final SoDAuthorizer sodAuthorizer;

    @Transactional
    public PeriodOperationResult closeFiscalPeriod(PeriodCloseRequest request) {
        List<String> inputErrors = validateCloseRequest(request);
        if (!inputErrors.isEmpty()) {
            return PeriodOperationResult.builder()
                .success(false)
                .code(PeriodErrorCode.INVALID_INPUT)
                .error("Input validation failed: " + String.join(", ", inputErrors))
                .inputErrors(inputErrors)
                .build();
        }

        Optional<FiscalPeriod> found = findOwned(request.getFiscalPeriodId(), request.getTenantId(), request.getCompanyId());
        if (found.isEmpty()) {
            return PeriodOperationResult.failure(PeriodErrorCode.PERIOD_NOT_FOUND, "Fiscal period not found");
        }
        FiscalPeriod period = found.get();
        if (period.getStatus().isClosed()) {
            return PeriodOperationResult.failure(PeriodErrorCode.PERIOD_ALREADY_CLOSED,
                "Period is already " + period.getStatus().name().toLowerCase());
        }

        SoDDecision decision = authorize(request.getTenantId(), request.getCompanyId(),
            request.getClosedBy(), request.getUserRole(), SoDAction.PERIOD_CLOSE);
        if (!decision.isAllowed()) {
            return PeriodOperationResult.failure(PeriodErrorCode.SOD_VIOLATION, "SoD violation: " + decision.getReason());
        }

        PeriodCloseValidation validation = periodCloseValidator.validate(period);
        if (!validation.isCanClose()) {
            if (!request.isForceClose()) {
                log.warn("Close of period {} refused: {}", period.getId(), validation.getErrors());
                return PeriodOperationResult.builder()
                    .success(false)
                    .code(PeriodErrorCode.PERIOD_CLOSE_VALIDATION_FAILED)
                    .error("Period cannot be closed: " + String.join(", ", validation.getErrors()))
                    .fiscalPeriodId(period.getId())
                    .validation(validation)
                    .build();
            }
            log.warn("Force-closing period {} despite: {}", period.getId(), validation.getErrors());
        }

        // Claim the period first; the loser of a concurrent close writes nothing.
        int updated = fiscalPeriodRepository.closeIfOpen(period.getId(), request.getCloseDate(),
            request.getClosedBy(), request.getCloseReason(), Instant.now());
        if (updated == 0) {
            log.info("Period {} was closed concurrently", period.getId());
            return PeriodOperationResult.failure(PeriodErrorCode.PERIOD_ALREADY_CLOSED, "Period is already closed");
        }

        Optional<FiscalPeriod> nextPeriod = fiscalPeriodRepository.findNext(period);
        int reversingEntries = 0;
        if (request.isGenerateReversingEntries()) {
            reversingEntries = reversingEntryGenerator.generate(period, nextPeriod.orElse(null), request.getClosedBy());
        }

        // Authorized by period:close above; the posting lock is part of the close.
        PeriodLock lock = insertLock(period, PeriodLockType.POSTING, request.getClosedBy(),
            request.getCloseReason() != null ? request.getCloseReason() : "Period closed");

        log.info("Period {} CLOSED by {} ({} reversing entries, lock {})",
            period.getId(), request.getClosedBy(), reversingEntries, lock.getId());

        return PeriodOperationResult.builder()
            .success(true)
            .fiscalPeriodId(period.getId())
            .status(FiscalPeriodStatus.CLOSED)
            .closedAt(request.getCloseDate())
            .closedBy(request.getClosedBy())
            .reversingEntriesCreated(reversingEntries)
            .nextPeriodId(nextPeriod.map(FiscalPeriod::getId).orElse(null))
            .validation(validation)
            .requiresApproval(decision.isRequiresApproval())
            .approverRoles(approverRoles(decision))
            .build();
    }

    @Transactional
    public PeriodOperationResult openFiscalPeriod(PeriodOpenRequest request) {
        if (isBlank(request.getFiscalPeriodId()) || isBlank(request.getOpenedBy()) || isBlank(request.getOpenReason())) {
            return PeriodOperationResult.failure(PeriodErrorCode.INVALID_INPUT, "Missing required fields for period open");
        }

        Optional<FiscalPeriod> found = findOwned(request.getFiscalPeriodId(), request.getTenantId(), request.getCompanyId());
        if (found.isEmpty()) {
            return PeriodOperationResult.failure(PeriodErrorCode.PERIOD_NOT_FOUND, "Fiscal period not found");
        }
        FiscalPeriod period = found.get();
        if (period.getStatus() == FiscalPeriodStatus.OPEN) {
            return PeriodOperationResult.failure(PeriodErrorCode.PERIOD_ALREADY_OPEN, "Period is already open");
        }

        SoDDecision decision = authorize(request.getTenantId(), request.getCompanyId(),
            request.getOpenedBy(), request.getUserRole(), SoDAction.PERIOD_OPEN);
        if (!decision.isAllowed()) {
            return PeriodOperationResult.failure(PeriodErrorCode.SOD_VIOLATION, "SoD violation: " + decision.getReason());
        }
        if (request.isApprovalRequired() && !decision.isRequiresApproval()) {
            return PeriodOperationResult.failure(PeriodErrorCode.APPROVAL_REQUIRED,
                "Period open requires approval from " + String.join(" or ", sodAuthorizer.getApproverRoles()));
        }

        Instant now = Instant.now();
        int updated = fiscalPeriodRepository.reopenIfStatus(period.getId(), period.getStatus(),
            request.getOpenedBy(), request.getOpenReason(), now);
        if (updated == 0) {
            log.info("Period {} was reopened concurrently", period.getId());
            return PeriodOperationResult.failure(PeriodErrorCode.PERIOD_ALREADY_OPEN, "Period is already open");
        }

        int released = periodLockRepository.deactivateAll(period.getId(), now);

        log.info("Period {} reopened from {} by {}: {} (released {} locks)",
            period.getId(), period.getStatus(), request.getOpenedBy(), request.getOpenReason(), released);

        return PeriodOperationResult.builder()
            .success(true)
            .fiscalPeriodId(period.getId())
            .status(FiscalPeriodStatus.OPEN)
            .requiresApproval(decision.isRequiresApproval())
            .approverRoles(approverRoles(decision))
            .build();
    }

    /**
     * Place a lock on a period. A FULL lock on a CLOSED period also moves it to LOCKED.
     */
    @Transactional
    public PeriodLockResult createPeriodLock(PeriodLockRequest request) {
        List<String> inputErrors = validateLockRequest(request);
        if (!inputErrors.isEmpty()) {
            return PeriodLockResult.refused(PeriodErrorCode.INVALID_INPUT,
                "Input validation failed: " + String.join(", ", inputErrors));
        }

        Optional<FiscalPeriod> found = findOwned(request.getFiscalPeriodId(), request.getTenantId(), request.getCompanyId());
        if (found.isEmpty()) {
            return PeriodLockResult.refused(PeriodErrorCode.PERIOD_NOT_FOUND, "Fiscal period not found");
        }

        SoDDecision decision = authorize(request.getTenantId(), request.getCompanyId(),
            request.getLockedBy(), request.getUserRole(), SoDAction.PERIOD_LOCK);
        if (!decision.isAllowed()) {
            return PeriodLockResult.refused(PeriodErrorCode.SOD_VIOLATION, "SoD violation: " + decision.getReason());
        }

        PeriodLock lock = insertLock(found.get(), request.getLockType(), request.getLockedBy(), request.getReason());

        if (request.getLockType() == PeriodLockType.FULL && found.get().getStatus() == FiscalPeriodStatus.CLOSED) {
            if (fiscalPeriodRepository.lockIfClosed(request.getFiscalPeriodId(), Instant.now()) == 1) {
                log.info("Period {} LOCKED", request.getFiscalPeriodId());
            }
        }

        log.info("Created {} lock {} on period {} by {}",
            lock.getLockType(), lock.getId(), lock.getFiscalPeriodId(), lock.getLockedBy());
        return PeriodLockResult.locked(lock.getId(), decision.isRequiresApproval(), approverRoles(decision));
    }

    private Optional<FiscalPeriod> findOwned(String fiscalPeriodId, String tenantId, String companyId) {
        return fiscalPeriodRepository.findById(fiscalPeriodId)
            .filter(period -> period.getTenantId().equals(tenantId) && period.getCompanyId().equals(companyId));
    }

    private PeriodLock insertLock(FiscalPeriod period, PeriodLockType lockType, String lockedBy, String reason) {
        try {
            return periodLockRepository.save(new PeriodLock(period.getTenantId(), period.getCompanyId(),
                period.getId(), lockType, lockedBy, reason));
        } catch (DataAccessException e) {
            throw new PeriodLockException(period.getId(), e.getMessage(), e);
        }
    }

    private List<String> approverRoles(SoDDecision decision) {
        return decision.isRequiresApproval() ? sodAuthorizer.getApproverRoles() : List.of();
    }

    private SoDDecision authorize(String tenantId, String companyId, String userId, String userRole, SoDAction action) {
        return sodAuthorizer.check(SoDRequest.builder()
            .tenantId(tenantId)
            .companyId(companyId)
            .userId(userId)
            .userRole(userRole)
            .action(action)
            .build());
    }

    private List<String> validateCloseRequest(PeriodCloseRequest request) {
        List<String> errors = new ArrayList<>();
        if (isBlank(request.getTenantId())) {
            errors.add("Tenant ID is required");
        }
        if (isBlank(request.getCompanyId())) {
            errors.add("Company ID is required");
        }
        if (isBlank(request.getFiscalPeriodId())) {
            errors.add("Fiscal period ID is required");
        }
        if (isBlank(request.getClosedBy())) {
            errors.add("Closed by user ID is required");
        }
        if (isBlank(request.getUserRole())) {
            errors.add("User role is required");
        }
        if (request.getCloseDate() == null) {
            errors.add("Close date is required");
        } else if (request.getCloseDate().isAfter(Instant.now())) {
            errors.add("Close date cannot be in the future");
        }
        return errors;
    }

    private List<String> validateLockRequest(PeriodLockRequest request) {
        List<String> errors = new ArrayList<>();
        if (isBlank(request.getTenantId())) {
            errors.add("Tenant ID is required");
        }
        if (isBlank(request.getCompanyId())) {
            errors.add("Company ID is required");
        }
        if (isBlank(request.getFiscalPeriodId())) {
            errors.add("Fiscal period ID is required");
        }
        if (request.getLockType() == null) {
            errors.add("Lock type is required");
        }
        if (isBlank(request.getLockedBy())) {
            errors.add("Locked by user ID is required");
        }
        if (isBlank(request.getUserRole())) {
            errors.add("User role is required");
        }
        if (isBlank(request.getReason())) {
            errors.add("Reason is required");
        }
        return errors;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
