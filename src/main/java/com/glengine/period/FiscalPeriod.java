package com.glengine.period;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A fiscal period of a company's fiscal calendar.
 *
 * Periods are created administratively. Status and the close/reopen audit
 * columns change only through the compare-and-swap updates on
 * {@link FiscalPeriodRepository}.
 */
@Entity
@Table(name = "fiscal_periods", indexes = {
    @Index(name = "idx_fiscal_periods_scope", columnList = "tenant_id, company_id"),
    @Index(name = "idx_fiscal_periods_calendar", columnList = "fiscal_calendar_id, period_number")
})
@Data
@NoArgsConstructor
public class FiscalPeriod {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "company_id", nullable = false)
    private String companyId;

    @Column(name = "fiscal_calendar_id")
    private String fiscalCalendarId;

    @Column(name = "period_number")
    private int periodNumber;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FiscalPeriodStatus status;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "closed_by")
    private String closedBy;

    @Column(name = "close_reason")
    private String closeReason;

    @Column(name = "reopened_at")
    private Instant reopenedAt;

    @Column(name = "reopened_by")
    private String reopenedBy;

    @Column(name = "reopen_reason")
    private String reopenReason;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public FiscalPeriod(String tenantId, String companyId, String fiscalCalendarId,
                        int periodNumber, LocalDate startDate, LocalDate endDate) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.companyId = companyId;
        this.fiscalCalendarId = fiscalCalendarId;
        this.periodNumber = periodNumber;
        this.startDate = startDate;
        this.endDate = endDate;
        this.status = FiscalPeriodStatus.OPEN;
        this.updatedAt = Instant.now();
    }
}
