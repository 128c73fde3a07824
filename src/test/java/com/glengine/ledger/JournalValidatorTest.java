package com.glengine.ledger;

import com.glengine.accounts.Account;
import com.glengine.accounts.AccountType;
import com.glengine.accounts.ChartOfAccountsRegistry;
import com.glengine.accounts.ChartOfAccountsTemplate;
import com.glengine.period.FiscalPeriod;
import com.glengine.period.FiscalPeriodRepository;
import com.glengine.period.PeriodLock;
import com.glengine.period.PeriodLockRepository;
import com.glengine.period.PeriodLockType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for journal validation against the standard chart of accounts.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JournalValidatorTest {

    private static final String TENANT = "tenant-1";
    private static final String COMPANY = "company-1";

    @Autowired
    private JournalValidator validator;

    @Autowired
    private ChartOfAccountsRegistry registry;

    @Autowired
    private ChartOfAccountsTemplate template;

    @Autowired
    private FiscalPeriodRepository fiscalPeriodRepository;

    @Autowired
    private PeriodLockRepository periodLockRepository;

    @BeforeEach
    void setUp() {
        registry.clear();
        template.install("MYR");
        registry.register(new Account("acct_closed_1999", "1999", "Old Bank", AccountType.ASSET, null, "MYR", false));
        registry.register(new Account("acct_usd_bank_1010", "1010", "USD Bank", AccountType.ASSET, null, "USD", true));
    }

    @Test
    void testBalancedJournalIsValidated() {
        JournalValidationResult result = validator.validate(journal("accountant",
            JournalLine.debit(ChartOfAccountsTemplate.BANK, new BigDecimal("100.00"), "Cash sale", null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("100.00"), "Cash sale", null)));

        assertTrue(result.isValidated());
        assertNull(result.getCode());
        assertEquals(0, new BigDecimal("100.00").compareTo(result.getTotalDebit()));
        assertEquals(0, new BigDecimal("100.00").compareTo(result.getTotalCredit()));
        assertFalse(result.isRequiresApproval());
        assertTrue(result.getApproverRoles().isEmpty());
        assertTrue(result.getCoaWarnings().isEmpty());
    }

    @Test
    void testUnbalancedJournalReportsSignedDifference() {
        JournalValidationResult result = validator.validate(journal("accountant",
            JournalLine.debit(ChartOfAccountsTemplate.BANK, new BigDecimal("100"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("99"), null, null)));

        assertFalse(result.isValidated());
        assertEquals(PostingErrorCode.JOURNAL_UNBALANCED, result.getCode());
        assertEquals(0, new BigDecimal("1.00").compareTo(result.getDifference()));
        assertNotNull(result.getError());
    }

    @Test
    void testCreditHeavyJournalHasNegativeDifference() {
        JournalValidationResult result = validator.validate(journal("accountant",
            JournalLine.debit(ChartOfAccountsTemplate.BANK, new BigDecimal("50.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("52.50"), null, null)));

        assertEquals(PostingErrorCode.JOURNAL_UNBALANCED, result.getCode());
        assertEquals(0, new BigDecimal("-2.50").compareTo(result.getDifference()));
    }

    @Test
    void testBalanceToleranceBoundary() {
        Random random = new Random(42);

        for (int i = 0; i < 40; i++) {
            BigDecimal debit = BigDecimal.valueOf(100 + random.nextInt(900_000), 2);
            BigDecimal delta = BigDecimal.valueOf(random.nextInt(11) - 5, 2);
            BigDecimal credit = debit.add(delta);

            JournalValidationResult result = validator.validate(journal("admin",
                JournalLine.debit(ChartOfAccountsTemplate.BANK, debit, null, null),
                JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, credit, null, null)));

            if (delta.abs().compareTo(new BigDecimal("0.01")) <= 0) {
                assertTrue(result.isValidated(), "delta " + delta + " should balance");
            } else {
                assertEquals(PostingErrorCode.JOURNAL_UNBALANCED, result.getCode(), "delta " + delta);
            }
        }
    }

    @Test
    void testEmptyJournalRejected() {
        JournalValidationResult result = validator.validate(journal("accountant"));

        assertFalse(result.isValidated());
        assertEquals(PostingErrorCode.INVALID_ACCOUNTS, result.getCode());
    }

    @Test
    void testUnknownAndInactiveAccountsRejected() {
        JournalValidationResult result = validator.validate(journal("accountant",
            JournalLine.debit("acct_missing", new BigDecimal("10.00"), null, null),
            JournalLine.debit("acct_closed_1999", new BigDecimal("10.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("20.00"), null, null)));

        assertEquals(PostingErrorCode.INVALID_ACCOUNTS, result.getCode());
        assertEquals(List.of("acct_missing", "acct_closed_1999"), result.getInvalidAccountIds());
    }

    @Test
    void testAccountInOtherCurrencyRejected() {
        JournalValidationResult result = validator.validate(journal("accountant",
            JournalLine.debit("acct_usd_bank_1010", new BigDecimal("10.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("10.00"), null, null)));

        assertEquals(PostingErrorCode.INVALID_CURRENCY, result.getCode());
        assertTrue(result.getError().contains("Currency mismatch"));
    }

    @Test
    void testForeignCurrencyRequiresRate() {
        JournalPostingInput input = journal("accountant",
            JournalLine.debit(ChartOfAccountsTemplate.BANK, new BigDecimal("10.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("10.00"), null, null));
        input.setCurrency("USD");

        JournalValidationResult result = validator.validate(input);

        assertEquals(PostingErrorCode.INVALID_CURRENCY, result.getCode());
        assertEquals("Exchange rate required for USD to MYR conversion", result.getError());
    }

    @Test
    void testMalformedCurrencyRejected() {
        JournalPostingInput input = journal("accountant",
            JournalLine.debit(ChartOfAccountsTemplate.BANK, new BigDecimal("10.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("10.00"), null, null));
        input.setCurrency("RINGGIT");

        assertEquals(PostingErrorCode.INVALID_CURRENCY, validator.validate(input).getCode());
    }

    @Test
    void testForeignCurrencyConvertedToBase() {
        JournalPostingInput input = journal("accountant",
            JournalLine.debit(ChartOfAccountsTemplate.BANK, new BigDecimal("100.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("100.00"), null, null));
        input.setCurrency("USD");
        input.setExchangeRate(new BigDecimal("4.2"));

        JournalValidationResult result = validator.validate(input);

        assertTrue(result.isValidated());
        assertEquals(0, new BigDecimal("420.00").compareTo(result.getTotalDebit()));
        assertEquals(0, new BigDecimal("420.00").compareTo(result.getBaseLines().get(1).getCredit()));
    }

    @Test
    void testForeignRoundingResidueIsAbsorbed() {
        JournalPostingInput input = journal("accountant",
            JournalLine.debit(ChartOfAccountsTemplate.BANK, new BigDecimal("5.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("1.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("1.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("1.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("1.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("1.00"), null, null));
        input.setCurrency("USD");
        input.setExchangeRate(new BigDecimal("1.005"));

        JournalValidationResult result = validator.validate(input);

        assertTrue(result.isValidated(), result.getError());
        assertEquals(0, new BigDecimal("5.05").compareTo(result.getTotalDebit()));
        assertEquals(0, new BigDecimal("5.05").compareTo(result.getTotalCredit()));
        assertEquals(0, new BigDecimal("5.05").compareTo(result.getBaseLines().get(0).getDebit()));
        for (JournalLine line : result.getBaseLines().subList(1, 6)) {
            assertEquals(0, new BigDecimal("1.01").compareTo(line.getCredit()));
        }
    }

    @Test
    void testForeignRoundingResidueAcrossRandomJournals() {
        Random random = new Random(7);
        for (int run = 0; run < 50; run++) {
            List<JournalLine> lines = new ArrayList<>();
            BigDecimal total = BigDecimal.ZERO;
            for (int i = 0; i < 8; i++) {
                BigDecimal amount = BigDecimal.valueOf(1 + random.nextInt(100000), 2);
                total = total.add(amount);
                lines.add(JournalLine.debit(ChartOfAccountsTemplate.OFFICE_EXPENSES, amount, null, null));
            }
            lines.add(JournalLine.credit(ChartOfAccountsTemplate.BANK, total, null, null));

            JournalPostingInput input = journal("accountant", lines.toArray(new JournalLine[0]));
            input.setCurrency("USD");
            input.setExchangeRate(BigDecimal.valueOf(1000 + random.nextInt(9000), 3));

            JournalValidationResult result = validator.validate(input);

            assertTrue(result.isValidated(), result.getError());
            assertEquals(0, result.getTotalDebit().compareTo(result.getTotalCredit()));
        }
    }

    @Test
    void testNegativeAmountRejected() {
        JournalValidationResult result = validator.validate(journal("accountant",
            JournalLine.debit(ChartOfAccountsTemplate.BANK, new BigDecimal("-50.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("-50.00"), null, null)));

        assertEquals(PostingErrorCode.INVALID_AMOUNT, result.getCode());
    }

    @Test
    void testAmountAboveMaximumRejected() {
        BigDecimal huge = new BigDecimal("1000000000.00");
        JournalValidationResult result = validator.validate(journal("admin",
            JournalLine.debit(ChartOfAccountsTemplate.BANK, huge, null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, huge, null, null)));

        assertEquals(PostingErrorCode.INVALID_AMOUNT, result.getCode());
    }

    @Test
    void testTooManyLinesRejected() {
        List<JournalLine> lines = new ArrayList<>();
        for (int i = 0; i < 101; i++) {
            lines.add(JournalLine.debit(ChartOfAccountsTemplate.BANK, new BigDecimal("1.00"), null, null));
        }
        JournalPostingInput input = journal("accountant");
        input.setLines(lines);

        JournalValidationResult result = validator.validate(input);

        assertEquals(PostingErrorCode.BUSINESS_RULE_VIOLATION, result.getCode());
    }

    @Test
    void testFutureDateRejected() {
        JournalPostingInput input = journal("accountant",
            JournalLine.debit(ChartOfAccountsTemplate.BANK, new BigDecimal("10.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("10.00"), null, null));
        input.setJournalDate(LocalDate.now().plusDays(3));

        JournalValidationResult result = validator.validate(input);

        assertEquals(PostingErrorCode.BUSINESS_RULE_VIOLATION, result.getCode());
        assertEquals("Journal date cannot be in the future", result.getError());
    }

    @Test
    void testPostingLockBlocksJournal() {
        FiscalPeriod period = fiscalPeriodRepository.save(new FiscalPeriod(TENANT, COMPANY, "FY",
            1, LocalDate.now().minusDays(10), LocalDate.now().plusDays(10)));
        periodLockRepository.save(new PeriodLock(TENANT, COMPANY, period.getId(),
            PeriodLockType.POSTING, "controller", "Period closed"));

        JournalValidationResult result = validator.validate(journal("accountant",
            JournalLine.debit(ChartOfAccountsTemplate.BANK, new BigDecimal("10.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("10.00"), null, null)));

        assertEquals(PostingErrorCode.BUSINESS_RULE_VIOLATION, result.getCode());
        assertTrue(result.getError().contains("locked for posting"));
    }

    @Test
    void testReportingLockDoesNotBlockJournal() {
        FiscalPeriod period = fiscalPeriodRepository.save(new FiscalPeriod(TENANT, COMPANY, "FY",
            1, LocalDate.now().minusDays(10), LocalDate.now().plusDays(10)));
        periodLockRepository.save(new PeriodLock(TENANT, COMPANY, period.getId(),
            PeriodLockType.REPORTING, "controller", "Board pack"));

        JournalValidationResult result = validator.validate(journal("accountant",
            JournalLine.debit(ChartOfAccountsTemplate.BANK, new BigDecimal("10.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("10.00"), null, null)));

        assertTrue(result.isValidated());
    }

    @Test
    void testClerkCannotPost() {
        JournalValidationResult result = validator.validate(journal("clerk",
            JournalLine.debit(ChartOfAccountsTemplate.BANK, new BigDecimal("10.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("10.00"), null, null)));

        assertFalse(result.isValidated());
        assertEquals(PostingErrorCode.SOD_VIOLATION, result.getCode());
        assertTrue(result.getError().contains("clerk"));
    }

    @Test
    void testLargeJournalRequiresApproval() {
        JournalValidationResult result = validator.validate(journal("accountant",
            JournalLine.debit(ChartOfAccountsTemplate.BANK, new BigDecimal("20000.00"), null, null),
            JournalLine.credit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("20000.00"), null, null)));

        assertTrue(result.isValidated());
        assertTrue(result.isRequiresApproval());
        assertEquals(List.of("manager", "admin"), result.getApproverRoles());
    }

    @Test
    void testCoaWarningsForUnusualSides() {
        JournalValidationResult result = validator.validate(journal("accountant",
            JournalLine.debit(ChartOfAccountsTemplate.PRODUCT_SALES, new BigDecimal("75.00"), "Refund", null),
            JournalLine.credit(ChartOfAccountsTemplate.BANK, new BigDecimal("75.00"), "Refund", null)));

        assertTrue(result.isValidated());
        assertEquals(2, result.getCoaWarnings().size());

        CoaWarning revenue = result.getCoaWarnings().get(0);
        assertEquals(ChartOfAccountsTemplate.PRODUCT_SALES, revenue.getAccountId());
        assertEquals("REVENUE account normally has credit balance", revenue.getWarning());
        assertEquals(AccountType.REVENUE, revenue.getAccountType());
        assertEquals(AccountType.NormalBalance.DEBIT, revenue.getSide());
        assertEquals(0, new BigDecimal("75.00").compareTo(revenue.getAmount()));

        CoaWarning bank = result.getCoaWarnings().get(1);
        assertEquals("ASSET account normally has debit balance", bank.getWarning());
        assertEquals(AccountType.NormalBalance.CREDIT, bank.getSide());
    }

    private JournalPostingInput journal(String role, JournalLine... lines) {
        return JournalPostingInput.builder()
            .journalNumber("JE-001")
            .description("Test journal")
            .journalDate(LocalDate.now())
            .currency("MYR")
            .lines(new ArrayList<>(List.of(lines)))
            .context(new PostingContext(TENANT, COMPANY, "user-1", role))
            .build();
    }
}
