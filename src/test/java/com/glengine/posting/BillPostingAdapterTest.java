package com.glengine.posting;

import com.glengine.accounts.AccountType;
import com.glengine.accounts.ChartOfAccountsRegistry;
import com.glengine.accounts.ChartOfAccountsTemplate;
import com.glengine.ledger.JournalLine;
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

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class BillPostingAdapterTest {

    @Autowired
    private BillPostingAdapter adapter;

    @Autowired
    private ChartOfAccountsRegistry registry;

    @Autowired
    private ChartOfAccountsTemplate template;

    @BeforeEach
    void setUp() {
        registry.clear();
        template.install("MYR");
    }

    @Test
    void testBillJournalShape() {
        BillPostingResult result = adapter.validate(bill("MYR", null), "user-1", "accountant");

        assertTrue(result.isValidated(), result.getError());
        assertEquals("BILL-B-100", result.getJournalInput().getJournalNumber());
        assertEquals("Bill B-100 - Office Supplies Co", result.getJournalInput().getDescription());

        List<JournalLine> lines = result.getJournalInput().getLines();
        assertEquals(3, lines.size());
        assertEquals(ChartOfAccountsTemplate.OFFICE_EXPENSES, lines.get(0).getAccountId());
        assertEquals(0, new BigDecimal("300.00").compareTo(lines.get(0).getDebit()));
        assertEquals("Expense - Paper", lines.get(0).getDescription());
        assertEquals(0, new BigDecimal("200.00").compareTo(lines.get(1).getDebit()));

        JournalLine ap = lines.get(2);
        assertEquals(ChartOfAccountsTemplate.AP_TRADE, ap.getAccountId());
        assertEquals(0, new BigDecimal("500.00").compareTo(ap.getCredit()));
        assertEquals("AP - Office Supplies Co - B-100", ap.getDescription());

        assertEquals(0, new BigDecimal("500.00").compareTo(result.getTotalExpense()));
        assertEquals(0, new BigDecimal("500.00").compareTo(result.getTotalAmount()));
    }

    @Test
    void testBillWithInputTax() {
        BillPostingInput input = bill("MYR", null);
        input.setTaxLines(List.of(TaxLine.builder()
            .taxCode("SST")
            .taxAccountId(ChartOfAccountsTemplate.SST)
            .taxAmount(new BigDecimal("30.00"))
            .taxType(TaxType.INPUT)
            .build()));

        BillPostingResult result = adapter.validate(input, "user-1", "accountant");

        assertTrue(result.isValidated(), result.getError());
        assertEquals(0, new BigDecimal("530.00").compareTo(result.getTotalAmount()));

        List<JournalLine> lines = result.getJournalInput().getLines();
        assertEquals(4, lines.size());
        assertEquals(0, new BigDecimal("30.00").compareTo(lines.get(2).getDebit()));
        assertEquals(0, new BigDecimal("530.00").compareTo(lines.get(3).getCredit()));

        // input tax debited to a liability account is reported, not rejected
        assertEquals(1, result.getCoaWarnings().size());
        assertEquals(AccountType.LIABILITY, result.getCoaWarnings().get(0).getAccountType());
    }

    @Test
    void testForeignCurrencyBill() {
        BillPostingResult result = adapter.validate(bill("SGD", new BigDecimal("3.5")), "user-1", "accountant");

        assertTrue(result.isValidated(), result.getError());
        List<JournalLine> lines = result.getJournalInput().getLines();
        assertEquals(0, new BigDecimal("1050.00").compareTo(lines.get(0).getDebit()));
        assertEquals(0, new BigDecimal("1750.00").compareTo(lines.get(2).getCredit()));
    }

    @Test
    void testManyForeignLinesStayBalancedAfterRounding() {
        BillPostingInput input = bill("USD", new BigDecimal("1.005"));
        input.getLines().clear();
        for (int i = 1; i <= 5; i++) {
            input.getLines().add(BillLine.builder()
                .lineNumber(i)
                .description("Item " + i)
                .quantity(BigDecimal.ONE)
                .unitPrice(new BigDecimal("1.00"))
                .lineAmount(new BigDecimal("1.00"))
                .expenseAccountId(ChartOfAccountsTemplate.OFFICE_EXPENSES)
                .build());
        }

        BillPostingResult result = adapter.validate(input, "user-1", "accountant");

        assertTrue(result.isValidated(), result.getError());
        List<JournalLine> lines = result.getJournalInput().getLines();
        assertEquals(6, lines.size());
        for (JournalLine expense : lines.subList(0, 5)) {
            assertEquals(0, new BigDecimal("1.01").compareTo(expense.getDebit()));
        }
        assertEquals(0, new BigDecimal("5.05").compareTo(lines.get(5).getCredit()));
    }

    @Test
    void testMissingApAccount() {
        BillPostingInput input = bill("MYR", null);
        input.setApAccountId(" ");

        BillPostingResult result = adapter.validate(input, "user-1", "accountant");

        assertEquals(DocumentPostingErrorCode.INVALID_AMOUNTS, result.getCode());
        assertEquals("Bill must have ID, AP account, and at least one line", result.getError());
    }

    @Test
    void testNegativeExpenseRejected() {
        BillPostingInput input = bill("MYR", null);
        input.getLines().get(0).setLineAmount(new BigDecimal("-400.00"));

        BillPostingResult result = adapter.validate(input, "user-1", "accountant");

        assertEquals(DocumentPostingErrorCode.INVALID_AMOUNTS, result.getCode());
        assertEquals("Bill expense must be positive", result.getError());
    }

    @Test
    void testInactiveExpenseAccount() {
        BillPostingInput input = bill("MYR", null);
        input.getLines().get(1).setExpenseAccountId("acct_unknown_7999");

        BillPostingResult result = adapter.validate(input, "user-1", "accountant");

        assertEquals(DocumentPostingErrorCode.BUSINESS_RULE_VIOLATION, result.getCode());
        assertTrue(result.getError().contains("acct_unknown_7999"));
    }

    private BillPostingInput bill(String currency, BigDecimal rate) {
        List<BillLine> lines = new ArrayList<>();
        lines.add(BillLine.builder()
            .lineNumber(1)
            .description("Paper")
            .quantity(new BigDecimal("30"))
            .unitPrice(new BigDecimal("10.00"))
            .lineAmount(new BigDecimal("300.00"))
            .expenseAccountId(ChartOfAccountsTemplate.OFFICE_EXPENSES)
            .build());
        lines.add(BillLine.builder()
            .lineNumber(2)
            .description("Courier")
            .quantity(BigDecimal.ONE)
            .unitPrice(new BigDecimal("200.00"))
            .lineAmount(new BigDecimal("200.00"))
            .expenseAccountId(ChartOfAccountsTemplate.TRAVEL_EXPENSES)
            .build());

        return BillPostingInput.builder()
            .tenantId("tenant-1")
            .companyId("company-1")
            .billId("bill-1")
            .billNumber("B-100")
            .supplierId("sup-1")
            .supplierName("Office Supplies Co")
            .billDate(LocalDate.now())
            .currency(currency)
            .exchangeRate(rate)
            .apAccountId(ChartOfAccountsTemplate.AP_TRADE)
            .lines(lines)
            .build();
    }
}
