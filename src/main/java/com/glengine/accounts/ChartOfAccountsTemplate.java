package com.glengine.accounts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * The standard chart of accounts offered to new tenants.
 *
 * Codes follow the usual ranges: 1xxx assets, 2xxx liabilities, 3xxx equity,
 * 4xxx revenue, 6xxx cost of sales, 7xxx-8xxx expenses (FX gain sits at 7100
 * as a revenue account).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChartOfAccountsTemplate {

    public static final String BANK = "acct_bank_1000";
    public static final String AR = "acct_ar_1100";
    public static final String AR_TRADE = "acct_ar_1101";
    public static final String AR_INTERCOMPANY = "acct_ar_1102";
    public static final String PREPAID = "acct_prepay_1200";
    public static final String VENDOR_PREPAYMENTS = "acct_vend_prepay_1201";
    public static final String INVENTORY = "acct_inventory_1300";
    public static final String FIXED_ASSETS = "acct_fixed_assets_1500";
    public static final String AP = "acct_ap_2100";
    public static final String AP_TRADE = "acct_ap_2101";
    public static final String TAX = "acct_tax_2105";
    public static final String SST = "acct_sst_2106";
    public static final String CUSTOMER_ADVANCES = "acct_advances_2300";
    public static final String ACCRUALS = "acct_accruals_2400";
    public static final String EQUITY = "acct_equity_3000";
    public static final String RETAINED_EARNINGS = "acct_retained_earnings_3100";
    public static final String REVENUE = "acct_revenue_4000";
    public static final String PRODUCT_SALES = "acct_sales_4001";
    public static final String SERVICE_REVENUE = "acct_service_4002";
    public static final String OTHER_INCOME = "acct_other_income_4900";
    public static final String COGS = "acct_cogs_6000";
    public static final String OPERATING_EXPENSES = "acct_operating_7000";
    public static final String BANK_FEES = "acct_bank_fees_7001";
    public static final String OFFICE_EXPENSES = "acct_office_7002";
    public static final String TRAVEL_EXPENSES = "acct_travel_7003";
    public static final String FX_GAIN = "acct_fx_gain_7100";
    public static final String FX_LOSS = "acct_fx_loss_8100";

    private final ChartOfAccountsRegistry registry;

    /**
     * Install the standard hierarchy in the given currency, parents first.
     */
    @Transactional
    public List<Account> install(String currency) {
        List<Account> accounts = List.of(
            account(BANK, "1000", "Bank Account", AccountType.ASSET, null, currency),
            account(AR, "1100", "Accounts Receivable", AccountType.ASSET, null, currency),
            account(AR_TRADE, "1101", "AR - Trade", AccountType.ASSET, AR, currency),
            account(AR_INTERCOMPANY, "1102", "AR - Intercompany", AccountType.ASSET, AR, currency),
            account(PREPAID, "1200", "Prepaid Expenses", AccountType.ASSET, null, currency),
            account(VENDOR_PREPAYMENTS, "1201", "Vendor Prepayments", AccountType.ASSET, PREPAID, currency),
            account(INVENTORY, "1300", "Inventory", AccountType.ASSET, null, currency),
            account(FIXED_ASSETS, "1500", "Fixed Assets", AccountType.ASSET, null, currency),
            account(AP, "2100", "Accounts Payable", AccountType.LIABILITY, null, currency),
            account(AP_TRADE, "2101", "AP - Trade", AccountType.LIABILITY, AP, currency),
            account(TAX, "2105", "Tax Payable", AccountType.LIABILITY, null, currency),
            account(SST, "2106", "SST Payable", AccountType.LIABILITY, TAX, currency),
            account(CUSTOMER_ADVANCES, "2300", "Customer Advances", AccountType.LIABILITY, null, currency),
            account(ACCRUALS, "2400", "Accrued Expenses", AccountType.LIABILITY, null, currency),
            account(EQUITY, "3000", "Share Capital", AccountType.EQUITY, null, currency),
            account(RETAINED_EARNINGS, "3100", "Retained Earnings", AccountType.EQUITY, EQUITY, currency),
            account(REVENUE, "4000", "Sales Revenue", AccountType.REVENUE, null, currency),
            account(PRODUCT_SALES, "4001", "Product Sales", AccountType.REVENUE, REVENUE, currency),
            account(SERVICE_REVENUE, "4002", "Service Revenue", AccountType.REVENUE, REVENUE, currency),
            account(OTHER_INCOME, "4900", "Other Income", AccountType.REVENUE, null, currency),
            account(COGS, "6000", "Cost of Goods Sold", AccountType.COST_OF_GOODS_SOLD, null, currency),
            account(OPERATING_EXPENSES, "7000", "Operating Expenses", AccountType.EXPENSE, null, currency),
            account(BANK_FEES, "7001", "Bank Fees", AccountType.EXPENSE, OPERATING_EXPENSES, currency),
            account(OFFICE_EXPENSES, "7002", "Office Expenses", AccountType.EXPENSE, OPERATING_EXPENSES, currency),
            account(TRAVEL_EXPENSES, "7003", "Travel Expenses", AccountType.EXPENSE, OPERATING_EXPENSES, currency),
            account(FX_GAIN, "7100", "FX Gain", AccountType.REVENUE, null, currency),
            account(FX_LOSS, "8100", "FX Loss", AccountType.EXPENSE, null, currency)
        );

        accounts.forEach(registry::register);
        log.info("Installed standard chart of accounts: {} accounts in {}", accounts.size(), currency);
        return accounts;
    }

    private static Account account(String id, String code, String name, AccountType type,
                                   String parentId, String currency) {
        return new Account(id, code, name, type, parentId, currency, true);
    }
}
