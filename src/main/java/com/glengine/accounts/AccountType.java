package com.glengine.accounts;

/**
 * Chart-of-accounts classification.
 */
public enum AccountType {
    ASSET(NormalBalance.DEBIT),
    LIABILITY(NormalBalance.CREDIT),
    EQUITY(NormalBalance.CREDIT),
    REVENUE(NormalBalance.CREDIT),
    EXPENSE(NormalBalance.DEBIT),
    COST_OF_GOODS_SOLD(NormalBalance.DEBIT);

    private final NormalBalance normalBalance;

    AccountType(NormalBalance normalBalance) {
        this.normalBalance = normalBalance;
    }

    /**
     * The side on which this type of account normally carries its balance.
     */
    public NormalBalance getNormalBalance() {
        return normalBalance;
    }

    public enum NormalBalance {
        DEBIT,
        CREDIT;

        public String label() {
            return name().toLowerCase();
        }
    }
}
