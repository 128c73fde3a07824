package com.glengine.ledger;

import com.glengine.accounts.AccountType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Advisory note about a line posted against an account's normal balance side.
 */
@Value
public class CoaWarning {
    String accountId;
    String warning;
    AccountType accountType;
    BigDecimal amount;
    AccountType.NormalBalance side;
}
