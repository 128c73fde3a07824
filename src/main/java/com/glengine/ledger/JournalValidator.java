package com.glengine.ledger;

import com.glengine.accounts.Account;
import com.glengine.accounts.AccountType;
import com.glengine.accounts.ChartOfAccountsRegistry;
import com.glengine.common.CurrencyCodes;
import com.glengine.common.Money;
import com.glengine.fx.FxPolicyResolver;
import com.glengine.fx.FxRateCheck;
import com.glengine.period.PostingPeriodGate;
import com.glengine.sod.SoDAction;
import com.glengine.sod.SoDAuthorizer;
import com.glengine.sod.SoDDecision;
import com.glengine.sod.SoDRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Validates a proposed journal before the caller persists it.
 *
 * Validation flow (stops at the first failure):
 * 1. Structure: lines present, accounts exist, are active and in base currency
 * 2. Currency: convert lines to base currency with the journal's rate
 * 3. Balance: debits equal credits within one cent, checked before rounding;
 *    converted lines are then rounded with the residue absorbed so they balance exactly
 * 4. Amount sanity per line
 * 5. Posting date: not in the future, not in a period locked for posting
 * 6. Segregation of duties for journal:post on the total debit
 * 7. Chart-of-accounts warnings (never fatal)
 *
 * Nothing is written; the result says whether the journal may be posted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalValidator {

    static final BigDecimal MIN_AMOUNT = new BigDecimal("0.01");
    static final BigDecimal MAX_AMOUNT = new BigDecimal("999999999.99");

    private final ChartOfAccountsRegistry accountsRegistry;
    private final FxPolicyResolver fxPolicyResolver;
    private final SoDAuthorizer sodAuthorizer;
    private final PostingPeriodGate postingPeriodGate;

    @Value("${gl-engine.base-currency:MYR}")
    private String baseCurrency;

    @Value("${gl-engine.posting.max-lines:100}")
    private int maxLines;

    @Transactional(readOnly = true)
    public JournalValidationResult validate(JournalPostingInput input) {
        log.debug("Validating journal {} with {} lines", input.getJournalNumber(),
            input.getLines() == null ? 0 : input.getLines().size());

        try {
            PostingContext context = requireContext(input);
            Map<String, Account> accounts = validateStructure(input.getLines());
            List<JournalLine> convertedLines = toBaseCurrency(input);

            BigDecimal rawDebit = debitTotal(convertedLines);
            BigDecimal rawCredit = creditTotal(convertedLines);
            if (!Money.withinTolerance(rawDebit, rawCredit)) {
                throw PostingRuleException.unbalanced(Money.round(rawDebit), Money.round(rawCredit));
            }

            List<JournalLine> baseLines = convertedLines;
            if (fxPolicyResolver.requiresFxRate(baseCurrency, input.getCurrency())) {
                baseLines = roundToBase(convertedLines);
                rawDebit = debitTotal(baseLines);
                rawCredit = creditTotal(baseLines);
            }

            validateAmounts(baseLines);
            validatePostingDate(input.getJournalDate(), context);

            BigDecimal totalDebit = Money.round(rawDebit);
            SoDDecision decision = authorizePosting(context, totalDebit);
            List<CoaWarning> warnings = coaWarnings(baseLines, accounts);

            log.info("Journal {} validated: debit={} credit={} {} requiresApproval={} warnings={}",
                input.getJournalNumber(), totalDebit, Money.round(rawCredit), baseCurrency,
                decision.isRequiresApproval(), warnings.size());

            return JournalValidationResult.builder()
                .validated(true)
                .requiresApproval(decision.isRequiresApproval())
                .approverRoles(decision.isRequiresApproval() ? sodAuthorizer.getApproverRoles() : List.of())
                .coaWarnings(warnings)
                .totalDebit(totalDebit)
                .totalCredit(Money.round(rawCredit))
                .baseLines(baseLines)
                .build();

        } catch (PostingRuleException e) {
            log.warn("Journal {} rejected: {} - {}", input.getJournalNumber(), e.getCode(), e.getMessage());
            return JournalValidationResult.rejected(e);
        }
    }

    public String getBaseCurrency() {
        return baseCurrency;
    }

    private PostingContext requireContext(JournalPostingInput input) {
        PostingContext context = input.getContext();
        if (context == null || context.getTenantId() == null || context.getCompanyId() == null) {
            throw new PostingRuleException(PostingErrorCode.BUSINESS_RULE_VIOLATION,
                "Posting context with tenant and company is required");
        }
        return context;
    }

    private Map<String, Account> validateStructure(List<JournalLine> lines) {
        if (lines == null || lines.isEmpty()) {
            throw PostingRuleException.invalidAccounts("Journal must have at least one line", List.of());
        }
        if (lines.size() > maxLines) {
            throw new PostingRuleException(PostingErrorCode.BUSINESS_RULE_VIOLATION,
                String.format("Journal cannot have more than %d lines", maxLines));
        }

        Set<String> accountIds = new LinkedHashSet<>();
        lines.forEach(line -> accountIds.add(line.getAccountId()));
        Map<String, Account> accounts = accountsRegistry.resolveAll(accountIds);

        List<String> invalid = new ArrayList<>();
        for (String accountId : accountIds) {
            Account account = accounts.get(accountId);
            if (account == null || !account.isActive()) {
                invalid.add(String.valueOf(accountId));
            }
        }
        if (!invalid.isEmpty()) {
            throw PostingRuleException.invalidAccounts(
                "Invalid or inactive accounts: " + String.join(", ", invalid), invalid);
        }

        for (Account account : accounts.values()) {
            if (!baseCurrency.equals(account.getCurrency())) {
                throw new PostingRuleException(PostingErrorCode.INVALID_CURRENCY,
                    String.format("Currency mismatch: account %s is in %s, base currency is %s",
                        account.getCode(), account.getCurrency(), baseCurrency));
            }
        }
        return accounts;
    }

    private List<JournalLine> toBaseCurrency(JournalPostingInput input) {
        if (!CurrencyCodes.isValid(input.getCurrency())) {
            throw new PostingRuleException(PostingErrorCode.INVALID_CURRENCY,
                "Invalid currency code: " + input.getCurrency());
        }

        FxRateCheck rateCheck = fxPolicyResolver.validateRate(baseCurrency, input.getCurrency(), input.getExchangeRate());
        if (!rateCheck.isOk()) {
            throw new PostingRuleException(PostingErrorCode.INVALID_CURRENCY, rateCheck.getMessage());
        }
        if (!fxPolicyResolver.requiresFxRate(baseCurrency, input.getCurrency())) {
            return input.getLines();
        }

        BigDecimal rate = rateCheck.getEffectiveRate();
        List<JournalLine> converted = new ArrayList<>(input.getLines().size());
        for (JournalLine line : input.getLines()) {
            converted.add(new JournalLine(line.getAccountId(),
                fxPolicyResolver.convert(line.getDebit(), rate),
                fxPolicyResolver.convert(line.getCredit(), rate),
                line.getDescription(), line.getReference()));
        }
        return converted;
    }

    /**
     * Round converted lines to 2 places. The residue left by per-line rounding goes
     * onto the largest line of the lighter side, so the rounded lines balance exactly.
     */
    private List<JournalLine> roundToBase(List<JournalLine> converted) {
        List<JournalLine> rounded = new ArrayList<>(converted.size());
        for (JournalLine line : converted) {
            rounded.add(new JournalLine(line.getAccountId(), Money.round(line.getDebit()),
                Money.round(line.getCredit()), line.getDescription(), line.getReference()));
        }

        BigDecimal residue = debitTotal(rounded).subtract(creditTotal(rounded));
        if (residue.signum() > 0) {
            JournalLine target = largest(rounded, JournalLine::getCredit);
            target.setCredit(target.getCredit().add(residue));
        } else if (residue.signum() < 0) {
            JournalLine target = largest(rounded, JournalLine::getDebit);
            target.setDebit(target.getDebit().subtract(residue));
        }
        return rounded;
    }

    private static JournalLine largest(List<JournalLine> lines, Function<JournalLine, BigDecimal> side) {
        return lines.stream()
            .max(Comparator.comparing(line -> Money.orZero(side.apply(line))))
            .orElseThrow();
    }

    private static BigDecimal debitTotal(List<JournalLine> lines) {
        return lines.stream().map(line -> Money.orZero(line.getDebit())).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal creditTotal(List<JournalLine> lines) {
        return lines.stream().map(line -> Money.orZero(line.getCredit())).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private void validateAmounts(List<JournalLine> lines) {
        for (int i = 0; i < lines.size(); i++) {
            checkAmount(i + 1, "debit", Money.orZero(lines.get(i).getDebit()));
            checkAmount(i + 1, "credit", Money.orZero(lines.get(i).getCredit()));
        }
    }

    private void checkAmount(int lineNumber, String side, BigDecimal amount) {
        if (amount.signum() < 0) {
            throw new PostingRuleException(PostingErrorCode.INVALID_AMOUNT,
                String.format("Line %d: %s amount cannot be negative", lineNumber, side));
        }
        if (amount.signum() > 0 && (amount.compareTo(MIN_AMOUNT) < 0 || amount.compareTo(MAX_AMOUNT) > 0)) {
            throw new PostingRuleException(PostingErrorCode.INVALID_AMOUNT,
                String.format("Line %d: %s amount %s is outside [%s, %s]",
                    lineNumber, side, amount, MIN_AMOUNT, MAX_AMOUNT));
        }
    }

    private void validatePostingDate(LocalDate journalDate, PostingContext context) {
        if (journalDate == null) {
            throw new PostingRuleException(PostingErrorCode.BUSINESS_RULE_VIOLATION, "Journal date is required");
        }
        if (journalDate.isAfter(LocalDate.now())) {
            throw new PostingRuleException(PostingErrorCode.BUSINESS_RULE_VIOLATION,
                "Journal date cannot be in the future");
        }
        if (postingPeriodGate.isPostingLocked(context.getTenantId(), context.getCompanyId(), journalDate)) {
            throw new PostingRuleException(PostingErrorCode.BUSINESS_RULE_VIOLATION,
                String.format("Journal date %s falls in a period locked for posting", journalDate));
        }
    }

    private SoDDecision authorizePosting(PostingContext context, BigDecimal totalDebit) {
        SoDDecision decision = sodAuthorizer.check(SoDRequest.builder()
            .tenantId(context.getTenantId())
            .companyId(context.getCompanyId())
            .userId(context.getUserId())
            .userRole(context.getUserRole())
            .action(SoDAction.JOURNAL_POST)
            .amount(totalDebit)
            .build());

        if (!decision.isAllowed()) {
            throw new PostingRuleException(PostingErrorCode.SOD_VIOLATION,
                String.format("User role '%s' is not authorized to post journal entries: %s",
                    context.getUserRole(), decision.getReason()));
        }
        return decision;
    }

    private List<CoaWarning> coaWarnings(List<JournalLine> lines, Map<String, Account> accounts) {
        List<CoaWarning> warnings = new ArrayList<>();
        for (JournalLine line : lines) {
            Account account = accounts.get(line.getAccountId());
            AccountType type = account.getType();
            AccountType.NormalBalance normal = type.getNormalBalance();

            if (normal == AccountType.NormalBalance.CREDIT && Money.isPositive(line.getDebit())) {
                warnings.add(warning(account, line.getDebit(), AccountType.NormalBalance.DEBIT));
            } else if (normal == AccountType.NormalBalance.DEBIT && Money.isPositive(line.getCredit())) {
                warnings.add(warning(account, line.getCredit(), AccountType.NormalBalance.CREDIT));
            }
        }
        return warnings;
    }

    private CoaWarning warning(Account account, BigDecimal amount, AccountType.NormalBalance side) {
        String text = String.format("%s account normally has %s balance",
            account.getType(), account.getType().getNormalBalance().label());
        return new CoaWarning(account.getId(), text, account.getType(), amount, side);
    }
}
