package com.glengine.accounts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup service over the chart of accounts.
 *
 * Keeps an id-keyed index of every account it has resolved so that the
 * journal validator hot path is a map lookup. The index holds detached
 * snapshots and hands out copies, so a caller mutating a resolved account
 * changes neither the index nor the database. Account writes go through
 * {@link #register(Account)}; after writing through {@link AccountRepository}
 * directly, call {@link #evict(String)} or {@link #clear()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChartOfAccountsRegistry {

    private final AccountRepository accountRepository;

    private final Map<String, Account> index = new ConcurrentHashMap<>();

    @Transactional(readOnly = true)
    public Optional<Account> resolve(String accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        Account cached = index.get(accountId);
        if (cached != null) {
            return Optional.of(cached.snapshot());
        }
        Optional<Account> loaded = accountRepository.findById(accountId).map(Account::snapshot);
        loaded.ifPresent(account -> index.put(account.getId(), account.snapshot()));
        return loaded;
    }

    /**
     * Resolve a batch of ids. Ids that do not exist are absent from the result.
     */
    @Transactional(readOnly = true)
    public Map<String, Account> resolveAll(Collection<String> accountIds) {
        Map<String, Account> resolved = new LinkedHashMap<>();
        for (String accountId : accountIds) {
            resolve(accountId).ifPresent(account -> resolved.put(accountId, account));
        }
        return resolved;
    }

    @Transactional(readOnly = true)
    public List<Account> childrenOf(String accountId) {
        return accountRepository.findByParentIdOrderByCode(accountId);
    }

    @Transactional(readOnly = true)
    public List<Account> accountsByType(AccountType type) {
        return accountRepository.findByTypeOrderByCode(type);
    }

    /**
     * Root-to-leaf list of account codes, e.g. ["1100", "1101"].
     * Returns an empty list for an unknown account.
     */
    @Transactional(readOnly = true)
    public List<String> pathOf(String accountId) {
        LinkedList<String> path = new LinkedList<>();
        Set<String> visited = new HashSet<>();
        Optional<Account> current = resolve(accountId);
        while (current.isPresent() && visited.add(current.get().getId())) {
            path.addFirst(current.get().getCode());
            current = current.get().isRoot() ? Optional.empty() : resolve(current.get().getParentId());
        }
        return new ArrayList<>(path);
    }

    /**
     * Save an account and refresh its index entry.
     */
    @Transactional
    public Account register(Account account) {
        Account saved = accountRepository.save(account);
        index.put(saved.getId(), saved.snapshot());
        log.info("Registered account {} ({}) type={} currency={} active={}",
            saved.getId(), saved.getCode(), saved.getType(), saved.getCurrency(), saved.isActive());
        return saved;
    }

    public void evict(String accountId) {
        index.remove(accountId);
    }

    public void clear() {
        log.debug("Clearing chart-of-accounts index ({} entries)", index.size());
        index.clear();
    }
}
