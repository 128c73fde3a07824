package com.glengine.accounts;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for chart-of-accounts persistence.
 *
 * Writes belong in {@link ChartOfAccountsRegistry#register(Account)}, which
 * keeps the registry index current. A write made here directly is not seen by
 * posting validation until the account is evicted from the registry.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, String> {

    List<Account> findByParentIdOrderByCode(String parentId);

    List<Account> findByTypeOrderByCode(AccountType type);
}
