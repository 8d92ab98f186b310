package com.flagship.revenue_ledger.distribution;

import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.ledger.AccountRef;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcPayeeAccountResolver implements PayeeAccountResolver {

    private final JdbcTemplate jdbcTemplate;

    public JdbcPayeeAccountResolver(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<AccountRef> resolve(String payeeScopeId) {
        if (payeeScopeId == null || payeeScopeId.isBlank()) {
            return Optional.empty();
        }
        List<String> owners = jdbcTemplate.queryForList(
            "SELECT owner_id FROM payee_accounts WHERE scope_id = ? AND active",
            String.class,
            payeeScopeId
        );
        return owners.stream().findFirst().map(owner -> AccountRef.payee(owner, payeeScopeId));
    }

    @Override
    public AccountRef register(String payeeScopeId, String ownerId) {
        if (payeeScopeId == null || payeeScopeId.isBlank()) {
            throw new ValidationException("Payee scope id is required");
        }
        AccountRef account = AccountRef.payee(ownerId, payeeScopeId);
        jdbcTemplate.update(
            "INSERT INTO payee_accounts (scope_id, owner_id, active) VALUES (?, ?, TRUE) " +
            "ON CONFLICT (scope_id) DO UPDATE SET owner_id = EXCLUDED.owner_id, active = TRUE",
            payeeScopeId,
            account.getOwnerId()
        );
        return account;
    }
}
