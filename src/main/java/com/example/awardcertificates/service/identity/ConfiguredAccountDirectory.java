package com.example.awardcertificates.service.identity;

import com.example.awardcertificates.config.CertificateProperties;
import com.example.awardcertificates.model.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Component
public class ConfiguredAccountDirectory implements AccountDirectory {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredAccountDirectory.class);

    private final Map<String, Identity> accounts;

    public ConfiguredAccountDirectory(CertificateProperties properties) {
        Map<String, Identity> loaded = new LinkedHashMap<>();
        for (CertificateProperties.Account account : properties.getAccounts()) {
            Identity identity = new Identity(account.getAccountId(), account.getDisplayName(), account.getRole(),
                    account.getDepartment());
            if (loaded.putIfAbsent(identity.accountId(), identity) != null) {
                throw new IllegalStateException("Account " + identity.accountId() + " is configured twice");
            }
        }
        this.accounts = Collections.unmodifiableMap(loaded);
        log.info("Loaded {} configured accounts", accounts.size());
    }

    @Override
    public Optional<Identity> findByAccountId(String accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(accounts.get(accountId.trim()));
    }
}
