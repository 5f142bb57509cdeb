package com.sysmuse.leadership.hub;

import com.sysmuse.leadership.model.LeadershipHierarchy;
import com.sysmuse.util.LoggingUtil;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Attaches external account ids to every person in a hierarchy whose primary email
 * the directory knows. Returns an enriched copy; the input is left as is.
 */
public class AccountEnrichmentService {

    private final AccountLookupService lookupService;

    public AccountEnrichmentService(AccountLookupService lookupService) {
        this.lookupService = lookupService;
    }

    public LeadershipHierarchy enrich(LeadershipHierarchy hierarchy) {
        List<String> emails = hierarchy.extractEmails();
        if (emails.isEmpty()) {
            LoggingUtil.info("No emails to enrich");
            return hierarchy;
        }

        Map<String, Optional<String>> results = lookupService.lookupAll(emails);
        Map<String, String> ids = new LinkedHashMap<>();
        for (Map.Entry<String, Optional<String>> entry : results.entrySet()) {
            entry.getValue().ifPresent(id -> ids.put(entry.getKey(), id));
        }

        LeadershipHierarchy enriched = hierarchy.withAccountIds(ids);
        LoggingUtil.info("Enriched " + ids.size() + "/" + emails.size() + " emails with account ids");
        return enriched;
    }
}
