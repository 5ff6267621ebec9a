package com.sharesgate.domain;

/**
 * Upsert and flag updates on user_mappings.
 */
public interface UserMappingRepositoryCustom {

    /**
     * Creates the mapping or refreshes its external identity. A new mapping starts un-gated;
     * an existing mapping keeps its gated flag.
     */
    UserMapping upsertIdentity(String address, String chainType, String externalIdentity);

    /** @return true when a mapping existed and was flagged */
    boolean markGated(String address, String chainType);
}
