package com.expansion.leads.sources;

import com.expansion.leads.core.model.SourceRecord;

import java.util.List;

/**
 * Supplies the current sponsor register as filtered rows.
 */
public interface SponsorRegisterSource {

    /**
     * @throws com.expansion.leads.core.UpstreamException when the feed cannot be downloaded
     */
    List<SourceRecord> fetch();
}
