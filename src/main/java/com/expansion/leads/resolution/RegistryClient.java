package com.expansion.leads.resolution;

import com.expansion.leads.core.model.BeneficialOwner;
import com.expansion.leads.core.model.CompanyProfile;
import com.expansion.leads.core.model.Incorporation;
import com.expansion.leads.core.model.Officer;
import com.expansion.leads.core.model.RegistrySearchHit;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Companies registry collaborator.
 *
 * <p>"Not found" is an empty result, never an exception. Transient failures that survive the
 * HTTP boundary's retries surface as {@link com.expansion.leads.core.UpstreamException}.</p>
 */
public interface RegistryClient {

    List<RegistrySearchHit> search(String query, int maxResults);

    Optional<CompanyProfile> profile(String registryNumber);

    List<Officer> officers(String registryNumber);

    List<BeneficialOwner> owners(String registryNumber);

    /**
     * Companies incorporated in the inclusive date range, newest first, at most {@code maxResults}.
     */
    List<Incorporation> incorporatedBetween(LocalDate from, LocalDate to, int maxResults);
}
