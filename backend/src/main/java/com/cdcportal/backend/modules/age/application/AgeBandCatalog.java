package com.cdcportal.backend.modules.age.application;

import java.util.ArrayList;
import java.util.List;

import com.cdcportal.backend.modules.age.domain.AgeBand;
import com.cdcportal.backend.modules.age.domain.AgeBandTable;
import com.cdcportal.backend.modules.age.domain.AgeRange;
import com.cdcportal.backend.modules.age.domain.UnparseableRangeException;
import com.cdcportal.backend.modules.age.infrastructure.persistence.AgeBandRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds the {@link AgeBandTable} from the {@code age_groups} catalog, keyed by row id.
 * Rows whose range cannot be parsed are left out of the table.
 */
@Service
@Transactional(readOnly = true)
public class AgeBandCatalog {

    private static final Logger log = LoggerFactory.getLogger(AgeBandCatalog.class);

    private final AgeBandRepository ageBandRepository;

    public AgeBandCatalog(AgeBandRepository ageBandRepository) {
        this.ageBandRepository = ageBandRepository;
    }

    public AgeBandTable loadTable() {
        AgeBandTable.Builder builder = AgeBandTable.builder();
        for (CatalogEntry entry : listEntries()) {
            if (entry.range() != null) {
                builder.add(AgeBand.keyOf(entry.id()), entry.range());
            }
        }
        return builder.build();
    }

    public List<CatalogEntry> listEntries() {
        List<CatalogEntry> entries = new ArrayList<>();
        for (AgeBand band : ageBandRepository.findAllByOrderByIdAsc()) {
            try {
                entries.add(new CatalogEntry(band.getId(), band.getAgeRange(), AgeBandTable.parse(band.getAgeRange())));
            } catch (UnparseableRangeException ex) {
                log.warn("Skipping age band {}: {}", band.getId(), ex.getMessage());
                entries.add(new CatalogEntry(band.getId(), band.getAgeRange(), null));
            }
        }
        return entries;
    }

    /** {@code range} is null when the stored text is unparseable. */
    public record CatalogEntry(Long id, String rawRange, AgeRange range) {
    }
}
