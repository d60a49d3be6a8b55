package com.crimedata.api.service;

import com.crimedata.api.model.Agency;
import com.crimedata.api.query.NotFoundException;
import com.crimedata.api.query.PageRequest;
import com.crimedata.api.query.PaginationShaper;
import com.crimedata.api.store.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class AgencyService {

    private final RecordStore recordStore;
    private final PaginationShaper paginationShaper;

    public List<Agency> list(String page, String pageSize) {
        PageRequest request = paginationShaper.resolve(page, pageSize);
        List<Agency> agencies = recordStore.findAgencies(request);
        log.debug("Agencies page {}: {} rows", request.page(), agencies.size());
        return agencies;
    }

    public Agency get(String ori) {
        return recordStore.findAgencyByOri(ori)
                .orElseThrow(() -> new NotFoundException("Agency not found: " + ori));
    }
}
