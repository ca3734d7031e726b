package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.IncidentRecord;

public interface IncidentRecordRepository extends IncidentOutcomeSource {

    IncidentRecord save(IncidentRecord incident);
}
