package com.delta.casetracker.tracker.service;

import com.delta.casetracker.tracker.model.ClassifiedRecord;
import com.delta.casetracker.tracker.model.LimitPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Admits the first {@code maxNewPerRun} NEW records in the order given (id order when fed by
 * {@link ChangeDetector}). UPDATED records are always admitted, UNCHANGED never.
 */
@Service
public class LimitEnforcer {
    private static final Logger log = LoggerFactory.getLogger(LimitEnforcer.class);

    public List<ClassifiedRecord> enforce(List<ClassifiedRecord> classified, LimitPolicy policy) {
        List<ClassifiedRecord> out = new ArrayList<>(classified.size());
        int admittedNew = 0;
        int limitedNew = 0;
        for (ClassifiedRecord record : classified) {
            switch (record.status()) {
                case NEW -> {
                    if (admittedNew < policy.maxNewPerRun()) {
                        admittedNew++;
                        out.add(record.admit());
                    } else {
                        limitedNew++;
                        out.add(record.exclude(ClassifiedRecord.SKIP_NEW_RECORD_LIMIT));
                    }
                }
                case UPDATED -> out.add(record.admit());
                case UNCHANGED -> out.add(record.exclude(null));
            }
        }
        if (limitedNew > 0) {
            log.info(
                "New record limit reached: admitted={} limited={} maxNewPerRun={}",
                admittedNew,
                limitedNew,
                policy.maxNewPerRun()
            );
        }
        return out;
    }
}
