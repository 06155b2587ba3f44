package com.vidnyan.calltree.adapter.out.parser;

import com.vidnyan.calltree.domain.model.CallSite;
import com.vidnyan.calltree.domain.model.FunctionKey;
import com.vidnyan.calltree.domain.model.FunctionRecord;
import com.vidnyan.calltree.domain.model.FunctionSignature;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Function records of one file, keyed by name and qualifiers.
 * Owned by a single worker for the duration of one scan.
 */
@Slf4j
class CallAggregator {

    private final Path path;
    private final RteClassifier rteClassifier;
    private final Map<FunctionKey, FunctionRecord> records = new LinkedHashMap<>();

    CallAggregator(Path path, RteClassifier rteClassifier) {
        this.path = path;
        this.rteClassifier = rteClassifier;
    }

    /**
     * Record a definition. An exact duplicate (same name and qualifiers) keeps the
     * existing identity and restarts its edges, so the last definition wins.
     */
    FunctionRecord define(FunctionSignature signature) {
        FunctionRecord existing = records.get(signature.key());
        if (existing != null) {
            log.debug("Duplicate definition of {} at {}:{}, keeping the later body",
                    signature.key(), path, signature.startLine());
            existing.redefine(signature);
            return existing;
        }
        FunctionRecord created = new FunctionRecord(signature, path);
        records.put(signature.key(), created);
        return created;
    }

    void record(FunctionRecord caller, CallSite site) {
        caller.addCall(site, rteClassifier.isRte(site.callee()));
    }

    List<FunctionRecord> functions() {
        return new ArrayList<>(records.values());
    }
}
