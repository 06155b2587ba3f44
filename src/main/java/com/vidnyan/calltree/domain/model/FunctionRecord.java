package com.vidnyan.calltree.domain.model;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A defined function and its outgoing calls.
 * <p>
 * Identity is the {@link FunctionKey} (name and qualifiers). The record is owned
 * by the single worker scanning its file; once that scan finishes it is only read.
 */
public final class FunctionRecord {

    private final FunctionKey key;
    private final Path sourcePath;
    private final Map<String, CallEdge> edges = new LinkedHashMap<>();
    private FunctionSignature signature;
    private int bodyEndLine;
    private int definitionCount = 1;

    public FunctionRecord(FunctionSignature signature, Path sourcePath) {
        this.signature = Objects.requireNonNull(signature, "signature");
        this.key = signature.key();
        this.sourcePath = sourcePath;
        this.bodyEndLine = signature.endLine();
    }

    /**
     * Record one call site. The first sighting creates the edge, repeats merge into it.
     */
    public CallEdge addCall(CallSite site, boolean rte) {
        return edges.merge(site.callee(),
                CallEdge.firstSighting(site, rte),
                (existing, fresh) -> existing.withOccurrence(site));
    }

    /**
     * Replace this record's definition with a later exact duplicate.
     * Identity is kept; edges restart so the last definition wins.
     */
    public void redefine(FunctionSignature newer) {
        if (!key.equals(newer.key())) {
            throw new IllegalArgumentException("Redefinition " + newer.key() + " does not match " + key);
        }
        this.signature = newer;
        this.bodyEndLine = newer.endLine();
        this.edges.clear();
        this.definitionCount++;
    }

    public void closeBody(int line) {
        this.bodyEndLine = line;
    }

    public FunctionKey key() {
        return key;
    }

    public String name() {
        return key.name();
    }

    public FunctionSignature signature() {
        return signature;
    }

    public Path sourcePath() {
        return sourcePath;
    }

    public int definitionCount() {
        return definitionCount;
    }

    /**
     * Callee name to edge, in order of first sighting.
     */
    public Map<String, CallEdge> edges() {
        return Collections.unmodifiableMap(edges);
    }

    public Collection<CallEdge> calls() {
        return Collections.unmodifiableCollection(edges.values());
    }

    public Optional<CallEdge> edgeTo(String callee) {
        return Optional.ofNullable(edges.get(callee));
    }

    public Location location() {
        String file = sourcePath != null ? sourcePath.toString() : "unknown";
        return new Location(file, signature.startLine(), bodyEndLine);
    }

    @Override
    public String toString() {
        return key.qualifiers().isEmpty() ? key.name() : key.qualifiers() + " " + key.name();
    }
}
