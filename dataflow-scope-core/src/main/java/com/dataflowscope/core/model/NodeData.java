package com.dataflowscope.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Location and scoping payload of a graph node.
 *
 * @param locationId stable hash of the tick-stripped location kind, or null
 * @param locationType location constructor ({@code Process}, {@code Cluster}, {@code External}), or null
 * @param locationKind normalised location kind, e.g. {@code Tick<Process<Leader>>}, or null
 * @param tickVariable function-qualified tick variable ({@code fn::tick}), or null
 * @param returnType raw return type matched from the type oracle, or null
 * @param backtrace call-site backtrace entries, usually empty
 * @param sourcePosition position of the operator name, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeData(
    Integer locationId,
    String locationType,
    String locationKind,
    String tickVariable,
    String returnType,
    List<String> backtrace,
    SourcePosition sourcePosition
) {
    /**
     * Compact constructor with defaults.
     */
    public NodeData {
        backtrace = backtrace == null ? List.of() : List.copyOf(backtrace);
    }

    public static NodeData at(SourcePosition position) {
        return new NodeData(null, null, null, null, null, List.of(), position);
    }

    public NodeData withTickVariable(String tickVariable) {
        return new NodeData(locationId, locationType, locationKind, tickVariable, returnType, backtrace, sourcePosition);
    }

    /**
     * Returns a copy carrying location information.
     *
     * @param locationId location hash
     * @param locationType location constructor
     * @param locationKind normalised kind
     * @param returnType matched return type
     * @return updated data
     */
    public NodeData withLocation(Integer locationId, String locationType, String locationKind, String returnType) {
        return new NodeData(locationId, locationType, locationKind, tickVariable, returnType, backtrace, sourcePosition);
    }
}
