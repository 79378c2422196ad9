package org.Aayush.locus.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Translates between location keys (as they appear in engagement records) and the dense
 * node ids used by every graph stage.
 *
 * <p>Node ids are assigned once, after aggregation sorts locations by key, and are shared by
 * the similarity graph, the partition and the position map. Renderer lookups by key
 * ({@code NetworkResult.locationNode}) go through {@link #toInternal(String)}.</p>
 */
public interface LocationIdMapper {

    /**
     * Resolves a location key to its node id.
     *
     * @throws UnknownLocationException when the key was never aggregated (unknown, or dropped
     *                                  as incomplete or below the minimum tweet count).
     */
    int toInternal(String locationId) throws UnknownLocationException;

    /**
     * Location key of a node.
     *
     * @throws IndexOutOfBoundsException when {@code nodeId} is outside {@code [0, size())}.
     */
    String toExternal(int nodeId);

    boolean containsExternal(String locationId);

    boolean containsInternal(int nodeId);

    /**
     * Number of aggregated locations, which equals the graph node count.
     */
    int size();

    /**
     * Raised for a location key that has no node.
     */
    @StandardException
    class UnknownLocationException extends RuntimeException {
    }

    /**
     * Node id {@code i} becomes {@code orderedLocationIds.get(i)}.
     *
     * @param orderedLocationIds distinct keys in node-id order.
     */
    static LocationIdMapper fromOrderedIds(List<String> orderedLocationIds) {
        return new FastUtilLocationIdMapper(orderedLocationIds);
    }
}
