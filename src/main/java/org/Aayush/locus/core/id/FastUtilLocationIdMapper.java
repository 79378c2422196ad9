package org.Aayush.locus.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * {@link LocationIdMapper} over the aggregated, key-sorted location list.
 * <p>
 * Keys must be non-null and distinct. Immutable after construction.
 */
public class FastUtilLocationIdMapper implements LocationIdMapper {

    // key -> node id, -1 when absent
    private final Object2IntOpenHashMap<String> forward;
    // node id -> key
    private final String[] reverse;

    /**
     * @param orderedLocationIds distinct keys; list position becomes the node id.
     */
    public FastUtilLocationIdMapper(List<String> orderedLocationIds) {
        if (orderedLocationIds == null) {
            throw new IllegalArgumentException("Location ids cannot be null");
        }
        int size = orderedLocationIds.size();

        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(-1);
        this.reverse = new String[size];

        for (int nodeId = 0; nodeId < size; nodeId++) {
            String locationId = orderedLocationIds.get(nodeId);
            if (locationId == null) {
                throw new IllegalArgumentException("Location id at position " + nodeId + " is null");
            }
            int previous = forward.put(locationId, nodeId);
            if (previous != -1) {
                throw new IllegalArgumentException(
                        "Duplicate location id '" + locationId + "' at positions " + previous + " and " + nodeId
                );
            }
            reverse[nodeId] = locationId;
        }

        this.forward.trim();
    }

    @Override
    public int toInternal(String locationId) throws UnknownLocationException {
        int id = forward.getInt(locationId);
        if (id == -1) {
            throw new UnknownLocationException("Location id not found: " + locationId);
        }
        return id;
    }

    @Override
    public String toExternal(int nodeId) {
        if (!containsInternal(nodeId)) {
            throw new IndexOutOfBoundsException("Node id out of bounds: " + nodeId);
        }
        return reverse[nodeId];
    }

    @Override
    public boolean containsExternal(String locationId) {
        return forward.containsKey(locationId);
    }

    @Override
    public boolean containsInternal(int nodeId) {
        return nodeId >= 0 && nodeId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
