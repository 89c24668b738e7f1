package com.qubi.netmap.core.store;

import com.qubi.netmap.core.model.AggregateCounters;
import com.qubi.netmap.core.model.Device;
import com.qubi.netmap.core.model.DeviceKind;
import com.qubi.netmap.core.model.DeviceStatus;
import com.qubi.netmap.core.model.Edge;
import com.qubi.netmap.core.model.MergeResult;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Current set of canonical devices, indexed by id and by address.
 *
 * <p>Identity resolution on merge is exact id first, then exact address. Matching records are
 * updated field by field, last writer wins, and fields the incoming record leaves empty keep
 * their stored value. Nothing is ever removed except through {@link #remove(String)}.
 *
 * <p>Not thread-safe: a single writer owns the store (see {@code TopologyService}).
 */
public final class DeviceStore {

    private final Map<Long, Device> slots = new LinkedHashMap<>();   // orden de inserción
    private final Map<String, Long> byId = new HashMap<>();
    private final Map<String, Long> byAddress = new HashMap<>();
    private long nextSlot;
    private long version;

    /**
     * Inserts or updates a device. Records without any identity are ignored and reported
     * as {@link MergeResult#IGNORED}.
     */
    public MergeResult merge(Device incoming) {
        if (incoming == null || incoming.identityKey() == null) {
            return MergeResult.IGNORED;
        }
        Long slot = incoming.id() != null ? byId.get(incoming.id()) : null;
        if (slot == null && incoming.address() != null) {
            slot = byAddress.get(incoming.address());
        }
        if (slot == null) {
            insert(incoming.position() == null ? incoming : incoming.withPosition(null));
            return MergeResult.CREATED;
        }
        Device existing = slots.get(slot);
        Device merged = mergeFields(existing, incoming);
        if (!merged.equals(existing)) {
            replace(slot, existing, merged);
        }
        return MergeResult.UPDATED;
    }

    /**
     * Removes by id. An id-less device is addressed by its identity key, its address.
     */
    public boolean remove(String id) {
        if (id == null) return false;
        Long slot = byId.get(id);
        if (slot == null) {
            Long byAddr = byAddress.get(id);
            if (byAddr != null && slots.get(byAddr).id() == null) slot = byAddr;
        }
        if (slot == null) return false;
        Device gone = slots.remove(slot);
        unindex(slot, gone);
        version++;
        return true;
    }

    /** Merges every entry; devices missing from the snapshot are left untouched. */
    public void replaceSnapshot(List<Device> devices) {
        if (devices == null) return;
        for (Device d : devices) merge(d);
    }

    /**
     * Applies a metrics report to a known device, marking it online.
     *
     * @return false when no device matches {@code deviceId}
     */
    public boolean recordMetrics(String deviceId, Map<String, Object> metrics, Instant lastSeen) {
        Long slot = deviceId == null ? null : byId.get(deviceId);
        if (slot == null && deviceId != null) slot = byAddress.get(deviceId);
        if (slot == null) return false;
        Device existing = slots.get(slot);
        Device.Builder b = existing.toBuilder().status(DeviceStatus.ONLINE);
        if (lastSeen != null) b.lastSeen(lastSeen);
        if (metrics != null) metrics.forEach(b::metric);
        Device updated = b.build();
        if (!updated.equals(existing)) {
            replace(slot, existing, updated);
        }
        return true;
    }

    public Device get(String key) {
        if (key == null) return null;
        Long slot = byId.get(key);
        if (slot == null) slot = byAddress.get(key);
        return slot == null ? null : slots.get(slot);
    }

    /** Immutable copy, safe to hand to inference and layout. */
    public List<Device> devices() {
        return List.copyOf(slots.values());
    }

    public int size() {
        return slots.size();
    }

    /** Incremented on every change of the stored state, never on no-op merges. */
    public long version() {
        return version;
    }

    public AggregateCounters counters(Collection<Edge> edges) {
        return AggregateCounters.of(slots.values(), edges);
    }

    // ===== internals =====

    static Device mergeFields(Device existing, Device incoming) {
        Map<String, Object> metrics = new LinkedHashMap<>(existing.metrics());
        metrics.putAll(incoming.metrics());
        return Device.builder()
                .id(pick(incoming.id(), existing.id()))
                .address(pick(incoming.address(), existing.address()))
                .displayName(pick(incoming.displayName(), existing.displayName()))
                .kind(pickKind(incoming.kind(), existing.kind()))
                .status(incoming.status() != null ? incoming.status() : existing.status())
                .lastSeen(incoming.lastSeen() != null ? incoming.lastSeen() : existing.lastSeen())
                .metrics(metrics)
                .build();
    }

    private static String pick(String incoming, String existing) {
        return incoming != null && !incoming.isBlank() ? incoming : existing;
    }

    // UNKNOWN nunca degrada un tipo conocido
    private static DeviceKind pickKind(DeviceKind incoming, DeviceKind existing) {
        if (incoming != null && incoming != DeviceKind.UNKNOWN) return incoming;
        return existing != null ? existing : incoming;
    }

    private void insert(Device d) {
        long slot = nextSlot++;
        slots.put(slot, d);
        index(slot, d);
        version++;
    }

    private void replace(long slot, Device before, Device after) {
        unindex(slot, before);
        slots.put(slot, after);
        if (after.address() != null) absorbAddressTwin(slot, after);
        index(slot, slots.get(slot));
        version++;
    }

    /**
     * An update that moved a record onto an address still held by an id-less record folds
     * that record in, since both now describe the same device.
     */
    private void absorbAddressTwin(long slot, Device owner) {
        Long other = byAddress.get(owner.address());
        if (other == null || other == slot) return;
        Device twin = slots.get(other);
        if (twin.id() != null) return;
        slots.remove(other);
        unindex(other, twin);
        slots.put(slot, mergeFields(twin, owner));
    }

    private void index(long slot, Device d) {
        if (d.id() != null) byId.put(d.id(), slot);
        if (d.address() != null) byAddress.put(d.address(), slot);
    }

    private void unindex(long slot, Device d) {
        if (d.id() != null) byId.remove(d.id(), slot);
        if (d.address() != null && byAddress.remove(d.address(), slot)) {
            // otro registro con id propio puede compartir la dirección
            for (Map.Entry<Long, Device> en : slots.entrySet()) {
                if (en.getKey() != slot && d.address().equals(en.getValue().address())) {
                    byAddress.put(d.address(), en.getKey());
                    break;
                }
            }
        }
    }
}
