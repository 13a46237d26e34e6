package com.example.tiltbatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Compute devices discovered at the start of a stage. The free list does not change afterwards,
 * even if a busy device frees up while the stage runs.
 */
public final class ResourcePool {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResourcePool.class);

    private final List<ResourceDescriptor> descriptors;
    private final List<String> freeDevices;

    ResourcePool(List<ResourceDescriptor> descriptors) throws ResourceUnavailableException {
        this.descriptors = List.copyOf(descriptors);
        this.freeDevices = descriptors.stream()
                .filter(descriptor -> !descriptor.busy())
                .map(ResourceDescriptor::deviceId)
                .toList();
        if (freeDevices.isEmpty()) {
            throw new ResourceUnavailableException(descriptors.size()
                    + " device(s) detected, but none of them is free.");
        }
    }

    /**
     * Queries the devices and keeps the ones no process is running on.
     *
     * @throws ResourceUnavailableException if no device is free
     */
    public static ResourcePool discover(DeviceQuery query) throws ResourceUnavailableException {
        List<ResourceDescriptor> descriptors = parse(query.listDevices(), query.listBusyDevices());
        ResourcePool pool = new ResourcePool(descriptors);
        LOGGER.info("Free devices: {} of {}", pool.freeDevices(), descriptors.size());
        return pool;
    }

    /**
     * Cross-references the device list with the busy list by UUID.
     */
    static List<ResourceDescriptor> parse(String deviceListing, String busyListing) {
        Set<String> busy = new HashSet<>();
        for (String line : busyListing.split("\\R")) {
            String uuid = line.strip();
            if (!uuid.isEmpty() && !uuid.equalsIgnoreCase("gpu_uuid")) {
                busy.add(uuid);
            }
        }

        List<ResourceDescriptor> descriptors = new ArrayList<>();
        for (String line : deviceListing.split("\\R")) {
            String trimmed = line.strip();
            int idStart = trimmed.indexOf("GPU ");
            int idEnd = trimmed.indexOf(':', idStart + 4);
            if (idStart < 0 || idEnd < 0) {
                continue;
            }
            String deviceId = trimmed.substring(idStart + 4, idEnd).strip();
            String uuid = "";
            int uuidStart = trimmed.indexOf("UUID:");
            if (uuidStart >= 0) {
                int uuidEnd = trimmed.indexOf(')', uuidStart);
                uuid = trimmed.substring(uuidStart + 5, uuidEnd < 0 ? trimmed.length() : uuidEnd).strip();
            }
            descriptors.add(new ResourceDescriptor(deviceId, uuid, busy.contains(uuid)));
        }
        return descriptors;
    }

    public List<ResourceDescriptor> descriptors() {
        return descriptors;
    }

    public List<String> freeDevices() {
        return freeDevices;
    }

    /**
     * Number of jobs that may run at once.
     */
    public int concurrency(int jobsPerDevice) {
        return freeDevices.size() * Math.max(1, jobsPerDevice);
    }

    /**
     * Binds the items to the free devices round-robin, in the order given.
     */
    public List<WorkItem> assign(List<WorkItem> items) {
        List<WorkItem> assigned = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            assigned.add(items.get(i).withDevice(freeDevices.get(i % freeDevices.size())));
        }
        return assigned;
    }
}
