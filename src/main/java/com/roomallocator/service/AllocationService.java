package com.roomallocator.service;

import com.roomallocator.engine.ActivityLog;
import com.roomallocator.engine.ClassroomAllocator;
import com.roomallocator.model.BookingIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Holds the live engine. A reset builds a complete new engine from the
 * factory and swaps it in with one atomic write, so requests see either the
 * old state or the new one, never a half-seeded one.
 */
public class AllocationService {
    private static final Logger logger = LoggerFactory.getLogger(AllocationService.class);

    private final Supplier<ClassroomAllocator> factory;
    private final AtomicReference<ClassroomAllocator> current;

    public AllocationService(Supplier<ClassroomAllocator> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.current = new AtomicReference<>(Objects.requireNonNull(factory.get(), "initial allocator"));
    }

    /**
     * Creates a service whose engines are seeded from a classpath dataset.
     */
    public static AllocationService seededFrom(String datasetResource, int activityLogCapacity) {
        DatasetLoader loader = new DatasetLoader();
        SeedDataset dataset = loader.load(datasetResource);
        return new AllocationService(() -> {
            ClassroomAllocator allocator = new ClassroomAllocator(
                    new ActivityLog(activityLogCapacity, Clock.systemDefaultZone()),
                    new BookingIdGenerator());
            loader.apply(dataset, allocator);
            return allocator;
        });
    }

    /**
     * @return the engine serving requests right now
     */
    public ClassroomAllocator current() {
        return current.get();
    }

    /**
     * Replaces the whole engine state with a freshly seeded one.
     *
     * @return the new engine
     */
    public ClassroomAllocator reset() {
        ClassroomAllocator fresh = Objects.requireNonNull(factory.get(), "reset allocator");
        current.set(fresh);
        logger.info("Engine reset to initial dataset");
        return fresh;
    }
}
