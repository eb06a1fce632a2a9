package com.roomallocator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomallocator.engine.ClassroomAllocator;
import com.roomallocator.engine.Result;
import com.roomallocator.model.Booking;
import com.roomallocator.model.Facility;
import com.roomallocator.model.InvalidRequestException;
import com.roomallocator.model.RoomSummary;
import com.roomallocator.model.TimeSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Reads a {@link SeedDataset} from the classpath and applies it to an engine.
 */
public class DatasetLoader {
    private static final Logger logger = LoggerFactory.getLogger(DatasetLoader.class);

    private final ObjectMapper objectMapper;

    public DatasetLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @param resource classpath location, e.g. {@code dataset/default-rooms.json}
     * @throws IllegalStateException if the resource does not exist
     * @throws UncheckedIOException if it cannot be read or parsed
     */
    public SeedDataset load(String resource) {
        try (InputStream input = DatasetLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalStateException("Dataset resource not found: " + resource);
            }
            SeedDataset dataset = objectMapper.readValue(input, SeedDataset.class);
            logger.info("Loaded dataset {} ({} rooms, {} bookings)",
                    resource, dataset.getRooms().size(), dataset.getBookings().size());
            return dataset;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read dataset " + resource, e);
        }
    }

    /**
     * Registers the dataset's rooms, then restores its bookings. Entries the
     * engine rejects are logged and skipped.
     */
    public void apply(SeedDataset dataset, ClassroomAllocator allocator) {
        int rooms = 0;
        for (SeedDataset.SeedRoom seed : dataset.getRooms()) {
            try {
                Result<RoomSummary> result = allocator.registerRoom(seed.getRoomId(), seed.getBuilding(),
                        seed.getCapacity(), seed.getFloor(), Facility.fromFlags(seed.getFacilities()));
                if (result.isSuccess()) {
                    rooms++;
                } else {
                    logger.warn("Skipped seed room {}: {}", seed.getRoomId(), result.getMessage());
                }
            } catch (InvalidRequestException e) {
                logger.warn("Skipped seed room {}: {}", seed.getRoomId(), e.getMessage());
            }
        }

        int bookings = 0;
        for (SeedDataset.SeedBooking seed : dataset.getBookings()) {
            try {
                TimeSlot slot = TimeSlot.parse(seed.getDate(), seed.getStartTime(), seed.getEndTime());
                Result<Booking> result = allocator.importBooking(seed.getRoomId(), seed.getBookingId(), slot,
                        seed.getCourseName(), seed.getInstructor(), null);
                if (result.isSuccess()) {
                    bookings++;
                } else {
                    logger.warn("Skipped seed booking for room {}: {}", seed.getRoomId(), result.getMessage());
                }
            } catch (InvalidRequestException e) {
                logger.warn("Skipped seed booking for room {}: {}", seed.getRoomId(), e.getMessage());
            }
        }

        allocator.getActivityLog().info("System initialized with sample data");
        logger.debug("Applied dataset: {} rooms, {} bookings, {} edges", rooms, bookings, allocator.getEdgeCount());
    }
}
