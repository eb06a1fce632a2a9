package com.roomallocator;

import com.roomallocator.engine.ClassroomAllocator;
import com.roomallocator.server.AllocationServer;
import com.roomallocator.service.AllocationService;
import com.roomallocator.util.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;
import java.util.Scanner;
import java.util.concurrent.CountDownLatch;

/**
 * Boots the classroom allocator:
 * • loads the seed dataset into a fresh engine
 * • serves it through an AllocationServer (ZeroMQ ROUTER, default tcp://*:5570)
 * <p>
 * Command line arguments can be used to override configuration:
 * • java -jar classroom-allocator.jar ALLOCATOR_ENDPOINT=tcp://*:6000
 * • java -jar classroom-allocator.jar DATASET_RESOURCE=dataset/default-rooms.json ACTIVITY_LOG_CAPACITY=200
 * <p>
 * Press ENTER (or send CTRL-C) to stop.
 */
public final class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final CountDownLatch LATCH = new CountDownLatch(1);

    public static void main(String[] args) {
        Properties config = ConfigProvider.loadConfiguration(args);

        String endpoint = config.getProperty(ConfigProvider.ALLOCATOR_ENDPOINT);
        String dataset = config.getProperty(ConfigProvider.DATASET_RESOURCE);
        int logCapacity = ConfigProvider.getPositiveInt(config, ConfigProvider.ACTIVITY_LOG_CAPACITY, 100);

        AllocationService service = AllocationService.seededFrom(dataset, logCapacity);

        try (AllocationServer server = new AllocationServer(service, endpoint)) {
            server.start();
            logConfiguration(service.current(), endpoint, dataset, logCapacity);

            // shutdown hook so Ctrl-C works as well
            Runtime.getRuntime().addShutdownHook(new Thread(LATCH::countDown));

            logger.info("Allocator running – press ENTER to quit.");
            waitForEnter();
        } catch (Exception ex) {
            logger.error("Fatal error in Main", ex);
        }

        logger.info("Allocator shutdown complete");
    }

    private static void logConfiguration(ClassroomAllocator allocator, String endpoint,
                                         String dataset, int logCapacity) {
        logger.info("System configuration:");
        logger.info("- Endpoint: {}", endpoint);
        logger.info("- Dataset: {}", dataset);
        logger.info("- Activity log capacity: {}", logCapacity);
        logger.info("- Rooms: {} ({} adjacency edges)", allocator.getStatistics().getTotalRooms(),
                allocator.getEdgeCount());
    }

    private static void waitForEnter() {
        Thread stdin = new Thread(() -> {
            try (Scanner sc = new Scanner(System.in)) {
                if (sc.hasNextLine()) {
                    sc.nextLine();
                }
            } finally {
                LATCH.countDown();
            }
        }, "stdin-wait");
        stdin.setDaemon(true);
        stdin.start();

        try {
            LATCH.await();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
