package com.telcobright.partman;

import com.telcobright.partman.core.config.PartitionManagerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Runs the partition manager as a standalone process until it is terminated.
 */
public class PartitionManagerMain {

    private static final Logger logger = LoggerFactory.getLogger(PartitionManagerMain.class);

    public static void main(String[] args) throws Exception {
        PartitionManagerConfig config = PartitionManagerConfig.load();
        PartitionManager manager = PartitionManager.builder()
            .withConfig(config)
            .build();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            manager.close();
            stopped.countDown();
        }, "partition-manager-shutdown"));

        try {
            manager.start();
        } catch (Exception e) {
            logger.error("Partition manager failed to start", e);
            manager.close();
            System.exit(1);
        }

        logger.info("Partition manager running against {}", config.getDataSourceConfig());
        stopped.await();
    }
}
