package io.portalfetch.transfer;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.portalfetch.manifest.WorkItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Writes transfer events to the log. Per-chunk progress goes to TRACE.
public class LoggingTransferEventSink implements TransferEventSink {
    private static final Logger logger = LogManager.getLogger(LoggingTransferEventSink.class);

    @Override
    public void roundStarted(int round, int items) {
        logger.info("Round {}: {} item(s) to transfer", round, items);
    }

    @Override
    public void progress(WorkItem item, long bytesOnDisk, long totalBytes) {
        if (logger.isTraceEnabled()) {
            logger.trace("{}: {}/{} bytes", item.destinationPath().getFileName(), bytesOnDisk,
                totalBytes < 0 ? "?" : totalBytes);
        }
    }

    @Override
    public void itemFinished(int round, TransferOutcome outcome) {
        switch (outcome.status()) {
            case COMPLETED:
                logger.info("Downloaded {} ({} bytes)", outcome.item().destinationPath(), outcome.bytes());
                break;
            case SKIPPED:
                logger.debug("Already complete: {}", outcome.item().destinationPath());
                break;
            default:
                if (outcome.isCancelled()) {
                    logger.info("Stopped {} on cancellation", outcome.item().destinationPath());
                } else {
                    logger.warn("Round {}: failed {}: {}", round, outcome.item().sourceLocator(),
                        outcome.error() == null ? "unknown error" : outcome.error().getMessage());
                }
        }
    }

    @Override
    public void roundFinished(int round, int completed, int skipped, int failed) {
        logger.info("Round {} finished: {} downloaded, {} already complete, {} failed", round, completed, skipped,
            failed);
    }
}
