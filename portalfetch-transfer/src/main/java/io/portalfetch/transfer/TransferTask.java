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
import io.portalfetch.transport.AuthenticatedTransport;
import io.portalfetch.transport.HttpStatusException;
import io.portalfetch.transport.TransportRequest;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/// Downloads one remote object to one local file, resuming from whatever is already on disk.
///
/// A partial local file of size `S` is continued with `Range: bytes=S-`. The response decides
/// what happens next:
/// - 206: the body is appended and the expected total is `Content-Length + S`
/// - 200 although a range was sent: the server ignored the range, so the local bytes are
///   discarded and the body is taken as the whole object
/// - 416: the remote size is queried; a file of exactly that size is complete, anything else is
///   deleted and downloaded again from zero
///
/// After streaming, a file shorter than the expected total is a failure that keeps the partial
/// file as the next resume point. A file longer than the total is deleted. The task never leaves
/// a file larger than the remote object. Bodies are requested without content coding so byte
/// offsets on disk match offsets on the server.
public class TransferTask implements ItemFetcher {
    private static final Logger logger = LogManager.getLogger(TransferTask.class);

    private static final String IDENTITY_ENCODING = "identity";

    private final AuthenticatedTransport transport;
    private final TransferConfig config;
    private final TransferEventSink events;
    private final CancellationToken cancellation;

    public TransferTask(AuthenticatedTransport transport, TransferConfig config, TransferEventSink events,
                        CancellationToken cancellation)
    {
        this.transport = transport;
        this.config = config;
        this.events = events;
        this.cancellation = cancellation;
    }

    /// Transfers an item and reports the result instead of throwing.
    ///
    /// @param item The item to transfer
    /// @return COMPLETED, SKIPPED or FAILED with the cause
    @Override
    public TransferOutcome fetch(WorkItem item) {
        try {
            return download(item);
        } catch (TransferCancelledException e) {
            logger.info("Transfer of {} cancelled", item.sourceLocator());
            return TransferOutcome.failed(item, e);
        } catch (IOException | RuntimeException e) {
            logger.debug("Transfer of {} failed", item.sourceLocator(), e);
            return TransferOutcome.failed(item, e);
        }
    }

    /// Transfers an item.
    ///
    /// @param item The item to transfer
    /// @return COMPLETED or SKIPPED
    /// @throws TransferException If the file is incomplete or inconsistent after the attempt
    /// @throws IOException If the transport or the file system fails
    public TransferOutcome download(WorkItem item) throws IOException {
        cancellation.throwIfCancelled(item);
        Path destination = item.destinationPath();
        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        long localSize = localSize(destination);
        if (item.hasSizeHint() && Files.exists(destination) && localSize == item.sizeHint()) {
            logger.debug("{} already has the expected {} bytes", destination, localSize);
            return TransferOutcome.skipped(item, localSize);
        }
        return transfer(item, localSize, true);
    }

    private TransferOutcome transfer(WorkItem item, long localSize, boolean mayRestart) throws IOException {
        Path destination = item.destinationPath();
        String url = item.sourceLocator();
        TransportRequest request = TransportRequest.get(url)
            .withHeader("Accept-Encoding", IDENTITY_ENCODING)
            .allowingStatus(416);
        if (localSize > 0) {
            request = request.withHeader("Range", "bytes=" + localSize + "-");
        }

        try (Response response = transport.request(request)) {
            if (response.code() == 416) {
                long remoteSize = remoteSize(url);
                if (remoteSize >= 0 && remoteSize == localSize) {
                    return TransferOutcome.skipped(item, localSize);
                }
                if (remoteSize >= 0 && localSize > remoteSize) {
                    logger.warn("{} is larger than the remote object ({} > {} bytes), downloading again",
                        destination, localSize, remoteSize);
                } else {
                    logger.warn("Range {}- refused for {} (remote size {}), downloading again", localSize, url,
                        remoteSize < 0 ? "unknown" : remoteSize);
                }
                Files.deleteIfExists(destination);
                if (!mayRestart) {
                    throw new TransferException("Range refused again after restart for " + url);
                }
            } else {
                return stream(item, response, localSize);
            }
        }
        return transfer(item, 0, false);
    }

    private TransferOutcome stream(WorkItem item, Response response, long localSize) throws IOException {
        Path destination = item.destinationPath();
        ResponseBody body = response.body();
        if (body == null) {
            throw new TransferException("No response body for " + item.sourceLocator());
        }
        long contentLength = body.contentLength();

        long offset;
        long total;
        if (response.code() == 206) {
            offset = localSize;
            long rangeTotal = totalFromContentRange(response.header("Content-Range"));
            total = contentLength >= 0 ? contentLength + localSize : rangeTotal;
        } else {
            if (localSize > 0) {
                logger.warn("Server ignored the range request for {}, discarding {} local bytes",
                    item.sourceLocator(), localSize);
            }
            offset = 0;
            total = contentLength;
        }

        if (total > 0 && offset >= total) {
            return TransferOutcome.skipped(item, offset);
        }

        OpenOption[] options = offset > 0
            ? new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND}
            : new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING};

        long written = 0;
        byte[] buffer = new byte[config.chunkSize()];
        try (OutputStream out = Files.newOutputStream(destination, options);
             BufferedSource source = body.source())
        {
            int read;
            while ((read = source.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                written += read;
                events.progress(item, offset + written, total);
                cancellation.throwIfCancelled(item);
            }
        }

        long finalSize = Files.size(destination);
        if (total >= 0 && finalSize < total) {
            throw new TransferException("Truncated transfer of " + item.sourceLocator() + ": " + finalSize + " of "
                                        + total + " bytes on disk");
        }
        if (total >= 0 && finalSize > total) {
            Files.deleteIfExists(destination);
            throw new IntegrityException("Local file " + destination + " overran the remote object", total, finalSize);
        }
        return TransferOutcome.completed(item, written);
    }

    /// Asks the portal for the size of an object, first with HEAD, then with a one-byte range.
    ///
    /// @return The size in bytes, or -1 when the portal does not say
    long remoteSize(String url) throws IOException {
        try (Response head = transport.head(url)) {
            long length = parseLong(head.header("Content-Length"));
            if (length >= 0) {
                return length;
            }
        } catch (HttpStatusException e) {
            logger.debug("HEAD {} answered {}, falling back to a range probe", url, e.statusCode());
        }

        TransportRequest probe = TransportRequest.get(url)
            .withHeader("Accept-Encoding", IDENTITY_ENCODING)
            .withHeader("Range", "bytes=0-0")
            .allowingStatus(416);
        try (Response response = transport.request(probe)) {
            long total = totalFromContentRange(response.header("Content-Range"));
            if (total >= 0) {
                return total;
            }
            if (response.code() == 200 && response.body() != null) {
                return response.body().contentLength();
            }
        }
        return -1;
    }

    static long totalFromContentRange(String contentRange) {
        if (contentRange == null) {
            return -1;
        }
        int slash = contentRange.lastIndexOf('/');
        if (slash < 0) {
            return -1;
        }
        return parseLong(contentRange.substring(slash + 1).trim());
    }

    private static long parseLong(String value) {
        if (value == null) {
            return -1;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static long localSize(Path path) throws IOException {
        return Files.exists(path) ? Files.size(path) : 0;
    }
}
