package io.portalfetch.command;

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

import io.portalfetch.config.PortalFetchSettings;
import io.portalfetch.crawl.CrawlFilter;
import io.portalfetch.crawl.HtmlDirectoryLister;
import io.portalfetch.crawl.ManifestCrawler;
import io.portalfetch.manifest.Manifest;
import io.portalfetch.manifest.ManifestStore;
import io.portalfetch.transfer.CancellationToken;
import io.portalfetch.transfer.LoggingTransferEventSink;
import io.portalfetch.transfer.RoundScheduler;
import io.portalfetch.transfer.RunSummary;
import io.portalfetch.transfer.TransferConfig;
import io.portalfetch.transfer.TransferEventSink;
import io.portalfetch.transfer.TransferTask;
import io.portalfetch.transport.AuthenticatedTransport;
import io.portalfetch.transport.AuthenticationException;
import io.portalfetch.transport.Credentials;
import io.portalfetch.transport.PortalConfig;
import io.portalfetch.transport.Sleeper;
import io.portalfetch.transport.auth.PortalAuthenticator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.Console;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/// Mirror a remote file tree that sits behind a login portal.
///
/// The command authenticates, builds the list of files (from the manifest cache, or by crawling
/// the listing pages), and downloads everything in rounds until nothing is left, resuming
/// partial files and logging in again whenever the portal session expires.
@CommandLine.Command(name = "portalfetch",
    header = "Mirror a remote file tree that sits behind a login portal",
    description = "Crawls the directory listings under the base URL, caches the resulting file list, and "
                  + "downloads every file with resume support, retrying failed files in rounds.",
    mixinStandardHelpOptions = true,
    exitCodeList = {
        "0: all files downloaded",
        "1: unexpected error",
        "2: missing configuration or credentials",
        "3: authentication failed",
        "4: round limit reached with files still failing",
        "130: cancelled"
    })
public class CMD_portalfetch implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_portalfetch.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_AUTH_FAILED = 3;
    public static final int EXIT_ROUND_LIMIT = 4;
    public static final int EXIT_CANCELLED = 130;

    public static final String ENV_USERNAME = "PORTALFETCH_USERNAME";
    public static final String ENV_PASSWORD = "PORTALFETCH_PASSWORD";

    @CommandLine.Option(names = {"--config", "-c"},
        description = "YAML settings file")
    private Path configFile;

    @CommandLine.Option(names = {"--base-url"},
        description = "Protected base URL; the root of the crawl")
    private String baseUrl;

    @CommandLine.Option(names = {"--auth-base-url"},
        description = "Base URL of the authentication realm")
    private String authBaseUrl;

    @CommandLine.Option(names = {"--client-id"},
        description = "Client id presented to the authentication realm")
    private String clientId;

    @CommandLine.Option(names = {"--client-secret"},
        description = "Client secret for confidential clients")
    private String clientSecret;

    @CommandLine.Option(names = {"--username", "-u"},
        description = "Account name (default: $" + ENV_USERNAME + ", then the settings file, then a prompt)")
    private String username;

    @CommandLine.Option(names = {"--password", "-p"},
        description = "Account password (default: $" + ENV_PASSWORD + ", then a prompt)")
    private String password;

    @CommandLine.Option(names = {"--output", "-o"},
        description = "Directory the remote tree is mirrored into (default: ./downloads)")
    private Path outputDir;

    @CommandLine.Option(names = {"--cache"},
        description = "Manifest cache file (default: file_list_cache.json)")
    private Path cacheFile;

    @CommandLine.Option(names = {"--rescan"},
        description = "Crawl again even when a manifest cache exists")
    private boolean rescan = false;

    @CommandLine.Option(names = {"--workers", "-w"},
        description = "Concurrent downloads per round (default: 4)")
    private Integer workers;

    @CommandLine.Option(names = {"--max-rounds"},
        description = "Stop after this many rounds; 0 retries until everything is downloaded (default: 0)")
    private Integer maxRounds;

    @CommandLine.Option(names = {"--round-cooldown"},
        description = "Seconds to wait between rounds (default: 5)")
    private Integer roundCooldownSeconds;

    @CommandLine.Option(names = {"--include"},
        description = "Only download files whose name ends with this suffix; repeatable")
    private List<String> includeSuffixes = new ArrayList<>();

    @CommandLine.Option(names = {"--exclude-dir"},
        description = "Never descend into directories with this name; repeatable")
    private List<String> excludedDirectories = new ArrayList<>();

    private final Map<String, String> environment;
    private final Console console;

    private volatile RoundScheduler scheduler;

    public CMD_portalfetch() {
        this(System.getenv(), System.console());
    }

    CMD_portalfetch(Map<String, String> environment, Console console) {
        this.environment = environment;
        this.console = console;
    }

    /// Run the command.
    /// @param args command line args
    public static void main(String[] args) {
        CMD_portalfetch command = new CMD_portalfetch();
        int exitCode = new CommandLine(command).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PortalFetchSettings settings;
        try {
            settings = configFile == null ? PortalFetchSettings.empty() : PortalFetchSettings.load(configFile);
        } catch (IOException e) {
            System.err.println("Cannot read settings: " + e.getMessage());
            return EXIT_USAGE;
        }

        String resolvedBaseUrl = firstNonBlank(baseUrl, settings.baseUrl());
        String resolvedAuthBaseUrl = firstNonBlank(authBaseUrl, settings.authBaseUrl());
        String resolvedClientId = firstNonBlank(clientId, settings.clientId());
        if (resolvedBaseUrl == null || resolvedAuthBaseUrl == null || resolvedClientId == null) {
            System.err.println("--base-url, --auth-base-url and --client-id are required "
                               + "(on the command line or in the settings file)");
            return EXIT_USAGE;
        }

        Credentials credentials = resolveCredentials(settings);
        if (credentials == null) {
            System.err.println("No credentials: pass --username/--password or set " + ENV_USERNAME + " and "
                               + ENV_PASSWORD);
            return EXIT_USAGE;
        }

        PortalConfig portalConfig;
        TransferConfig transferConfig;
        try {
            portalConfig = portalConfig(settings, resolvedBaseUrl, resolvedAuthBaseUrl, resolvedClientId);
            transferConfig = transferConfig(settings);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        Path output = outputDir != null ? outputDir : Path.of(firstNonBlank(settings.output(), "downloads"));
        Path cache = cacheFile != null ? cacheFile : Path.of(firstNonBlank(settings.cacheFile(),
            "file_list_cache.json"));

        System.out.println("Target URL: " + portalConfig.baseUrl());
        try (AuthenticatedTransport transport = new AuthenticatedTransport(portalConfig,
            new PortalAuthenticator(portalConfig, credentials)))
        {
            try {
                transport.start();
            } catch (AuthenticationException e) {
                System.err.println("Authentication failed: " + e.getMessage());
                return EXIT_AUTH_FAILED;
            }

            Files.createDirectories(output);
            Manifest manifest = loadOrCrawl(transport, settings, portalConfig, output.toAbsolutePath(), cache);
            if (manifest.isEmpty()) {
                System.out.println("Nothing to download.");
                return EXIT_OK;
            }
            System.out.println("Files to download: " + manifest.size() + ", saving to " + output.toAbsolutePath());

            RunSummary summary = runRounds(transport, transferConfig, manifest);
            System.out.println("Finished after " + summary.rounds() + " round(s): " + summary.completed()
                               + " downloaded, " + summary.skipped() + " already complete, "
                               + summary.pending().size() + " pending");
            switch (summary.status()) {
                case SUCCEEDED:
                    return EXIT_OK;
                case ROUND_LIMIT_REACHED:
                    return EXIT_ROUND_LIMIT;
                default:
                    System.out.println("Cancelled. Run the same command again to resume.");
                    return EXIT_CANCELLED;
            }
        } catch (IOException | RuntimeException e) {
            logger.error("portalfetch failed", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private Manifest loadOrCrawl(AuthenticatedTransport transport, PortalFetchSettings settings,
                                 PortalConfig portalConfig, Path output, Path cache)
    {
        ManifestStore store = new ManifestStore(cache);
        if (store.exists() && !rescan) {
            try {
                Manifest cached = store.load();
                System.out.println("Loaded " + cached.size() + " files from cache " + cache);
                return cached;
            } catch (IOException e) {
                logger.warn("Error loading manifest cache {}: {}. Will rescan.", cache, e.getMessage());
            }
        }

        List<String> suffixes = includeSuffixes.isEmpty() ? settings.includeSuffixes() : includeSuffixes;
        Set<String> excluded = new LinkedHashSet<>(settings.excludeDirectories());
        excluded.addAll(excludedDirectories);
        ManifestCrawler crawler = new ManifestCrawler(new HtmlDirectoryLister(transport),
            new CrawlFilter(suffixes, excluded), portalConfig.baseUrl(), output);
        System.out.println("Scanning directory structure (this may take a while)...");
        Manifest manifest = crawler.crawl();
        try {
            store.save(manifest);
        } catch (IOException e) {
            logger.warn("Could not save manifest cache {}: {}", cache, e.getMessage());
        }
        return manifest;
    }

    private RunSummary runRounds(AuthenticatedTransport transport, TransferConfig transferConfig, Manifest manifest) {
        CancellationToken cancellation = new CancellationToken();
        TransferEventSink events = new LoggingTransferEventSink();
        TransferTask task = new TransferTask(transport, transferConfig, events, cancellation);
        scheduler = new RoundScheduler(task, transferConfig, events, cancellation, Sleeper.SYSTEM);

        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            logger.info("Interrupt received, stopping after the current chunks");
            scheduler.cancel();
            try {
                finished.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "portalfetch-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return scheduler.run(manifest);
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                logger.debug("JVM already shutting down, leaving the shutdown hook in place");
            }
        }
    }

    private Credentials resolveCredentials(PortalFetchSettings settings) {
        String user = firstNonBlank(username, environment.get(ENV_USERNAME), settings.username());
        String secret = firstNonBlank(password, environment.get(ENV_PASSWORD));
        if (user == null && console != null) {
            user = firstNonBlank(console.readLine("Username: "));
        }
        if (secret == null && console != null && user != null) {
            char[] typed = console.readPassword("Password for %s: ", user);
            secret = typed == null ? null : firstNonBlank(new String(typed));
        }
        if (user == null || secret == null) {
            return null;
        }
        return new Credentials(user, secret);
    }

    private PortalConfig portalConfig(PortalFetchSettings settings, String base, String authBase, String client) {
        PortalConfig.Builder builder = PortalConfig.builder(base, authBase, client)
            .clientSecret(firstNonBlank(clientSecret, settings.clientSecret()));
        if (settings.connectTimeoutSeconds() != null) {
            builder.connectTimeout(Duration.ofSeconds(settings.connectTimeoutSeconds()));
        }
        if (settings.readTimeoutSeconds() != null) {
            builder.readTimeout(Duration.ofSeconds(settings.readTimeoutSeconds()));
        }
        if (settings.maxAttempts() != null) {
            builder.maxAttempts(settings.maxAttempts());
        }
        if (settings.backoffBaseSeconds() != null) {
            builder.backoffBase(Duration.ofSeconds(settings.backoffBaseSeconds()));
        }
        if (settings.backoffJitterSeconds() != null) {
            builder.backoffJitter(Duration.ofSeconds(settings.backoffJitterSeconds()));
        }
        return builder.build();
    }

    private TransferConfig transferConfig(PortalFetchSettings settings) {
        TransferConfig defaults = TransferConfig.defaults();
        int resolvedWorkers = workers != null ? workers
            : settings.workers() != null ? settings.workers() : defaults.workers();
        int chunkSize = settings.chunkSize() != null ? settings.chunkSize() : defaults.chunkSize();
        int cooldown = roundCooldownSeconds != null ? roundCooldownSeconds
            : settings.roundCooldownSeconds() != null ? settings.roundCooldownSeconds()
            : (int) defaults.roundCooldown().getSeconds();
        int rounds = maxRounds != null ? maxRounds
            : settings.maxRounds() != null ? settings.maxRounds() : defaults.maxRounds();
        return new TransferConfig(resolvedWorkers, chunkSize, Duration.ofSeconds(cooldown), rounds);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
