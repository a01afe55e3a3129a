/*
 * Copyright 2014-2025 Andrew Gaul <andrew@gaul.org>
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gaul.s3gateway;

import java.io.Console;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.google.common.base.Strings;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.jclouds.Constants;
import org.jclouds.ContextBuilder;
import org.jclouds.JcloudsVersion;
import org.jclouds.blobstore.BlobStore;
import org.jclouds.blobstore.BlobStoreContext;
import org.jclouds.concurrent.DynamicExecutors;
import org.jclouds.concurrent.config.ExecutorServiceModule;
import org.jclouds.location.reference.LocationConstants;
import org.jclouds.logging.slf4j.config.SLF4JLoggingModule;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);
    private Main() {
        throw new AssertionError("intentionally not implemented");
    }

    private static final class Options {
        @Option(name = "--config",
                usage = "S3Gateway JSON configuration (default: config.json)")
        private Path config = Paths.get(S3GatewayConstants.DEFAULT_CONFIG_FILE);

        @Option(name = "--version", usage = "display version")
        private boolean version;
    }

    public static void main(String[] args) throws Exception {
        Console console = System.console();
        if (console == null) {
            System.setErr(createLoggerErrorPrintStream());
        }

        var options = new Options();
        var parser = new CmdLineParser(options);
        try {
            parser.parseArgument(args);
        } catch (CmdLineException cle) {
            usage(parser);
        }

        if (options.version) {
            System.err.println(
                    Main.class.getPackage().getImplementationVersion());
            System.exit(0);
        }

        GatewayConfig config;
        List<StorageAccount> accounts;
        S3Gateway.Builder builder;
        try {
            config = GatewayConfig.load(options.config);
            accounts = config.getStorageAccounts();
            builder = S3Gateway.Builder.fromConfig(config);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Failed to load configuration from " +
                    options.config + ": " + e.getMessage());
            System.exit(1);
            throw e;
        }

        var factory = new ThreadFactoryBuilder()
                .setNameFormat("user thread %d")
                .setThreadFactory(Executors.defaultThreadFactory())
                .build();
        ExecutorService executorService = DynamicExecutors.newScalingThreadPool(
                1, 20, 60 * 1000, factory);

        Map<String, BlobStoreClient> clients = new HashMap<>();
        for (StorageAccount account : accounts) {
            BlobStore blobStore = createBlobStore(account,
                    config.getBackendTimeoutMillis(), executorService);
            clients.put(account.getId(), new BlobStoreClient(blobStore));
            logger.info("Configured account {} with buckets {}",
                    account.getId(), account.getBuckets());
        }

        S3Gateway gateway;
        try {
            gateway = builder
                    .accountRegistry(new AccountRegistry(accounts, clients))
                    .build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            throw e;
        }

        try {
            gateway.start();
        } catch (Exception e) {
            System.err.println(e.getMessage());
            System.exit(1);
        }
        logger.info("S3Gateway listening on {}:{}", config.getHost(),
                gateway.getPort());
    }

    private static PrintStream createLoggerErrorPrintStream() {
        return new PrintStream(System.err) {
            private final StringBuilder builder = new StringBuilder();

            @Override
            public void print(final String string) {
                logger.error("{}", string);
            }

            @Override
            public void write(byte[] buf, int off, int len) {
                for (int i = off; i < off + len; ++i) {
                    char ch = (char) buf[i];
                    if (ch == '\n') {
                        if (builder.length() != 0) {
                            print(builder.toString());
                            builder.setLength(0);
                        }
                    } else {
                        builder.append(ch);
                    }
                }
            }
        };
    }

    static BlobStore createBlobStore(StorageAccount account,
            long timeoutMillis, ExecutorService executorService) {
        var properties = new Properties();
        properties.setProperty(Constants.PROPERTY_SO_TIMEOUT,
                String.valueOf(timeoutMillis));
        properties.setProperty(Constants.PROPERTY_CONNECTION_TIMEOUT,
                String.valueOf(timeoutMillis));
        properties.setProperty(Constants.PROPERTY_USER_AGENT,
                String.format("s3gateway/%s jclouds/%s java/%s",
                        Main.class.getPackage().getImplementationVersion(),
                        JcloudsVersion.get(),
                        System.getProperty("java.version")));
        if (account.getRegion() != null) {
            properties.setProperty(LocationConstants.PROPERTY_REGIONS,
                    account.getRegion());
        }
        if (account.getEndpoint() != null &&
                account.getProvider().equals("s3")) {
            // S3-compatible services rarely support virtual host buckets
            properties.setProperty("jclouds.s3.virtual-host-buckets",
                    "false");
        }

        ContextBuilder builder = ContextBuilder
                .newBuilder(account.getProvider())
                .credentials(account.getIdentity(), account.getCredential())
                .modules(List.of(
                        new SLF4JLoggingModule(),
                        new ExecutorServiceModule(executorService)))
                .overrides(properties);
        if (!Strings.isNullOrEmpty(account.getEndpoint())) {
            builder = builder.endpoint(account.getEndpoint());
        }

        return builder.build(BlobStoreContext.class).getBlobStore();
    }

    private static void usage(CmdLineParser parser) {
        System.err.println("Usage: s3gateway [options...]");
        parser.printUsage(System.err);
        System.exit(1);
    }
}
