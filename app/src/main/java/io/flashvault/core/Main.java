package io.flashvault.core;

import io.flashvault.core.api.ApiServer;
import io.flashvault.core.asset.BookCurrency;
import io.flashvault.core.asset.InMemoryShareToken;
import io.flashvault.core.asset.TokenBook;
import io.flashvault.core.demo.OneToOneExchangeApp;
import io.flashvault.core.metrics.VaultMetrics;
import io.flashvault.core.protocol.Address;
import io.flashvault.core.protocol.PoolKey;
import io.flashvault.core.vault.Vault;
import io.flashvault.core.vault.VaultConfig;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        VaultConfig config = VaultConfig.defaultLocal();
        if (options.owner() != null) {
            config = config.withOwner(Address.of(options.owner()));
        }
        InMemoryShareToken shares = new InMemoryShareToken();

        Vault vault;
        if (options.inMemory()) {
            vault = Vault.inMemory(config, shares);
        } else {
            Path dataPath = options.dataDir().toAbsolutePath().normalize();
            if (options.resetState()) {
                resetState(dataPath);
            }
            Files.createDirectories(dataPath);
            vault = Vault.rocks(config, shares, dataPath.toString());
        }
        LOG.info("Vault owner=" + vault.owner() + " custodian=" + vault.custodian());

        ApiServer apiServer = null;
        try {
            if (options.demo()) {
                runDemoFlow(vault);
            } else {
                LOG.info("Demo flow disabled (--no-demo)");
            }

            if (options.enableApi()) {
                apiServer = new ApiServer(vault, options.apiBind(), options.apiPort(), options.apiToken());
                apiServer.start();
            }

            if (options.keepAlive()) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "flash-vault-shutdown"));
                LOG.info("Vault running. Press CTRL+C to exit.");
                shutdownLatch.await();
            }
        } finally {
            if (apiServer != null) {
                apiServer.stop();
            }
            vault.close();
        }
    }

    /**
     * Registers the sample exchange, seeds it with liquidity and runs one swap session,
     * all against a simulated token book.
     */
    static void runDemoFlow(Vault vault) {
        TokenBook book = new TokenBook();
        BookCurrency usd = BookCurrency.token("USD", book, vault.custodian());
        BookCurrency eur = BookCurrency.token("EUR", book, vault.custodian());
        PoolKey key = new PoolKey(usd, eur, 0);

        Address provider = Address.of("liquidity-provider");
        Address trader = Address.of("trader");
        book.mint(provider, usd.id(), BigInteger.valueOf(10_000));
        book.mint(provider, eur.id(), BigInteger.valueOf(10_000));
        book.mint(trader, usd.id(), BigInteger.valueOf(1_000));

        OneToOneExchangeApp exchange = new OneToOneExchangeApp(vault, Address.of("one-to-one-exchange"));
        vault.registerApp(vault.owner(), exchange.address());

        // the simulated book starts empty on every run; align persisted snapshots with it
        vault.sync(usd);
        vault.sync(eur);

        BigInteger liquidity = BigInteger.valueOf(5_000);
        vault.lock(provider, data -> {
            exchange.addLiquidity(provider, key, liquidity, liquidity);
            usd.deposit(provider, liquidity);
            vault.settle(provider, usd);
            eur.deposit(provider, liquidity);
            vault.settle(provider, eur);
            return data;
        }, new byte[0]);
        LOG.info("Liquidity added: app reserves USD=" + vault.reservesOfApp(exchange.address(), usd)
                + " EUR=" + vault.reservesOfApp(exchange.address(), eur));

        BigInteger amountIn = BigInteger.valueOf(250);
        vault.lock(trader, data -> {
            exchange.swap(trader, key, true, amountIn);
            usd.deposit(trader, amountIn);
            vault.settle(trader, usd);
            vault.take(trader, eur, trader, vault.currencyDelta(trader, eur));
            return data;
        }, new byte[0]);

        LOG.info("Swap settled: trader USD=" + book.balanceOf(trader, usd.id())
                + " EUR=" + book.balanceOf(trader, eur.id())
                + ", vault reserves USD=" + vault.reservesOfVault(usd)
                + " EUR=" + vault.reservesOfVault(eur)
                + ", unsettled=" + vault.getUnsettledDeltasCount());
        LOG.fine(VaultMetrics::scrapeMetrics);
    }

    private static void resetState(Path dataPath) throws IOException {
        if (!Files.exists(dataPath)) {
            return;
        }
        LOG.warning("Resetting vault state at " + dataPath);
        try (Stream<Path> walk = Files.walk(dataPath)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            boolean inMemory,
            boolean resetState,
            String owner,
            boolean demo,
            boolean enableApi,
            String apiBind,
            int apiPort,
            String apiToken,
            boolean keepAlive
    ) {
        static CliOptions parse(String[] args) {
            boolean showHelp = false;
            String error = null;
            Path dataDir = envPath("FLASH_VAULT_DATA_DIR", Path.of("./data/vault"));
            boolean inMemory = false;
            boolean reset = false;
            String owner = System.getenv("FLASH_VAULT_OWNER");
            boolean demo = true;
            boolean enableApi = "true".equalsIgnoreCase(System.getenv("FLASH_VAULT_ENABLE_API"));
            String apiBind = "127.0.0.1";
            int apiPort = 8080;
            String apiToken = null;
            boolean keepAlive = false;

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if (arg.equals("--help") || arg.equals("-h")) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.equals("--in-memory")) {
                        inMemory = true;
                    } else if (arg.equals("--reset-state")) {
                        reset = true;
                    } else if (arg.startsWith("--owner=")) {
                        owner = arg.substring("--owner=".length()).trim();
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (arg.equals("--enable-api")) {
                        enableApi = true;
                    } else if (arg.startsWith("--api-bind=")) {
                        apiBind = arg.substring("--api-bind=".length());
                    } else if (arg.startsWith("--api-port=")) {
                        try {
                            apiPort = parsePort(arg.substring("--api-port=".length()), "--api-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--api-token=")) {
                        apiToken = arg.substring("--api-token=".length());
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (apiToken == null || apiToken.isBlank()) {
                apiToken = System.getenv("FLASH_VAULT_API_TOKEN");
            }
            if (owner != null && owner.isBlank()) {
                owner = null;
            }
            if (owner != null && !Address.isValid(owner) && error == null) {
                showHelp = true;
                error = "Invalid value for --owner: " + owner;
            }

            keepAlive = keepAlive || enableApi || "true".equalsIgnoreCase(System.getenv("FLASH_VAULT_KEEP_ALIVE"));

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    inMemory,
                    reset,
                    owner,
                    demo,
                    enableApi,
                    apiBind,
                    apiPort,
                    apiToken,
                    keepAlive
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: flash-vault [options]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for vault data (default ./data/vault)
  --in-memory                Keep vault state in memory only
  --reset-state              Delete persisted vault state before starting
  --owner=<addr>             Address allowed to register apps (default "owner")
  --demo / --no-demo         Enable (default) or disable the demo swap flow
  --keep-alive               Keep the process running until interrupted
  --enable-api               Start the read-only REST API (default bind 127.0.0.1:8080)
  --api-bind=<host>          Bind address for the REST API
  --api-port=<port>          Port for the REST API (default 8080)
  --api-token=<token>        Require Bearer/X-API-Key token for the REST API

Environment overrides:
  FLASH_VAULT_DATA_DIR       Override --data-dir
  FLASH_VAULT_OWNER          Owner address (if --owner not supplied)
  FLASH_VAULT_API_TOKEN      Token for REST API auth (if --api-token not supplied)
  FLASH_VAULT_ENABLE_API     Set to "true" to enable the REST API without CLI flag
  FLASH_VAULT_KEEP_ALIVE     Set to "true" to force keep-alive mode
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }
    }
}
