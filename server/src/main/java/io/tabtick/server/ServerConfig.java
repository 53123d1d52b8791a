package io.tabtick.server;

/**
 * Process configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:         HTTP API port
 *  - dataDir:          root of the record store (WAL in dataDir/wal, snapshots in dataDir/snap)
 *  - bridgeUrl:        base URL of the browser bridge
 *  - engineConfigPath: optional JSON file with {@link EngineConfig} overrides
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        String bridgeUrl,
        String engineConfigPath
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port,     -p   <port>
     *   --data,          -d   <path>
     *   --bridge-url,    -b   <url>
     *   --engine-config, -c   <path>
     *   --help,          -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        int httpPort = 8080;
        String dataDir = "./data";
        String bridgeUrl = "http://localhost:9222";
        String engineConfigPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        httpPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid http-port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--data", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--bridge-url", "-b" -> {
                    ensureValue(args, i);
                    bridgeUrl = args[++i];
                }

                case "--engine-config", "-c" -> {
                    ensureValue(args, i);
                    engineConfigPath = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(httpPort, dataDir, bridgeUrl, engineConfigPath);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: tabtick-server [options]

            Options:
              --http-port,     -p   HTTP port (default: 8080)
              --data,          -d   Data directory for WAL and snapshots (default: ./data)
              --bridge-url,    -b   Browser bridge base URL (default: http://localhost:9222)
              --engine-config, -c   Path to JSON engine config (optional)
              --help,          -h   Show this help message
            """);
        System.exit(0);
    }
}
